package switchkeeper.engine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import switchkeeper.engine.config.EngineConfig;
import switchkeeper.engine.model.DeviceHandle;
import switchkeeper.engine.model.PoeMode;
import switchkeeper.engine.model.PortOverride;
import switchkeeper.engine.model.Site;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DeviceGateway} over the controller's cookie-authenticated REST API.
 * <p>
 * Session policy: log in lazily; when a call answers 401/403 the session is dropped,
 * re-established and the call retried once. A second auth failure is reported as a
 * {@link GatewayException}.
 */
public class ControllerGateway implements DeviceGateway {

    private static final Logger log = LoggerFactory.getLogger(ControllerGateway.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String username;
    private final String password;
    private final String defaultSite;
    private final Duration requestTimeout;
    private final CookieManager cookies;
    private final HttpClient httpClient;

    private volatile boolean authenticated = false;

    public ControllerGateway(EngineConfig config) {
        this.baseUrl = config.controllerUrl();
        this.username = config.controllerUsername();
        this.password = config.controllerPassword();
        this.defaultSite = config.defaultSite();
        this.requestTimeout = config.controllerRequestTimeout();
        this.cookies = new CookieManager(null, CookiePolicy.ACCEPT_ALL);

        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .cookieHandler(cookies);
        if (!config.verifySsl()) {
            builder.sslContext(trustAllContext());
        }
        this.httpClient = builder.build();
    }

    // ---- SESSION ----

    /**
     * Authenticate with the controller if there is no live session.
     */
    public synchronized void login() {
        if (authenticated) {
            return;
        }
        log.info("Authenticating to controller at {}", baseUrl);

        ObjectNode payload = MAPPER.createObjectNode()
                .put("username", username)
                .put("password", password)
                .put("remember", true);

        HttpResponse<String> response = send(request("POST", "/api/login", payload), "authenticate");
        if (response.statusCode() != 200) {
            log.error("Authentication failed: {} - {}", response.statusCode(), abbreviate(response.body()));
            throw new GatewayException("Authentication failed", response.statusCode());
        }

        authenticated = true;
        log.info("Authenticated to controller");
    }

    private synchronized void invalidateSession() {
        authenticated = false;
        cookies.getCookieStore().removeAll();
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    // ---- DEVICE GATEWAY ----

    @Override
    public List<Site> listSites() {
        JsonNode data = call("GET", "/api/self/sites", null, "get sites");
        List<Site> sites = new ArrayList<>();
        for (JsonNode s : data) {
            sites.add(new Site(s.path("name").asText(null), s.path("desc").asText(null)));
        }
        log.debug("Found {} site(s)", sites.size());
        return sites;
    }

    @Override
    public List<DeviceHandle> listDevices(String site) {
        String target = targetSite(site);
        JsonNode data = call("GET", "/api/s/" + target + "/stat/device", null, "get devices");
        List<DeviceHandle> devices = new ArrayList<>();
        for (JsonNode d : data) {
            devices.add(DeviceHandle.fromJson(d));
        }
        log.debug("Retrieved {} devices from site '{}'", devices.size(), target);
        return devices;
    }

    @Override
    public void reboot(String macOrId, String site) {
        ObjectNode payload = MAPPER.createObjectNode()
                .put("cmd", "restart")
                .put("mac", macOrId);
        call("POST", "/api/s/" + targetSite(site) + "/cmd/devmgr", payload, "reboot device");
        log.info("Reboot command sent to device {}", macOrId);
    }

    @Override
    public void setPoeMode(String deviceId, int portIdx, PoeMode mode, String site) {
        DeviceHandle device = getDevice(deviceId, site).orElseThrow(() -> new DeviceNotFoundException(deviceId));

        ObjectNode payload = MAPPER.createObjectNode();
        payload.putArray("port_overrides").addObject()
                .put(PortOverride.PORT_IDX, portIdx)
                .put("poe_mode", mode.wireName());

        call("PUT", "/api/s/" + targetSite(site) + "/rest/device/" + device.id(), payload, "set PoE mode");
        log.info("Set PoE mode to '{}' for device {} port {}", mode.wireName(), deviceId, portIdx);
    }

    @Override
    public void setPortOverride(String deviceId, PortOverride override, String site) {
        DeviceHandle device = getDevice(deviceId, site).orElseThrow(() -> new DeviceNotFoundException(deviceId));
        int portIdx = override.portIdx();

        ObjectNode payload = MAPPER.createObjectNode();
        ArrayNode list = payload.putArray("port_overrides");
        for (PortOverride other : device.overrides()) {
            if (other.portIdx() != portIdx) {
                list.add(other.toJson());
            }
        }
        list.add(override.toJson());

        call("PUT", "/api/s/" + targetSite(site) + "/rest/device/" + device.id(), payload, "set port override");
        log.info("Port {} override written for device {} (forward={}, native_networkconf_id={})",
                portIdx, deviceId, override.forward(), override.nativeNetworkId());
    }

    // ---- PLUMBING ----

    private String targetSite(String site) {
        return site != null && !site.isBlank() ? site : defaultSite;
    }

    /**
     * Issue an API call with one re-authentication retry and return its {@code data} array.
     */
    private JsonNode call(String method, String path, JsonNode body, String action) {
        login();
        HttpRequest request = request(method, path, body);
        HttpResponse<String> response = send(request, action);

        if (isAuthExpired(response.statusCode())) {
            log.info("Controller session rejected during '{}', re-authenticating", action);
            invalidateSession();
            login();
            response = send(request, action);
        }

        if (response.statusCode() != 200) {
            log.error("Failed to {}: {} - {}", action, response.statusCode(), abbreviate(response.body()));
            if (isAuthExpired(response.statusCode())) {
                invalidateSession();
            }
            throw new GatewayException("Failed to " + action, response.statusCode());
        }

        return parseData(response.body(), action);
    }

    private static boolean isAuthExpired(int status) {
        return status == 401 || status == 403;
    }

    private HttpRequest request(String method, String path, JsonNode body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body.toString()));
        }
        return builder.build();
    }

    private HttpResponse<String> send(HttpRequest request, String action) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GatewayException("HTTP error during " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Interrupted during " + action, e);
        }
    }

    private static JsonNode parseData(String body, String action) {
        if (body == null || body.isBlank()) {
            return MAPPER.createArrayNode();
        }
        try {
            JsonNode root = MAPPER.readTree(body);
            JsonNode data = root.path("data");
            return data.isArray() ? data : MAPPER.createArrayNode();
        } catch (IOException e) {
            throw new GatewayException("Malformed controller response to " + action, e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    /**
     * Self-signed controllers are the norm; accept any certificate and skip hostname checks.
     */
    private static SSLContext trustAllContext() {
        TrustManager trustAll = new X509ExtendedTrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
            }

            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
            }

            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] { trustAll }, null);
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to create TLS context", e);
        }
    }
}
