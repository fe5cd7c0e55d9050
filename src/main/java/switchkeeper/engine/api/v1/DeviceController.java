package switchkeeper.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import switchkeeper.engine.api.Controller;
import switchkeeper.engine.api.v1.dto.DeviceResponse;
import switchkeeper.engine.api.v1.dto.PoeControlRequest;
import switchkeeper.engine.api.v1.dto.PortResponse;
import switchkeeper.engine.api.v1.dto.SiteResponse;
import switchkeeper.engine.gateway.DeviceGateway;
import switchkeeper.engine.gateway.DeviceNotFoundException;
import switchkeeper.engine.gateway.GatewayException;
import switchkeeper.engine.model.DeviceHandle;
import switchkeeper.engine.model.PoeMode;
import switchkeeper.engine.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Live controller inventory and direct PoE control.
 *
 * GET /api/v1/sites - Sites visible to the controller session
 * GET /api/v1/devices?siteName= - Devices of a site
 * GET /api/v1/devices/{deviceId}?siteName= - One device, by id or MAC
 * GET /api/v1/devices/{deviceId}/ports?siteName= - Port table of a device
 * POST /api/v1/devices/poe - Set the PoE mode of one port
 */
public class DeviceController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DeviceController.class);

    private static final String SITES_PATH = "/api/v1/sites";
    private static final String DEVICES_PATH = "/api/v1/devices";
    private static final String POE_PATH = "/api/v1/devices/poe";
    private static final Pattern DEVICE_PATTERN = Pattern.compile("^/api/v1/devices/([^/]+)$");
    private static final Pattern PORTS_PATTERN = Pattern.compile("^/api/v1/devices/([^/]+)/ports$");

    private final DeviceGateway gateway;

    public DeviceController(DeviceGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return POE_PATH.equals(path);
        }
        return method.equals(HttpMethod.GET)
                && (SITES_PATH.equals(path) || DEVICES_PATH.equals(path)
                        || DEVICE_PATTERN.matcher(path).matches() || PORTS_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String site = siteParam(req);

            if (POE_PATH.equals(path)) {
                return handlePoeControl(req);
            }
            if (SITES_PATH.equals(path)) {
                return handleSites();
            }
            if (DEVICES_PATH.equals(path)) {
                return handleDevices(site);
            }

            Matcher ports = PORTS_PATTERN.matcher(path);
            if (ports.matches()) {
                return handlePorts(ports.group(1), site);
            }

            Matcher device = DEVICE_PATTERN.matcher(path);
            if (device.matches()) {
                return handleDevice(device.group(1), site);
            }

            return ControllerResponse.notFound("unknown device endpoint");

        } catch (DeviceNotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (GatewayException e) {
            log.error("Controller call failed: {}", e.getMessage());
            return ControllerResponse.badGateway(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Device controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleSites() throws Exception {
        List<SiteResponse> sites = gateway.listSites().stream().map(SiteResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(sites));
    }

    private ControllerResponse handleDevices(String site) throws Exception {
        List<DeviceResponse> devices = gateway.listDevices(site).stream().map(DeviceResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(devices));
    }

    private ControllerResponse handleDevice(String deviceId, String site) throws Exception {
        DeviceHandle device = requireDevice(deviceId, site);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(DeviceResponse.from(device)));
    }

    private ControllerResponse handlePorts(String deviceId, String site) throws Exception {
        List<PortResponse> ports = requireDevice(deviceId, site).ports().stream().map(PortResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(ports));
    }

    /**
     * POST /api/v1/devices/poe
     */
    private ControllerResponse handlePoeControl(FullHttpRequest req) throws Exception {
        PoeControlRequest request = RouterHandler.readJson(req, PoeControlRequest.class);
        request.validate();

        DeviceHandle device = requireDevice(request.deviceId(), request.siteName());
        PoeMode mode = request.poeMode();
        gateway.setPoeMode(device.id(), request.portIdx(), mode, request.siteName());
        log.info("PoE mode of {} port {} set to {} by operator", device.name(), request.portIdx(), mode.wireName());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("deviceId", request.deviceId());
        response.put("deviceName", device.name());
        response.put("portIdx", request.portIdx());
        response.put("mode", mode.wireName());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private DeviceHandle requireDevice(String deviceId, String site) {
        return gateway.getDevice(deviceId, site).orElseThrow(() -> new DeviceNotFoundException(deviceId));
    }

    private static String siteParam(FullHttpRequest req) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get("siteName");
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
