package switchkeeper.engine.config;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration holder for engine settings.
 * All settings have sensible defaults; controller credentials come from the environment.
 */
public final class EngineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/switchkeeper;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8000;
    private String serverHost = "0.0.0.0";

    // Controller settings
    private String controllerUrl = "https://127.0.0.1:8443";
    private String controllerUsername = "";
    private String controllerPassword = "";
    private String defaultSite = "default";
    private boolean verifySsl = false;
    private Duration controllerRequestTimeout = Duration.ofSeconds(30);

    // Scheduler settings
    private ZoneId timeZone = ZoneId.of("America/New_York");
    private boolean schedulerEnabled = true;

    // Port cycle timing
    private Duration portPollInterval = Duration.ofSeconds(10);
    private Duration portTransitionTimeout = Duration.ofSeconds(300);
    private Duration bulkStagger = Duration.ofSeconds(5);

    // Reboot timing
    private Duration rebootGracePeriod = Duration.ofSeconds(10);
    private Duration onlinePollInterval = Duration.ofSeconds(10);
    private Duration manualOnlineTimeout = Duration.ofSeconds(300);

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String dbUrl = System.getenv("SWITCHKEEPER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("SWITCHKEEPER_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String url = System.getenv("SWITCHKEEPER_CONTROLLER_URL");
        if (url != null && !url.isBlank()) {
            config.controllerUrl = normalizeUrl(url);
        }

        String username = System.getenv("SWITCHKEEPER_CONTROLLER_USERNAME");
        if (username != null) {
            config.controllerUsername = username;
        }

        String password = System.getenv("SWITCHKEEPER_CONTROLLER_PASSWORD");
        if (password != null) {
            config.controllerPassword = password;
        }

        String site = System.getenv("SWITCHKEEPER_SITE");
        if (site != null && !site.isBlank()) {
            config.defaultSite = site;
        }

        String verify = System.getenv("SWITCHKEEPER_VERIFY_SSL");
        if (verify != null && !verify.isBlank()) {
            config.verifySsl = Boolean.parseBoolean(verify);
        }

        String tz = System.getenv("SWITCHKEEPER_TIMEZONE");
        if (tz != null && !tz.isBlank()) {
            config.timeZone = ZoneId.of(tz);
        }

        String schedulerEnabled = System.getenv("SWITCHKEEPER_SCHEDULER_ENABLED");
        if (schedulerEnabled != null && !schedulerEnabled.isBlank()) {
            config.schedulerEnabled = Boolean.parseBoolean(schedulerEnabled);
        }

        return config;
    }

    private static String normalizeUrl(String url) {
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new IllegalArgumentException("SWITCHKEEPER_CONTROLLER_URL must start with http:// or https://");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String controllerUrl() {
        return controllerUrl;
    }

    public String controllerUsername() {
        return controllerUsername;
    }

    public String controllerPassword() {
        return controllerPassword;
    }

    public String defaultSite() {
        return defaultSite;
    }

    public boolean verifySsl() {
        return verifySsl;
    }

    public Duration controllerRequestTimeout() {
        return controllerRequestTimeout;
    }

    public ZoneId timeZone() {
        return timeZone;
    }

    public boolean schedulerEnabled() {
        return schedulerEnabled;
    }

    public Duration portPollInterval() {
        return portPollInterval;
    }

    public Duration portTransitionTimeout() {
        return portTransitionTimeout;
    }

    public Duration bulkStagger() {
        return bulkStagger;
    }

    public Duration rebootGracePeriod() {
        return rebootGracePeriod;
    }

    public Duration onlinePollInterval() {
        return onlinePollInterval;
    }

    public Duration manualOnlineTimeout() {
        return manualOnlineTimeout;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public EngineConfig withController(String url, String username, String password) {
        this.controllerUrl = normalizeUrl(url);
        this.controllerUsername = username;
        this.controllerPassword = password;
        return this;
    }

    public EngineConfig withDefaultSite(String site) {
        this.defaultSite = site;
        return this;
    }

    public EngineConfig withTimeZone(ZoneId zone) {
        this.timeZone = zone;
        return this;
    }

    public EngineConfig withSchedulerEnabled(boolean enabled) {
        this.schedulerEnabled = enabled;
        return this;
    }

    public EngineConfig withPortTiming(Duration pollInterval, Duration transitionTimeout) {
        this.portPollInterval = pollInterval;
        this.portTransitionTimeout = transitionTimeout;
        return this;
    }

    public EngineConfig withBulkStagger(Duration stagger) {
        this.bulkStagger = stagger;
        return this;
    }

    public EngineConfig withRebootTiming(Duration gracePeriod, Duration pollInterval) {
        this.rebootGracePeriod = gracePeriod;
        this.onlinePollInterval = pollInterval;
        return this;
    }

    public EngineConfig withManualOnlineTimeout(Duration timeout) {
        this.manualOnlineTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", controllerUrl='" + controllerUrl + '\'' +
                ", defaultSite='" + defaultSite + '\'' +
                ", verifySsl=" + verifySsl +
                ", timeZone=" + timeZone +
                '}';
    }
}
