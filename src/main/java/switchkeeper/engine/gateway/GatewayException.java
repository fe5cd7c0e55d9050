package switchkeeper.engine.gateway;

import switchkeeper.engine.core.MaintenanceException;

/**
 * Transport, authentication or remote 4xx/5xx failure of a controller call.
 * Not retried by the orchestration code.
 */
public class GatewayException extends MaintenanceException {

    private final int statusCode;

    public GatewayException(String message) {
        this(message, -1, null);
    }

    public GatewayException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public GatewayException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public GatewayException(String message, int statusCode, Throwable cause) {
        super(statusCode > 0 ? message + " (HTTP " + statusCode + ")" : message, cause);
        this.statusCode = statusCode;
    }

    /** Remote HTTP status, or -1 when the call never got an answer */
    public int statusCode() {
        return statusCode;
    }
}
