package switchkeeper.engine.core;

/**
 * Base of the engine's failure taxonomy. Unchecked, like the persistence
 * errors the repositories raise.
 */
public class MaintenanceException extends RuntimeException {

    public MaintenanceException(String message) {
        super(message);
    }

    public MaintenanceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Restores the interrupt flag and wraps the interruption.
     */
    public static MaintenanceException interrupted(String during, InterruptedException e) {
        Thread.currentThread().interrupt();
        return new MaintenanceException("Interrupted while " + during, e);
    }
}
