package switchkeeper.engine.scheduler;

import switchkeeper.engine.core.MaintenanceException;

/**
 * A recurrence names a frequency the trigger rules do not know.
 */
public class UnknownFrequencyException extends MaintenanceException {

    private final String frequency;

    public UnknownFrequencyException(String frequency) {
        super("Unknown frequency: " + frequency);
        this.frequency = frequency;
    }

    public String frequency() {
        return frequency;
    }
}
