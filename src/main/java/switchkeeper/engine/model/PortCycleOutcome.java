package switchkeeper.engine.model;

/**
 * Result of a port cycle whose command sequence succeeded.
 * {@code linkConfirmation} tells whether the link was seen back up afterwards.
 */
public record PortCycleOutcome(
        String deviceId,
        int portIdx,
        boolean poeOnly,
        Confirmation linkConfirmation,
        String warning) {

    public boolean hasWarning() {
        return warning != null;
    }
}
