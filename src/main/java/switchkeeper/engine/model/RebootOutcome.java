package switchkeeper.engine.model;

/**
 * Per-device reboot result: the run record carries command acceptance,
 * {@code onlineConfirmation} whether the device was seen back online.
 */
public record RebootOutcome(RunRecord run, Confirmation onlineConfirmation) {

    public boolean commandAccepted() {
        return run.status() == RunStatus.COMPLETED;
    }
}
