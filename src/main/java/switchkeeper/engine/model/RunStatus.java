package switchkeeper.engine.model;

/**
 * Run record status. A record is created RUNNING and finished exactly once.
 */
public enum RunStatus {
    /** Operation in progress */
    RUNNING,
    /** Command sequence succeeded */
    COMPLETED,
    /** Operation failed; see the error message */
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
