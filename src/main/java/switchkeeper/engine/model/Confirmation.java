package switchkeeper.engine.model;

/**
 * Whether the effect of an accepted command was observed on the device.
 * A command can succeed while its outcome stays unconfirmed.
 */
public enum Confirmation {
    /** Device/port observed in the expected state */
    CONFIRMED,
    /** Waited and gave up; the command itself was accepted */
    UNCONFIRMED,
    /** No confirmation was attempted */
    NOT_CHECKED
}
