package switchkeeper.engine.model;

/**
 * How a device reboot schedule walks its device list.
 */
public enum RebootMode {
    /** One device at a time, gated by online confirmation and inter-device delay */
    ROLLING,
    /** All devices at once */
    PARALLEL
}
