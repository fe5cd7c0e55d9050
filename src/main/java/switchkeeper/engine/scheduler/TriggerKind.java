package switchkeeper.engine.scheduler;

/**
 * Which schedule table a trigger was registered from.
 */
public enum TriggerKind {
    REBOOT_SCHEDULE("schedule:"),
    PORT_SCHEDULE("port-schedule:");

    private final String keyPrefix;

    TriggerKind(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String keyFor(String scheduleId) {
        return keyPrefix + scheduleId;
    }
}
