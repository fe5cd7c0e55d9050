package switchkeeper.engine.model;

/**
 * Kind of maintenance operation a run record tracks.
 */
public enum JobKind {
    REBOOT("reboot"),
    POE_CYCLE("poe_cycle"),
    PORT_CYCLE("port_cycle");

    private final String wireName;

    JobKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static JobKind forPortCycle(boolean poeOnly) {
        return poeOnly ? POE_CYCLE : PORT_CYCLE;
    }
}
