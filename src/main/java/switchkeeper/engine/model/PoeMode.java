package switchkeeper.engine.model;

/**
 * Power-delivery mode of a switch port, as the controller names it.
 */
public enum PoeMode {
    AUTO("auto"),
    OFF("off"),
    PASV24("pasv24"),
    PASSTHROUGH("passthrough");

    private final String wireName;

    PoeMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static PoeMode fromWire(String value) {
        for (PoeMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown PoE mode: " + value);
    }
}
