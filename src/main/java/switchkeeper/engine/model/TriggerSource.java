package switchkeeper.engine.model;

/**
 * What started an operation. Stored in run metadata under {@code source}.
 */
public enum TriggerSource {
    MANUAL("manual"),
    SCHEDULED("scheduled"),
    BULK("bulk");

    private final String wireName;

    TriggerSource(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
