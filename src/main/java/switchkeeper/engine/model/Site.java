package switchkeeper.engine.model;

/**
 * A controller site: {@code name} is the API key, {@code desc} the display name.
 */
public record Site(String name, String desc) {

    public String displayName() {
        if (desc != null && !desc.isBlank()) {
            return desc;
        }
        return name;
    }
}
