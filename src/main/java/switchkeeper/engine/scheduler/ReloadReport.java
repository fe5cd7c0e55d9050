package switchkeeper.engine.scheduler;

import java.util.List;

/**
 * What a reload registered and what it could not.
 */
public record ReloadReport(List<String> registered, List<Failure> failures) {

    public ReloadReport {
        registered = List.copyOf(registered);
        failures = List.copyOf(failures);
    }

    public static ReloadReport empty() {
        return new ReloadReport(List.of(), List.of());
    }

    public int registeredCount() {
        return registered.size();
    }

    /**
     * A schedule whose trigger could not be built.
     */
    public record Failure(String key, String scheduleId, String reason) {
    }
}
