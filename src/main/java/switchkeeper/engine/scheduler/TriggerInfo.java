package switchkeeper.engine.scheduler;

import java.time.Instant;

/**
 * Snapshot of one registered trigger.
 */
public record TriggerInfo(String key, TriggerKind kind, String scheduleId, String name, String rule,
        Instant nextFire) {
}
