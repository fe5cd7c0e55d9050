package switchkeeper.engine.scheduler;

import java.util.Locale;

/**
 * Recurrence frequencies a trigger can be built for.
 */
public enum Frequency {
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * @throws UnknownFrequencyException for anything but hourly, daily, weekly or monthly
     */
    public static Frequency parse(String value) {
        if (value == null || value.isBlank()) {
            throw new UnknownFrequencyException(value);
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownFrequencyException(value);
        }
    }
}
