package switchkeeper.engine.model;

/**
 * Recurrence descriptor shared by both schedule kinds.
 *
 * @param frequency  hourly, daily, weekly or monthly (stored as given, validated at trigger registration)
 * @param timeOfDay  "HH:MM"; null means midnight
 * @param dayOfWeek  0..6 with 0 = Monday, weekly only
 * @param dayOfMonth 1..31, monthly only
 */
public record Recurrence(
        String frequency,
        String timeOfDay,
        Integer dayOfWeek,
        Integer dayOfMonth) {

    public static Recurrence hourly(int minute) {
        return new Recurrence("hourly", String.format("00:%02d", minute), null, null);
    }

    public static Recurrence daily(String timeOfDay) {
        return new Recurrence("daily", timeOfDay, null, null);
    }

    public static Recurrence weekly(int dayOfWeek, String timeOfDay) {
        return new Recurrence("weekly", timeOfDay, dayOfWeek, null);
    }

    public static Recurrence monthly(int dayOfMonth, String timeOfDay) {
        return new Recurrence("monthly", timeOfDay, null, dayOfMonth);
    }
}
