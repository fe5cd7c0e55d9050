package switchkeeper.engine.scheduler;

import switchkeeper.engine.model.Recurrence;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Cron-like firing rule derived from a {@link Recurrence}.
 * <p>
 * Hourly fires at minute {@code mm} of every hour; daily at {@code HH:mm}; weekly on
 * {@code dayOfWeek} (0 = Monday, default 0); monthly on {@code dayOfMonth} (default 1).
 * Months without that day are skipped, so a rule for the 31st fires seven times a year.
 */
public final class TriggerRule {

    private static final int MONTH_SEARCH_LIMIT = 48;

    private final Frequency frequency;
    private final LocalTime time;
    private final DayOfWeek dayOfWeek;
    private final int dayOfMonth;

    private TriggerRule(Frequency frequency, LocalTime time, DayOfWeek dayOfWeek, int dayOfMonth) {
        this.frequency = frequency;
        this.time = time;
        this.dayOfWeek = dayOfWeek;
        this.dayOfMonth = dayOfMonth;
    }

    /**
     * @throws UnknownFrequencyException for an unknown frequency
     * @throws IllegalArgumentException  for a malformed time or an out-of-range day
     */
    public static TriggerRule from(Recurrence recurrence) {
        Frequency frequency = Frequency.parse(recurrence.frequency());
        LocalTime time = parseTime(recurrence.timeOfDay());

        int dow = recurrence.dayOfWeek() != null ? recurrence.dayOfWeek() : 0;
        if (frequency == Frequency.WEEKLY && (dow < 0 || dow > 6)) {
            throw new IllegalArgumentException("dayOfWeek must be 0..6 (0 = Monday), got " + dow);
        }
        int dom = recurrence.dayOfMonth() != null ? recurrence.dayOfMonth() : 1;
        if (frequency == Frequency.MONTHLY && (dom < 1 || dom > 31)) {
            throw new IllegalArgumentException("dayOfMonth must be 1..31, got " + dom);
        }

        return new TriggerRule(frequency, time, DayOfWeek.of(Math.floorMod(dow, 7) + 1), dom);
    }

    /** "HH:MM", "H:MM" or "HH"; null or blank means midnight */
    static LocalTime parseTime(String timeOfDay) {
        if (timeOfDay == null || timeOfDay.isBlank()) {
            return LocalTime.MIDNIGHT;
        }
        String[] parts = timeOfDay.trim().split(":");
        try {
            int hour = Integer.parseInt(parts[0]);
            int minute = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            return LocalTime.of(hour, minute);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed time of day: '" + timeOfDay + "'", e);
        }
    }

    /**
     * First fire instant strictly after {@code after}, in {@code after}'s zone.
     */
    public ZonedDateTime nextFireAfter(ZonedDateTime after) {
        switch (frequency) {
            case HOURLY: {
                ZonedDateTime candidate = after.truncatedTo(ChronoUnit.HOURS).withMinute(time.getMinute());
                return candidate.isAfter(after) ? candidate : candidate.plusHours(1);
            }
            case DAILY: {
                ZonedDateTime candidate = at(after.toLocalDate(), after);
                return candidate.isAfter(after) ? candidate : at(after.toLocalDate().plusDays(1), after);
            }
            case WEEKLY: {
                LocalDate date = after.toLocalDate().with(TemporalAdjusters.nextOrSame(dayOfWeek));
                ZonedDateTime candidate = at(date, after);
                return candidate.isAfter(after) ? candidate : at(date.plusWeeks(1), after);
            }
            case MONTHLY: {
                YearMonth month = YearMonth.from(after);
                for (int i = 0; i < MONTH_SEARCH_LIMIT; i++, month = month.plusMonths(1)) {
                    if (dayOfMonth > month.lengthOfMonth()) {
                        continue;
                    }
                    ZonedDateTime candidate = at(month.atDay(dayOfMonth), after);
                    if (candidate.isAfter(after)) {
                        return candidate;
                    }
                }
                throw new IllegalStateException("No fire time found for " + this);
            }
            default:
                throw new IllegalStateException("Unhandled frequency " + frequency);
        }
    }

    private ZonedDateTime at(LocalDate date, ZonedDateTime reference) {
        return ZonedDateTime.of(date, time, reference.getZone());
    }

    public Frequency frequency() {
        return frequency;
    }

    @Override
    public String toString() {
        switch (frequency) {
            case HOURLY:
                return String.format("hourly at :%02d", time.getMinute());
            case DAILY:
                return "daily at " + time;
            case WEEKLY:
                return "weekly on " + dayOfWeek + " at " + time;
            default:
                return "monthly on day " + dayOfMonth + " at " + time;
        }
    }
}
