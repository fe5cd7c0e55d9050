package switchkeeper.engine.scheduler;

import org.junit.jupiter.api.Test;
import switchkeeper.engine.model.Recurrence;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class TriggerRuleTest {

    private static final ZoneId ZONE = ZoneId.of("America/New_York");

    // Thursday
    private static final ZonedDateTime JAN_15_10AM = ZonedDateTime.of(2026, 1, 15, 10, 0, 0, 0, ZONE);

    @Test
    void hourlyFiresAtConfiguredMinute() {
        TriggerRule rule = TriggerRule.from(Recurrence.hourly(30));

        assertEquals(JAN_15_10AM.withMinute(30), rule.nextFireAfter(JAN_15_10AM));
        assertEquals(JAN_15_10AM.withHour(11).withMinute(30), rule.nextFireAfter(JAN_15_10AM.withMinute(30)));
    }

    @Test
    void dailyFiresTodayOrTomorrow() {
        TriggerRule rule = TriggerRule.from(Recurrence.daily("03:00"));

        assertEquals(at(2026, 1, 16, 3, 0), rule.nextFireAfter(JAN_15_10AM));
        assertEquals(at(2026, 1, 15, 3, 0), rule.nextFireAfter(at(2026, 1, 15, 2, 0)));
    }

    @Test
    void nextFireIsStrictlyAfter() {
        TriggerRule rule = TriggerRule.from(Recurrence.daily("03:00"));

        assertEquals(at(2026, 1, 16, 3, 0), rule.nextFireAfter(at(2026, 1, 15, 3, 0)));
    }

    @Test
    void weeklyCountsDaysFromMonday() {
        TriggerRule monday = TriggerRule.from(Recurrence.weekly(0, "04:00"));
        TriggerRule sunday = TriggerRule.from(Recurrence.weekly(6, "04:00"));

        assertEquals(at(2026, 1, 19, 4, 0), monday.nextFireAfter(JAN_15_10AM));
        assertEquals(at(2026, 1, 26, 4, 0), monday.nextFireAfter(at(2026, 1, 19, 5, 0)));
        assertEquals(at(2026, 1, 18, 4, 0), sunday.nextFireAfter(JAN_15_10AM));
    }

    @Test
    void weeklyDefaultsToMonday() {
        TriggerRule rule = TriggerRule.from(new Recurrence("weekly", "04:00", null, null));

        assertEquals(at(2026, 1, 19, 4, 0), rule.nextFireAfter(JAN_15_10AM));
    }

    @Test
    void monthlySkipsMonthsWithoutTheDay() {
        TriggerRule rule = TriggerRule.from(Recurrence.monthly(31, "04:00"));

        assertEquals(at(2026, 3, 31, 4, 0), rule.nextFireAfter(at(2026, 1, 31, 12, 0)));
        assertEquals(at(2026, 5, 31, 4, 0), rule.nextFireAfter(at(2026, 3, 31, 4, 0)));
    }

    @Test
    void monthlyDefaultsToFirstDay() {
        TriggerRule rule = TriggerRule.from(new Recurrence("monthly", "02:30", null, null));

        assertEquals(at(2026, 2, 1, 2, 30), rule.nextFireAfter(JAN_15_10AM));
    }

    @Test
    void frequencyIsCaseInsensitive() {
        assertEquals(Frequency.DAILY, TriggerRule.from(new Recurrence("Daily", "01:00", null, null)).frequency());
    }

    @Test
    void parsesTimeFormats() {
        assertEquals(LocalTime.of(7, 5), TriggerRule.parseTime("7:05"));
        assertEquals(LocalTime.of(7, 0), TriggerRule.parseTime("07"));
        assertEquals(LocalTime.MIDNIGHT, TriggerRule.parseTime(null));
        assertEquals(LocalTime.of(23, 59), TriggerRule.parseTime(" 23:59 "));
    }

    @Test
    void rejectsMalformedTime() {
        assertThrows(IllegalArgumentException.class, () -> TriggerRule.parseTime("7:xx"));
        assertThrows(IllegalArgumentException.class, () -> TriggerRule.parseTime("25:00"));
    }

    @Test
    void rejectsUnknownFrequency() {
        UnknownFrequencyException e = assertThrows(UnknownFrequencyException.class,
                () -> TriggerRule.from(new Recurrence("fortnightly", "03:00", null, null)));
        assertEquals("fortnightly", e.frequency());
        assertThrows(UnknownFrequencyException.class,
                () -> TriggerRule.from(new Recurrence(null, "03:00", null, null)));
    }

    @Test
    void rejectsOutOfRangeDays() {
        assertThrows(IllegalArgumentException.class, () -> TriggerRule.from(Recurrence.weekly(7, "03:00")));
        assertThrows(IllegalArgumentException.class, () -> TriggerRule.from(Recurrence.monthly(0, "03:00")));
    }

    @Test
    void describesItself() {
        assertEquals("daily at 03:00", TriggerRule.from(Recurrence.daily("3:00")).toString());
        assertEquals("hourly at :15", TriggerRule.from(Recurrence.hourly(15)).toString());
    }

    private static ZonedDateTime at(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, ZONE);
    }
}
