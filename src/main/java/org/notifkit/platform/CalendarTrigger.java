package org.notifkit.platform;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;

/**
 * Repeating trigger matching a wall-clock time: every day at hour:minute:second, or every week on
 * a weekday at hour:minute.
 *
 * @param weekday null for a daily trigger
 */
public record CalendarTrigger(DayOfWeek weekday, int hour, int minute, int second, ZoneId zone) {

    public static CalendarTrigger daily(ZonedDateTime target) {
        return new CalendarTrigger(null, target.getHour(), target.getMinute(), target.getSecond(), target.getZone());
    }

    public static CalendarTrigger weekly(ZonedDateTime target) {
        return new CalendarTrigger(target.getDayOfWeek(), target.getHour(), target.getMinute(), 0, target.getZone());
    }

    public boolean isWeekly() {
        return weekday != null;
    }

    /**
     * Earliest matching time strictly after {@code after}.
     */
    public ZonedDateTime nextAfter(ZonedDateTime after) {
        ZonedDateTime local = after.withZoneSameInstant(zone);
        ZonedDateTime candidate = local.withHour(hour).withMinute(minute).withSecond(second).withNano(0);
        if (weekday != null) {
            candidate = candidate.with(TemporalAdjusters.nextOrSame(weekday));
        }
        if (!candidate.isAfter(local)) {
            candidate = weekday != null ? candidate.plusWeeks(1) : candidate.plusDays(1);
            candidate = candidate.withHour(hour).withMinute(minute).withSecond(second);
        }
        return candidate;
    }

    /**
     * Fire plan starting at the first match after {@code now}.
     */
    public FirePlan planFrom(Instant now) {
        Instant first = nextAfter(now.atZone(zone)).toInstant();
        return new FirePlan() {
            @Override
            public Instant first() {
                return first;
            }

            @Override
            public Optional<Instant> nextAfter(Instant previous) {
                return Optional.of(CalendarTrigger.this.nextAfter(previous.atZone(zone)).toInstant());
            }
        };
    }
}
