package io.github.drompincen.postscheduler.runtime.schedule;

import io.github.drompincen.postscheduler.runtime.trigger.Crontab;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human-entered times and repeat patterns, all read in the configured reference zone.
 *
 * <p>Accepted one-shot formats: {@code YYYY-MM-DD HH:MM}, {@code MM/DD HH:MM} (current year),
 * {@code today HH:MM} and {@code tomorrow HH:MM} ({@code 今日} / {@code 明日} work as well).
 */
@Component
public class ScheduleTimeParser {

    private static final Pattern ABSOLUTE = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})\\s+(\\d{2}):(\\d{2})$");
    private static final Pattern MONTH_DAY = Pattern.compile("^(\\d{1,2})/(\\d{1,2})\\s+(\\d{2}):(\\d{2})$");
    private static final Pattern TODAY = Pattern.compile("^(?:today|今日)\\s+(\\d{2}):(\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOMORROW = Pattern.compile("^(?:tomorrow|明日)\\s+(\\d{2}):(\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOCK_TIME = Pattern.compile("^(\\d{2}):(\\d{2})$");

    private static final Map<String, String> WEEKDAYS = Map.ofEntries(
            Map.entry("mon", "mon"), Map.entry("monday", "mon"), Map.entry("月", "mon"),
            Map.entry("tue", "tue"), Map.entry("tuesday", "tue"), Map.entry("火", "tue"),
            Map.entry("wed", "wed"), Map.entry("wednesday", "wed"), Map.entry("水", "wed"),
            Map.entry("thu", "thu"), Map.entry("thursday", "thu"), Map.entry("木", "thu"),
            Map.entry("fri", "fri"), Map.entry("friday", "fri"), Map.entry("金", "fri"),
            Map.entry("sat", "sat"), Map.entry("saturday", "sat"), Map.entry("土", "sat"),
            Map.entry("sun", "sun"), Map.entry("sunday", "sun"), Map.entry("日", "sun"));

    private final Clock clock;
    private final ZoneId zone;

    public ScheduleTimeParser(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    public Optional<ZonedDateTime> parseWhen(String text) {
        if (text == null) return Optional.empty();
        String value = text.trim();
        LocalDate today = LocalDate.now(clock.withZone(zone));
        try {
            Matcher m = ABSOLUTE.matcher(value);
            if (m.matches()) {
                return Optional.of(at(LocalDate.of(num(m, 1), num(m, 2), num(m, 3)), num(m, 4), num(m, 5)));
            }
            m = MONTH_DAY.matcher(value);
            if (m.matches()) {
                return Optional.of(at(LocalDate.of(today.getYear(), num(m, 1), num(m, 2)), num(m, 3), num(m, 4)));
            }
            m = TODAY.matcher(value);
            if (m.matches()) {
                return Optional.of(at(today, num(m, 1), num(m, 2)));
            }
            m = TOMORROW.matcher(value);
            if (m.matches()) {
                return Optional.of(at(today, num(m, 1), num(m, 2)).plusDays(1));
            }
        } catch (DateTimeException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * Builds {@code "mm hh * * dow"} from a {@code HH:MM} clock time; a blank weekday repeats daily.
     */
    public String toCron(String time, String weekday) {
        Matcher m = time != null ? CLOCK_TIME.matcher(time.trim()) : null;
        if (m == null || !m.matches()) {
            throw new ScheduleValidationException("Invalid time format, expected HH:MM");
        }
        int hour = num(m, 1);
        int minute = num(m, 2);
        if (hour > 23 || minute > 59) {
            throw new ScheduleValidationException("Invalid time format, expected HH:MM");
        }
        String dow = "*";
        if (weekday != null && !weekday.isBlank()) {
            dow = WEEKDAYS.get(weekday.trim().toLowerCase(Locale.ROOT));
            if (dow == null) {
                throw new ScheduleValidationException("Invalid weekday: " + weekday);
            }
        }
        return minute + " " + hour + " * * " + dow;
    }

    /** @return the expression with normalized spacing */
    public String validateCron(String cronExpr) {
        try {
            Crontab.parse(cronExpr);
            return Crontab.normalize(cronExpr);
        } catch (IllegalArgumentException e) {
            throw new ScheduleValidationException("Invalid cron expression: " + e.getMessage());
        }
    }

    public String format(ZonedDateTime when) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(when.withZoneSameInstant(zone));
    }

    /**
     * Reads a stored timestamp. Values without an offset are taken as local time in the reference zone.
     *
     * @throws java.time.format.DateTimeParseException if the text is not an ISO-8601 date-time
     */
    public Instant parseStored(String text) {
        String value = text.trim();
        if (value.indexOf('T') < 0) value = value.replaceFirst(" ", "T");
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value, ZonedDateTime::from, LocalDateTime::from);
        if (parsed instanceof ZonedDateTime zdt) return zdt.toInstant();
        return ((LocalDateTime) parsed).atZone(zone).toInstant();
    }

    private ZonedDateTime at(LocalDate date, int hour, int minute) {
        return ZonedDateTime.of(date, LocalTime.of(hour, minute), zone);
    }

    private static int num(Matcher m, int group) {
        return Integer.parseInt(m.group(group));
    }
}
