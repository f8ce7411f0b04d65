package io.cronhttp.utils;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses job schedule strings into the instant of the next execution.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>{@code every [N] second(s)|minute(s)|hour(s)}: last run plus N units</li>
 *   <li>{@code every [N] day(s) [@ HH:MM]}: last run plus N days, at HH:MM (midnight when omitted)</li>
 *   <li>{@code once @ <utc-timestamp>}: exactly that timestamp, whatever the last run was</li>
 * </ul>
 * <p>
 * Calendar arithmetic (day boundaries, HH:MM) is done in the zone passed by the caller, which the
 * scheduler fixes once at startup.
 */
public final class ScheduleParser {

    public static final String SYNTAX = """
            Schedule string must be one of the following formats:
              * "every hour"
              * "every 2 hours"
              * "every 2 minutes"
              * "every 10 seconds"
              * "every day @ 13:00"
              * "every 30 days @ 07:30"
              * "once @ <utc-timestamp>\"""";

    private static final Pattern TIME_OF_DAY = Pattern.compile("([01]\\d|2[0-3]):([0-5]\\d)");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private ScheduleParser() {
    }

    private enum Unit {
        SECOND(1),
        MINUTE(60),
        HOUR(60 * 60),
        DAY(24 * 60 * 60);

        private final long seconds;

        Unit(long seconds) {
            this.seconds = seconds;
        }

        static Unit fromToken(String token) {
            return switch (token) {
                case "second", "seconds" -> SECOND;
                case "minute", "minutes" -> MINUTE;
                case "hour", "hours" -> HOUR;
                case "day", "days" -> DAY;
                default -> null;
            };
        }
    }

    /**
     * Computes the next run time of a schedule.
     *
     * @param schedule schedule string (see class docs)
     * @param lastRan  instant of the previous run, or of job creation if it never ran
     * @param zone     zone used for day/HH:MM arithmetic
     * @return next scheduled run time
     * @throws ScheduleParseException if the schedule is malformed
     */
    public static Instant parse(String schedule, Instant lastRan, ZoneId zone) {
        Objects.requireNonNull(lastRan, "lastRan must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (schedule == null) {
            throw new ScheduleParseException(null);
        }

        String[] pieces = schedule.split(" ", -1);
        if (pieces.length < 2) {
            throw new ScheduleParseException(schedule);
        }

        return switch (pieces[0]) {
            case "every" -> parseEvery(schedule, pieces, lastRan, zone);
            case "once" -> parseOnce(schedule, pieces);
            default -> throw new ScheduleParseException(schedule);
        };
    }

    /**
     * Returns true if {@code schedule} is accepted by {@link #parse}.
     */
    public static boolean isValid(String schedule) {
        try {
            parse(schedule, Instant.EPOCH, ZoneId.of("UTC"));
            return true;
        } catch (ScheduleParseException ex) {
            return false;
        }
    }

    /**
     * One-shot schedules are the ones starting with {@code "once"}; the job is done after its run.
     */
    public static boolean isRunOnce(String schedule) {
        return schedule != null && schedule.startsWith("once");
    }

    private static Instant parseEvery(String schedule, String[] pieces, Instant lastRan, ZoneId zone) {
        long count = 1;
        int i = 1;

        Unit unit = Unit.fromToken(pieces[i]);
        if (unit == null) {
            try {
                count = Long.parseLong(pieces[i]);
            } catch (NumberFormatException ex) {
                throw new ScheduleParseException(schedule, ex);
            }
            if (count <= 0 || !pieces[i].chars().allMatch(Character::isDigit)) {
                throw new ScheduleParseException(schedule);
            }
            i++;
            if (i >= pieces.length || (unit = Unit.fromToken(pieces[i])) == null) {
                throw new ScheduleParseException(schedule);
            }
        }
        i++;

        int hour = 0;
        int minute = 0;
        if (i < pieces.length) {
            if (unit != Unit.DAY || pieces.length - i != 2 || !"@".equals(pieces[i])) {
                throw new ScheduleParseException(schedule);
            }
            Matcher m = TIME_OF_DAY.matcher(pieces[i + 1]);
            if (!m.matches()) {
                throw new ScheduleParseException(schedule);
            }
            hour = Integer.parseInt(m.group(1));
            minute = Integer.parseInt(m.group(2));
        }

        try {
            if (unit == Unit.DAY) {
                return ZonedDateTime.ofInstant(lastRan, zone)
                        .plusDays(count)
                        .withHour(hour)
                        .withMinute(minute)
                        .withSecond(0)
                        .withNano(0)
                        .toInstant();
            }
            return lastRan.plus(Duration.ofSeconds(unit.seconds).multipliedBy(count));
        } catch (ArithmeticException | DateTimeException ex) {
            throw new ScheduleParseException(schedule, ex);
        }
    }

    private static Instant parseOnce(String schedule, String[] pieces) {
        if (pieces.length != 3 || !"@".equals(pieces[1]) || !DECIMAL.matcher(pieces[2]).matches()) {
            throw new ScheduleParseException(schedule);
        }
        try {
            return EpochSeconds.toInstant(Double.parseDouble(pieces[2]));
        } catch (IllegalArgumentException | ArithmeticException | DateTimeException ex) {
            throw new ScheduleParseException(schedule, ex);
        }
    }
}
