package io.cronhttp.utils;

/**
 * Thrown when a schedule string does not match the supported grammar.
 *
 * <p>The message is always {@link ScheduleParser#SYNTAX} so it can be shown to the user as-is.
 */
public class ScheduleParseException extends IllegalArgumentException {

    private final String schedule;

    public ScheduleParseException(String schedule) {
        super(ScheduleParser.SYNTAX);
        this.schedule = schedule;
    }

    public ScheduleParseException(String schedule, Throwable cause) {
        super(ScheduleParser.SYNTAX, cause);
        this.schedule = schedule;
    }

    /**
     * The rejected schedule string, possibly null.
     */
    public String getSchedule() {
        return schedule;
    }
}
