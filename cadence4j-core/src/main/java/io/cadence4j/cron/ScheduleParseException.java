package io.cadence4j.cron;

/**
 * Thrown when a schedule expression is malformed or can never fire.
 */
public class ScheduleParseException extends IllegalArgumentException {

    private final String expression;

    public ScheduleParseException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
