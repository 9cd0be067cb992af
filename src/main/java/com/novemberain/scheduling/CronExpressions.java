package com.novemberain.scheduling;

import org.quartz.CronExpression;

import java.text.ParseException;

/**
 * Validation helpers for cron expressions, as used by admin front ends.
 */
public final class CronExpressions {

    private CronExpressions() {
    }

    public static boolean isValid(String expression) {
        return expression != null && CronExpression.isValidExpression(expression);
    }

    /**
     * @throws InvalidScheduleException with the parser's message when the expression is malformed
     */
    public static void validate(String expression) throws InvalidScheduleException {
        if (expression == null) {
            throw new InvalidScheduleException("Cron expression cannot be null");
        }
        try {
            CronExpression.validateExpression(expression);
        } catch (ParseException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + expression + "': "
                    + e.getMessage(), e);
        }
    }

    /**
     * Parsed field-by-field summary of the expression.
     */
    public static String describe(String expression) throws InvalidScheduleException {
        validate(expression);
        try {
            return new CronExpression(expression).getExpressionSummary();
        } catch (ParseException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + expression + "'", e);
        }
    }
}
