package com.novemberain.scheduling;

/**
 * A schedule is malformed, or together with its bounds and calendar it
 * would never produce a fire time.
 */
public class InvalidScheduleException extends SchedulerException {

    private static final long serialVersionUID = 1L;

    public InvalidScheduleException(String msg) {
        super(msg);
    }

    public InvalidScheduleException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
