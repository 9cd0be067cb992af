package com.novemberain.scheduling;

/**
 * Base class for all checked failures reported by the scheduler.
 */
public class SchedulerException extends Exception {

    private static final long serialVersionUID = 1L;

    public SchedulerException() {
        super();
    }

    public SchedulerException(String msg) {
        super(msg);
    }

    public SchedulerException(Throwable cause) {
        super(cause);
    }

    public SchedulerException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
