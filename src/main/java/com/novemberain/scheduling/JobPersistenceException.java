package com.novemberain.scheduling;

/**
 * A trigger store could not read or write its data.
 */
public class JobPersistenceException extends SchedulerException {

    private static final long serialVersionUID = 1L;

    public JobPersistenceException(String msg) {
        super(msg);
    }

    public JobPersistenceException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
