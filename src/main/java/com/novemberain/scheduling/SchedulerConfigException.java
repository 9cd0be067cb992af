package com.novemberain.scheduling;

public class SchedulerConfigException extends SchedulerException {

    private static final long serialVersionUID = 1L;

    public SchedulerConfigException(String msg) {
        super(msg);
    }

    public SchedulerConfigException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
