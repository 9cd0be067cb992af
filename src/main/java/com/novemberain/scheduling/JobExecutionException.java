package com.novemberain.scheduling;

/**
 * Thrown by a {@link Job} to report a failed execution. The flags tell the
 * scheduler what to do with the firing trigger afterwards.
 */
public class JobExecutionException extends SchedulerException {

    private static final long serialVersionUID = 1L;

    private boolean refire = false;
    private boolean unscheduleTrigger = false;
    private boolean unscheduleAllTriggers = false;

    public JobExecutionException() {
        super();
    }

    public JobExecutionException(String msg) {
        super(msg);
    }

    public JobExecutionException(Throwable cause) {
        super(cause);
    }

    public JobExecutionException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public JobExecutionException(String msg, Throwable cause, boolean refireImmediately) {
        super(msg, cause);
        this.refire = refireImmediately;
    }

    public void setRefireImmediately(boolean refire) {
        this.refire = refire;
    }

    public boolean refireImmediately() {
        return refire;
    }

    public void setUnscheduleFiringTrigger(boolean unscheduleTrigger) {
        this.unscheduleTrigger = unscheduleTrigger;
    }

    public boolean unscheduleFiringTrigger() {
        return unscheduleTrigger;
    }

    public void setUnscheduleAllTriggers(boolean unscheduleAllTriggers) {
        this.unscheduleAllTriggers = unscheduleAllTriggers;
    }

    public boolean unscheduleAllTriggers() {
        return unscheduleAllTriggers;
    }
}
