package com.novemberain.scheduling;

import org.quartz.JobDataMap;
import org.quartz.TriggerKey;

import java.util.Date;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything a running {@link Job} gets to know about the fire instance that
 * started it.
 *
 * <p>The merged data map is the job's data overlaid with the trigger's. Jobs
 * that want their changes persisted should write to the job detail's map and
 * declare {@code persistJobDataAfterExecution}.</p>
 */
public class JobExecutionContext {

    private final Scheduler scheduler;
    private final Trigger trigger;
    private final JobDetail jobDetail;
    private final JobDataMap mergedJobDataMap;
    private final String fireInstanceId;
    private final Date fireTime;
    private final Date scheduledFireTime;
    private final Date previousFireTime;
    private final Date nextFireTime;
    private final boolean recovering;
    private final AtomicBoolean interrupted = new AtomicBoolean(false);

    private Job jobInstance;
    private int refireCount;
    private Object result;
    private long jobRunTime = -1;

    public JobExecutionContext(Scheduler scheduler, Trigger trigger, JobDetail jobDetail,
                               String fireInstanceId, Date fireTime, Date scheduledFireTime,
                               Date previousFireTime, Date nextFireTime, boolean recovering) {
        this.scheduler = scheduler;
        this.trigger = trigger;
        this.jobDetail = jobDetail;
        this.fireInstanceId = fireInstanceId;
        this.fireTime = fireTime;
        this.scheduledFireTime = scheduledFireTime;
        this.previousFireTime = previousFireTime;
        this.nextFireTime = nextFireTime;
        this.recovering = recovering;

        this.mergedJobDataMap = new JobDataMap();
        mergedJobDataMap.putAll(jobDetail.getJobDataMap());
        mergedJobDataMap.putAll(trigger.getJobDataMap());
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public JobDetail getJobDetail() {
        return jobDetail;
    }

    public JobDataMap getMergedJobDataMap() {
        return mergedJobDataMap;
    }

    public String getFireInstanceId() {
        return fireInstanceId;
    }

    public Date getFireTime() {
        return fireTime;
    }

    public Date getScheduledFireTime() {
        return scheduledFireTime;
    }

    public Date getPreviousFireTime() {
        return previousFireTime;
    }

    public Date getNextFireTime() {
        return nextFireTime;
    }

    /**
     * True when this execution re-runs a job that was cut off by a dead scheduler instance.
     */
    public boolean isRecovering() {
        return recovering;
    }

    /**
     * Key of the trigger that originally fired a recovered job.
     *
     * @throws IllegalStateException when this execution is not a recovery
     */
    public TriggerKey getRecoveringTriggerKey() {
        if (!recovering) {
            throw new IllegalStateException("Not a recovering job");
        }
        JobDataMap data = trigger.getJobDataMap();
        return new TriggerKey(data.getString(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_NAME),
                data.getString(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_GROUP));
    }

    public Job getJobInstance() {
        return jobInstance;
    }

    public void setJobInstance(Job jobInstance) {
        this.jobInstance = jobInstance;
    }

    public int getRefireCount() {
        return refireCount;
    }

    public void incrementRefireCount() {
        refireCount++;
    }

    /**
     * Cooperative interruption flag. Long-running jobs should poll it.
     */
    public boolean isInterrupted() {
        return interrupted.get();
    }

    /**
     * Raise the interrupt flag.
     *
     * @return false if it was already raised
     */
    public boolean markInterrupted() {
        return interrupted.compareAndSet(false, true);
    }

    public Object getResult() {
        return result;
    }

    public void setResult(Object result) {
        this.result = result;
    }

    public long getJobRunTime() {
        return jobRunTime;
    }

    public void setJobRunTime(long jobRunTime) {
        this.jobRunTime = jobRunTime;
    }

    @Override
    public String toString() {
        return "JobExecutionContext: trigger: '" + trigger.getKey() + "' job: '" + jobDetail.getKey()
                + "' fireInstanceId: " + fireInstanceId + " fireTime: '" + fireTime
                + "' scheduledFireTime: " + scheduledFireTime + " refireCount: " + refireCount;
    }
}
