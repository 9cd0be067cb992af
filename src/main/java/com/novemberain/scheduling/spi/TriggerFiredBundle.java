package com.novemberain.scheduling.spi;

import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.calendar.ExclusionCalendar;

import java.util.Date;

/**
 * What a store hands back for a trigger it agreed to fire: the job to run and
 * the fire times the execution context reports.
 */
public class TriggerFiredBundle {

    private final JobDetail jobDetail;
    private final Trigger trigger;
    private final ExclusionCalendar calendar;
    private final boolean recovering;
    private final String fireInstanceId;
    private final Date fireTime;
    private final Date scheduledFireTime;
    private final Date previousFireTime;
    private final Date nextFireTime;

    public TriggerFiredBundle(JobDetail jobDetail, Trigger trigger, ExclusionCalendar calendar,
                              boolean recovering, String fireInstanceId, Date fireTime,
                              Date scheduledFireTime, Date previousFireTime, Date nextFireTime) {
        this.jobDetail = jobDetail;
        this.trigger = trigger;
        this.calendar = calendar;
        this.recovering = recovering;
        this.fireInstanceId = fireInstanceId;
        this.fireTime = fireTime;
        this.scheduledFireTime = scheduledFireTime;
        this.previousFireTime = previousFireTime;
        this.nextFireTime = nextFireTime;
    }

    public JobDetail getJobDetail() {
        return jobDetail;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public ExclusionCalendar getCalendar() {
        return calendar;
    }

    public boolean isRecovering() {
        return recovering;
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
}
