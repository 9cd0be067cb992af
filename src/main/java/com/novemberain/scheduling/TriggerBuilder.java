package com.novemberain.scheduling;

import com.novemberain.scheduling.schedule.ScheduleSpec;
import com.novemberain.scheduling.schedule.SimpleSchedule;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.quartz.utils.Key;

import java.util.Date;

public class TriggerBuilder {

    private TriggerKey key;
    private JobKey jobKey;
    private String description;
    private ScheduleSpec schedule;
    private Date startTime;
    private Date endTime;
    private String calendarName;
    private int priority = Trigger.DEFAULT_PRIORITY;
    private MisfireInstruction misfireInstruction = MisfireInstruction.FIRE_NOW;
    private JobDataMap jobDataMap = new JobDataMap();

    private TriggerBuilder() {
    }

    public static TriggerBuilder newTrigger() {
        return new TriggerBuilder();
    }

    /**
     * Build the trigger. Without a schedule the trigger fires once at its
     * start time; without a start time it starts now.
     */
    public Trigger build() {
        Date start = startTime == null ? new Date() : startTime;
        if (endTime != null && endTime.before(start)) {
            throw new IllegalArgumentException("End time cannot be before start time");
        }
        Trigger trigger = new Trigger();
        trigger.setKey(key == null ? new TriggerKey(Key.createUniqueName(null), null) : key);
        trigger.setJobKey(jobKey);
        trigger.setDescription(description);
        trigger.setSchedule(schedule == null ? SimpleSchedule.oneShot() : schedule);
        trigger.setStartTime(new Date(start.getTime()));
        trigger.setEndTime(endTime == null ? null : new Date(endTime.getTime()));
        trigger.setCalendarName(calendarName);
        trigger.setPriority(priority);
        trigger.setMisfireInstruction(misfireInstruction);
        trigger.setJobDataMap(new JobDataMap(jobDataMap));
        return trigger;
    }

    public TriggerBuilder withIdentity(String name) {
        return withIdentity(new TriggerKey(name, null));
    }

    public TriggerBuilder withIdentity(String name, String group) {
        return withIdentity(new TriggerKey(name, group));
    }

    public TriggerBuilder withIdentity(TriggerKey triggerKey) {
        this.key = triggerKey;
        return this;
    }

    public TriggerBuilder forJob(JobKey keyOfJobToFire) {
        this.jobKey = keyOfJobToFire;
        return this;
    }

    public TriggerBuilder forJob(String jobName, String jobGroup) {
        return forJob(new JobKey(jobName, jobGroup));
    }

    public TriggerBuilder forJob(JobDetail jobDetail) {
        return forJob(jobDetail.getKey());
    }

    public TriggerBuilder withDescription(String triggerDescription) {
        this.description = triggerDescription;
        return this;
    }

    public TriggerBuilder withSchedule(ScheduleSpec scheduleSpec) {
        this.schedule = scheduleSpec;
        return this;
    }

    public TriggerBuilder startNow() {
        this.startTime = new Date();
        return this;
    }

    public TriggerBuilder startAt(Date triggerStartTime) {
        this.startTime = triggerStartTime;
        return this;
    }

    public TriggerBuilder endAt(Date triggerEndTime) {
        this.endTime = triggerEndTime;
        return this;
    }

    public TriggerBuilder modifiedByCalendar(String calName) {
        this.calendarName = calName;
        return this;
    }

    public TriggerBuilder withPriority(int triggerPriority) {
        this.priority = triggerPriority;
        return this;
    }

    public TriggerBuilder withMisfireInstruction(MisfireInstruction instruction) {
        if (instruction == null) {
            throw new IllegalArgumentException("Misfire instruction cannot be null.");
        }
        this.misfireInstruction = instruction;
        return this;
    }

    public TriggerBuilder usingJobData(String dataKey, Object value) {
        jobDataMap.put(dataKey, value);
        return this;
    }

    public TriggerBuilder usingJobData(JobDataMap newJobDataMap) {
        jobDataMap.putAll(newJobDataMap);
        return this;
    }
}
