package com.novemberain.scheduling;

import com.novemberain.scheduling.schedule.ScheduleSpec;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.TriggerKey;

import java.util.Comparator;
import java.util.Date;

/**
 * A schedule rule bound to one job.
 *
 * <p>The definition part (schedule, bounds, calendar, priority, misfire
 * instruction, data) is set through {@link TriggerBuilder}. The fire-time
 * fields are maintained by the trigger store: {@code nextFireTime} is only
 * a cache of what the schedule calculator derives from the definition.</p>
 */
public class Trigger implements Cloneable {

    public static final int DEFAULT_PRIORITY = 5;

    /**
     * Acquisition order: earliest next fire time, then highest priority, then key.
     */
    public static final Comparator<Trigger> FIRE_ORDER = new Comparator<Trigger>() {
        @Override
        public int compare(Trigger t1, Trigger t2) {
            Date n1 = t1.getNextFireTime();
            Date n2 = t2.getNextFireTime();
            if (n1 != null || n2 != null) {
                if (n1 == null) {
                    return 1;
                }
                if (n2 == null) {
                    return -1;
                }
                int byTime = n1.compareTo(n2);
                if (byTime != 0) {
                    return byTime;
                }
            }
            int byPriority = Integer.compare(t2.getPriority(), t1.getPriority());
            if (byPriority != 0) {
                return byPriority;
            }
            return compareKeys(t1.getKey(), t2.getKey());
        }
    };

    private TriggerKey key;
    private JobKey jobKey;
    private String description;
    private ScheduleSpec schedule;
    private Date startTime;
    private Date endTime;
    private String calendarName;
    private int priority = DEFAULT_PRIORITY;
    private MisfireInstruction misfireInstruction = MisfireInstruction.FIRE_NOW;
    private JobDataMap jobDataMap = new JobDataMap();

    private Date nextFireTime;
    private Date previousFireTime;
    private int timesTriggered;
    private long version;
    private String fireInstanceId;

    public Trigger() {
    }

    public static int compareKeys(TriggerKey k1, TriggerKey k2) {
        int byGroup = k1.getGroup().compareTo(k2.getGroup());
        if (byGroup != 0) {
            return byGroup;
        }
        return k1.getName().compareTo(k2.getName());
    }

    public TriggerKey getKey() {
        return key;
    }

    public void setKey(TriggerKey key) {
        this.key = key;
    }

    public JobKey getJobKey() {
        return jobKey;
    }

    public void setJobKey(JobKey jobKey) {
        this.jobKey = jobKey;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public ScheduleSpec getSchedule() {
        return schedule;
    }

    public void setSchedule(ScheduleSpec schedule) {
        this.schedule = schedule;
    }

    public Date getStartTime() {
        return startTime;
    }

    public void setStartTime(Date startTime) {
        this.startTime = startTime;
    }

    public Date getEndTime() {
        return endTime;
    }

    public void setEndTime(Date endTime) {
        this.endTime = endTime;
    }

    public String getCalendarName() {
        return calendarName;
    }

    public void setCalendarName(String calendarName) {
        this.calendarName = calendarName;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public MisfireInstruction getMisfireInstruction() {
        return misfireInstruction;
    }

    public void setMisfireInstruction(MisfireInstruction misfireInstruction) {
        this.misfireInstruction = misfireInstruction;
    }

    public JobDataMap getJobDataMap() {
        return jobDataMap;
    }

    public void setJobDataMap(JobDataMap jobDataMap) {
        this.jobDataMap = jobDataMap;
    }

    public Date getNextFireTime() {
        return nextFireTime;
    }

    public void setNextFireTime(Date nextFireTime) {
        this.nextFireTime = nextFireTime;
    }

    public Date getPreviousFireTime() {
        return previousFireTime;
    }

    public void setPreviousFireTime(Date previousFireTime) {
        this.previousFireTime = previousFireTime;
    }

    public int getTimesTriggered() {
        return timesTriggered;
    }

    public void setTimesTriggered(int timesTriggered) {
        this.timesTriggered = timesTriggered;
    }

    /**
     * Optimistic concurrency counter, incremented by the store on every write.
     * Zero for a trigger that was never stored.
     */
    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    public String getFireInstanceId() {
        return fireInstanceId;
    }

    public void setFireInstanceId(String fireInstanceId) {
        this.fireInstanceId = fireInstanceId;
    }

    public boolean mayFireAgain() {
        return nextFireTime != null;
    }

    public TriggerBuilder getTriggerBuilder() {
        return TriggerBuilder.newTrigger()
                .withIdentity(key)
                .forJob(jobKey)
                .withDescription(description)
                .withSchedule(schedule)
                .startAt(startTime)
                .endAt(endTime)
                .modifiedByCalendar(calendarName)
                .withPriority(priority)
                .withMisfireInstruction(misfireInstruction)
                .usingJobData(new JobDataMap(jobDataMap));
    }

    @Override
    public Trigger clone() {
        try {
            Trigger copy = (Trigger) super.clone();
            copy.jobDataMap = (JobDataMap) jobDataMap.clone();
            copy.startTime = copyOf(startTime);
            copy.endTime = copyOf(endTime);
            copy.nextFireTime = copyOf(nextFireTime);
            copy.previousFireTime = copyOf(previousFireTime);
            return copy;
        } catch (CloneNotSupportedException e) {
            throw new IncompatibleClassChangeError("Not Cloneable.");
        }
    }

    private static Date copyOf(Date date) {
        return date == null ? null : new Date(date.getTime());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Trigger)) {
            return false;
        }
        Trigger other = (Trigger) o;
        return key != null && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key == null ? 0 : key.hashCode();
    }

    @Override
    public String toString() {
        return "Trigger '" + key + "':  job: " + jobKey + ", schedule: " + schedule
                + ", calendar: " + calendarName + ", misfireInstruction: " + misfireInstruction
                + ", nextFireTime: " + nextFireTime;
    }
}
