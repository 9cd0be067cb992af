package com.novemberain.scheduling.mongodb.cluster;

import com.novemberain.scheduling.MisfireInstruction;
import com.novemberain.scheduling.Scheduler;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerBuilder;
import com.novemberain.scheduling.schedule.SimpleSchedule;
import com.novemberain.scheduling.spi.FiredTriggerRecord;
import com.novemberain.scheduling.util.Clock;
import org.quartz.JobDataMap;
import org.quartz.TriggerKey;

/**
 * Builds the one-shot trigger that re-runs a job cut off by a dead node.
 */
public class RecoveryTriggerFactory {

    private final Clock clock;

    public RecoveryTriggerFactory(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param originalData data of the original trigger, copied because the
     *                     original may be stored again afterwards
     */
    public Trigger from(FiredTriggerRecord record, JobDataMap originalData) {
        TriggerKey originalKey = record.getTriggerKey();

        JobDataMap data = new JobDataMap(originalData);
        data.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_NAME, originalKey.getName());
        data.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_GROUP, originalKey.getGroup());
        data.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_FIRETIME_IN_MILLISECONDS,
                String.valueOf(record.getFireTime().getTime()));
        data.put(Scheduler.FAILED_JOB_ORIGINAL_TRIGGER_SCHEDULED_FIRETIME_IN_MILLISECONDS,
                String.valueOf(record.getScheduledFireTime().getTime()));

        return TriggerBuilder.newTrigger()
                .withIdentity(recoveryKey(record))
                .forJob(record.getJobKey())
                .withSchedule(SimpleSchedule.oneShot())
                .startAt(clock.now())
                .withMisfireInstruction(MisfireInstruction.IGNORE_MISFIRE_POLICY)
                .withPriority(record.getPriority())
                .usingJobData(data)
                .build();
    }

    /**
     * The same fired record always maps to the same key, whichever node
     * recovers it. Fire instance ids restart with the process, so the fire
     * time keeps keys of different lifetimes apart.
     */
    static TriggerKey recoveryKey(FiredTriggerRecord record) {
        return new TriggerKey("recover_" + record.getFireInstanceId() + "_" + record.getFireTime().getTime(),
                Scheduler.DEFAULT_RECOVERY_GROUP);
    }
}
