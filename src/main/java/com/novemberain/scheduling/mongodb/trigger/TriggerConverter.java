package com.novemberain.scheduling.mongodb.trigger;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.MisfireInstruction;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.mongodb.Constants;
import com.novemberain.scheduling.mongodb.JobDataConverter;
import com.novemberain.scheduling.mongodb.dao.JobDao;
import com.novemberain.scheduling.mongodb.trigger.schedules.ScheduleConverter;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.quartz.JobKey;
import org.quartz.TriggerKey;

import static com.novemberain.scheduling.mongodb.util.Keys.KEY_GROUP;
import static com.novemberain.scheduling.mongodb.util.Keys.KEY_NAME;

public class TriggerConverter {

    private static final String TRIGGER_DESCRIPTION = "description";
    private static final String TRIGGER_END_TIME = "endTime";
    private static final String TRIGGER_FIRE_INSTANCE_ID = "fireInstanceId";
    private static final String TRIGGER_MISFIRE_INSTRUCTION = "misfireInstruction";
    private static final String TRIGGER_PREVIOUS_FIRE_TIME = "previousFireTime";
    private static final String TRIGGER_START_TIME = "startTime";
    private static final String TRIGGER_TIMES_TRIGGERED = "timesTriggered";

    private final JobDao jobDao;
    private final JobDataConverter jobDataConverter;

    public TriggerConverter(JobDao jobDao, JobDataConverter jobDataConverter) {
        this.jobDao = jobDao;
        this.jobDataConverter = jobDataConverter;
    }

    /**
     * Converts trigger into document in the given state.
     * Depending on the config, job data map can be stored
     * as a {@code base64} encoded (default) or plain object.
     */
    public Document toDocument(Trigger trigger, ObjectId jobId, String state)
            throws JobPersistenceException {
        Document doc = convertToBson(trigger, jobId, state);
        jobDataConverter.toDocument(trigger.getJobDataMap(), doc);

        ScheduleConverter converter = ScheduleConverter.getConverterFor(trigger.getSchedule());
        if (converter == null) {
            throw new JobPersistenceException("No converter for schedule " + trigger.getSchedule()
                    + " of trigger " + trigger.getKey());
        }
        return converter.injectScheduleProperties(trigger.getSchedule(), doc);
    }

    /**
     * Restore trigger from Mongo Document.
     *
     * @return trigger from Document or null when trigger has no associated job
     * @throws JobPersistenceException if the schedule or the job data
     * cannot be restored.
     */
    public Trigger toTrigger(Document triggerDoc) throws JobPersistenceException {
        Trigger trigger = toTriggerWithOptionalJob(triggerDoc);
        if (trigger.getJobKey() == null) {
            return null;
        }
        return trigger;
    }

    /**
     * Restore trigger from Mongo Document even if no associated job exists.
     */
    public Trigger toTriggerWithOptionalJob(Document triggerDoc) throws JobPersistenceException {
        Trigger trigger = new Trigger();
        trigger.setKey(new TriggerKey(triggerDoc.getString(KEY_NAME), triggerDoc.getString(KEY_GROUP)));

        ScheduleConverter converter = ScheduleConverter.getConverterFor(triggerDoc);
        if (converter == null) {
            throw new JobPersistenceException("Unknown schedule type '"
                    + triggerDoc.getString(ScheduleConverter.SCHEDULE_TYPE) + "' of trigger " + trigger.getKey());
        }
        trigger.setSchedule(converter.toSchedule(triggerDoc));

        loadCommonProperties(triggerDoc, trigger);
        trigger.setJobDataMap(jobDataConverter.toJobData(triggerDoc));

        Document job = jobDao.getById(triggerDoc.get(Constants.TRIGGER_JOB_ID));
        if (job != null) {
            trigger.setJobKey(new JobKey(job.getString(KEY_NAME), job.getString(KEY_GROUP)));
        }
        return trigger;
    }

    private Document convertToBson(Trigger trigger, ObjectId jobId, String state) {
        Document doc = new Document();
        doc.put(KEY_NAME, trigger.getKey().getName());
        doc.put(KEY_GROUP, trigger.getKey().getGroup());
        doc.put(Constants.TRIGGER_JOB_ID, jobId);
        doc.put(Constants.TRIGGER_STATE, state);
        doc.put(Constants.TRIGGER_VERSION, trigger.getVersion());
        doc.put(Constants.TRIGGER_CALENDAR_NAME, trigger.getCalendarName());
        doc.put(TRIGGER_DESCRIPTION, trigger.getDescription());
        doc.put(TRIGGER_START_TIME, trigger.getStartTime());
        doc.put(TRIGGER_END_TIME, trigger.getEndTime());
        doc.put(TRIGGER_FIRE_INSTANCE_ID, trigger.getFireInstanceId());
        doc.put(TRIGGER_MISFIRE_INSTRUCTION, trigger.getMisfireInstruction().name());
        doc.put(Constants.TRIGGER_NEXT_FIRE_TIME, trigger.getNextFireTime());
        doc.put(TRIGGER_PREVIOUS_FIRE_TIME, trigger.getPreviousFireTime());
        doc.put(Constants.TRIGGER_PRIORITY, trigger.getPriority());
        doc.put(TRIGGER_TIMES_TRIGGERED, trigger.getTimesTriggered());
        return doc;
    }

    private void loadCommonProperties(Document triggerDoc, Trigger trigger) throws JobPersistenceException {
        trigger.setCalendarName(triggerDoc.getString(Constants.TRIGGER_CALENDAR_NAME));
        trigger.setDescription(triggerDoc.getString(TRIGGER_DESCRIPTION));
        trigger.setStartTime(triggerDoc.getDate(TRIGGER_START_TIME));
        trigger.setEndTime(triggerDoc.getDate(TRIGGER_END_TIME));
        trigger.setFireInstanceId(triggerDoc.getString(TRIGGER_FIRE_INSTANCE_ID));
        trigger.setNextFireTime(triggerDoc.getDate(Constants.TRIGGER_NEXT_FIRE_TIME));
        trigger.setPreviousFireTime(triggerDoc.getDate(TRIGGER_PREVIOUS_FIRE_TIME));
        trigger.setPriority(triggerDoc.getInteger(Constants.TRIGGER_PRIORITY, Trigger.DEFAULT_PRIORITY));
        trigger.setTimesTriggered(triggerDoc.getInteger(TRIGGER_TIMES_TRIGGERED, 0));
        Number version = triggerDoc.get(Constants.TRIGGER_VERSION, Number.class);
        trigger.setVersion(version == null ? 0L : version.longValue());

        String instruction = triggerDoc.getString(TRIGGER_MISFIRE_INSTRUCTION);
        try {
            trigger.setMisfireInstruction(instruction == null
                    ? MisfireInstruction.FIRE_NOW : MisfireInstruction.valueOf(instruction));
        } catch (IllegalArgumentException e) {
            throw new JobPersistenceException("Unknown misfire instruction '" + instruction
                    + "' of trigger " + trigger.getKey(), e);
        }
    }
}
