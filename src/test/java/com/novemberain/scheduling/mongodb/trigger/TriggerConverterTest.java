package com.novemberain.scheduling.mongodb.trigger;

import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.MisfireInstruction;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerBuilder;
import com.novemberain.scheduling.mongodb.Constants;
import com.novemberain.scheduling.mongodb.JobDataConverter;
import com.novemberain.scheduling.mongodb.dao.JobDao;
import com.novemberain.scheduling.mongodb.trigger.schedules.ScheduleConverter;
import com.novemberain.scheduling.schedule.CronSchedule;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.Before;
import org.junit.Test;
import org.quartz.JobKey;

import java.time.Instant;
import java.util.Date;

import static com.novemberain.scheduling.mongodb.util.Keys.KEY_GROUP;
import static com.novemberain.scheduling.mongodb.util.Keys.KEY_NAME;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class TriggerConverterTest {

    private static final Date START = Date.from(Instant.parse("2024-01-01T00:00:00Z"));

    private final ObjectId jobId = new ObjectId();
    private JobDao jobDao;
    private Trigger trigger;

    @Before
    public void setUp() throws Exception {
        jobDao = mock(JobDao.class);
        trigger = TriggerBuilder.newTrigger()
                .withIdentity("noon", "reports")
                .forJob("report", "reports")
                .withSchedule(CronSchedule.cronSchedule("0 0 12 * * ?"))
                .startAt(START)
                .withPriority(7)
                .withMisfireInstruction(MisfireInstruction.DO_NOTHING)
                .modifiedByCalendar("holidays")
                .usingJobData("format", "pdf")
                .build();
        trigger.setNextFireTime(Date.from(Instant.parse("2024-01-01T12:00:00Z")));
        trigger.setVersion(4L);
    }

    @Test
    public void documentCarriesStateAndSchedule() throws Exception {
        Document doc = converter(false).toDocument(trigger, jobId, Constants.STATE_WAITING);

        assertEquals(Constants.STATE_WAITING, doc.getString(Constants.TRIGGER_STATE));
        assertEquals(jobId, doc.getObjectId(Constants.TRIGGER_JOB_ID));
        assertEquals(Long.valueOf(4L), doc.getLong(Constants.TRIGGER_VERSION));
        assertEquals("cron", doc.getString(ScheduleConverter.SCHEDULE_TYPE));
        assertEquals("pdf", doc.get(Constants.JOB_DATA_PLAIN, Document.class).getString("format"));
        assertFalse(doc.containsKey(Constants.JOB_DATA));
    }

    @Test
    public void storedTriggerIsRestoredWithItsJobKey() throws Exception {
        when(jobDao.getById(jobId)).thenReturn(new Document(KEY_NAME, "report").append(KEY_GROUP, "reports"));
        TriggerConverter converter = converter(true);

        Trigger restored = converter.toTrigger(converter.toDocument(trigger, jobId, Constants.STATE_WAITING));

        assertEquals(trigger.getKey(), restored.getKey());
        assertEquals(new JobKey("report", "reports"), restored.getJobKey());
        assertEquals(trigger.getSchedule(), restored.getSchedule());
        assertEquals(trigger.getNextFireTime(), restored.getNextFireTime());
        assertEquals(MisfireInstruction.DO_NOTHING, restored.getMisfireInstruction());
        assertEquals("holidays", restored.getCalendarName());
        assertEquals(7, restored.getPriority());
        assertEquals(4L, restored.getVersion());
        assertEquals("pdf", restored.getJobDataMap().getString("format"));
        assertFalse(restored.getJobDataMap().isDirty());
    }

    @Test
    public void triggerOfRemovedJobIsNotRestored() throws Exception {
        TriggerConverter converter = converter(false);
        Document doc = converter.toDocument(trigger, jobId, Constants.STATE_WAITING);

        assertNull(converter.toTrigger(doc));
        assertNull(converter.toTriggerWithOptionalJob(doc).getJobKey());
    }

    @Test
    public void unknownMisfireInstructionIsRejected() throws Exception {
        TriggerConverter converter = converter(false);
        Document doc = converter.toDocument(trigger, jobId, Constants.STATE_WAITING);
        doc.put("misfireInstruction", "FIRE_TWICE");

        try {
            converter.toTriggerWithOptionalJob(doc);
            throw new AssertionError("an unknown misfire instruction must not be restored");
        } catch (JobPersistenceException expected) {
            assertTrue(expected.getMessage().contains("FIRE_TWICE"));
        }
    }

    @Test(expected = JobPersistenceException.class)
    public void unknownScheduleTypeIsRejected() throws Exception {
        TriggerConverter converter = converter(false);
        Document doc = converter.toDocument(trigger, jobId, Constants.STATE_WAITING);
        doc.put(ScheduleConverter.SCHEDULE_TYPE, "lunar");

        converter.toTriggerWithOptionalJob(doc);
    }

    private TriggerConverter converter(boolean base64) {
        return new TriggerConverter(jobDao, new JobDataConverter(base64));
    }
}
