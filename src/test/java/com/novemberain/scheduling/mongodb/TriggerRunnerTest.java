package com.novemberain.scheduling.mongodb;

import com.mongodb.MongoException;
import com.novemberain.scheduling.JobBuilder;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerBuilder;
import com.novemberain.scheduling.mongodb.dao.CalendarDao;
import com.novemberain.scheduling.mongodb.dao.FiredTriggerDao;
import com.novemberain.scheduling.mongodb.dao.JobDao;
import com.novemberain.scheduling.mongodb.dao.TriggerDao;
import com.novemberain.scheduling.mongodb.trigger.TriggerConverter;
import com.novemberain.scheduling.schedule.MisfireHandler;
import com.novemberain.scheduling.schedule.ScheduleCalculator;
import com.novemberain.scheduling.schedule.SimpleSchedule;
import com.novemberain.scheduling.spi.FiredTriggerRecord;
import com.novemberain.scheduling.spi.TriggerFiredBundle;
import com.novemberain.scheduling.util.Clock;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.Before;
import org.junit.Test;
import org.quartz.TriggerKey;

import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TriggerRunnerTest {

    private static final long NOW = 1704067200000L;

    private final ObjectId jobId = new ObjectId();
    private final JobDetail job = JobBuilder.newJob("report").withIdentity("report", "reports").build();

    private TriggerAndJobPersister persister;
    private TriggerDao triggerDao;
    private JobDao jobDao;
    private FiredTriggerDao firedTriggerDao;
    private TriggerConverter triggerConverter;
    private LockManager lockManager;
    private TriggerRunner runner;

    @Before
    public void setUp() throws Exception {
        persister = mock(TriggerAndJobPersister.class);
        triggerDao = mock(TriggerDao.class);
        jobDao = mock(JobDao.class);
        firedTriggerDao = mock(FiredTriggerDao.class);
        triggerConverter = mock(TriggerConverter.class);
        lockManager = mock(LockManager.class);
        runner = new TriggerRunner(persister, triggerDao, jobDao, mock(CalendarDao.class), firedTriggerDao,
                mock(MisfireHandler.class), new ScheduleCalculator(), triggerConverter, lockManager,
                Clock.fixed(NOW), "node-a");

        when(jobDao.retrieveJob(job.getKey())).thenReturn(job);
        when(persister.updateIfCurrent(any(Trigger.class), eq(jobId), anyString(), anyString())).thenReturn(true);
    }

    @Test
    public void firedTriggersSurviveFailureOfALaterOne() throws Exception {
        Trigger fired = acquired("first");
        Trigger failing = acquired("second");
        storedAsAcquired(fired);
        when(triggerDao.findTrigger(failing.getKey())).thenThrow(new MongoException("connection reset"));

        List<TriggerFiredBundle> bundles = runner.triggersFired(Arrays.asList(fired, failing));

        assertEquals(1, bundles.size());
        assertEquals(fired.getKey(), bundles.get(0).getTrigger().getKey());
        assertEquals(new Date(NOW - 1000L), bundles.get(0).getScheduledFireTime());
        verify(firedTriggerDao, times(1)).insert(any(FiredTriggerRecord.class));
        verify(triggerDao).transferState(failing.getKey(), Constants.STATE_ACQUIRED, Constants.STATE_WAITING);
        verify(lockManager).unlockAcquiredTrigger(fired.getKey());
        verify(lockManager).unlockAcquiredTrigger(failing.getKey());
    }

    @Test
    public void batchWithNothingFiredReportsTheFailure() throws Exception {
        Trigger failing = acquired("only");
        when(triggerDao.findTrigger(failing.getKey())).thenThrow(new MongoException("connection reset"));

        try {
            runner.triggersFired(Collections.singletonList(failing));
            fail("a batch that could not fire at all must be reported");
        } catch (JobPersistenceException expected) {
            assertEquals(MongoException.class, expected.getCause().getClass());
        }
        verify(triggerDao).transferState(failing.getKey(), Constants.STATE_ACQUIRED, Constants.STATE_WAITING);
    }

    private Trigger acquired(String name) {
        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity(name, "reports")
                .forJob(job)
                .withSchedule(SimpleSchedule.repeatForever(60000L))
                .startAt(new Date(NOW - 1000L))
                .build();
        trigger.setNextFireTime(new Date(NOW - 1000L));
        trigger.setVersion(3L);
        return trigger;
    }

    private void storedAsAcquired(Trigger trigger) throws JobPersistenceException {
        Document doc = new Document(Constants.TRIGGER_STATE, Constants.STATE_ACQUIRED)
                .append(Constants.TRIGGER_VERSION, 3L)
                .append(Constants.TRIGGER_JOB_ID, jobId);
        TriggerKey key = trigger.getKey();
        when(triggerDao.findTrigger(key)).thenReturn(doc);
        when(triggerConverter.toTriggerWithOptionalJob(doc)).thenReturn(trigger);
    }
}
