package com.novemberain.scheduling.core;

import com.novemberain.scheduling.Scheduler;
import com.novemberain.scheduling.SchedulerConfigException;
import com.novemberain.scheduling.SchedulerMetaData;
import com.novemberain.scheduling.listeners.LoggingJobHistoryListener;
import com.novemberain.scheduling.listeners.LoggingTriggerHistoryListener;
import com.novemberain.scheduling.simpl.RAMTriggerStore;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class StdSchedulerFactoryTest {

    @Test
    public void buildsSchedulerFromProperties() throws Exception {
        Scheduler scheduler = new StdSchedulerFactory(testProperties()).getScheduler();
        try {
            SchedulerMetaData metaData = scheduler.getMetaData();
            assertEquals("TestScheduler", metaData.getSchedulerName());
            assertEquals("test-node", metaData.getSchedulerInstanceId());
            assertEquals(3, metaData.getThreadPoolSize());
            assertEquals(RAMTriggerStore.class, metaData.getTriggerStoreClass());
            assertFalse(metaData.isStoreClustered());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    public void generatesInstanceIdOnRequest() throws Exception {
        Properties props = testProperties();
        props.setProperty(StdSchedulerFactory.PROP_SCHED_INSTANCE_ID, StdSchedulerFactory.AUTO_GENERATE_INSTANCE_ID);

        Scheduler scheduler = new StdSchedulerFactory(props).getScheduler();
        try {
            assertNotEquals(StdSchedulerFactory.AUTO_GENERATE_INSTANCE_ID, scheduler.getSchedulerInstanceId());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    public void registersHistoryListenersWhenAsked() throws Exception {
        Properties props = testProperties();
        props.setProperty(StdSchedulerFactory.PROP_HISTORY_LOGGING, "true");

        Scheduler scheduler = new StdSchedulerFactory(props).getScheduler();
        try {
            assertTrue(scheduler.getListenerManager().getJobListeners().get(0) instanceof LoggingJobHistoryListener);
            assertTrue(scheduler.getListenerManager().getTriggerListeners().get(0)
                    instanceof LoggingTriggerHistoryListener);
        } finally {
            scheduler.shutdown();
        }
    }

    @Test(expected = SchedulerConfigException.class)
    public void rejectsMalformedNumber() throws Exception {
        Properties props = testProperties();
        props.setProperty(StdSchedulerFactory.PROP_IDLE_WAIT_TIME, "soon");

        new StdSchedulerFactory(props).getScheduler();
    }

    @Test(expected = SchedulerConfigException.class)
    public void rejectsOutOfRangeValue() throws Exception {
        Properties props = testProperties();
        props.setProperty(StdSchedulerFactory.PROP_MISFIRE_THRESHOLD, "0");

        new StdSchedulerFactory(props).getScheduler();
    }

    @Test(expected = SchedulerConfigException.class)
    public void rejectsUnknownStoreType() throws Exception {
        Properties props = testProperties();
        props.setProperty(StdSchedulerFactory.PROP_JOB_STORE_TYPE, "jdbc");

        new StdSchedulerFactory(props).getScheduler();
    }

    @Test(expected = SchedulerConfigException.class)
    public void rejectsMalformedBoolean() throws Exception {
        Properties props = testProperties();
        props.setProperty(StdSchedulerFactory.PROP_JOB_STORE_TYPE, StdSchedulerFactory.STORE_TYPE_MONGODB);
        props.setProperty(StdSchedulerFactory.PROP_JOB_STORE_PREFIX + "clustered", "maybe");

        new StdSchedulerFactory(props).getScheduler();
    }

    @Test(expected = SchedulerConfigException.class)
    public void missingPropertiesFileIsAConfigError() throws Exception {
        new StdSchedulerFactory("/does/not/exist/scheduler.properties");
    }

    private static Properties testProperties() throws IOException {
        Properties props = new Properties();
        InputStream in = StdSchedulerFactoryTest.class.getResourceAsStream("/test-scheduler.properties");
        try {
            props.load(in);
        } finally {
            in.close();
        }
        return props;
    }
}
