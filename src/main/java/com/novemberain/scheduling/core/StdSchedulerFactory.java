package com.novemberain.scheduling.core;

import com.novemberain.scheduling.JobRegistry;
import com.novemberain.scheduling.Scheduler;
import com.novemberain.scheduling.SchedulerConfigException;
import com.novemberain.scheduling.SchedulerException;
import com.novemberain.scheduling.listeners.LoggingJobHistoryListener;
import com.novemberain.scheduling.listeners.LoggingTriggerHistoryListener;
import com.novemberain.scheduling.mongodb.MongoTriggerStore;
import com.novemberain.scheduling.simpl.BoundedWorkerPool;
import com.novemberain.scheduling.simpl.RAMTriggerStore;
import com.novemberain.scheduling.spi.TriggerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Properties;

/**
 * Builds a {@link StdScheduler} from properties: the classpath resource
 * {@value #PROPERTIES_FILE} by default, a {@link Properties} object or a file.
 */
public class StdSchedulerFactory {

    private static final Logger log = LoggerFactory.getLogger(StdSchedulerFactory.class);

    public static final String PROPERTIES_FILE = "scheduler.properties";

    public static final String PROP_SCHED_INSTANCE_NAME = "scheduler.instanceName";
    public static final String PROP_SCHED_INSTANCE_ID = "scheduler.instanceId";
    public static final String PROP_THREAD_COUNT = "scheduler.threadPool.threadCount";
    public static final String PROP_IDLE_WAIT_TIME = "scheduler.idleWaitTime";
    public static final String PROP_BATCH_MAX_COUNT = "scheduler.batchTriggerAcquisitionMaxCount";
    public static final String PROP_BATCH_TIME_WINDOW = "scheduler.batchTriggerAcquisitionFireAheadTimeWindow";
    public static final String PROP_ACQUIRE_RETRY_DELAY = "scheduler.acquireRetryDelay";
    public static final String PROP_MAX_ACQUIRE_RETRY_DELAY = "scheduler.maxAcquireRetryDelay";
    public static final String PROP_MAX_CONSECUTIVE_ACQUIRE_FAILURES = "scheduler.maxConsecutiveAcquireFailures";
    public static final String PROP_MISFIRE_THRESHOLD = "scheduler.misfireThreshold";
    public static final String PROP_HISTORY_LOGGING = "scheduler.historyLogging";
    public static final String PROP_JOB_STORE_TYPE = "scheduler.jobStore.type";
    public static final String PROP_JOB_STORE_PREFIX = "scheduler.jobStore.";

    public static final String AUTO_GENERATE_INSTANCE_ID = "AUTO";
    public static final String DEFAULT_INSTANCE_ID = "NON_CLUSTERED";
    public static final String STORE_TYPE_RAM = "ram";
    public static final String STORE_TYPE_MONGODB = "mongodb";

    private final Properties props;

    /**
     * Use {@value #PROPERTIES_FILE} from the classpath, or the defaults when
     * there is none.
     */
    public StdSchedulerFactory() throws SchedulerConfigException {
        this(loadFromClasspath());
    }

    public StdSchedulerFactory(Properties props) {
        this.props = new Properties();
        this.props.putAll(props);
    }

    public StdSchedulerFactory(String fileName) throws SchedulerConfigException {
        this(loadFromFile(fileName));
    }

    public Scheduler getScheduler() throws SchedulerException {
        return getScheduler(new JobRegistry());
    }

    /**
     * @param jobRegistry job types the scheduler may instantiate
     */
    public Scheduler getScheduler(JobRegistry jobRegistry) throws SchedulerException {
        SchedulerResources resources = new SchedulerResources();
        try {
            resources.setName(getString(PROP_SCHED_INSTANCE_NAME, "DefaultScheduler"));
            resources.setInstanceId(resolveInstanceId());
            resources.setIdleWaitTime(getLong(PROP_IDLE_WAIT_TIME, SchedulerResources.DEFAULT_IDLE_WAIT_TIME));
            resources.setMaxBatchSize(getInt(PROP_BATCH_MAX_COUNT, 1));
            resources.setBatchTimeWindow(getLong(PROP_BATCH_TIME_WINDOW, 0L));
            resources.setAcquireRetryDelay(getLong(PROP_ACQUIRE_RETRY_DELAY,
                    SchedulerResources.DEFAULT_ACQUIRE_RETRY_DELAY));
            resources.setMaxAcquireRetryDelay(getLong(PROP_MAX_ACQUIRE_RETRY_DELAY,
                    SchedulerResources.DEFAULT_MAX_ACQUIRE_RETRY_DELAY));
            resources.setMaxConsecutiveAcquireFailures(getInt(PROP_MAX_CONSECUTIVE_ACQUIRE_FAILURES,
                    SchedulerResources.DEFAULT_MAX_CONSECUTIVE_ACQUIRE_FAILURES));
            resources.setJobRegistry(jobRegistry);
            resources.setTriggerStore(createTriggerStore());
        } catch (IllegalArgumentException e) {
            throw new SchedulerConfigException("Invalid scheduler configuration: " + e.getMessage(), e);
        }
        resources.setWorkerPool(new BoundedWorkerPool(getInt(PROP_THREAD_COUNT, 10),
                resources.getName() + "_Worker"));

        log.info("Creating scheduler '{}' with a {} trigger store",
                resources.getName(), getString(PROP_JOB_STORE_TYPE, STORE_TYPE_RAM));
        StdScheduler scheduler = new StdScheduler(resources);
        if (getBoolean(PROP_HISTORY_LOGGING, false)) {
            scheduler.getListenerManager().addJobListener(new LoggingJobHistoryListener());
            scheduler.getListenerManager().addTriggerListener(new LoggingTriggerHistoryListener());
        }
        return scheduler;
    }

    private TriggerStore createTriggerStore() throws SchedulerConfigException {
        String type = getString(PROP_JOB_STORE_TYPE, STORE_TYPE_RAM);
        long misfireThreshold = getLong(PROP_MISFIRE_THRESHOLD, 60000L);
        if (STORE_TYPE_RAM.equalsIgnoreCase(type)) {
            RAMTriggerStore store = new RAMTriggerStore();
            store.setMisfireThreshold(misfireThreshold);
            return store;
        }
        if (STORE_TYPE_MONGODB.equalsIgnoreCase(type)) {
            MongoTriggerStore store = createMongoStore();
            store.setMisfireThreshold(misfireThreshold);
            return store;
        }
        throw new SchedulerConfigException("Unknown job store type '" + type + "', expected 'ram' or 'mongodb'");
    }

    private MongoTriggerStore createMongoStore() throws SchedulerConfigException {
        MongoTriggerStore store = new MongoTriggerStore();
        String uri = getStoreString("mongoUri");
        if (uri != null) {
            store.setMongoUri(uri);
        }
        String addresses = getStoreString("addresses");
        if (addresses != null) {
            store.setAddresses(addresses);
        }
        store.setDbName(getStoreString("dbName"));
        store.setAuthDbName(getStoreString("authDbName"));
        String username = getStoreString("username");
        if (username != null) {
            store.setUsername(username);
            store.setPassword(getStoreString("password"));
        }
        String prefix = getStoreString("collectionPrefix");
        if (prefix != null) {
            store.setCollectionPrefix(prefix);
        }

        store.setIsClustered(getBoolean(PROP_JOB_STORE_PREFIX + "clustered", false));
        store.setClusterCheckinInterval(getLong(PROP_JOB_STORE_PREFIX + "clusterCheckinIntervalMillis", 7500L));
        store.setCheckInErrorHandler(getString(PROP_JOB_STORE_PREFIX + "checkInErrorHandler",
                MongoTriggerStore.CHECKIN_ERROR_STANDBY));
        store.setJobTimeoutMillis(getLong(PROP_JOB_STORE_PREFIX + "jobTimeoutMillis", 10 * 60 * 1000L));
        store.setTriggerTimeoutMillis(getLong(PROP_JOB_STORE_PREFIX + "triggerTimeoutMillis", 10 * 60 * 1000L));
        store.setJobDataAsBase64(getBoolean(PROP_JOB_STORE_PREFIX + "jobDataAsBase64", true));

        store.setMongoOptionWriteConcernTimeoutMillis(
                getInt(PROP_JOB_STORE_PREFIX + "mongoOptionWriteConcernTimeoutMillis", 5000));
        String writeConcernW = getStoreString("mongoOptionWriteConcernW");
        if (writeConcernW != null) {
            store.setMongoOptionWriteConcernW(writeConcernW);
        }
        if (getStoreString("mongoOptionMaxConnections") != null) {
            store.setMongoOptionMaxConnections(getInt(PROP_JOB_STORE_PREFIX + "mongoOptionMaxConnections", 0));
        }
        if (getStoreString("mongoOptionConnectTimeoutMillis") != null) {
            store.setMongoOptionConnectTimeoutMillis(
                    getInt(PROP_JOB_STORE_PREFIX + "mongoOptionConnectTimeoutMillis", 0));
        }
        if (getStoreString("mongoOptionReadTimeoutMillis") != null) {
            store.setMongoOptionReadTimeoutMillis(
                    getInt(PROP_JOB_STORE_PREFIX + "mongoOptionReadTimeoutMillis", 0));
        }
        return store;
    }

    private String resolveInstanceId() throws SchedulerConfigException {
        String instanceId = getString(PROP_SCHED_INSTANCE_ID, DEFAULT_INSTANCE_ID);
        if (!AUTO_GENERATE_INSTANCE_ID.equals(instanceId)) {
            return instanceId;
        }
        try {
            return InetAddress.getLocalHost().getHostName() + System.currentTimeMillis();
        } catch (UnknownHostException e) {
            throw new SchedulerConfigException("Couldn't get host name to generate an instance id", e);
        }
    }

    private String getStoreString(String name) {
        return getString(PROP_JOB_STORE_PREFIX + name, null);
    }

    private String getString(String name, String defaultValue) {
        String value = props.getProperty(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    private long getLong(String name, long defaultValue) throws SchedulerConfigException {
        String value = getString(name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new SchedulerConfigException("Property '" + name + "' is not a number: " + value, e);
        }
    }

    private int getInt(String name, int defaultValue) throws SchedulerConfigException {
        String value = getString(name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new SchedulerConfigException("Property '" + name + "' is not an integer: " + value, e);
        }
    }

    private boolean getBoolean(String name, boolean defaultValue) throws SchedulerConfigException {
        String value = getString(name, null);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new SchedulerConfigException("Property '" + name + "' is not a boolean: " + value);
    }

    private static Properties loadFromClasspath() throws SchedulerConfigException {
        Properties props = new Properties();
        InputStream in = StdSchedulerFactory.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE);
        if (in == null) {
            log.info("No {} found on the classpath, using defaults", PROPERTIES_FILE);
            return props;
        }
        try {
            props.load(in);
        } catch (IOException e) {
            throw new SchedulerConfigException("Could not read " + PROPERTIES_FILE, e);
        } finally {
            closeQuietly(in);
        }
        return props;
    }

    private static Properties loadFromFile(String fileName) throws SchedulerConfigException {
        Properties props = new Properties();
        InputStream in = null;
        try {
            in = new FileInputStream(fileName);
            props.load(in);
        } catch (IOException e) {
            throw new SchedulerConfigException("Could not read properties file " + fileName, e);
        } finally {
            closeQuietly(in);
        }
        return props;
    }

    private static void closeQuietly(InputStream in) {
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException e) {
            log.warn("Could not close properties stream", e);
        }
    }
}
