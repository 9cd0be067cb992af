package com.novemberain.scheduling.mongodb;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.novemberain.scheduling.CompletedExecutionInstruction;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.ObjectAlreadyExistsException;
import com.novemberain.scheduling.SchedulerConfigException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerState;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.mongodb.db.MongoConnector;
import com.novemberain.scheduling.schedule.MisfireHandler;
import com.novemberain.scheduling.schedule.ScheduleCalculator;
import com.novemberain.scheduling.spi.SchedulerSignaler;
import com.novemberain.scheduling.spi.TriggerFiredBundle;
import com.novemberain.scheduling.spi.TriggerStore;
import com.novemberain.scheduling.util.Clock;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.quartz.JobKey;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * A {@link TriggerStore} keeping jobs, triggers, calendars and locks in
 * MongoDB, so that several scheduler instances can share them.
 *
 * <p>Driver failures surface as {@link JobPersistenceException}.</p>
 */
public class MongoTriggerStore implements TriggerStore {

    private static final Logger log = LoggerFactory.getLogger(MongoTriggerStore.class);

    public static final String CHECKIN_ERROR_STANDBY = "standby";
    public static final String CHECKIN_ERROR_SHUTDOWN = "shutdown";

    private final MongoStoreAssembler assembler = new MongoStoreAssembler();

    MongoConnector mongoConnector;
    MongoDatabase mongoDatabase;
    MongoClient mongo;
    String collectionPrefix = "quartz_";
    String dbName;
    String authDbName;
    String schedulerName = "DefaultScheduler";
    String instanceId = "NON_CLUSTERED";
    String[] addresses;
    String mongoUri;
    String username;
    String password;
    long misfireThreshold = MisfireHandler.DEFAULT_MISFIRE_THRESHOLD;
    long triggerTimeoutMillis = 10 * 60 * 1000L;
    long jobTimeoutMillis = 10 * 60 * 1000L;
    private boolean clustered = false;
    long clusterCheckinIntervalMillis = 7500;
    String checkInErrorHandler = CHECKIN_ERROR_STANDBY;
    boolean jobDataAsBase64 = true;
    Clock clock = Clock.SYSTEM_CLOCK;

    // options for the Mongo client
    Integer mongoOptionMaxConnections;
    Integer mongoOptionConnectTimeoutMillis;
    Integer mongoOptionReadTimeoutMillis;
    int mongoOptionWriteConcernTimeoutMillis = 5000;
    String mongoOptionWriteConcernW;

    private ScheduleCalculator calculator;
    private SchedulerSignaler signaler;
    private volatile boolean checkinStarted;

    public MongoTriggerStore() {
    }

    public MongoTriggerStore(final MongoConnector mongoConnector) {
        this.mongoConnector = mongoConnector;
    }

    public MongoTriggerStore(final MongoDatabase mongoDatabase) {
        this.mongoDatabase = mongoDatabase;
    }

    public MongoTriggerStore(final MongoClient mongo) {
        this.mongo = mongo;
    }

    public MongoTriggerStore(final String mongoUri, final String username, final String password) {
        this.mongoUri = mongoUri;
        this.username = username;
        this.password = password;
    }

    @Override
    public void initialize(SchedulerSignaler signaler, ScheduleCalculator calculator)
            throws SchedulerConfigException {
        this.signaler = signaler;
        this.calculator = calculator;
        assembler.build(this, signaler, calculator);
        ensureIndexes();
        log.info("MongoTriggerStore initialized: instance {} of {}, clustered: {}",
                instanceId, schedulerName, clustered);
    }

    @Override
    public void schedulerStarted() throws JobPersistenceException {
        call(() -> {
            // executions left behind by an earlier run under the same id
            assembler.triggerRecoverer.recover(instanceId);
            if (!clustered) {
                assembler.triggerRecoverer.resetStates();
            }
            return null;
        });
        if (clustered) {
            assembler.checkinExecutor.start();
            checkinStarted = true;
        }
    }

    @Override
    public void schedulerPaused() {
        // no-op
    }

    @Override
    public void schedulerResumed() {
        // no-op
    }

    @Override
    public void shutdown() {
        if (checkinStarted) {
            assembler.checkinExecutor.shutdown();
        }
        if (assembler.mongoConnector != null) {
            assembler.mongoConnector.close();
        }
        log.info("MongoTriggerStore shut down.");
    }

    @Override
    public boolean isClustered() {
        return clustered;
    }

    // jobs and triggers

    @Override
    public void storeJob(JobDetail newJob, boolean replaceExisting) throws JobPersistenceException {
        call(() -> {
            assembler.persister.storeJob(newJob, replaceExisting);
            return null;
        });
    }

    @Override
    public void storeJobAndTrigger(JobDetail newJob, Trigger newTrigger) throws JobPersistenceException {
        call(() -> {
            assembler.persister.storeJobAndTrigger(newJob, newTrigger);
            return null;
        });
    }

    @Override
    public void storeTrigger(Trigger newTrigger, boolean replaceExisting) throws JobPersistenceException {
        call(() -> {
            assembler.persister.storeTrigger(newTrigger, replaceExisting);
            return null;
        });
    }

    @Override
    public boolean replaceTrigger(TriggerKey triggerKey, Trigger newTrigger) throws JobPersistenceException {
        return call(() -> assembler.persister.replaceTrigger(triggerKey, newTrigger));
    }

    @Override
    public boolean removeJob(JobKey jobKey) throws JobPersistenceException {
        return call(() -> assembler.persister.removeJob(jobKey));
    }

    @Override
    public boolean removeTrigger(TriggerKey triggerKey) throws JobPersistenceException {
        return call(() -> assembler.persister.removeTrigger(triggerKey));
    }

    @Override
    public JobDetail retrieveJob(JobKey jobKey) throws JobPersistenceException {
        return call(() -> assembler.jobDao.retrieveJob(jobKey));
    }

    @Override
    public Trigger retrieveTrigger(TriggerKey triggerKey) throws JobPersistenceException {
        return call(() -> assembler.triggerDao.getTrigger(triggerKey));
    }

    @Override
    public boolean checkExists(JobKey jobKey) throws JobPersistenceException {
        return call(() -> assembler.jobDao.exists(jobKey));
    }

    @Override
    public boolean checkExists(TriggerKey triggerKey) throws JobPersistenceException {
        return call(() -> assembler.triggerDao.exists(triggerKey));
    }

    @Override
    public List<Trigger> getTriggersForJob(JobKey jobKey) throws JobPersistenceException {
        return call(() -> assembler.persister.getTriggersForJob(jobKey));
    }

    // keys and groups

    @Override
    public Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher) throws JobPersistenceException {
        return call(() -> assembler.jobDao.getJobKeys(matcher));
    }

    @Override
    public Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher) throws JobPersistenceException {
        return call(() -> assembler.triggerDao.getTriggerKeys(matcher));
    }

    @Override
    public List<String> getJobGroupNames() throws JobPersistenceException {
        return call(() -> assembler.jobDao.getGroupNames());
    }

    @Override
    public List<String> getTriggerGroupNames() throws JobPersistenceException {
        return call(() -> assembler.triggerDao.getGroupNames());
    }

    // calendars

    @Override
    public void storeCalendar(String name, ExclusionCalendar calendar, boolean replaceExisting,
                              boolean updateTriggers) throws JobPersistenceException {
        call(() -> {
            if (!replaceExisting && assembler.calendarDao.exists(name)) {
                throw new ObjectAlreadyExistsException("Calendar with name '" + name + "' already exists.");
            }
            assembler.calendarDao.store(name, calendar);
            if (updateTriggers) {
                updateTriggersOfCalendar(name, calendar);
            }
            return null;
        });
    }

    @Override
    public boolean removeCalendar(String calName) throws JobPersistenceException {
        return call(() -> {
            if (assembler.triggerDao.hasTriggersWithCalendar(calName)) {
                throw new JobPersistenceException("Calendar '" + calName
                        + "' cannot be removed while it is referenced by a trigger.");
            }
            return assembler.calendarDao.remove(calName);
        });
    }

    @Override
    public ExclusionCalendar retrieveCalendar(String calName) throws JobPersistenceException {
        return call(() -> assembler.calendarDao.retrieveCalendar(calName));
    }

    @Override
    public List<String> getCalendarNames() throws JobPersistenceException {
        return call(() -> assembler.calendarDao.getCalendarNames());
    }

    // counts

    @Override
    public int getNumberOfJobs() throws JobPersistenceException {
        return call(() -> assembler.jobDao.getCount());
    }

    @Override
    public int getNumberOfTriggers() throws JobPersistenceException {
        return call(() -> assembler.triggerDao.getCount());
    }

    @Override
    public int getNumberOfCalendars() throws JobPersistenceException {
        return call(() -> assembler.calendarDao.getCount());
    }

    // state

    @Override
    public TriggerState getTriggerState(TriggerKey triggerKey) throws JobPersistenceException {
        return call(() -> assembler.triggerStateManager.getState(triggerKey));
    }

    @Override
    public void resetTriggerFromErrorState(TriggerKey triggerKey) throws JobPersistenceException {
        call(() -> {
            assembler.triggerStateManager.resetTriggerFromErrorState(triggerKey);
            return null;
        });
    }

    @Override
    public void pauseTrigger(TriggerKey triggerKey) throws JobPersistenceException {
        call(() -> {
            assembler.triggerStateManager.pause(triggerKey);
            return null;
        });
    }

    @Override
    public Collection<String> pauseTriggers(GroupMatcher<TriggerKey> matcher) throws JobPersistenceException {
        return call(() -> assembler.triggerStateManager.pause(matcher));
    }

    @Override
    public void pauseJob(JobKey jobKey) throws JobPersistenceException {
        call(() -> {
            assembler.triggerStateManager.pauseJob(jobKey);
            return null;
        });
    }

    @Override
    public Collection<String> pauseJobs(GroupMatcher<JobKey> groupMatcher) throws JobPersistenceException {
        return call(() -> assembler.triggerStateManager.pauseJobs(groupMatcher));
    }

    @Override
    public void resumeTrigger(TriggerKey triggerKey) throws JobPersistenceException {
        call(() -> {
            assembler.triggerStateManager.resume(triggerKey);
            return null;
        });
    }

    @Override
    public Collection<String> resumeTriggers(GroupMatcher<TriggerKey> matcher) throws JobPersistenceException {
        return call(() -> assembler.triggerStateManager.resume(matcher));
    }

    @Override
    public void resumeJob(JobKey jobKey) throws JobPersistenceException {
        call(() -> {
            assembler.triggerStateManager.resume(jobKey);
            return null;
        });
    }

    @Override
    public Collection<String> resumeJobs(GroupMatcher<JobKey> groupMatcher) throws JobPersistenceException {
        return call(() -> assembler.triggerStateManager.resumeJobs(groupMatcher));
    }

    @Override
    public void pauseAll() throws JobPersistenceException {
        call(() -> {
            assembler.triggerStateManager.pauseAll();
            return null;
        });
    }

    @Override
    public void resumeAll() throws JobPersistenceException {
        call(() -> {
            assembler.triggerStateManager.resumeAll();
            return null;
        });
    }

    @Override
    public Set<String> getPausedTriggerGroups() throws JobPersistenceException {
        return call(() -> assembler.triggerStateManager.getPausedTriggerGroups());
    }

    @Override
    public Set<String> getPausedJobGroups() throws JobPersistenceException {
        return call(() -> assembler.triggerStateManager.getPausedJobGroups());
    }

    @Override
    public void clearAllSchedulingData() throws JobPersistenceException {
        call(() -> {
            assembler.jobDao.clear();
            assembler.triggerDao.clear();
            assembler.calendarDao.clear();
            assembler.pausedJobGroupsDao.remove();
            assembler.pausedTriggerGroupsDao.remove();
            assembler.firedTriggerDao.clear();
            assembler.locksDao.clear();
            return null;
        });
    }

    // firing

    @Override
    public List<Trigger> acquireNextTriggers(long noLaterThan, int maxCount, long timeWindow)
            throws JobPersistenceException {
        return assembler.triggerRunner.acquireNext(noLaterThan, maxCount, timeWindow);
    }

    @Override
    public void releaseAcquiredTrigger(Trigger trigger) {
        try {
            assembler.triggerRunner.releaseAcquiredTrigger(trigger);
        } catch (MongoException e) {
            // the trigger lock expires and another acquisition takes the trigger over
            log.error("Could not release trigger " + trigger.getKey() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<TriggerFiredBundle> triggersFired(List<Trigger> triggers) throws JobPersistenceException {
        return assembler.triggerRunner.triggersFired(triggers);
    }

    @Override
    public void triggeredJobComplete(Trigger trigger, JobDetail job,
                                     CompletedExecutionInstruction instruction) throws JobPersistenceException {
        call(() -> {
            assembler.jobCompleteHandler.jobComplete(trigger, job, instruction);
            return null;
        });
    }

    private void updateTriggersOfCalendar(String name, ExclusionCalendar calendar)
            throws JobPersistenceException {
        for (Document doc : assembler.triggerDao.findUnfinishedByCalendarName(name)) {
            Trigger trigger = assembler.triggerConverter.toTriggerWithOptionalJob(doc);
            String state = doc.getString(Constants.TRIGGER_STATE);
            ObjectId jobId = doc.getObjectId(Constants.TRIGGER_JOB_ID);

            calculator.updateWithNewCalendar(trigger, calendar);
            String newState = trigger.getNextFireTime() == null ? Constants.STATE_COMPLETE : state;
            if (!assembler.persister.updateIfCurrent(trigger, jobId, state, newState)) {
                log.warn("Trigger {} changed while applying calendar {}, left as it was", trigger.getKey(), name);
            }
        }
        signaler.signalSchedulingChange(0L);
    }

    private void ensureIndexes() throws SchedulerConfigException {
        try {
            // group before name, so that group matchers can use the indexes
            assembler.jobDao.createIndex();
            assembler.triggerDao.createIndex();
            assembler.locksDao.createIndex(isClustered());
            assembler.calendarDao.createIndex();
            assembler.schedulerDao.createIndex();
            assembler.pausedJobGroupsDao.createIndex();
            assembler.pausedTriggerGroupsDao.createIndex();
            assembler.firedTriggerDao.createIndex();
        } catch (MongoException e) {
            throw new SchedulerConfigException("Error while initializing the indexes", e);
        }
    }

    private <T> T call(StoreCall<T> storeCall) throws JobPersistenceException {
        try {
            return storeCall.call();
        } catch (MongoException e) {
            throw new JobPersistenceException("MongoDB operation failed: " + e.getMessage(), e);
        }
    }

    private interface StoreCall<T> {
        T call() throws JobPersistenceException;
    }

    // configuration

    @Override
    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void setInstanceName(String schedName) {
        // part of the cluster node identifier
        this.schedulerName = schedName;
    }

    @Override
    public void setMisfireThreshold(long misfireThreshold) {
        if (misfireThreshold < 1) {
            throw new IllegalArgumentException("Misfire threshold must be larger than 0");
        }
        this.misfireThreshold = misfireThreshold;
    }

    /**
     * Set whether this instance is part of a cluster.
     */
    public void setIsClustered(boolean isClustered) {
        this.clustered = isClustered;
    }

    /**
     * Set the frequency at which this instance checks in with the other
     * instances of the cluster. Affects the rate of detecting failed instances.
     */
    public void setClusterCheckinInterval(long clusterCheckinInterval) {
        this.clusterCheckinIntervalMillis = clusterCheckinInterval;
    }

    /**
     * @param handler {@code standby} or {@code shutdown}
     */
    public void setCheckInErrorHandler(String handler) {
        this.checkInErrorHandler = handler;
    }

    public boolean isJobDataAsBase64() {
        return jobDataAsBase64;
    }

    /**
     * Configures the way job data is stored.
     * <ul>
     * <li><b>{@code true}</b> (default) - serialize the map with
     * {@link java.io.ObjectOutputStream ObjectOutputStream} and store it as
     * a base64 string in field '{@value Constants#JOB_DATA}'. Any
     * {@link java.io.Serializable Serializable} value is allowed.</li>
     * <li><b>{@code false}</b> - store the map directly in field
     * '{@value Constants#JOB_DATA_PLAIN}'. Faster, for simple values only.</li>
     * </ul>
     */
    public void setJobDataAsBase64(boolean jobDataAsBase64) {
        this.jobDataAsBase64 = jobDataAsBase64;
    }

    /**
     * Replace the time source. Must be called before {@link #initialize}.
     */
    public void setClock(Clock clock) {
        this.clock = clock;
    }

    public void setAddresses(String addresses) {
        this.addresses = addresses.split(",");
    }

    public String getDbName() {
        return dbName;
    }

    public void setDbName(String dbName) {
        this.dbName = dbName;
    }

    public String getAuthDbName() {
        return authDbName;
    }

    public void setAuthDbName(String authDbName) {
        this.authDbName = authDbName;
    }

    public void setCollectionPrefix(String prefix) {
        collectionPrefix = prefix + "_";
    }

    public void setMongoUri(final String mongoUri) {
        this.mongoUri = mongoUri;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public void setTriggerTimeoutMillis(long triggerTimeoutMillis) {
        this.triggerTimeoutMillis = triggerTimeoutMillis;
    }

    public void setJobTimeoutMillis(long jobTimeoutMillis) {
        this.jobTimeoutMillis = jobTimeoutMillis;
    }

    public void setMongoOptionMaxConnections(int maxConnections) {
        this.mongoOptionMaxConnections = maxConnections;
    }

    public void setMongoOptionConnectTimeoutMillis(int connectTimeoutMillis) {
        this.mongoOptionConnectTimeoutMillis = connectTimeoutMillis;
    }

    public void setMongoOptionReadTimeoutMillis(int readTimeoutMillis) {
        this.mongoOptionReadTimeoutMillis = readTimeoutMillis;
    }

    public void setMongoOptionWriteConcernTimeoutMillis(int writeConcernTimeoutMillis) {
        this.mongoOptionWriteConcernTimeoutMillis = writeConcernTimeoutMillis;
    }

    public void setMongoOptionWriteConcernW(String writeConcernW) {
        this.mongoOptionWriteConcernW = writeConcernW;
    }

    public MongoCollection<Document> getJobCollection() {
        return assembler.jobDao.getCollection();
    }

    public MongoCollection<Document> getTriggerCollection() {
        return assembler.triggerDao.getCollection();
    }

    public MongoCollection<Document> getCalendarCollection() {
        return assembler.calendarDao.getCollection();
    }

    public MongoCollection<Document> getLocksCollection() {
        return assembler.locksDao.getCollection();
    }

    public MongoCollection<Document> getFiredTriggersCollection() {
        return assembler.firedTriggerDao.getCollection();
    }
}
