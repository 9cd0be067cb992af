package com.novemberain.scheduling.mongodb;

import com.mongodb.client.MongoCollection;
import com.novemberain.scheduling.SchedulerConfigException;
import com.novemberain.scheduling.mongodb.cluster.CheckinExecutor;
import com.novemberain.scheduling.mongodb.cluster.CheckinTask;
import com.novemberain.scheduling.mongodb.cluster.Recoverer;
import com.novemberain.scheduling.mongodb.cluster.RecoveryTriggerFactory;
import com.novemberain.scheduling.mongodb.cluster.ShutdownErrorHandler;
import com.novemberain.scheduling.mongodb.cluster.StandbyErrorHandler;
import com.novemberain.scheduling.mongodb.cluster.TriggerRecoverer;
import com.novemberain.scheduling.mongodb.dao.CalendarDao;
import com.novemberain.scheduling.mongodb.dao.FiredTriggerDao;
import com.novemberain.scheduling.mongodb.dao.JobDao;
import com.novemberain.scheduling.mongodb.dao.LocksDao;
import com.novemberain.scheduling.mongodb.dao.PausedJobGroupsDao;
import com.novemberain.scheduling.mongodb.dao.PausedTriggerGroupsDao;
import com.novemberain.scheduling.mongodb.dao.SchedulerDao;
import com.novemberain.scheduling.mongodb.dao.TriggerDao;
import com.novemberain.scheduling.mongodb.db.MongoConnector;
import com.novemberain.scheduling.mongodb.db.MongoConnectorBuilder;
import com.novemberain.scheduling.mongodb.trigger.CalendarConverter;
import com.novemberain.scheduling.mongodb.trigger.TriggerConverter;
import com.novemberain.scheduling.mongodb.util.ExpiryCalculator;
import com.novemberain.scheduling.mongodb.util.QueryHelper;
import com.novemberain.scheduling.schedule.MisfireHandler;
import com.novemberain.scheduling.schedule.ScheduleCalculator;
import com.novemberain.scheduling.spi.SchedulerSignaler;
import com.novemberain.scheduling.util.Clock;
import org.bson.Document;

/**
 * Wires the DAOs and managers behind a {@link MongoTriggerStore}.
 */
public class MongoStoreAssembler {

    public MongoConnector mongoConnector;
    public JobCompleteHandler jobCompleteHandler;
    public LockManager lockManager;
    public TriggerStateManager triggerStateManager;
    public TriggerRunner triggerRunner;
    public TriggerAndJobPersister persister;
    public MisfireHandler misfireHandler;

    public CalendarDao calendarDao;
    public JobDao jobDao;
    public LocksDao locksDao;
    public SchedulerDao schedulerDao;
    public PausedJobGroupsDao pausedJobGroupsDao;
    public PausedTriggerGroupsDao pausedTriggerGroupsDao;
    public TriggerDao triggerDao;
    public FiredTriggerDao firedTriggerDao;

    public TriggerConverter triggerConverter;
    public TriggerRecoverer triggerRecoverer;
    public CheckinExecutor checkinExecutor;

    private final QueryHelper queryHelper = new QueryHelper();

    public void build(MongoTriggerStore store, SchedulerSignaler signaler, ScheduleCalculator calculator)
            throws SchedulerConfigException {
        Clock clock = store.clock;
        mongoConnector = createMongoConnector(store);

        JobDataConverter jobDataConverter = new JobDataConverter(store.jobDataAsBase64);
        jobDao = new JobDao(getCollection(store, "jobs"), queryHelper,
                new JobConverter(jobDataConverter), jobDataConverter);
        triggerConverter = new TriggerConverter(jobDao, jobDataConverter);

        triggerDao = new TriggerDao(getCollection(store, "triggers"), queryHelper, triggerConverter);
        calendarDao = new CalendarDao(getCollection(store, "calendars"), new CalendarConverter());
        locksDao = new LocksDao(getCollection(store, "locks"), clock, store.instanceId);
        pausedJobGroupsDao = new PausedJobGroupsDao(getCollection(store, "paused_job_groups"));
        pausedTriggerGroupsDao = new PausedTriggerGroupsDao(getCollection(store, "paused_trigger_groups"));
        schedulerDao = new SchedulerDao(getCollection(store, "schedulers"), store.schedulerName,
                store.instanceId, store.clusterCheckinIntervalMillis, clock);
        firedTriggerDao = new FiredTriggerDao(getCollection(store, "fired_triggers"));

        misfireHandler = new MisfireHandler(calculator, clock, store.misfireThreshold, signaler);
        lockManager = new LockManager(locksDao, new ExpiryCalculator(schedulerDao, clock,
                store.jobTimeoutMillis, store.triggerTimeoutMillis));

        persister = new TriggerAndJobPersister(triggerDao, jobDao, calendarDao, locksDao,
                pausedTriggerGroupsDao, pausedJobGroupsDao, triggerConverter, calculator, signaler);
        jobCompleteHandler = new JobCompleteHandler(persister, signaler, jobDao, lockManager,
                triggerDao, firedTriggerDao);
        triggerStateManager = new TriggerStateManager(triggerDao, jobDao, calendarDao,
                pausedJobGroupsDao, pausedTriggerGroupsDao, queryHelper, triggerConverter, persister,
                lockManager, misfireHandler, signaler);
        triggerRunner = new TriggerRunner(persister, triggerDao, jobDao, calendarDao, firedTriggerDao,
                misfireHandler, calculator, triggerConverter, lockManager, clock, store.instanceId);

        triggerRecoverer = new TriggerRecoverer(locksDao, firedTriggerDao, triggerDao, jobDao, persister,
                lockManager, new RecoveryTriggerFactory(clock));

        checkinExecutor = createCheckinExecutor(store, signaler, clock);
    }

    private CheckinExecutor createCheckinExecutor(MongoTriggerStore store, SchedulerSignaler signaler,
                                                  Clock clock) throws SchedulerConfigException {
        Recoverer recoverer = new Recoverer(schedulerDao, triggerRecoverer, clock);
        CheckinTask task = new CheckinTask(schedulerDao, recoverer, createErrorHandler(store, signaler));
        return new CheckinExecutor(task, store.clusterCheckinIntervalMillis, store.instanceId);
    }

    private Runnable createErrorHandler(MongoTriggerStore store, SchedulerSignaler signaler)
            throws SchedulerConfigException {
        String handler = store.checkInErrorHandler;
        if (handler == null || MongoTriggerStore.CHECKIN_ERROR_STANDBY.equalsIgnoreCase(handler)) {
            return new StandbyErrorHandler(signaler);
        }
        if (MongoTriggerStore.CHECKIN_ERROR_SHUTDOWN.equalsIgnoreCase(handler)) {
            return new ShutdownErrorHandler(signaler);
        }
        throw new SchedulerConfigException("Unknown check-in error handler '" + handler
                + "', expected 'standby' or 'shutdown'");
    }

    private MongoConnector createMongoConnector(MongoTriggerStore store) throws SchedulerConfigException {
        MongoConnectorBuilder builder = MongoConnectorBuilder.builder()
                .withConnector(store.mongoConnector)
                .withDatabase(store.mongoDatabase)
                .withClient(store.mongo)
                .withUri(store.mongoUri)
                .withAddresses(store.addresses)
                .withDatabaseName(store.dbName)
                .withAuthDatabaseName(store.authDbName)
                .withMaxConnections(store.mongoOptionMaxConnections)
                .withConnectTimeoutMillis(store.mongoOptionConnectTimeoutMillis)
                .withReadTimeoutMillis(store.mongoOptionReadTimeoutMillis)
                .withWriteConcernWriteTimeout(store.mongoOptionWriteConcernTimeoutMillis)
                .withWriteConcernW(store.mongoOptionWriteConcernW);
        if (store.username != null) {
            builder.withCredentials(store.username, store.password);
        }
        return builder.build();
    }

    private MongoCollection<Document> getCollection(MongoTriggerStore store, String name) {
        return mongoConnector.getCollection(store.collectionPrefix + name);
    }
}
