package com.novemberain.scheduling.mongodb.cluster;

import com.mongodb.MongoException;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.mongodb.dao.SchedulerDao;
import org.junit.Before;
import org.junit.Test;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class CheckinTaskTest {

    private SchedulerDao schedulerDao;
    private Recoverer recoverer;
    private Runnable errorHandler;
    private CheckinTask task;

    @Before
    public void setUp() {
        schedulerDao = mock(SchedulerDao.class);
        recoverer = mock(Recoverer.class);
        errorHandler = mock(Runnable.class);
        task = new CheckinTask(schedulerDao, recoverer, errorHandler);
    }

    @Test
    public void checksInThenRecoversDefunctNodes() throws Exception {
        task.run();

        verify(schedulerDao).checkIn();
        verify(recoverer).recover();
        verify(errorHandler, never()).run();
    }

    @Test
    public void failedCheckinRunsErrorHandlerAndSkipsRecovery() throws Exception {
        doThrow(new MongoException("no primary")).when(schedulerDao).checkIn();

        task.run();

        verify(errorHandler).run();
        verify(recoverer, never()).recover();
    }

    @Test
    public void failedRecoveryDoesNotStopTheNode() throws Exception {
        doThrow(new JobPersistenceException("corrupt fired trigger")).when(recoverer).recover();

        task.run();

        verify(errorHandler, never()).run();
    }
}
