package com.novemberain.scheduling.mongodb.cluster;

import com.novemberain.scheduling.mongodb.dao.SchedulerDao;
import com.novemberain.scheduling.util.Clock;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RecovererTest {

    private static final long NOW = 1704067200000L;
    private static final long INTERVAL = 7500L;

    private final SchedulerInstance self = new SchedulerInstance("cluster", "self", NOW - 60000L, INTERVAL);
    private final SchedulerInstance alive = new SchedulerInstance("cluster", "alive", NOW - 1000L, INTERVAL);
    private final SchedulerInstance dead = new SchedulerInstance("cluster", "dead", NOW - 60000L, INTERVAL);

    private SchedulerDao schedulerDao;
    private TriggerRecoverer triggerRecoverer;
    private Recoverer recoverer;

    @Before
    public void setUp() {
        schedulerDao = mock(SchedulerDao.class);
        triggerRecoverer = mock(TriggerRecoverer.class);
        when(schedulerDao.getAllByCheckinTime()).thenReturn(Arrays.asList(self, dead, alive));
        when(schedulerDao.isNotSelf(self)).thenReturn(false);
        when(schedulerDao.isNotSelf(dead)).thenReturn(true);
        when(schedulerDao.isNotSelf(alive)).thenReturn(true);
        recoverer = new Recoverer(schedulerDao, triggerRecoverer, Clock.fixed(NOW));
    }

    @Test
    public void onlyDefunctOtherNodesAreRecovered() throws Exception {
        recoverer.recover();

        verify(triggerRecoverer).recover("dead");
        verify(schedulerDao).remove("dead", dead.getLastCheckinTime());
        verify(triggerRecoverer, never()).recover("self");
        verify(triggerRecoverer, never()).recover("alive");
        verify(schedulerDao, never()).remove(eq("alive"), anyLong());
    }

    @Test
    public void nothingToRecoverWhenEveryNodeIsAlive() throws Exception {
        when(schedulerDao.getAllByCheckinTime()).thenReturn(Arrays.asList(alive));

        recoverer.recover();

        verify(triggerRecoverer, never()).recover(anyString());
    }

    @Test
    public void instanceIsDefunctAfterIntervalAndEpsilon() {
        long deadline = dead.getLastCheckinTime() + INTERVAL + SchedulerInstance.TIME_EPSILON;

        assertFalse(dead.isDefunct(deadline));
        assertTrue(dead.isDefunct(deadline + 1));
    }
}
