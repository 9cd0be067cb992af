package com.novemberain.scheduling.spi;

import com.novemberain.scheduling.SchedulerException;
import com.novemberain.scheduling.Trigger;
import org.quartz.JobKey;

/**
 * Callbacks from a {@link TriggerStore} into the scheduler that owns it.
 */
public interface SchedulerSignaler {

    void notifyTriggerListenersMisfired(Trigger trigger);

    void notifySchedulerListenersFinalized(Trigger trigger);

    void notifySchedulerListenersJobDeleted(JobKey jobKey);

    void notifySchedulerListenersError(String message, SchedulerException cause);

    /**
     * Wake the dispatch loop because a trigger may now fire earlier than it planned.
     *
     * @param candidateNewNextFireTime the new fire time, or 0 when unknown
     */
    void signalSchedulingChange(long candidateNewNextFireTime);

    /**
     * The store lost contact with its cluster and asks the scheduler to stop firing.
     */
    void requestStandby(String reason);

    /**
     * The store lost contact with its cluster and asks the scheduler to shut down.
     */
    void requestShutdown(String reason);
}
