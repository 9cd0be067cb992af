package com.novemberain.scheduling;

/**
 * Receives events about job executions. All methods have empty defaults.
 */
public interface JobListener {

    String getName();

    default void jobToBeExecuted(JobExecutionContext context) {
    }

    /**
     * Called when a trigger listener vetoed the execution.
     */
    default void jobExecutionVetoed(JobExecutionContext context) {
    }

    /**
     * Called after the job ran. {@code jobException} is null on success.
     */
    default void jobWasExecuted(JobExecutionContext context, JobExecutionException jobException) {
    }
}
