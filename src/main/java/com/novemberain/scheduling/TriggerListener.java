package com.novemberain.scheduling;

public interface TriggerListener {

    String getName();

    default void triggerFired(Trigger trigger, JobExecutionContext context) {
    }

    /**
     * Return true to prevent the job from executing.
     */
    default boolean vetoJobExecution(Trigger trigger, JobExecutionContext context) {
        return false;
    }

    default void triggerMisfired(Trigger trigger) {
    }

    default void triggerComplete(Trigger trigger, JobExecutionContext context,
                                 CompletedExecutionInstruction instruction) {
    }
}
