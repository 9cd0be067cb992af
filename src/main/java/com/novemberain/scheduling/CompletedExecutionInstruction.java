package com.novemberain.scheduling;

/**
 * Outcome of one fire instance, reported by the worker back to the store.
 */
public enum CompletedExecutionInstruction {
    NOOP,
    RE_EXECUTE_JOB,
    SET_TRIGGER_COMPLETE,
    DELETE_TRIGGER,
    SET_ALL_JOB_TRIGGERS_COMPLETE,
    SET_TRIGGER_ERROR,
    SET_ALL_JOB_TRIGGERS_ERROR
}
