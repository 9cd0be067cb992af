package com.novemberain.scheduling;

/**
 * A trigger was changed by someone else since it was read.
 */
public class ConcurrencyConflictException extends JobPersistenceException {

    private static final long serialVersionUID = 1L;

    public ConcurrencyConflictException(String msg) {
        super(msg);
    }
}
