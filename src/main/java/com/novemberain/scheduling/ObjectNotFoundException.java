package com.novemberain.scheduling;

/**
 * A job, trigger, calendar or job type was referenced but is not known.
 */
public class ObjectNotFoundException extends JobPersistenceException {

    private static final long serialVersionUID = 1L;

    public ObjectNotFoundException(String msg) {
        super(msg);
    }
}
