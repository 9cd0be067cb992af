package com.novemberain.scheduling;

/**
 * A job that can react to {@link Scheduler#interrupt(String)}.
 * Interruption is cooperative: the job decides when to stop.
 */
public interface InterruptableJob extends Job {

    void interrupt();
}
