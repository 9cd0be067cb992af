package com.novemberain.scheduling;

/**
 * Body of work executed when a trigger fires.
 *
 * <p>Implementations are created through the {@link JobRegistry}; a fresh
 * instance is used for every execution.</p>
 */
public interface Job {

    void execute(JobExecutionContext context) throws JobExecutionException;
}
