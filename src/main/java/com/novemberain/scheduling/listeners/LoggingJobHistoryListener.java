package com.novemberain.scheduling.listeners;

import com.novemberain.scheduling.JobExecutionContext;
import com.novemberain.scheduling.JobExecutionException;
import com.novemberain.scheduling.JobListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the start, completion and failure of every job execution.
 */
public class LoggingJobHistoryListener implements JobListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingJobHistoryListener.class);

    private final String name;

    public LoggingJobHistoryListener() {
        this("LoggingJobHistoryListener");
    }

    public LoggingJobHistoryListener(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void jobToBeExecuted(JobExecutionContext context) {
        log.info("Job {} fired by trigger {} at {}, scheduled for {}, refire count {}",
                context.getJobDetail().getKey(), context.getTrigger().getKey(), context.getFireTime(),
                context.getScheduledFireTime(), context.getRefireCount());
    }

    @Override
    public void jobExecutionVetoed(JobExecutionContext context) {
        log.info("Job {} was vetoed; it was to be fired by trigger {} at {}",
                context.getJobDetail().getKey(), context.getTrigger().getKey(), context.getFireTime());
    }

    @Override
    public void jobWasExecuted(JobExecutionContext context, JobExecutionException jobException) {
        if (jobException != null) {
            log.warn("Job {} run {} failed after {} ms: {}", context.getJobDetail().getKey(),
                    context.getFireInstanceId(), context.getJobRunTime(), jobException.getMessage());
        } else {
            log.info("Job {} run {} completed in {} ms, result: {}", context.getJobDetail().getKey(),
                    context.getFireInstanceId(), context.getJobRunTime(), context.getResult());
        }
    }
}
