package com.novemberain.scheduling.listeners;

import com.novemberain.scheduling.CompletedExecutionInstruction;
import com.novemberain.scheduling.JobExecutionContext;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs firings, misfires and completions of triggers. Never vetoes.
 */
public class LoggingTriggerHistoryListener implements TriggerListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingTriggerHistoryListener.class);

    private final String name;

    public LoggingTriggerHistoryListener() {
        this("LoggingTriggerHistoryListener");
    }

    public LoggingTriggerHistoryListener(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void triggerFired(Trigger trigger, JobExecutionContext context) {
        log.info("Trigger {} fired job {} at {}, next fire time {}", trigger.getKey(),
                trigger.getJobKey(), context.getFireTime(), trigger.getNextFireTime());
    }

    @Override
    public void triggerMisfired(Trigger trigger) {
        log.info("Trigger {} misfired job {}, should have fired at {}", trigger.getKey(),
                trigger.getJobKey(), trigger.getNextFireTime());
    }

    @Override
    public void triggerComplete(Trigger trigger, JobExecutionContext context,
                                CompletedExecutionInstruction instruction) {
        log.info("Trigger {} completed firing job {} with instruction {}", trigger.getKey(),
                trigger.getJobKey(), instruction);
    }
}
