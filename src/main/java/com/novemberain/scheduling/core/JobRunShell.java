package com.novemberain.scheduling.core;

import com.novemberain.scheduling.CompletedExecutionInstruction;
import com.novemberain.scheduling.Job;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobExecutionContext;
import com.novemberain.scheduling.JobExecutionException;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.SchedulerException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.spi.TriggerFiredBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one fire instance on a worker thread.
 *
 * <p>Every failure of the job is caught here and turned into a completion
 * instruction for the store, so nothing the job does can reach the dispatch
 * loop.</p>
 */
public class JobRunShell implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobRunShell.class);

    private final StdScheduler scheduler;
    private final TriggerFiredBundle firedBundle;
    private JobExecutionContext context;

    public JobRunShell(StdScheduler scheduler, TriggerFiredBundle firedBundle) {
        this.scheduler = scheduler;
        this.firedBundle = firedBundle;
    }

    /**
     * Instantiate the job through the registry and build its execution context.
     *
     * @throws SchedulerException when the job type cannot be instantiated
     */
    public void initialize() throws SchedulerException {
        JobDetail jobDetail = firedBundle.getJobDetail();
        Job job = scheduler.getJobRegistry().newJob(jobDetail.getJobType());

        context = new JobExecutionContext(scheduler, firedBundle.getTrigger(), jobDetail,
                firedBundle.getFireInstanceId(), firedBundle.getFireTime(), firedBundle.getScheduledFireTime(),
                firedBundle.getPreviousFireTime(), firedBundle.getNextFireTime(), firedBundle.isRecovering());
        context.setJobInstance(job);
    }

    public JobExecutionContext getContext() {
        return context;
    }

    @Override
    public void run() {
        Trigger trigger = context.getTrigger();
        JobDetail jobDetail = context.getJobDetail();
        scheduler.addExecutingJob(context);
        try {
            while (true) {
                if (scheduler.notifyTriggerListenersFired(context)) {
                    scheduler.notifyJobListenersWasVetoed(context);
                    completeTriggerRetryLoop(trigger, jobDetail, CompletedExecutionInstruction.NOOP);
                    return;
                }
                scheduler.notifyJobListenersToBeExecuted(context);

                JobExecutionException jobExEx = null;
                Job job = context.getJobInstance();
                long startTime = System.currentTimeMillis();
                try {
                    log.debug("Calling execute on job {}", jobDetail.getKey());
                    job.execute(context);
                } catch (JobExecutionException jee) {
                    jobExEx = jee;
                    log.info("Job {} threw a JobExecutionException: ", jobDetail.getKey(), jee);
                } catch (Throwable e) {
                    log.error("Job {} threw an unhandled Exception: ", jobDetail.getKey(), e);
                    jobExEx = new JobExecutionException("Job threw an unhandled exception.", e, false);
                }
                context.setJobRunTime(System.currentTimeMillis() - startTime);

                scheduler.jobExecuted(jobExEx == null);
                scheduler.notifyJobListenersWasExecuted(context, jobExEx);

                CompletedExecutionInstruction instruction = instructionFor(jobExEx);
                scheduler.notifyTriggerListenersComplete(context, instruction);

                if (instruction == CompletedExecutionInstruction.RE_EXECUTE_JOB) {
                    context.incrementRefireCount();
                    log.debug("Re-executing job {}, refire count {}", jobDetail.getKey(),
                            context.getRefireCount());
                    continue;
                }
                completeTriggerRetryLoop(trigger, jobDetail, instruction);
                return;
            }
        } finally {
            scheduler.removeExecutingJob(context);
        }
    }

    static CompletedExecutionInstruction instructionFor(JobExecutionException jobExEx) {
        if (jobExEx == null) {
            return CompletedExecutionInstruction.NOOP;
        }
        if (jobExEx.refireImmediately()) {
            return CompletedExecutionInstruction.RE_EXECUTE_JOB;
        }
        if (jobExEx.unscheduleAllTriggers()) {
            return CompletedExecutionInstruction.SET_ALL_JOB_TRIGGERS_COMPLETE;
        }
        if (jobExEx.unscheduleFiringTrigger()) {
            return CompletedExecutionInstruction.SET_TRIGGER_COMPLETE;
        }
        return CompletedExecutionInstruction.NOOP;
    }

    /**
     * Report the outcome to the store, retrying until it succeeds or the scheduler shuts down.
     */
    private void completeTriggerRetryLoop(Trigger trigger, JobDetail jobDetail,
                                          CompletedExecutionInstruction instruction) {
        long count = 0;
        while (!scheduler.isShuttingDown()) {
            try {
                scheduler.getTriggerStore().triggeredJobComplete(trigger, jobDetail, instruction);
                return;
            } catch (JobPersistenceException jpe) {
                if (count % 4 == 0) {
                    scheduler.notifySchedulerListenersError("An error occurred while marking executed job "
                            + "complete (will continue attempts). job= '" + jobDetail.getKey() + "'", jpe);
                }
            } catch (RuntimeException e) {
                log.error("Unexpected error while marking job {} complete", jobDetail.getKey(), e);
            }
            count++;
            try {
                Thread.sleep(scheduler.getResources().getJobCompletionRetryDelay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while retrying completion of job {}", jobDetail.getKey());
                return;
            }
        }
        log.warn("Scheduler shut down before job {} could be marked complete", jobDetail.getKey());
    }
}
