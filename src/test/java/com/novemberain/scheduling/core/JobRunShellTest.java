package com.novemberain.scheduling.core;

import com.novemberain.scheduling.CompletedExecutionInstruction;
import com.novemberain.scheduling.Job;
import com.novemberain.scheduling.JobBuilder;
import com.novemberain.scheduling.JobDetail;
import com.novemberain.scheduling.JobExecutionContext;
import com.novemberain.scheduling.JobExecutionException;
import com.novemberain.scheduling.JobPersistenceException;
import com.novemberain.scheduling.JobRegistry;
import com.novemberain.scheduling.ObjectNotFoundException;
import com.novemberain.scheduling.SchedulerException;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.TriggerBuilder;
import com.novemberain.scheduling.spi.TriggerFiredBundle;
import com.novemberain.scheduling.spi.TriggerStore;
import org.junit.Before;
import org.junit.Test;

import java.util.Date;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class JobRunShellTest {

    private final AtomicInteger runs = new AtomicInteger();

    private StdScheduler scheduler;
    private TriggerStore store;
    private JobRegistry registry;
    private JobDetail job;
    private Trigger trigger;

    @Before
    public void setUp() {
        scheduler = mock(StdScheduler.class);
        store = mock(TriggerStore.class);
        registry = new JobRegistry();
        SchedulerResources resources = new SchedulerResources();
        resources.setJobCompletionRetryDelay(1L);

        when(scheduler.getJobRegistry()).thenReturn(registry);
        when(scheduler.getTriggerStore()).thenReturn(store);
        when(scheduler.getResources()).thenReturn(resources);

        job = JobBuilder.newJob("job").withIdentity("job", "group").build();
        trigger = TriggerBuilder.newTrigger().withIdentity("trigger", "group").forJob(job).build();
    }

    @Test
    public void successfulRunCompletesWithNoop() throws Exception {
        registry.register("job", () -> context -> runs.incrementAndGet());

        JobRunShell shell = shellFor(bundle());
        shell.run();

        assertEquals(1, runs.get());
        verify(scheduler).jobExecuted(true);
        verify(store).triggeredJobComplete(trigger, job, CompletedExecutionInstruction.NOOP);
        verify(scheduler).addExecutingJob(shell.getContext());
        verify(scheduler).removeExecutingJob(shell.getContext());
    }

    @Test
    public void unhandledExceptionIsCountedAsFailure() throws Exception {
        registry.register("job", () -> context -> {
            throw new IllegalStateException("boom");
        });

        shellFor(bundle()).run();

        verify(scheduler).jobExecuted(false);
        verify(store).triggeredJobComplete(trigger, job, CompletedExecutionInstruction.NOOP);
    }

    @Test
    public void refireImmediatelyRunsTheJobAgain() throws Exception {
        registry.register("job", () -> new Job() {
            @Override
            public void execute(JobExecutionContext context) throws JobExecutionException {
                if (runs.incrementAndGet() == 1) {
                    throw new JobExecutionException("try again", null, true);
                }
            }
        });

        JobRunShell shell = shellFor(bundle());
        shell.run();

        assertEquals(2, runs.get());
        assertEquals(1, shell.getContext().getRefireCount());
        verify(store, times(1)).triggeredJobComplete(trigger, job, CompletedExecutionInstruction.NOOP);
    }

    @Test
    public void vetoedRunSkipsTheJob() throws Exception {
        registry.register("job", () -> context -> runs.incrementAndGet());
        when(scheduler.notifyTriggerListenersFired(any(JobExecutionContext.class))).thenReturn(true);

        shellFor(bundle()).run();

        assertEquals(0, runs.get());
        verify(scheduler).notifyJobListenersWasVetoed(any(JobExecutionContext.class));
        verify(scheduler, never()).jobExecuted(true);
        verify(store).triggeredJobComplete(trigger, job, CompletedExecutionInstruction.NOOP);
    }

    @Test
    public void completionIsRetriedUntilTheStoreAcceptsIt() throws Exception {
        registry.register("job", () -> context -> runs.incrementAndGet());
        doThrow(new JobPersistenceException("store is down"))
                .doNothing()
                .when(store).triggeredJobComplete(trigger, job, CompletedExecutionInstruction.NOOP);

        shellFor(bundle()).run();

        verify(store, times(2)).triggeredJobComplete(trigger, job, CompletedExecutionInstruction.NOOP);
        verify(scheduler).notifySchedulerListenersError(anyString(), any(SchedulerException.class));
    }

    @Test(expected = ObjectNotFoundException.class)
    public void unknownJobTypeFailsInitialization() throws Exception {
        shellFor(bundle());
    }

    @Test
    public void executionExceptionFlagsMapToInstructions() {
        JobExecutionException unscheduleAll = new JobExecutionException();
        unscheduleAll.setUnscheduleAllTriggers(true);
        JobExecutionException unscheduleThis = new JobExecutionException();
        unscheduleThis.setUnscheduleFiringTrigger(true);

        assertSame(CompletedExecutionInstruction.NOOP, JobRunShell.instructionFor(null));
        assertSame(CompletedExecutionInstruction.NOOP, JobRunShell.instructionFor(new JobExecutionException()));
        assertSame(CompletedExecutionInstruction.SET_ALL_JOB_TRIGGERS_COMPLETE,
                JobRunShell.instructionFor(unscheduleAll));
        assertSame(CompletedExecutionInstruction.SET_TRIGGER_COMPLETE, JobRunShell.instructionFor(unscheduleThis));
    }

    private JobRunShell shellFor(TriggerFiredBundle bundle) throws SchedulerException {
        JobRunShell shell = new JobRunShell(scheduler, bundle);
        shell.initialize();
        return shell;
    }

    private TriggerFiredBundle bundle() {
        Date now = new Date();
        return new TriggerFiredBundle(job, trigger, null, false, "fire-1", now, now, null, null);
    }
}
