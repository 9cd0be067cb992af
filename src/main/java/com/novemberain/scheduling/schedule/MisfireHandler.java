package com.novemberain.scheduling.schedule;

import com.novemberain.scheduling.MisfireInstruction;
import com.novemberain.scheduling.Trigger;
import com.novemberain.scheduling.calendar.ExclusionCalendar;
import com.novemberain.scheduling.spi.SchedulerSignaler;
import com.novemberain.scheduling.util.Clock;

import java.util.Date;

/**
 * The responsibility of this class is to handle misfires.
 */
public class MisfireHandler {

    public static final long DEFAULT_MISFIRE_THRESHOLD = 60000L;

    private final ScheduleCalculator calculator;
    private final Clock clock;
    private final long misfireThreshold;
    private final SchedulerSignaler signaler;

    public MisfireHandler(ScheduleCalculator calculator, Clock clock, long misfireThreshold,
                          SchedulerSignaler signaler) {
        this.calculator = calculator;
        this.clock = clock;
        this.misfireThreshold = misfireThreshold;
        this.signaler = signaler;
    }

    public long getMisfireThreshold() {
        return misfireThreshold;
    }

    public boolean isMisfired(Trigger trigger) {
        Date fireTime = trigger.getNextFireTime();
        return fireTime != null && fireTime.getTime() < calculateMisfireTime();
    }

    /**
     * Return true when the misfire instruction changed the trigger's next fire time.
     *
     * @param trigger  trigger whose next fire time may be overdue
     * @param calendar the trigger's calendar, or null
     */
    public boolean applyMisfire(Trigger trigger, ExclusionCalendar calendar) {
        Date fireTime = trigger.getNextFireTime();
        if (misfireIsNotApplicable(trigger)) {
            return false;
        }

        signaler.notifyTriggerListenersMisfired(trigger.clone());

        updateAfterMisfire(trigger, calendar);

        if (trigger.getNextFireTime() == null) {
            signaler.notifySchedulerListenersFinalized(trigger);
        } else if (fireTime.equals(trigger.getNextFireTime())) {
            return false;
        }
        return true;
    }

    /**
     * Apply the misfire instruction regardless of the threshold, as done for
     * triggers found acquired by an instance that died.
     *
     * @return true when the trigger still has a next fire time
     */
    public boolean applyMisfireOnRecovery(Trigger trigger, ExclusionCalendar calendar) {
        if (trigger.getMisfireInstruction() == MisfireInstruction.IGNORE_MISFIRE_POLICY) {
            return trigger.getNextFireTime() != null;
        }

        signaler.notifyTriggerListenersMisfired(trigger.clone());

        updateAfterMisfire(trigger, calendar);

        return trigger.getNextFireTime() != null;
    }

    void updateAfterMisfire(Trigger trigger, ExclusionCalendar calendar) {
        Date now = clock.now();
        switch (trigger.getMisfireInstruction()) {
            case FIRE_NOW:
                fireNow(trigger, calendar, now);
                break;
            case RESCHEDULE_NEXT:
                rescheduleNext(trigger, calendar, now);
                break;
            case DO_NOTHING:
                trigger.setNextFireTime(calculator.fireTimeAfter(trigger, calendar, now));
                break;
            default:
                break;
        }
    }

    private void fireNow(Trigger trigger, ExclusionCalendar calendar, Date now) {
        if (trigger.getSchedule() instanceof SimpleSchedule) {
            reanchor(trigger, calendar, now);
            return;
        }
        if (trigger.getEndTime() != null && trigger.getEndTime().before(now)) {
            trigger.setNextFireTime(null);
        } else if (calendar != null && calculator.getEvaluator().isExcluded(calendar, now)) {
            trigger.setNextFireTime(calculator.fireTimeAfter(trigger, calendar, now));
        } else {
            trigger.setNextFireTime(now);
        }
    }

    private void rescheduleNext(Trigger trigger, ExclusionCalendar calendar, Date now) {
        if (!(trigger.getSchedule() instanceof SimpleSchedule)) {
            trigger.setNextFireTime(calculator.fireTimeAfter(trigger, calendar, now));
            return;
        }
        SimpleSchedule simple = (SimpleSchedule) trigger.getSchedule();
        if (simple.getIntervalMillis() == 0) {
            trigger.setNextFireTime(null);
            return;
        }
        long start = trigger.getStartTime().getTime();
        long k = Math.max(0, (now.getTime() - start) / simple.getIntervalMillis() + 1);
        reanchor(trigger, calendar, new Date(start + k * simple.getIntervalMillis()));
    }

    /**
     * Move a simple schedule's grid to {@code newStart}, keeping the number
     * of fires not done yet.
     */
    private void reanchor(Trigger trigger, ExclusionCalendar calendar, Date newStart) {
        SimpleSchedule simple = (SimpleSchedule) trigger.getSchedule();
        int remaining = SimpleSchedule.REPEAT_INDEFINITELY;
        if (!simple.repeatsForever()) {
            remaining = simple.getRepeatCount() - firesDoneOnGrid(trigger, simple);
            if (remaining < 0) {
                trigger.setNextFireTime(null);
                return;
            }
        }
        if (trigger.getEndTime() != null && trigger.getEndTime().before(newStart)) {
            trigger.setNextFireTime(null);
            return;
        }
        long interval = remaining == 0 ? 0 : simple.getIntervalMillis();
        trigger.setSchedule(new SimpleSchedule(interval, remaining));
        trigger.setStartTime(newStart);
        calculator.computeFirstFireTime(trigger, calendar);
    }

    private static int firesDoneOnGrid(Trigger trigger, SimpleSchedule simple) {
        Date previous = trigger.getPreviousFireTime();
        long start = trigger.getStartTime().getTime();
        if (previous == null || previous.getTime() < start) {
            return 0;
        }
        if (simple.getIntervalMillis() == 0) {
            return 1;
        }
        return (int) Math.min(Integer.MAX_VALUE, (previous.getTime() - start) / simple.getIntervalMillis() + 1);
    }

    private long calculateMisfireTime() {
        long misfireTime = clock.millis();
        if (misfireThreshold > 0) {
            misfireTime -= misfireThreshold;
        }
        return misfireTime;
    }

    private boolean misfireIsNotApplicable(Trigger trigger) {
        return !isMisfired(trigger)
                || trigger.getMisfireInstruction() == MisfireInstruction.IGNORE_MISFIRE_POLICY;
    }
}
