package com.novemberain.scheduling;

/**
 * What to do with a trigger whose fire time passed by more than the
 * misfire threshold before it could be dispatched.
 */
public enum MisfireInstruction {

    /**
     * Fire once as soon as possible, then continue with the schedule.
     */
    FIRE_NOW,

    /**
     * Drop the missed fires and wait for the next scheduled time after now.
     */
    DO_NOTHING,

    /**
     * Move to the next scheduled time after now, keeping the number of
     * remaining fires of a finite simple schedule.
     */
    RESCHEDULE_NEXT,

    /**
     * Fire every missed time as soon as possible.
     */
    IGNORE_MISFIRE_POLICY
}
