package com.novemberain.scheduling.schedule;

/**
 * Fires at {@code start + k * interval} for {@code 0 <= k <= repeatCount}.
 */
public final class SimpleSchedule extends ScheduleSpec {

    public static final int REPEAT_INDEFINITELY = -1;

    private final long intervalMillis;
    private final int repeatCount;

    public SimpleSchedule(long intervalMillis, int repeatCount) {
        if (repeatCount < REPEAT_INDEFINITELY) {
            throw new IllegalArgumentException("Repeat count must be >= 0, use "
                    + "REPEAT_INDEFINITELY for infinite.");
        }
        if (intervalMillis < 0) {
            throw new IllegalArgumentException("Repeat interval must be >= 0");
        }
        if (repeatCount != 0 && intervalMillis == 0) {
            throw new IllegalArgumentException("Repeat interval cannot be zero when the trigger repeats.");
        }
        this.intervalMillis = intervalMillis;
        this.repeatCount = repeatCount;
    }

    public static SimpleSchedule oneShot() {
        return new SimpleSchedule(0, 0);
    }

    public static SimpleSchedule repeatForever(long intervalMillis) {
        return new SimpleSchedule(intervalMillis, REPEAT_INDEFINITELY);
    }

    public static SimpleSchedule repeat(long intervalMillis, int repeatCount) {
        return new SimpleSchedule(intervalMillis, repeatCount);
    }

    public long getIntervalMillis() {
        return intervalMillis;
    }

    public int getRepeatCount() {
        return repeatCount;
    }

    public boolean repeatsForever() {
        return repeatCount == REPEAT_INDEFINITELY;
    }

    @Override
    public <R> R accept(ScheduleVisitor<R> visitor) {
        return visitor.visitSimple(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimpleSchedule)) {
            return false;
        }
        SimpleSchedule that = (SimpleSchedule) o;
        return intervalMillis == that.intervalMillis && repeatCount == that.repeatCount;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(intervalMillis) + repeatCount;
    }

    @Override
    public String toString() {
        return "SimpleSchedule{interval=" + intervalMillis + "ms, repeatCount=" + repeatCount + "}";
    }
}
