package com.novemberain.scheduling;

public enum TriggerState {
    NONE, NORMAL, PAUSED, COMPLETE, ERROR, BLOCKED
}
