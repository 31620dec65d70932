package io.mnemo.core.scheduler;

public enum SchedulerState {
    IDLE,
    EVALUATING,
    OPTIMIZING
}
