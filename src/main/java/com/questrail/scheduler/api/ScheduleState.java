package com.questrail.scheduler.api;

/**
 * Position of a schedule in its timing cycle.
 */
public enum ScheduleState {
    /** A timer is armed (or about to be); nothing is in flight. */
    WAITING,
    /** The timer fired and the run has not been acknowledged yet. */
    DISPATCHED
}
