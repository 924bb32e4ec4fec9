package io.fullerstack.recurrent;

/**
 * Lifecycle of a {@link Scheduler}. Transitions only move forward:
 * {@code CREATED → RUNNING → STOPPED}, or {@code CREATED → STOPPED} when stopped before start.
 */
public enum LifecycleState {
    CREATED,
    RUNNING,
    STOPPED
}
