package com.questrail.storybridge.internal.exec;

/**
 * Lifecycle states of the {@link EngineWorker}.
 *
 * <pre>
 *   STARTING → RUNNING → STOPPING → STOPPED
 *   STARTING ───────────→ STOPPING            (open failed or stop requested)
 * </pre>
 */
public enum WorkerState {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED
}
