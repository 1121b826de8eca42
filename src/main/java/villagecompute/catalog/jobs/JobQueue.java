/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.jobs;

/**
 * Queues polled independently by {@link DelayedJobWorker}. Image work sits on its own queue so a burst of completed
 * uploads cannot starve the sweep.
 */
public enum JobQueue {

    /**
     * Periodic housekeeping (pending upload sweep).
     */
    DEFAULT(5),

    /**
     * Chunk assembly and variant rendering.
     */
    BULK(8);

    private final int priority;

    JobQueue(int priority) {
        this.priority = priority;
    }

    /**
     * Priority copied onto jobs created in this queue.
     */
    public int getPriority() {
        return priority;
    }
}
