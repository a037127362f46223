package com.example.workscheduler.store;

import java.util.List;

/**
 * Producer side of the downstream job queue. Safe for concurrent producers.
 */
public interface JobDispatcher {

    /**
     * Open the connection to the queue. Calling it on an open producer is a no-op.
     *
     * @throws com.example.workscheduler.exception.SchedulerInitializationException if the queue is unreachable
     */
    void initialize();

    /**
     * @return the dispatch id of the enqueued message
     */
    String enqueueOne(JobDescriptor job);

    /**
     * Enqueue all jobs as one batch.
     *
     * @return dispatch ids in the order of {@code jobs}
     */
    List<String> enqueueBatch(List<JobDescriptor> jobs);

    /**
     * Close the connection. Further enqueues fail until initialize() is called again.
     */
    void close();

    boolean isOpen();
}
