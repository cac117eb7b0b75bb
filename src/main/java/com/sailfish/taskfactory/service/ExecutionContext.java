package com.sailfish.taskfactory.service;

import java.util.concurrent.CompletableFuture;

/**
 * Schedules and runs the work submitted by task wrappers.
 */
public interface ExecutionContext {

    /**
     * Submits a task for asynchronous execution.
     * Implementations that cache results should key them on the submission's content identity
     * and arguments, and only when {@link TaskSubmission#isCache()} is set.
     *
     * @param submission The work and its execution parameters.
     * @return a future completed with the work's result, or exceptionally with its failure.
     * @throws java.util.concurrent.RejectedExecutionException if the context no longer accepts work.
     */
    CompletableFuture<Object> submit(TaskSubmission submission);
}
