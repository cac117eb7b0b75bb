package com.sailfish.taskfactory.service;

import com.sailfish.taskfactory.TaskArguments;
import com.sailfish.taskfactory.model.ExecutorSelector;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * A unit of work handed by a wrapper to an {@link ExecutionContext}, together with the
 * identity and execution parameters the context needs to schedule and cache it.
 */
public final class TaskSubmission {

    private final String taskName;
    private final String contentIdentity;
    private final boolean cache;
    private final ExecutorSelector executors;
    private final Duration walltime;
    private final List<Path> auxiliaryFiles;
    private final TaskArguments arguments;
    private final Callable<Object> work;

    public TaskSubmission(String taskName,
                          String contentIdentity,
                          boolean cache,
                          ExecutorSelector executors,
                          Duration walltime,
                          List<Path> auxiliaryFiles,
                          TaskArguments arguments,
                          Callable<Object> work) {
        this.taskName = Objects.requireNonNull(taskName, "taskName cannot be null");
        this.contentIdentity = Objects.requireNonNull(contentIdentity, "contentIdentity cannot be null");
        this.cache = cache;
        this.executors = Objects.requireNonNull(executors, "executors cannot be null");
        this.walltime = Objects.requireNonNull(walltime, "walltime cannot be null");
        this.auxiliaryFiles = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(auxiliaryFiles, "auxiliaryFiles cannot be null")));
        this.arguments = Objects.requireNonNull(arguments, "arguments cannot be null");
        this.work = Objects.requireNonNull(work, "work cannot be null");
    }

    public String getTaskName() {
        return taskName;
    }

    public String getContentIdentity() {
        return contentIdentity;
    }

    public boolean isCache() {
        return cache;
    }

    public ExecutorSelector getExecutors() {
        return executors;
    }

    public Duration getWalltime() {
        return walltime;
    }

    public List<Path> getAuxiliaryFiles() {
        return auxiliaryFiles;
    }

    public TaskArguments getArguments() {
        return arguments;
    }

    public Callable<Object> getWork() {
        return work;
    }

    @Override
    public String toString() {
        return "TaskSubmission{" + taskName + ", identity=" + contentIdentity + ", cache=" + cache
                + ", executors=" + executors + ", walltime=" + walltime + '}';
    }
}
