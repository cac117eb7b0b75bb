package com.sailfish.taskfactory.wrapper;

import com.sailfish.taskfactory.ParameterSignature;
import com.sailfish.taskfactory.model.ExecutorSelector;
import com.sailfish.taskfactory.service.ExecutionContext;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Everything a task factory hands to a new wrapper besides the callable itself.
 * The execution context may be {@code null}; wrappers then fail when invoked.
 */
public final class TaskWrapperConfig {

    private final ExecutionContext executionContext;
    private final ExecutorSelector executors;
    private final Duration walltime;
    private final boolean cache;
    private final String contentIdentity;
    private final List<Path> auxiliaryFiles;
    private final ParameterSignature signature;

    public TaskWrapperConfig(ExecutionContext executionContext,
                             ExecutorSelector executors,
                             Duration walltime,
                             boolean cache,
                             String contentIdentity,
                             List<Path> auxiliaryFiles,
                             ParameterSignature signature) {
        this.executionContext = executionContext;
        this.executors = Objects.requireNonNull(executors, "executors cannot be null");
        this.walltime = Objects.requireNonNull(walltime, "walltime cannot be null");
        this.cache = cache;
        this.contentIdentity = Objects.requireNonNull(contentIdentity, "contentIdentity cannot be null");
        this.auxiliaryFiles = Objects.requireNonNull(auxiliaryFiles, "auxiliaryFiles cannot be null");
        this.signature = Objects.requireNonNull(signature, "signature cannot be null");
    }

    public ExecutionContext getExecutionContext() {
        return executionContext;
    }

    public ExecutorSelector getExecutors() {
        return executors;
    }

    public Duration getWalltime() {
        return walltime;
    }

    public boolean isCache() {
        return cache;
    }

    public String getContentIdentity() {
        return contentIdentity;
    }

    public List<Path> getAuxiliaryFiles() {
        return auxiliaryFiles;
    }

    public ParameterSignature getSignature() {
        return signature;
    }

    @Override
    public String toString() {
        return "TaskWrapperConfig{identity=" + contentIdentity + ", cache=" + cache + ", executors=" + executors
                + ", walltime=" + walltime + ", auxiliaryFiles=" + auxiliaryFiles + '}';
    }
}
