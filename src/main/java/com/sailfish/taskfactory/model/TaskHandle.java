package com.sailfish.taskfactory.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * What a wrapper returns when invoked: a future for the task result plus one future per
 * declared output file, completing with that file's path once the task has succeeded.
 */
public final class TaskHandle {

    private final String taskName;
    private final CompletableFuture<Object> result;
    private final List<CompletableFuture<Path>> outputs;

    public TaskHandle(String taskName, CompletableFuture<Object> result, List<CompletableFuture<Path>> outputs) {
        this.taskName = Objects.requireNonNull(taskName, "taskName cannot be null");
        this.result = Objects.requireNonNull(result, "result cannot be null");
        this.outputs = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(outputs, "outputs cannot be null")));
    }

    public String getTaskName() {
        return taskName;
    }

    public CompletableFuture<Object> getResult() {
        return result;
    }

    public List<CompletableFuture<Path>> getOutputs() {
        return outputs;
    }

    @Override
    public String toString() {
        return "TaskHandle{" + taskName + ", done=" + result.isDone() + ", outputs=" + outputs.size() + '}';
    }
}
