package com.sailfish.taskfactory.wrapper;

import com.sailfish.taskfactory.TaskArguments;
import com.sailfish.taskfactory.TaskCallable;
import com.sailfish.taskfactory.model.TaskHandle;
import com.sailfish.taskfactory.service.ExecutionContext;
import com.sailfish.taskfactory.service.TaskSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Common invocation path of the bundled wrappers: strip reserved keywords, validate the rest
 * against the callable's signature, submit the work and derive one data future per output file.
 */
public abstract class AbstractTaskWrapper implements TaskWrapper {

    private static final Logger log = LoggerFactory.getLogger(AbstractTaskWrapper.class);

    /**
     * Keyword listing the files a task produces.
     */
    public static final String OUTPUTS = "outputs";

    protected final TaskCallable callable;
    protected final TaskWrapperConfig config;

    protected AbstractTaskWrapper(TaskCallable callable, TaskWrapperConfig config) {
        this.callable = Objects.requireNonNull(callable, "callable cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Keywords consumed by the wrapper and never passed to the callable.
     */
    protected Set<String> reservedKeywords() {
        return Collections.singleton(OUTPUTS);
    }

    /**
     * Builds the work to run in the execution context.
     *
     * @param callArguments Arguments for the callable, reserved keywords removed.
     * @param allArguments The caller's original arguments.
     */
    protected abstract Callable<Object> createWork(TaskArguments callArguments, TaskArguments allArguments);

    @Override
    public TaskHandle call(TaskArguments arguments) {
        Objects.requireNonNull(arguments, "arguments cannot be null");
        List<Path> outputs = toPaths(OUTPUTS, arguments.getKeyword(OUTPUTS));
        TaskArguments callArguments = arguments.withoutKeywords(reservedKeywords());
        config.getSignature().validate(callArguments);

        ExecutionContext context = config.getExecutionContext();
        if (context == null) {
            throw new IllegalStateException("No execution context bound to task " + callable.getName());
        }

        TaskSubmission submission = new TaskSubmission(callable.getName(),
                config.getContentIdentity(),
                config.isCache(),
                config.getExecutors(),
                config.getWalltime(),
                config.getAuxiliaryFiles(),
                arguments,
                createWork(callArguments, arguments));
        log.debug("Submitting task {} with identity {}", callable.getName(), config.getContentIdentity());
        CompletableFuture<Object> result = context.submit(submission);

        List<CompletableFuture<Path>> dataFutures = new ArrayList<>(outputs.size());
        for (Path output : outputs) {
            dataFutures.add(result.thenApply(ignored -> output));
        }
        return new TaskHandle(callable.getName(), result, dataFutures);
    }

    protected static Path toPath(String keyword, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Path) {
            return (Path) value;
        }
        if (value instanceof String) {
            return Paths.get((String) value);
        }
        throw new IllegalArgumentException(String.format("keyword '%s' expects a path but got %s",
                keyword, value.getClass().getName()));
    }

    private static List<Path> toPaths(String keyword, Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof Collection)) {
            throw new IllegalArgumentException(String.format("keyword '%s' expects a list of paths but got %s",
                    keyword, value.getClass().getName()));
        }
        List<Path> paths = new ArrayList<>();
        for (Object item : (Collection<?>) value) {
            Path path = toPath(keyword, item);
            if (path == null) {
                throw new IllegalArgumentException("keyword '" + keyword + "' cannot contain null");
            }
            paths.add(path);
        }
        return paths;
    }
}
