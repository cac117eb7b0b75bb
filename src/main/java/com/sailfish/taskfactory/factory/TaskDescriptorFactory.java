package com.sailfish.taskfactory.factory;

import com.sailfish.taskfactory.ParameterSignature;
import com.sailfish.taskfactory.TaskArguments;
import com.sailfish.taskfactory.TaskCallable;
import com.sailfish.taskfactory.model.ExecutorSelector;
import com.sailfish.taskfactory.model.TaskHandle;
import com.sailfish.taskfactory.model.TaskOptions;
import com.sailfish.taskfactory.model.TaskStatus;
import com.sailfish.taskfactory.service.ExecutionContext;
import com.sailfish.taskfactory.source.ClasspathSourceProvider;
import com.sailfish.taskfactory.source.SourceProvider;
import com.sailfish.taskfactory.wrapper.TaskWrapper;
import com.sailfish.taskfactory.wrapper.TaskWrapperConfig;
import com.sailfish.taskfactory.wrapper.TaskWrapperConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Binds one callable to one task kind and produces a fresh wrapper for every call.
 * <p>
 * The content identity used as cache key is derived once, here, rather than per call:
 * <ul>
 *     <li>caching on, source recoverable: hex MD5 of the UTF-8 source text;</li>
 *     <li>caching on, source not recoverable: the callable's name, logged at debug;</li>
 *     <li>caching off: the callable's name.</li>
 * </ul>
 * Instances are immutable and may be invoked from several threads at once.
 */
public class TaskDescriptorFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskDescriptorFactory.class);

    private final String displayName;
    private final TaskWrapperConstructor taskKind;
    private final TaskCallable callable;
    private final ExecutionContext executionContext;
    private final ParameterSignature signature;
    private final boolean cache;
    private final String contentIdentity;
    private final ExecutorSelector executors;
    private final Duration walltime;
    private final List<Path> auxiliaryFiles;
    private final TaskStatus status;

    public TaskDescriptorFactory(TaskWrapperConstructor taskKind, TaskCallable callable) {
        this(taskKind, callable, null, TaskOptions.defaults());
    }

    public TaskDescriptorFactory(TaskWrapperConstructor taskKind,
                                 TaskCallable callable,
                                 ExecutionContext executionContext,
                                 TaskOptions options) {
        this(taskKind, callable, executionContext, options, new ClasspathSourceProvider());
    }

    /**
     * @param taskKind Constructor of the wrappers this factory produces.
     * @param callable The task logic.
     * @param executionContext Context the wrappers submit to; may be {@code null}.
     * @param options Execution parameters forwarded to every wrapper.
     * @param sourceProvider Consulted once when caching is enabled.
     */
    public TaskDescriptorFactory(TaskWrapperConstructor taskKind,
                                 TaskCallable callable,
                                 ExecutionContext executionContext,
                                 TaskOptions options,
                                 SourceProvider sourceProvider) {
        this.taskKind = Objects.requireNonNull(taskKind, "taskKind cannot be null");
        this.callable = Objects.requireNonNull(callable, "callable cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        Objects.requireNonNull(sourceProvider, "sourceProvider cannot be null");

        this.displayName = callable.getName();
        this.signature = callable.getSignature();
        this.executionContext = executionContext;
        this.cache = options.isCache();
        this.executors = options.getExecutors();
        this.walltime = options.getWalltime();
        this.auxiliaryFiles = options.getAuxiliaryFiles();
        this.contentIdentity = cache ? deriveIdentity(callable, sourceProvider) : displayName;
        this.status = TaskStatus.CREATED;
    }

    /**
     * MD5 hex of the callable's source, or its bare name when no source can be recovered. The
     * fallback is not hashed, so it equals the identity used when caching is off.
     */
    private static String deriveIdentity(TaskCallable callable, SourceProvider sourceProvider) {
        Optional<String> source = sourceProvider.getSource(callable);
        if (!source.isPresent()) {
            log.debug("Unable to get source code for task caching of '{}'. Falling back to the task name as its "
                    + "identity; declare the task as a method of a class whose source is available.", callable.getName());
            return callable.getName();
        }
        return md5Hex(source.get());
    }

    static String md5Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 not available", ex);
        }
    }

    /**
     * Creates a new wrapper bound to this factory's parameters and invokes it.
     * The wrapper's handle is returned unchanged.
     *
     * @param arguments Arguments for the callable, plus any wrapper-reserved keywords.
     * @return the handle returned by the wrapper.
     */
    public TaskHandle call(TaskArguments arguments) {
        TaskWrapper wrapper = taskKind.create(callable, new TaskWrapperConfig(executionContext,
                executors,
                walltime,
                cache,
                contentIdentity,
                auxiliaryFiles,
                signature));
        return wrapper.call(arguments);
    }

    public TaskHandle call(Object... positional) {
        return call(TaskArguments.of(positional));
    }

    public String getDisplayName() {
        return displayName;
    }

    public TaskWrapperConstructor getTaskKind() {
        return taskKind;
    }

    public TaskCallable getCallable() {
        return callable;
    }

    public ExecutionContext getExecutionContext() {
        return executionContext;
    }

    public ParameterSignature getSignature() {
        return signature;
    }

    public boolean isCache() {
        return cache;
    }

    public String getContentIdentity() {
        return contentIdentity;
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

    public TaskStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "TaskDescriptorFactory[" + taskKind.describe() + " for " + displayName + "]";
    }
}
