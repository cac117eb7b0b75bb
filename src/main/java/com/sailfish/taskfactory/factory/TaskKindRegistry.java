package com.sailfish.taskfactory.factory;

import com.sailfish.taskfactory.TaskCallable;
import com.sailfish.taskfactory.model.TaskOptions;
import com.sailfish.taskfactory.service.ExecutionContext;
import com.sailfish.taskfactory.source.ClasspathSourceProvider;
import com.sailfish.taskfactory.source.SourceProvider;
import com.sailfish.taskfactory.wrapper.TaskWrapperConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps task kind names to wrapper constructors and creates {@link TaskDescriptorFactory}
 * instances for them. The kind table is fixed at construction and read-only afterwards,
 * so a registry can be shared between threads.
 */
public class TaskKindRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskKindRegistry.class);

    private final String name;
    private final Map<String, TaskWrapperConstructor> kindTable;
    private final SourceProvider sourceProvider;

    /**
     * Creates a registry holding the built-in {@link TaskKind}s.
     */
    public TaskKindRegistry(String name) {
        this(name, new ClasspathSourceProvider());
    }

    public TaskKindRegistry(String name, SourceProvider sourceProvider) {
        this(name, sourceProvider, defaultKinds());
    }

    /**
     * Creates a registry over a custom kind table.
     *
     * @throws IllegalArgumentException if a kind name is blank or a constructor is null.
     */
    public TaskKindRegistry(String name, SourceProvider sourceProvider, Map<String, ? extends TaskWrapperConstructor> kinds) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.sourceProvider = Objects.requireNonNull(sourceProvider, "sourceProvider cannot be null");
        Objects.requireNonNull(kinds, "kinds cannot be null");
        Map<String, TaskWrapperConstructor> table = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends TaskWrapperConstructor> entry : kinds.entrySet()) {
            if (entry.getKey() == null || entry.getKey().trim().isEmpty()) {
                throw new IllegalArgumentException("task kind name cannot be blank");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("wrapper constructor for kind '" + entry.getKey() + "' cannot be null");
            }
            table.put(entry.getKey(), entry.getValue());
        }
        this.kindTable = Collections.unmodifiableMap(table);
        log.info("TaskKindRegistry '{}' initialized with kinds {}", name, kindTable.keySet());
    }

    /**
     * The built-in kind table: {@code "bash"} and {@code "python"}.
     */
    public static Map<String, TaskWrapperConstructor> defaultKinds() {
        Map<String, TaskWrapperConstructor> kinds = new LinkedHashMap<>();
        for (TaskKind kind : TaskKind.values()) {
            kinds.put(kind.getKindName(), kind);
        }
        return kinds;
    }

    public TaskDescriptorFactory create(String kind, TaskCallable callable) {
        return create(kind, callable, null, TaskOptions.defaults());
    }

    public TaskDescriptorFactory create(String kind, TaskCallable callable, ExecutionContext executionContext) {
        return create(kind, callable, executionContext, TaskOptions.defaults());
    }

    /**
     * Creates a factory from loosely typed keyword parameters, see {@link TaskOptions#fromMap(Map)}.
     */
    public TaskDescriptorFactory create(String kind, TaskCallable callable, ExecutionContext executionContext,
                                        Map<String, ?> parameters) {
        TaskWrapperConstructor constructor = lookup(kind);
        return new TaskDescriptorFactory(constructor, callable, executionContext, TaskOptions.fromMap(parameters), sourceProvider);
    }

    /**
     * Creates a factory bound to the wrapper constructor registered for {@code kind}.
     *
     * @param kind The kind name, e.g. {@code "bash"}.
     * @param callable The task logic.
     * @param executionContext Context the produced wrappers submit to; may be {@code null}.
     * @param options Execution parameters, forwarded unchanged.
     * @return a new factory.
     * @throws InvalidTaskKindException if no such kind is registered.
     */
    public TaskDescriptorFactory create(String kind, TaskCallable callable, ExecutionContext executionContext,
                                        TaskOptions options) {
        TaskWrapperConstructor constructor = lookup(kind);
        return new TaskDescriptorFactory(constructor, callable, executionContext, options, sourceProvider);
    }

    private TaskWrapperConstructor lookup(String kind) {
        TaskWrapperConstructor constructor = kind == null ? null : kindTable.get(kind);
        if (constructor == null) {
            log.error("TaskKindRegistry:{} Invalid task kind requested : {}", name, kind);
            throw new InvalidTaskKindException(name, kind);
        }
        return constructor;
    }

    public String getName() {
        return name;
    }

    public Set<String> getKinds() {
        return kindTable.keySet();
    }

    public SourceProvider getSourceProvider() {
        return sourceProvider;
    }

    @Override
    public String toString() {
        return "TaskKindRegistry{" + name + ", kinds=" + kindTable.keySet() + '}';
    }
}
