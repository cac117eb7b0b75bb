package com.sailfish.taskfactory.model;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Execution parameters forwarded verbatim from a task factory to every wrapper it produces.
 */
public final class TaskOptions {

    public static final boolean DEFAULT_CACHE = false;
    public static final Duration DEFAULT_WALLTIME = Duration.ofSeconds(60);
    public static final ExecutorSelector DEFAULT_EXECUTORS = ExecutorSelector.all();

    public static final String KEY_CACHE = "cache";
    public static final String KEY_EXECUTORS = "executors";
    public static final String KEY_WALLTIME = "walltime";
    public static final String KEY_AUXILIARY_FILES = "auxiliaryFiles";

    private static final TaskOptions DEFAULTS = builder().build();

    private final boolean cache;
    private final ExecutorSelector executors;
    private final Duration walltime;
    private final List<Path> auxiliaryFiles;

    private TaskOptions(Builder builder) {
        this.cache = builder.cache;
        this.executors = builder.executors;
        this.walltime = builder.walltime;
        this.auxiliaryFiles = Collections.unmodifiableList(new ArrayList<>(builder.auxiliaryFiles));
    }

    /**
     * Options with caching off, all executors, a 60 second walltime and no auxiliary files.
     */
    public static TaskOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds options from loosely typed keyword parameters.
     * <ul>
     *     <li>{@code cache}: {@link Boolean}</li>
     *     <li>{@code executors}: {@link ExecutorSelector}, a label {@link String} or a collection of labels</li>
     *     <li>{@code walltime}: {@link Duration} or a {@link Number} of seconds</li>
     *     <li>{@code auxiliaryFiles}: collection of {@link Path} or {@link String}</li>
     * </ul>
     *
     * @throws IllegalArgumentException on an unknown key or a value of the wrong type.
     */
    public static TaskOptions fromMap(Map<String, ?> parameters) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : parameters.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case KEY_CACHE:
                    builder.cache(expect(key, value, Boolean.class));
                    break;
                case KEY_EXECUTORS:
                    builder.executors(toSelector(value));
                    break;
                case KEY_WALLTIME:
                    builder.walltime(toDuration(value));
                    break;
                case KEY_AUXILIARY_FILES:
                    builder.auxiliaryFiles(toPaths(value));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown task option '" + key + "'");
            }
        }
        return builder.build();
    }

    private static <T> T expect(String key, Object value, Class<T> type) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(String.format("Task option '%s' expects %s but got %s",
                    key, type.getSimpleName(), value.getClass().getName()));
        }
        return type.cast(value);
    }

    private static ExecutorSelector toSelector(Object value) {
        if (value instanceof ExecutorSelector) {
            return (ExecutorSelector) value;
        }
        if (value instanceof String) {
            return ExecutorSelector.of((String) value);
        }
        if (value instanceof Collection) {
            List<String> labels = new ArrayList<>();
            for (Object label : (Collection<?>) value) {
                labels.add(expect(KEY_EXECUTORS, label, String.class));
            }
            return ExecutorSelector.of(labels);
        }
        throw new IllegalArgumentException("Task option 'executors' expects a label or a list of labels but got "
                + value.getClass().getName());
    }

    private static Duration toDuration(Object value) {
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof Number) {
            return Duration.ofMillis(Math.round(((Number) value).doubleValue() * 1000));
        }
        throw new IllegalArgumentException("Task option 'walltime' expects a Duration or seconds but got "
                + value.getClass().getName());
    }

    private static List<Path> toPaths(Object value) {
        Collection<?> items = expect(KEY_AUXILIARY_FILES, value, Collection.class);
        List<Path> paths = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Path) {
                paths.add((Path) item);
            } else if (item instanceof String) {
                paths.add(Paths.get((String) item));
            } else {
                throw new IllegalArgumentException("Task option 'auxiliaryFiles' expects paths but got "
                        + (item == null ? "null" : item.getClass().getName()));
            }
        }
        return paths;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskOptions that = (TaskOptions) o;
        return cache == that.cache && executors.equals(that.executors) && walltime.equals(that.walltime)
                && auxiliaryFiles.equals(that.auxiliaryFiles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cache, executors, walltime, auxiliaryFiles);
    }

    @Override
    public String toString() {
        return "TaskOptions{cache=" + cache + ", executors=" + executors + ", walltime=" + walltime
                + ", auxiliaryFiles=" + auxiliaryFiles + '}';
    }

    public static final class Builder {

        private boolean cache = DEFAULT_CACHE;
        private ExecutorSelector executors = DEFAULT_EXECUTORS;
        private Duration walltime = DEFAULT_WALLTIME;
        private List<Path> auxiliaryFiles = Collections.emptyList();

        private Builder() {
        }

        public Builder cache(boolean cache) {
            this.cache = cache;
            return this;
        }

        public Builder executors(ExecutorSelector executors) {
            this.executors = Objects.requireNonNull(executors, "executors cannot be null");
            return this;
        }

        public Builder executors(String... labels) {
            return executors(ExecutorSelector.of(labels));
        }

        public Builder walltime(Duration walltime) {
            Objects.requireNonNull(walltime, "walltime cannot be null");
            if (walltime.isNegative() || walltime.isZero()) {
                throw new IllegalArgumentException("walltime must be positive");
            }
            this.walltime = walltime;
            return this;
        }

        public Builder walltimeSeconds(long seconds) {
            return walltime(Duration.ofSeconds(seconds));
        }

        public Builder auxiliaryFiles(List<Path> auxiliaryFiles) {
            Objects.requireNonNull(auxiliaryFiles, "auxiliaryFiles cannot be null");
            for (Path path : auxiliaryFiles) {
                Objects.requireNonNull(path, "auxiliary file cannot be null");
            }
            this.auxiliaryFiles = auxiliaryFiles;
            return this;
        }

        public TaskOptions build() {
            return new TaskOptions(this);
        }
    }
}
