package com.sailfish.taskfactory.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Labels of the executors a task may run on, or {@link #all()} for any executor.
 */
public final class ExecutorSelector {

    public static final String ALL_LABEL = "all";

    private static final ExecutorSelector ALL = new ExecutorSelector(Collections.emptySet());

    private final Set<String> labels;

    private ExecutorSelector(Set<String> labels) {
        this.labels = labels;
    }

    public static ExecutorSelector all() {
        return ALL;
    }

    public static ExecutorSelector of(String... labels) {
        return of(Arrays.asList(labels));
    }

    /**
     * Builds a selector from labels. A single {@code "all"} label selects every executor.
     */
    public static ExecutorSelector of(Collection<String> labels) {
        Objects.requireNonNull(labels, "labels cannot be null");
        if (labels.isEmpty()) {
            throw new IllegalArgumentException("executor labels cannot be empty");
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String label : labels) {
            if (label == null || label.trim().isEmpty()) {
                throw new IllegalArgumentException("executor label cannot be blank");
            }
            copy.add(label);
        }
        if (copy.size() == 1 && copy.contains(ALL_LABEL)) {
            return ALL;
        }
        return new ExecutorSelector(Collections.unmodifiableSet(copy));
    }

    public boolean isAll() {
        return labels.isEmpty();
    }

    public Set<String> getLabels() {
        return labels;
    }

    public boolean matches(String executorLabel) {
        return isAll() || labels.contains(executorLabel);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return labels.equals(((ExecutorSelector) o).labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return isAll() ? ALL_LABEL : labels.toString();
    }
}
