package com.sailfish.taskfactory;

import java.util.Objects;

/**
 * A single formal parameter of a {@link TaskCallable}.
 */
public final class TaskParameter {

    private final String name;
    private final Class<?> type;

    public TaskParameter(String name, Class<?> type) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("parameter name cannot be blank");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type cannot be null");
    }

    public String getName() {
        return name;
    }

    public Class<?> getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskParameter that = (TaskParameter) o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return type.getSimpleName() + " " + name;
    }
}
