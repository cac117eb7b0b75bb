package com.sailfish.taskfactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of arguments for a single task invocation: an ordered list of positional
 * values and an ordered map of keyword values. Both may contain {@code null} values.
 */
public final class TaskArguments {

    private static final TaskArguments EMPTY = new TaskArguments(Collections.emptyList(), Collections.emptyMap());

    private final List<Object> positional;
    private final Map<String, Object> keywords;

    private TaskArguments(List<Object> positional, Map<String, Object> keywords) {
        this.positional = positional;
        this.keywords = keywords;
    }

    public static TaskArguments empty() {
        return EMPTY;
    }

    public static TaskArguments of(Object... positional) {
        if (positional == null || positional.length == 0) {
            return EMPTY;
        }
        return new TaskArguments(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(positional))),
                Collections.emptyMap());
    }

    public static TaskArguments of(List<?> positional, Map<String, ?> keywords) {
        Objects.requireNonNull(positional, "positional cannot be null");
        Objects.requireNonNull(keywords, "keywords cannot be null");
        for (String name : keywords.keySet()) {
            requireKeywordName(name);
        }
        return new TaskArguments(Collections.unmodifiableList(new ArrayList<>(positional)),
                Collections.unmodifiableMap(new LinkedHashMap<>(keywords)));
    }

    /**
     * Returns a copy of these arguments with one keyword added (or replaced).
     */
    public TaskArguments withKeyword(String name, Object value) {
        requireKeywordName(name);
        Map<String, Object> copy = new LinkedHashMap<>(keywords);
        copy.put(name, value);
        return new TaskArguments(positional, Collections.unmodifiableMap(copy));
    }

    /**
     * Returns a copy of these arguments without the given keywords.
     */
    public TaskArguments withoutKeywords(Collection<String> names) {
        if (names.stream().noneMatch(keywords::containsKey)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(keywords);
        copy.keySet().removeAll(names);
        return new TaskArguments(positional, Collections.unmodifiableMap(copy));
    }

    public List<Object> getPositional() {
        return positional;
    }

    public Map<String, Object> getKeywords() {
        return keywords;
    }

    public boolean hasKeyword(String name) {
        return keywords.containsKey(name);
    }

    public Object getKeyword(String name) {
        return keywords.get(name);
    }

    private static void requireKeywordName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("keyword name cannot be blank");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskArguments that = (TaskArguments) o;
        return positional.equals(that.positional) && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, keywords);
    }

    @Override
    public String toString() {
        return "TaskArguments{positional=" + positional + ", keywords=" + keywords + '}';
    }
}
