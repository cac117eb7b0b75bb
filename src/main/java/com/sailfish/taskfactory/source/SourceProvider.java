package com.sailfish.taskfactory.source;

import com.sailfish.taskfactory.TaskCallable;

import java.util.Optional;

/**
 * Recovers the source text of a callable, for cache identity derivation.
 * <p>
 * Absence is an expected outcome (lambdas, generated code, classes shipped without sources)
 * and must be reported as an empty Optional rather than an exception.
 */
@FunctionalInterface
public interface SourceProvider {

    /**
     * @param callable The callable whose source is requested.
     * @return the source text, or empty if it cannot be recovered.
     */
    Optional<String> getSource(TaskCallable callable);

    /**
     * A provider that never finds source.
     */
    static SourceProvider none() {
        return callable -> Optional.empty();
    }
}
