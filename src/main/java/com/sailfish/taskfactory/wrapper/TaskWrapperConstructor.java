package com.sailfish.taskfactory.wrapper;

import com.sailfish.taskfactory.TaskCallable;

/**
 * Creates wrappers of one task kind from a callable and the factory's execution parameters.
 */
@FunctionalInterface
public interface TaskWrapperConstructor {

    TaskWrapper create(TaskCallable callable, TaskWrapperConfig config);

    /**
     * Short name of the wrapper kind, for diagnostics.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
