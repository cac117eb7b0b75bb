package com.sailfish.taskfactory.wrapper;

import com.sailfish.taskfactory.TaskArguments;
import com.sailfish.taskfactory.model.TaskHandle;

/**
 * One invocation of a bound callable. A wrapper is created per call by a task factory
 * and invoked exactly once with the caller's arguments.
 */
@FunctionalInterface
public interface TaskWrapper {

    /**
     * Validates the arguments, submits the work and returns its handle.
     *
     * @param arguments The caller's arguments, including any wrapper-reserved keywords.
     * @return the handle of the submitted task.
     * @throws IllegalArgumentException if the arguments do not fit the callable's signature.
     */
    TaskHandle call(TaskArguments arguments);
}
