package com.sailfish.taskfactory;

/**
 * The logic of a task defined in code rather than through a reflective method.
 */
@FunctionalInterface
public interface TaskBody {

    /**
     * Runs the task logic.
     *
     * @param arguments The arguments the task was invoked with.
     * @return the task result, possibly {@code null}.
     * @throws Exception if the task fails.
     */
    Object apply(TaskArguments arguments) throws Exception;
}
