package com.sailfish.taskfactory.wrapper;

import com.sailfish.taskfactory.TaskArguments;
import com.sailfish.taskfactory.TaskCallable;

import java.util.concurrent.Callable;

/**
 * Wrapper for in-process function tasks: the result is whatever the callable returns.
 */
public class FunctionTaskWrapper extends AbstractTaskWrapper {

    public FunctionTaskWrapper(TaskCallable callable, TaskWrapperConfig config) {
        super(callable, config);
    }

    @Override
    protected Callable<Object> createWork(TaskArguments callArguments, TaskArguments allArguments) {
        return () -> callable.call(callArguments);
    }
}
