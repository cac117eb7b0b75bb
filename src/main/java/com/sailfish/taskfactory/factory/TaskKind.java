package com.sailfish.taskfactory.factory;

import com.sailfish.taskfactory.TaskCallable;
import com.sailfish.taskfactory.wrapper.BashTaskWrapper;
import com.sailfish.taskfactory.wrapper.FunctionTaskWrapper;
import com.sailfish.taskfactory.wrapper.TaskWrapper;
import com.sailfish.taskfactory.wrapper.TaskWrapperConfig;
import com.sailfish.taskfactory.wrapper.TaskWrapperConstructor;

/**
 * The closed set of built-in task kinds, each bound to its wrapper constructor.
 */
public enum TaskKind implements TaskWrapperConstructor {

    /**
     * Shell-command task: the callable returns a command line run by bash.
     */
    BASH("bash", BashTaskWrapper.class, BashTaskWrapper::new),

    /**
     * In-process function task.
     */
    PYTHON("python", FunctionTaskWrapper.class, FunctionTaskWrapper::new);

    private final String kindName;
    private final Class<? extends TaskWrapper> wrapperType;
    private final TaskWrapperConstructor constructor;

    TaskKind(String kindName, Class<? extends TaskWrapper> wrapperType, TaskWrapperConstructor constructor) {
        this.kindName = kindName;
        this.wrapperType = wrapperType;
        this.constructor = constructor;
    }

    /**
     * The key under which this kind is registered, e.g. {@code "bash"}.
     */
    public String getKindName() {
        return kindName;
    }

    public Class<? extends TaskWrapper> getWrapperType() {
        return wrapperType;
    }

    @Override
    public TaskWrapper create(TaskCallable callable, TaskWrapperConfig config) {
        return constructor.create(callable, config);
    }

    @Override
    public String describe() {
        return wrapperType.getSimpleName();
    }
}
