/**
 * Provides the callable abstraction bound by task factories: {@link com.sailfish.taskfactory.TaskCallable},
 * its parameter signature and invocation arguments.
 * <p>
 * Factories and kind registries live in {@code com.sailfish.taskfactory.factory}, wrapper
 * implementations in {@code com.sailfish.taskfactory.wrapper}.
 */
package com.sailfish.taskfactory;
