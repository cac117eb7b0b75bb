/**
 * Task wrappers: the {@link com.sailfish.taskfactory.wrapper.TaskWrapperConstructor} capability
 * and the bundled shell and in-process function wrappers.
 */
package com.sailfish.taskfactory.wrapper;
