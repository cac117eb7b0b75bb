/**
 * Task factories and the kind registry that creates them.
 * <p>
 * A {@link com.sailfish.taskfactory.factory.TaskDescriptorFactory} binds one callable to one
 * wrapper constructor and derives its cache identity once at construction. The
 * {@link com.sailfish.taskfactory.factory.TaskKindRegistry} resolves kind names such as
 * {@code "bash"} to constructors and rejects unknown kinds with
 * {@link com.sailfish.taskfactory.factory.InvalidTaskKindException}.
 */
package com.sailfish.taskfactory.factory;
