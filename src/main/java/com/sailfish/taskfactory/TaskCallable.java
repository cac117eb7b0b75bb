package com.sailfish.taskfactory;

import java.lang.reflect.Method;
import java.util.Optional;

/**
 * A named unit of user logic that can be bound to a task kind.
 * Implementations must be safe to call from several threads at once.
 */
public interface TaskCallable {

    /**
     * The declared name of the callable, used for diagnostics and as the fallback cache identity.
     */
    String getName();

    /**
     * The formal parameter list of the callable.
     */
    ParameterSignature getSignature();

    /**
     * Executes the callable logic.
     *
     * @param arguments The invocation arguments, already stripped of wrapper-reserved keywords.
     * @return the result of the callable.
     * @throws Exception if the callable fails.
     */
    Object call(TaskArguments arguments) throws Exception;

    /**
     * The reflective method backing this callable, if any. Only method-backed callables have
     * source text that can be recovered.
     */
    default Optional<Method> getMethod() {
        return Optional.empty();
    }

    /**
     * Creates a callable from a lambda. Such callables have no recoverable source.
     */
    static TaskCallable of(String name, ParameterSignature signature, TaskBody body) {
        return new FunctionalTaskCallable(name, signature, body);
    }

    static TaskCallable of(String name, TaskBody body) {
        return new FunctionalTaskCallable(name, ParameterSignature.any(), body);
    }
}
