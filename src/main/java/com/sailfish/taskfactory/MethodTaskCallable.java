package com.sailfish.taskfactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A {@link TaskCallable} backed by a reflective method, either static or bound to a target instance.
 * Its name is the method name and its signature the method's parameter list.
 */
public class MethodTaskCallable implements TaskCallable {

    private final Object target;
    private final Method method;

    public MethodTaskCallable(Object target, Method method) {
        this.method = Objects.requireNonNull(method, "method cannot be null");
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (!isStatic && target == null) {
            throw new IllegalArgumentException("target cannot be null for instance method " + method.getName());
        }
        if (!isStatic && !method.getDeclaringClass().isInstance(target)) {
            throw new IllegalArgumentException("target is not an instance of " + method.getDeclaringClass().getName());
        }
        this.target = isStatic ? null : target;
        method.trySetAccessible();
    }

    /**
     * Binds the single static method with the given name declared by {@code type}.
     */
    public static MethodTaskCallable of(Class<?> type, String methodName) {
        return new MethodTaskCallable(null, findMethod(type, methodName));
    }

    /**
     * Binds the single method with the given name declared by the target's class.
     */
    public static MethodTaskCallable of(Object target, String methodName) {
        Objects.requireNonNull(target, "target cannot be null");
        return new MethodTaskCallable(target, findMethod(target.getClass(), methodName));
    }

    private static Method findMethod(Class<?> type, String methodName) {
        Objects.requireNonNull(type, "type cannot be null");
        List<Method> candidates = Arrays.stream(type.getDeclaredMethods())
                .filter(m -> m.getName().equals(methodName) && !m.isSynthetic() && !m.isBridge())
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No method '" + methodName + "' declared by " + type.getName());
        }
        if (candidates.size() > 1) {
            throw new IllegalArgumentException("Method '" + methodName + "' is overloaded in " + type.getName()
                    + "; bind the Method explicitly");
        }
        return candidates.get(0);
    }

    @Override
    public String getName() {
        return method.getName();
    }

    @Override
    public ParameterSignature getSignature() {
        return ParameterSignature.of(method);
    }

    @Override
    public Object call(TaskArguments arguments) throws Exception {
        Object[] values = getSignature().bind(arguments);
        try {
            return method.invoke(target, values);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    @Override
    public Optional<Method> getMethod() {
        return Optional.of(method);
    }

    @Override
    public String toString() {
        return "MethodTaskCallable{" + method.getDeclaringClass().getSimpleName() + "#" + method.getName() + '}';
    }
}
