package com.sailfish.taskfactory;

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The formal parameter list of a {@link TaskCallable}.
 * <p>
 * A signature binds {@link TaskArguments} to an argument array: positional values fill the
 * parameters in order, keyword values fill them by name, and a trailing varargs parameter
 * collects surplus positional values. The {@link #any()} signature accepts every argument
 * combination and is used for opaque lambdas.
 */
public final class ParameterSignature {

    private static final ParameterSignature ANY = new ParameterSignature(Collections.emptyList(), false, true);

    private final List<TaskParameter> parameters;
    private final boolean varArgs;
    private final boolean acceptsAny;

    private ParameterSignature(List<TaskParameter> parameters, boolean varArgs, boolean acceptsAny) {
        this.parameters = parameters;
        this.varArgs = varArgs;
        this.acceptsAny = acceptsAny;
    }

    /**
     * Captures the signature of a reflective method. Parameter names are only meaningful when
     * the declaring class was compiled with {@code -parameters}.
     */
    public static ParameterSignature of(Method method) {
        Objects.requireNonNull(method, "method cannot be null");
        List<TaskParameter> params = new ArrayList<>();
        for (Parameter parameter : method.getParameters()) {
            params.add(new TaskParameter(parameter.getName(), parameter.getType()));
        }
        return new ParameterSignature(Collections.unmodifiableList(params), method.isVarArgs(), false);
    }

    public static ParameterSignature of(TaskParameter... parameters) {
        List<TaskParameter> params = Arrays.asList(parameters);
        long distinct = params.stream().map(TaskParameter::getName).distinct().count();
        if (distinct != params.size()) {
            throw new IllegalArgumentException("duplicate parameter name in " + params);
        }
        return new ParameterSignature(Collections.unmodifiableList(new ArrayList<>(params)), false, false);
    }

    /**
     * Signature of untyped parameters, one per name.
     */
    public static ParameterSignature ofNames(String... names) {
        TaskParameter[] params = new TaskParameter[names.length];
        for (int i = 0; i < names.length; i++) {
            params[i] = new TaskParameter(names[i], Object.class);
        }
        return of(params);
    }

    public static ParameterSignature any() {
        return ANY;
    }

    public List<TaskParameter> getParameters() {
        return parameters;
    }

    public boolean isVarArgs() {
        return varArgs;
    }

    public boolean acceptsAny() {
        return acceptsAny;
    }

    /**
     * Checks that the arguments can be bound to this signature.
     *
     * @throws IllegalArgumentException if an argument is missing, duplicated, unknown or of the wrong type.
     */
    public void validate(TaskArguments arguments) {
        bind(arguments);
    }

    /**
     * Binds the arguments to an array in declaration order. For {@link #any()} the positional
     * values are returned as-is and keywords are left to the callable.
     *
     * @throws IllegalArgumentException if an argument is missing, duplicated, unknown or of the wrong type.
     */
    public Object[] bind(TaskArguments arguments) {
        Objects.requireNonNull(arguments, "arguments cannot be null");
        List<Object> positional = arguments.getPositional();
        if (acceptsAny) {
            return positional.toArray();
        }

        int fixed = varArgs ? parameters.size() - 1 : parameters.size();
        if (!varArgs && positional.size() > fixed) {
            throw new IllegalArgumentException(String.format(
                    "takes %d positional arguments but %d were given", fixed, positional.size()));
        }

        Object[] values = new Object[parameters.size()];
        boolean[] bound = new boolean[parameters.size()];
        int direct = Math.min(fixed, positional.size());
        for (int i = 0; i < direct; i++) {
            values[i] = positional.get(i);
            bound[i] = true;
        }

        for (Map.Entry<String, Object> keyword : arguments.getKeywords().entrySet()) {
            int index = indexOf(keyword.getKey(), fixed);
            if (index < 0) {
                throw new IllegalArgumentException("unexpected keyword argument '" + keyword.getKey() + "'");
            }
            if (bound[index]) {
                throw new IllegalArgumentException("multiple values for argument '" + keyword.getKey() + "'");
            }
            values[index] = keyword.getValue();
            bound[index] = true;
        }

        List<String> missing = new ArrayList<>();
        for (int i = 0; i < fixed; i++) {
            if (!bound[i]) {
                missing.add(parameters.get(i).getName());
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("missing required arguments: " + String.join(", ", missing));
        }

        for (int i = 0; i < fixed; i++) {
            checkType(parameters.get(i), values[i]);
        }

        if (varArgs) {
            TaskParameter rest = parameters.get(fixed);
            Class<?> componentType = rest.getType().getComponentType();
            int extra = positional.size() - direct;
            Object array = Array.newInstance(componentType, extra);
            for (int i = 0; i < extra; i++) {
                Object value = positional.get(direct + i);
                checkType(new TaskParameter(rest.getName(), componentType), value);
                Array.set(array, i, value);
            }
            values[fixed] = array;
        }
        return values;
    }

    private int indexOf(String name, int limit) {
        for (int i = 0; i < limit; i++) {
            if (parameters.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private static void checkType(TaskParameter parameter, Object value) {
        Class<?> type = parameter.getType();
        if (value == null) {
            if (type.isPrimitive()) {
                throw new IllegalArgumentException("argument '" + parameter.getName() + "' cannot be null");
            }
            return;
        }
        if (!box(type).isInstance(value)) {
            throw new IllegalArgumentException(String.format("argument '%s' expects %s but got %s",
                    parameter.getName(), type.getName(), value.getClass().getName()));
        }
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        return Void.class;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterSignature that = (ParameterSignature) o;
        return varArgs == that.varArgs && acceptsAny == that.acceptsAny && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, varArgs, acceptsAny);
    }

    @Override
    public String toString() {
        if (acceptsAny) {
            return "(...)";
        }
        return parameters.stream().map(TaskParameter::toString).collect(Collectors.joining(", ", "(", varArgs ? "...)" : ")"));
    }
}
