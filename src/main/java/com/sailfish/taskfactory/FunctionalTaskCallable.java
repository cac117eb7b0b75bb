package com.sailfish.taskfactory;

import java.util.Objects;

/**
 * A {@link TaskCallable} wrapping a {@link TaskBody} lambda.
 */
public class FunctionalTaskCallable implements TaskCallable {

    private final String name;
    private final ParameterSignature signature;
    private final TaskBody body;

    public FunctionalTaskCallable(String name, ParameterSignature signature, TaskBody body) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        this.name = name;
        this.signature = Objects.requireNonNull(signature, "signature cannot be null");
        this.body = Objects.requireNonNull(body, "body cannot be null");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ParameterSignature getSignature() {
        return signature;
    }

    @Override
    public Object call(TaskArguments arguments) throws Exception {
        return body.apply(arguments);
    }

    @Override
    public String toString() {
        return "FunctionalTaskCallable{" + name + signature + '}';
    }
}
