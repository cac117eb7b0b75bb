package com.sailfish.taskfactory.factory;

/**
 * A task kind was requested that the registry does not know. This is a configuration
 * defect in the caller and is not retryable.
 */
public class InvalidTaskKindException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String registryName;
    private final String kind;

    public InvalidTaskKindException(String registryName, String kind) {
        super(String.format("TaskKindRegistry:%s Invalid task kind requested : %s", registryName, kind));
        this.registryName = registryName;
        this.kind = kind;
    }

    public String getRegistryName() {
        return registryName;
    }

    public String getKind() {
        return kind;
    }
}
