package com.sailfish.taskfactory.model;

/**
 * Represents the lifecycle status of a task factory.
 * Execution states belong to the wrapper and the execution context, not to the factory.
 */
public enum TaskStatus {
    /**
     * Factory has been constructed and its content identity computed.
     */
    CREATED
}
