package io.throttleforge;

import java.time.Instant;

/**
 * Immutable metadata for a submitted task, handed to {@link TaskHook} callbacks.
 */
public final class TaskInfo {

    private final long taskId;
    private final String name;
    private final TaskContext context;
    private final Instant createdAt;

    public TaskInfo(long taskId, String name, TaskContext context, Instant createdAt) {
        this.taskId = taskId;
        this.name = name;
        this.context = context;
        this.createdAt = createdAt;
    }

    public long taskId() {
        return taskId;
    }

    public String name() {
        return name;
    }

    public TaskContext context() {
        return context;
    }

    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return name + "#" + taskId;
    }
}
