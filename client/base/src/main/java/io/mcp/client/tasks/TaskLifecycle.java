package io.mcp.client.tasks;

import static io.mcp.util.Assert.checkNotNullParam;

import io.mcp.client.TasksClient;
import io.mcp.client.transport.ClientCallContext;
import io.mcp.spec.Acknowledgement;
import io.mcp.spec.MCPApiException;
import io.mcp.spec.MCPError;
import io.mcp.spec.TaskInfo;
import io.mcp.spec.TaskStatus;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-side view of one task's lifecycle.
 * <p>
 * Status only moves forward: {@code queued -> running -> completed | failed | cancelled}. A
 * server report that would move the task backwards, such as {@code running} after
 * {@code completed}, is ignored and logged, so {@link #getStatus()} never regresses. The
 * tracker does not poll on its own; callers decide when to {@link #refresh()}.
 * <p>
 * Instances are thread-safe.
 */
public class TaskLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskLifecycle.class);

    private final TasksClient tasks;
    private final String taskId;
    private TaskInfo current;

    public TaskLifecycle(TasksClient tasks, TaskInfo initial) {
        this.tasks = checkNotNullParam("tasks", tasks);
        this.current = checkNotNullParam("initial", initial);
        this.taskId = initial.id();
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * @return the latest accepted task information
     */
    public synchronized TaskInfo current() {
        return current;
    }

    public TaskStatus getStatus() {
        return current().status();
    }

    public boolean isTerminal() {
        return getStatus().isFinal();
    }

    public TaskInfo refresh() throws MCPApiException {
        return refresh(null);
    }

    /**
     * Fetches the task once and records the result.
     *
     * @return the task information after the update, which is the previous one if the server
     * reported a regressive status
     */
    public TaskInfo refresh(@Nullable ClientCallContext context) throws MCPApiException {
        return observe(tasks.getTaskStatus(taskId, context));
    }

    /**
     * Records a status obtained elsewhere, e.g. from a webhook delivery.
     *
     * @param observed the reported task information
     * @return the task information after the update
     */
    public synchronized TaskInfo observe(TaskInfo observed) {
        checkNotNullParam("observed", observed);
        if (!taskId.equals(observed.id())) {
            throw new IllegalArgumentException("Status of task " + observed.id() + " reported to tracker of " + taskId);
        }
        if (current.status().canTransitionTo(observed.status())) {
            if (current.status() != observed.status()) {
                LOGGER.debug("Task {}: {} -> {}", taskId, current.status(), observed.status());
            }
            current = observed;
        } else {
            LOGGER.warn("Ignoring regressive status of task {}: server reported {} after {}",
                    taskId, observed.status(), current.status());
        }
        return current;
    }

    public Acknowledgement cancel() throws MCPApiException {
        return cancel(null);
    }

    /**
     * Cancels the task unless it is already known to be finished.
     *
     * @throws MCPError with status 409 without contacting the server if the last observed
     * status is terminal, or whatever the server reports
     */
    public Acknowledgement cancel(@Nullable ClientCallContext context) throws MCPApiException {
        TaskInfo snapshot = current();
        if (snapshot.isFinal()) {
            throw TasksClient.notCancelable(taskId, snapshot.status());
        }
        return tasks.cancelTask(snapshot, context);
    }
}
