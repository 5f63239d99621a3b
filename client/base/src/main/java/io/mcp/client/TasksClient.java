package io.mcp.client;

import static io.mcp.util.Assert.checkNotBlankParam;
import static io.mcp.util.Assert.checkNotNullParam;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcp.client.tasks.TaskLifecycle;
import io.mcp.client.transport.ClientCallContext;
import io.mcp.client.transport.HttpMethod;
import io.mcp.client.transport.McpResponse;
import io.mcp.client.transport.McpTransport;
import io.mcp.spec.Acknowledgement;
import io.mcp.spec.MCPApiException;
import io.mcp.spec.MCPError;
import io.mcp.spec.MCPErrorCodes;
import io.mcp.spec.TaskInfo;
import io.mcp.spec.TaskListing;
import io.mcp.spec.TaskQuery;
import io.mcp.spec.TaskStatus;
import io.mcp.spec.TaskSubmission;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Task submission, status queries and cancellation.
 */
public class TasksClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(TasksClient.class);

    private final McpTransport transport;

    TasksClient(McpTransport transport) {
        this.transport = checkNotNullParam("transport", transport);
    }

    public TaskInfo submitTask(TaskSubmission submission) throws MCPApiException {
        return submitTask(submission, null);
    }

    /**
     * Submits a task. The server answers with the new task, normally in status
     * {@link TaskStatus#QUEUED}.
     * <p>
     * A missing or blank type never gets here: {@link TaskSubmission} refuses it with an
     * {@link IllegalArgumentException} when it is built. Whether a well-formed type is one the
     * server knows is decided by the server, which answers with an {@link MCPError}.
     *
     * @param submission the task to run
     * @param context per-call headers and timeout, may be {@code null}
     * @return the created task
     * @throws MCPError if the server rejects the submission, e.g. for an unknown type
     * @throws IllegalArgumentException if {@code submission} is {@code null}
     * @throws io.mcp.spec.ConnectionError if the server could not be reached
     */
    public TaskInfo submitTask(TaskSubmission submission, @Nullable ClientCallContext context) throws MCPApiException {
        checkNotNullParam("submission", submission);
        McpResponse response = transport.exchange(HttpMethod.POST, "/run", Payloads.json(submission), context);
        JsonNode payload = response.payload();
        if (payload.isObject()) {
            // some deployments answer {"task_id": ..., "queued": true} instead of the task
            ObjectNode task = ((ObjectNode) payload).deepCopy();
            if (!task.hasNonNull("id") && task.hasNonNull("task_id")) {
                task.set("id", task.get("task_id"));
            }
            if (!task.hasNonNull("status")) {
                task.put("status", TaskStatus.QUEUED.asString());
            }
            payload = task;
        }
        TaskInfo task = Payloads.as(response, payload, TaskInfo.class);
        LOGGER.debug("Submitted {} task {} ({})", submission.type(), task.id(), task.status());
        return task;
    }

    public TaskInfo getTaskStatus(String taskId) throws MCPApiException {
        return getTaskStatus(taskId, null);
    }

    /**
     * @throws MCPError with status 404 if the server does not know the task
     */
    public TaskInfo getTaskStatus(String taskId, @Nullable ClientCallContext context) throws MCPApiException {
        checkNotBlankParam("taskId", taskId);
        return transport.exchange(HttpMethod.GET, Payloads.path("/tasks", taskId), null, context, TaskInfo.class);
    }

    public TaskListing listTasks() throws MCPApiException {
        return listTasks(TaskQuery.ALL, null);
    }

    public TaskListing listTasks(@Nullable TaskStatus status, @Nullable String agent) throws MCPApiException {
        return listTasks(new TaskQuery(status, agent, null), null);
    }

    /**
     * Lists tasks. Depending on the server the result is a list of tasks or aggregate
     * counters; see {@link TaskListing#isAggregate()}.
     */
    public TaskListing listTasks(TaskQuery query, @Nullable ClientCallContext context) throws MCPApiException {
        checkNotNullParam("query", query);
        McpResponse response = transport.exchange(HttpMethod.GET, "/api/tasks/analytics" + queryString(query), null, context);
        JsonNode list = Payloads.listNode(response.payload(), "tasks");
        if (list != null) {
            List<TaskInfo> tasks = new ArrayList<>();
            for (JsonNode element : list) {
                tasks.add(Payloads.as(response, element, TaskInfo.class));
            }
            return TaskListing.ofTasks(tasks);
        }
        if (response.payload().isObject()) {
            return TaskListing.ofAggregate(Payloads.asMap(response));
        }
        throw response.malformed("expected a task list or task analytics", null);
    }

    public Acknowledgement cancelTask(String taskId) throws MCPApiException {
        return cancelTask(taskId, null);
    }

    /**
     * Cancels a task after checking its current status. A task that already reached a
     * terminal status is not cancelled again.
     *
     * @throws MCPError with status {@value MCPErrorCodes#TASK_NOT_CANCELABLE} if the task is
     * already completed, failed or cancelled, or whatever the server reports
     */
    public Acknowledgement cancelTask(String taskId, @Nullable ClientCallContext context) throws MCPApiException {
        return cancelTask(getTaskStatus(taskId, context), context);
    }

    public Acknowledgement cancelTask(TaskInfo lastObserved) throws MCPApiException {
        return cancelTask(lastObserved, null);
    }

    /**
     * Cancels a task using the caller's last observed status instead of fetching it first.
     */
    public Acknowledgement cancelTask(TaskInfo lastObserved, @Nullable ClientCallContext context) throws MCPApiException {
        checkNotNullParam("lastObserved", lastObserved);
        if (lastObserved.isFinal()) {
            LOGGER.debug("Not cancelling task {}: already {}", lastObserved.id(), lastObserved.status());
            throw notCancelable(lastObserved.id(), lastObserved.status());
        }
        McpResponse response = transport.exchange(HttpMethod.POST,
                Payloads.path("/tasks", lastObserved.id()) + "/cancel", null, context);
        return new Acknowledgement(Payloads.asMap(response));
    }

    /**
     * Starts tracking a task, fetching its current status.
     */
    public TaskLifecycle track(String taskId) throws MCPApiException {
        return new TaskLifecycle(this, getTaskStatus(taskId));
    }

    /**
     * Starts tracking a task from a status the caller already has, e.g. the result of
     * {@link #submitTask(TaskSubmission)}.
     */
    public TaskLifecycle track(TaskInfo task) {
        return new TaskLifecycle(this, task);
    }

    public static MCPError notCancelable(String taskId, TaskStatus status) {
        return new MCPError(MCPErrorCodes.TASK_NOT_CANCELABLE,
                "Task " + taskId + " already finished (" + status + "): nothing to cancel", null);
    }

    private static String queryString(TaskQuery query) {
        StringBuilder sb = new StringBuilder();
        if (query.status() != null) {
            append(sb, "status", query.status().asString());
        }
        if (query.agent() != null) {
            append(sb, "agent", query.agent());
        }
        if (query.limit() != null) {
            append(sb, "limit", query.limit().toString());
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String name, String value) {
        sb.append(sb.length() == 0 ? '?' : '&')
                .append(name)
                .append('=')
                .append(McpTransport.encodeQueryValue(value));
    }
}
