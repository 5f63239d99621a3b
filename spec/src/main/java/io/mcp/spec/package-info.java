/**
 * Data model and error types of the MCP orchestration server API.
 *
 * <p>Records in this package mirror the JSON documents exchanged with the server. Entities
 * such as {@link io.mcp.spec.TaskInfo}, {@link io.mcp.spec.AgentStatus} and
 * {@link io.mcp.spec.PluginInfo} are produced by the server and are read-only on the client;
 * {@link io.mcp.spec.TaskSubmission} and {@link io.mcp.spec.WebhookRegistration} are built
 * by callers and sent to it.
 *
 * <p>Failures are reported with the two subtypes of {@link io.mcp.spec.MCPApiException}:
 * {@link io.mcp.spec.ConnectionError} and {@link io.mcp.spec.MCPError}.
 */
@NullMarked
package io.mcp.spec;

import org.jspecify.annotations.NullMarked;
