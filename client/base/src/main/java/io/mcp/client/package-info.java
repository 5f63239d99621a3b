/**
 * Entry point of the MCP client.
 *
 * <p>{@link io.mcp.client.MCPClient} groups the server endpoints into resource clients:
 * {@link io.mcp.client.TasksClient}, {@link io.mcp.client.AgentsClient},
 * {@link io.mcp.client.AIClient}, {@link io.mcp.client.WebhooksClient} and
 * {@link io.mcp.client.PluginsClient}. Every call throws
 * {@link io.mcp.spec.ConnectionError} when the server could not be reached and
 * {@link io.mcp.spec.MCPError} when it answered with a failure.
 */
@NullMarked
package io.mcp.client;

import org.jspecify.annotations.NullMarked;
