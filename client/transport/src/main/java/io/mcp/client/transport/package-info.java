/**
 * Transport layer of the MCP client.
 *
 * <p>{@link io.mcp.client.transport.McpTransport} performs requests with deadline and retry
 * handling, {@link io.mcp.client.transport.EnvelopeParser} decodes the {@code {"ok": ...}}
 * wrapper of responses and {@link io.mcp.client.transport.ErrorClassifier} turns failures into
 * {@link io.mcp.spec.ConnectionError} or {@link io.mcp.spec.MCPError}.
 */
@NullMarked
package io.mcp.client.transport;

import org.jspecify.annotations.NullMarked;
