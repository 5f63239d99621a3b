package io.mcp.client.transport;

/**
 * The HTTP methods used by the MCP server endpoints.
 */
public enum HttpMethod {
    GET,
    POST,
    DELETE
}
