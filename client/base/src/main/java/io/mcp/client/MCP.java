package io.mcp.client;

import io.mcp.client.config.ClientConfig;
import io.mcp.spec.MCPApiException;
import io.mcp.spec.ServerStatus;

/**
 * Convenience methods for one-off calls.
 */
public class MCP {

    private MCP() {
    }

    /**
     * Reads the status of the server at the default address, {@value ClientConfig#DEFAULT_BASE_URL}.
     */
    public static ServerStatus quickStatusCheck() throws MCPApiException {
        return quickStatusCheck(ClientConfig.DEFAULT_BASE_URL);
    }

    /**
     * Reads the status of a server with a throwaway client. Long running applications should
     * keep one {@link MCPClient} instead.
     *
     * @param baseUrl the server URL
     * @return the server status
     */
    public static ServerStatus quickStatusCheck(String baseUrl) throws MCPApiException {
        return MCPClient.create(baseUrl).getStatus();
    }
}
