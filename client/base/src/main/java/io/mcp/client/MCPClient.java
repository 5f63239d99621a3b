package io.mcp.client;

import static io.mcp.util.Assert.checkNotNullParam;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcp.client.config.ClientConfig;
import io.mcp.client.http.HttpClient;
import io.mcp.client.transport.ClientCallContext;
import io.mcp.client.transport.HttpMethod;
import io.mcp.client.transport.McpResponse;
import io.mcp.client.transport.McpTransport;
import io.mcp.spec.MCPApiException;
import io.mcp.spec.ServerStatus;
import org.jspecify.annotations.Nullable;

/**
 * Client of an MCP task-orchestration server.
 * <p>
 * A client holds no per-request state: create one per server and share it.
 * <pre>{@code
 * MCPClient client = MCPClient.builder()
 *     .config(ClientConfig.builder().baseUrl("http://localhost:5005").build())
 *     .build();
 * TaskInfo task = client.tasks().submitTask(TaskSubmission.builder().type("code_analysis").build());
 * }</pre>
 */
public class MCPClient {

    private final ClientConfig config;
    private final McpTransport transport;
    private final TasksClient tasks;
    private final AgentsClient agents;
    private final AIClient ai;
    private final WebhooksClient webhooks;
    private final PluginsClient plugins;

    MCPClient(ClientConfig config, @Nullable HttpClient httpClient) {
        this.config = checkNotNullParam("config", config);
        this.transport = new McpTransport(httpClient, config.getBaseUrl(), config.toTransportConfig());
        this.tasks = new TasksClient(transport);
        this.agents = new AgentsClient(transport);
        this.ai = new AIClient(transport);
        this.webhooks = new WebhooksClient(transport);
        this.plugins = new PluginsClient(transport);
    }

    public static MCPClientBuilder builder() {
        return new MCPClientBuilder();
    }

    public static MCPClient create(String baseUrl) {
        return builder().config(ClientConfig.builder().baseUrl(baseUrl).build()).build();
    }

    public ClientConfig getConfig() {
        return config;
    }

    public TasksClient tasks() {
        return tasks;
    }

    public AgentsClient agents() {
        return agents;
    }

    public AIClient ai() {
        return ai;
    }

    public WebhooksClient webhooks() {
        return webhooks;
    }

    public PluginsClient plugins() {
        return plugins;
    }

    public ServerStatus getStatus() throws MCPApiException {
        return getStatus(null);
    }

    /**
     * Reads the server status. Servers either nest it under {@code data} or {@code status} or
     * put a bare status string next to the other fields at the top level.
     */
    public ServerStatus getStatus(@Nullable ClientCallContext context) throws MCPApiException {
        McpResponse response = transport.exchange(HttpMethod.GET, "/status", null, context);
        JsonNode payload = response.payload();
        JsonNode node = payload.isObject() ? payload : response.document();
        return Payloads.as(response, node, ServerStatus.class);
    }

    public Map<String, Object> getHealth() throws MCPApiException {
        return getHealth(null);
    }

    public Map<String, Object> getHealth(@Nullable ClientCallContext context) throws MCPApiException {
        return Payloads.asMap(transport.exchange(HttpMethod.GET, "/health", null, context));
    }
}
