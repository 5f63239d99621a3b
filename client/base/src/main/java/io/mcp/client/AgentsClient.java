package io.mcp.client;

import static io.mcp.util.Assert.checkNotBlankParam;
import static io.mcp.util.Assert.checkNotNullParam;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcp.client.transport.ClientCallContext;
import io.mcp.client.transport.HttpMethod;
import io.mcp.client.transport.McpResponse;
import io.mcp.client.transport.McpTransport;
import io.mcp.spec.AgentStatus;
import io.mcp.spec.MCPApiException;
import org.jspecify.annotations.Nullable;

/**
 * Worker agents known to the server.
 */
public class AgentsClient {

    private final McpTransport transport;

    AgentsClient(McpTransport transport) {
        this.transport = checkNotNullParam("transport", transport);
    }

    public List<AgentStatus> listAgents() throws MCPApiException {
        return listAgents(null);
    }

    /**
     * Lists all agents. The server may answer with an array or with an object keyed by agent
     * name; in the latter case the key names entries that do not carry a name themselves.
     */
    public List<AgentStatus> listAgents(@Nullable ClientCallContext context) throws MCPApiException {
        McpResponse response = transport.exchange(HttpMethod.GET, "/api/agents/status", null, context);
        JsonNode payload = response.payload();
        List<AgentStatus> agents = new ArrayList<>();
        if (payload.isArray()) {
            for (JsonNode element : payload) {
                agents.add(Payloads.as(response, element, AgentStatus.class));
            }
            return agents;
        }
        if (payload.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isObject()) {
                    agents.add(Payloads.as(response, field.getValue(), AgentStatus.class).withDefaultName(field.getKey()));
                }
            }
            return agents;
        }
        throw response.malformed("expected agents as an array or an object", null);
    }

    public AgentStatus getAgentStatus(String agentName) throws MCPApiException {
        return getAgentStatus(agentName, null);
    }

    public AgentStatus getAgentStatus(String agentName, @Nullable ClientCallContext context) throws MCPApiException {
        checkNotBlankParam("agentName", agentName);
        return transport.exchange(HttpMethod.GET, Payloads.path("/agents", agentName), null, context, AgentStatus.class)
                .withDefaultName(agentName);
    }

    public AgentStatus registerAgent(String name, Collection<String> capabilities) throws MCPApiException {
        return registerAgent(name, capabilities, null);
    }

    public AgentStatus registerAgent(String name, Collection<String> capabilities, @Nullable ClientCallContext context)
            throws MCPApiException {
        checkNotBlankParam("name", name);
        checkNotNullParam("capabilities", capabilities);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("capabilities", List.copyOf(capabilities));
        return transport.exchange(HttpMethod.POST, "/agents", Payloads.json(body), context, AgentStatus.class)
                .withDefaultName(name);
    }
}
