package io.mcp.client;

import static io.mcp.util.Assert.checkNotNullParam;

import java.util.Map;

import io.mcp.client.transport.ClientCallContext;
import io.mcp.client.transport.HttpMethod;
import io.mcp.client.transport.McpTransport;
import io.mcp.spec.CodeAnalysisRequest;
import io.mcp.spec.CodeGenerationRequest;
import io.mcp.spec.MCPApiException;
import org.jspecify.annotations.Nullable;

/**
 * AI-assisted analysis and generation. Results are returned as the server produces them.
 */
public class AIClient {

    private final McpTransport transport;

    AIClient(McpTransport transport) {
        this.transport = checkNotNullParam("transport", transport);
    }

    public Map<String, Object> analyzeCode(CodeAnalysisRequest request) throws MCPApiException {
        return analyzeCode(request, null);
    }

    public Map<String, Object> analyzeCode(CodeAnalysisRequest request, @Nullable ClientCallContext context)
            throws MCPApiException {
        checkNotNullParam("request", request);
        return post("/ai/analyze", request, context);
    }

    public Map<String, Object> predictPerformance(Map<String, Object> metrics) throws MCPApiException {
        return predictPerformance(metrics, null);
    }

    public Map<String, Object> predictPerformance(Map<String, Object> metrics, @Nullable ClientCallContext context)
            throws MCPApiException {
        checkNotNullParam("metrics", metrics);
        return post("/ai/predict", metrics, context);
    }

    public Map<String, Object> generateCode(CodeGenerationRequest request) throws MCPApiException {
        return generateCode(request, null);
    }

    public Map<String, Object> generateCode(CodeGenerationRequest request, @Nullable ClientCallContext context)
            throws MCPApiException {
        checkNotNullParam("request", request);
        return post("/ai/generate", request, context);
    }

    private Map<String, Object> post(String path, Object body, @Nullable ClientCallContext context) throws MCPApiException {
        return Payloads.asMap(transport.exchange(HttpMethod.POST, path, Payloads.json(body), context));
    }
}
