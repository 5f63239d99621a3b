package io.mcp.client;

import io.mcp.client.config.ClientConfig;
import io.mcp.client.http.HttpClient;
import io.mcp.util.Assert;
import org.jspecify.annotations.Nullable;

public class MCPClientBuilder {

    private ClientConfig config = ClientConfig.defaults();
    private @Nullable HttpClient httpClient;

    MCPClientBuilder() {
    }

    public MCPClientBuilder config(ClientConfig config) {
        Assert.checkNotNullParam("config", config);
        this.config = config;
        return this;
    }

    /**
     * Uses the given HTTP client instead of creating one with the configured
     * {@link io.mcp.client.http.HttpClientBuilder}.
     */
    public MCPClientBuilder httpClient(HttpClient httpClient) {
        Assert.checkNotNullParam("httpClient", httpClient);
        this.httpClient = httpClient;
        return this;
    }

    public MCPClient build() {
        return new MCPClient(config, httpClient);
    }
}
