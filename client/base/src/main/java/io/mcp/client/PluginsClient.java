package io.mcp.client;

import static io.mcp.util.Assert.checkNotBlankParam;
import static io.mcp.util.Assert.checkNotNullParam;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.mcp.client.transport.ClientCallContext;
import io.mcp.client.transport.HttpMethod;
import io.mcp.client.transport.McpTransport;
import io.mcp.spec.Acknowledgement;
import io.mcp.spec.MCPApiException;
import io.mcp.spec.PluginInfo;
import org.jspecify.annotations.Nullable;

/**
 * Server plugins.
 */
public class PluginsClient {

    private final McpTransport transport;

    PluginsClient(McpTransport transport) {
        this.transport = checkNotNullParam("transport", transport);
    }

    public List<PluginInfo> listPlugins() throws MCPApiException {
        return listPlugins(null);
    }

    public List<PluginInfo> listPlugins(@Nullable ClientCallContext context) throws MCPApiException {
        return Payloads.asList(transport.exchange(HttpMethod.GET, "/plugins", null, context), "plugins", PluginInfo.class);
    }

    public PluginInfo getPluginInfo(String pluginName) throws MCPApiException {
        return getPluginInfo(pluginName, null);
    }

    public PluginInfo getPluginInfo(String pluginName, @Nullable ClientCallContext context) throws MCPApiException {
        checkNotBlankParam("pluginName", pluginName);
        return transport.exchange(HttpMethod.GET, Payloads.path("/plugins", pluginName), null, context, PluginInfo.class);
    }

    public PluginInfo installPlugin(String pluginName, @Nullable Map<String, Object> config) throws MCPApiException {
        return installPlugin(pluginName, config, null);
    }

    public PluginInfo installPlugin(String pluginName, @Nullable Map<String, Object> config,
            @Nullable ClientCallContext context) throws MCPApiException {
        checkNotBlankParam("pluginName", pluginName);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", pluginName);
        body.put("config", config == null ? Map.of() : config);
        return transport.exchange(HttpMethod.POST, "/plugins/install", Payloads.json(body), context, PluginInfo.class);
    }

    public Acknowledgement uninstallPlugin(String pluginName) throws MCPApiException {
        return uninstallPlugin(pluginName, null);
    }

    /**
     * @throws io.mcp.spec.MCPError if the plugin is not installed
     */
    public Acknowledgement uninstallPlugin(String pluginName, @Nullable ClientCallContext context) throws MCPApiException {
        checkNotBlankParam("pluginName", pluginName);
        return new Acknowledgement(Payloads.asMap(transport.exchange(HttpMethod.POST,
                Payloads.path("/plugins", pluginName) + "/uninstall", null, context)));
    }
}
