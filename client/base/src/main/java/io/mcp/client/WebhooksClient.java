package io.mcp.client;

import static io.mcp.util.Assert.checkNotBlankParam;
import static io.mcp.util.Assert.checkNotNullParam;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcp.client.transport.ClientCallContext;
import io.mcp.client.transport.HttpMethod;
import io.mcp.client.transport.McpResponse;
import io.mcp.client.transport.McpTransport;
import io.mcp.spec.Acknowledgement;
import io.mcp.spec.MCPApiException;
import io.mcp.spec.MCPError;
import io.mcp.spec.Webhook;
import io.mcp.spec.WebhookRegistration;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Webhook registrations. Deliveries can be authenticated with {@link WebhookSignatures}.
 */
public class WebhooksClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhooksClient.class);

    private static final List<String> ID_KEYS = List.of("webhookId", "webhook_id", "id");

    private final McpTransport transport;

    WebhooksClient(McpTransport transport) {
        this.transport = checkNotNullParam("transport", transport);
    }

    public String registerWebhook(WebhookRegistration registration) throws MCPApiException {
        return registerWebhook(registration, null);
    }

    /**
     * Registers a webhook.
     *
     * @return the identifier the server assigned
     * @throws MCPError if the server rejects the registration or its answer carries no id
     */
    public String registerWebhook(WebhookRegistration registration, @Nullable ClientCallContext context)
            throws MCPApiException {
        checkNotNullParam("registration", registration);
        McpResponse response = transport.exchange(HttpMethod.POST, "/webhooks", Payloads.json(registration), context);
        String id = findId(response.payload());
        if (id == null) {
            id = findId(response.document());
        }
        if (id == null) {
            throw response.malformed("no webhook id in registration response", null);
        }
        LOGGER.debug("Registered webhook {} for {}", id, registration.events());
        return id;
    }

    public List<Webhook> listWebhooks() throws MCPApiException {
        return listWebhooks(null);
    }

    public List<Webhook> listWebhooks(@Nullable ClientCallContext context) throws MCPApiException {
        return Payloads.asList(transport.exchange(HttpMethod.GET, "/webhooks", null, context), "webhooks", Webhook.class);
    }

    public Acknowledgement deleteWebhook(String webhookId) throws MCPApiException {
        return deleteWebhook(webhookId, null);
    }

    /**
     * @throws MCPError if the server does not know the webhook
     */
    public Acknowledgement deleteWebhook(String webhookId, @Nullable ClientCallContext context) throws MCPApiException {
        checkNotBlankParam("webhookId", webhookId);
        McpResponse response = transport.exchange(HttpMethod.DELETE, Payloads.path("/webhooks", webhookId), null, context);
        return new Acknowledgement(Payloads.asMap(response));
    }

    private static @Nullable String findId(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        for (String key : ID_KEYS) {
            JsonNode value = node.get(key);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
