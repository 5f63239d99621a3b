package io.mcp.client.transport;

import static io.mcp.util.Utils.OBJECT_MAPPER;

import java.io.IOException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import io.mcp.spec.Envelope;
import io.mcp.spec.MCPError;
import io.mcp.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A successful response: HTTP status below 400 and an envelope reporting {@code ok}.
 *
 * @param statusCode the HTTP status code
 * @param envelope the decoded envelope, always a success
 * @param rawBody the body as received
 */
public record McpResponse(int statusCode, Envelope envelope, String rawBody) {

    public McpResponse {
        Assert.checkNotNullParam("envelope", envelope);
        Assert.checkNotNullParam("rawBody", rawBody);
        if (!envelope.ok()) {
            throw new IllegalArgumentException("Not a successful envelope: " + envelope.error());
        }
    }

    public JsonNode payload() {
        return Assert.checkNotNullParam("payload", envelope.payload());
    }

    public JsonNode document() {
        return Assert.checkNotNullParam("document", envelope.document());
    }

    public <T> T payloadAs(Class<T> type) throws MCPError {
        return payloadAs(OBJECT_MAPPER.constructType(type));
    }

    public <T> T payloadAs(TypeReference<T> type) throws MCPError {
        return payloadAs(OBJECT_MAPPER.getTypeFactory().constructType(type));
    }

    /**
     * Maps the payload to the given type.
     *
     * @throws MCPError if the payload is {@code null} or does not fit the type
     */
    public <T> T payloadAs(JavaType type) throws MCPError {
        return convert(payload(), type);
    }

    public <T> T convert(JsonNode node, JavaType type) throws MCPError {
        if (node.isNull() || node.isMissingNode()) {
            throw malformed("no payload where " + type.getRawClass().getSimpleName() + " was expected", null);
        }
        try {
            T value = OBJECT_MAPPER.readerFor(type).readValue(node);
            if (value == null) {
                throw malformed("no payload where " + type.getRawClass().getSimpleName() + " was expected", null);
            }
            return value;
        } catch (IOException | IllegalArgumentException e) {
            throw malformed("cannot read " + type.getRawClass().getSimpleName() + " (" + e.getMessage() + ")", e);
        }
    }

    public MCPError malformed(String detail, @Nullable Throwable cause) {
        return ErrorClassifier.malformed(statusCode, detail, rawBody, cause);
    }
}
