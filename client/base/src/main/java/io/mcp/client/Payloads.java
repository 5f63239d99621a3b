package io.mcp.client;

import static io.mcp.util.Utils.OBJECT_MAPPER;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import io.mcp.client.transport.McpResponse;
import io.mcp.client.transport.McpTransport;
import io.mcp.spec.MCPError;
import io.mcp.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Payload shapes shared by the resource clients.
 */
final class Payloads {

    private static final JavaType MAP_TYPE = OBJECT_MAPPER.getTypeFactory().constructType(Utils.MAP_TYPE_REFERENCE);

    private Payloads() {
    }

    static String json(Object body) {
        try {
            return Utils.toJson(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + body.getClass().getSimpleName(), e);
        }
    }

    /**
     * The payload as a map. A payload that is not an object, such as a bare status string,
     * yields the whole document instead.
     */
    static Map<String, Object> asMap(McpResponse response) throws MCPError {
        JsonNode payload = response.payload();
        JsonNode node = payload.isObject() ? payload : response.document();
        return response.convert(node, MAP_TYPE);
    }

    /**
     * The payload as a list, either a JSON array or an object wrapping the array under
     * {@code wrapperKey}.
     */
    static <T> List<T> asList(McpResponse response, String wrapperKey, Class<T> elementType) throws MCPError {
        JsonNode node = listNode(response.payload(), wrapperKey);
        if (node == null) {
            throw response.malformed("expected a list of " + elementType.getSimpleName(), null);
        }
        return response.convert(node, OBJECT_MAPPER.getTypeFactory().constructCollectionType(List.class, elementType));
    }

    static @Nullable JsonNode listNode(JsonNode payload, String wrapperKey) {
        if (payload.isArray()) {
            return payload;
        }
        if (payload.isObject() && payload.path(wrapperKey).isArray()) {
            return payload.get(wrapperKey);
        }
        return null;
    }

    static <T> T as(McpResponse response, JsonNode node, Class<T> type) throws MCPError {
        return response.convert(node, OBJECT_MAPPER.constructType(type));
    }

    static String path(String prefix, String segment) {
        return prefix + "/" + McpTransport.encodePathSegment(segment);
    }
}
