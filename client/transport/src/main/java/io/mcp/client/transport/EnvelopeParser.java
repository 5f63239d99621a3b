package io.mcp.client.transport;

import static io.mcp.util.Utils.OBJECT_MAPPER;

import java.io.IOException;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.mcp.spec.Envelope;
import io.mcp.spec.MCPErrorCodes;
import org.jspecify.annotations.Nullable;

/**
 * Decodes response bodies into {@link Envelope}s.
 * <p>
 * Decoding never fails: a body that is not a JSON object yields a failed envelope whose error
 * text starts with {@link MCPErrorCodes#MALFORMED_RESPONSE}.
 */
public final class EnvelopeParser {

    private EnvelopeParser() {
    }

    public static Envelope decode(byte[] body) {
        if (body.length == 0) {
            return malformed("empty body", null);
        }
        JsonNode document;
        try {
            document = OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            return malformed("invalid JSON (" + e.getOriginalMessage() + ")", null);
        } catch (IOException e) {
            return malformed(String.valueOf(e.getMessage()), null);
        }
        if (document == null || document.isMissingNode()) {
            return malformed("empty body", null);
        }
        if (!document.isObject()) {
            return malformed("expected a JSON object but got " + document.getNodeType().name().toLowerCase(Locale.ROOT), document);
        }
        return decode(document);
    }

    static Envelope decode(JsonNode document) {
        // only the boolean true counts, "true" or 1 do not
        JsonNode ok = document.get("ok");
        if (ok == null || !ok.isBoolean() || !ok.booleanValue()) {
            return Envelope.failure(errorText(document.get("error")), document);
        }
        for (String key : Envelope.PAYLOAD_KEYS) {
            if (document.has(key)) {
                return Envelope.success(document.get(key), document);
            }
        }
        return Envelope.success(document, document);
    }

    private static String errorText(@Nullable JsonNode error) {
        if (error == null || error.isNull()) {
            return MCPErrorCodes.UNKNOWN_ERROR;
        }
        String text = error.isTextual() ? error.textValue() : error.toString();
        return text.isBlank() ? MCPErrorCodes.UNKNOWN_ERROR : text;
    }

    private static Envelope malformed(String detail, @Nullable JsonNode document) {
        return Envelope.failure(MCPErrorCodes.MALFORMED_RESPONSE + ": " + detail, document);
    }
}
