package io.mcp.spec;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcp.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The decoded top-level wrapper of every server response, {@code {"ok": bool, ...}}.
 * <p>
 * On success the payload is taken from the first key of {@link #PAYLOAD_KEYS} present in the
 * document, or is the whole document when none is present. On failure {@link #error()} holds
 * the server's error text.
 *
 * @param ok whether the server reported success
 * @param payload the selected payload on success, {@code null} on failure
 * @param error the error text on failure, {@code null} on success
 * @param document the complete decoded document, {@code null} if the body was not JSON
 */
public record Envelope(boolean ok,
                       @Nullable JsonNode payload,
                       @Nullable String error,
                       @Nullable JsonNode document) {

    /**
     * Payload keys in priority order. Endpoints disagree on where they put their payload, so the
     * order is fixed and must not change.
     */
    public static final List<String> PAYLOAD_KEYS = List.of("data", "status", "agents", "analytics");

    public Envelope {
        if (ok) {
            Assert.checkNotNullParam("payload", payload);
        } else {
            Assert.checkNotBlankParam("error", error);
        }
    }

    public static Envelope success(JsonNode payload, JsonNode document) {
        return new Envelope(true, payload, null, document);
    }

    public static Envelope failure(String error, @Nullable JsonNode document) {
        return new Envelope(false, null, error, document);
    }
}
