package io.mcp.client.transport;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.mcp.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Per-call settings passed alongside a request: extra HTTP headers and an optional override
 * of the configured call timeout.
 */
public class ClientCallContext {

    private final Map<String, String> headers;
    private final @Nullable Duration timeout;

    public ClientCallContext(Map<String, String> headers, @Nullable Duration timeout) {
        Assert.checkNotNullParam("headers", headers);
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.timeout = timeout;
    }

    public ClientCallContext(Map<String, String> headers) {
        this(headers, null);
    }

    public static ClientCallContext withTimeout(Duration timeout) {
        Assert.checkNotNullParam("timeout", timeout);
        return new ClientCallContext(Map.of(), timeout);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * @return the timeout for the whole call including retries, or {@code null} to use the
     * configured default
     */
    public @Nullable Duration getTimeout() {
        return timeout;
    }
}
