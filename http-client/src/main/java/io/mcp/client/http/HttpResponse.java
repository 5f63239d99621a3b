package io.mcp.client.http;

import java.nio.charset.StandardCharsets;

public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * @return the raw response body, empty but never {@code null}
     */
    byte[] body();

    default String bodyAsString() {
        return new String(body(), StandardCharsets.UTF_8);
    }
}
