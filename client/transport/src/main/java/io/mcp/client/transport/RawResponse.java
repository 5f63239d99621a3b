package io.mcp.client.transport;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import io.mcp.util.Assert;

/**
 * An HTTP response as the transport received it, before envelope decoding.
 *
 * @param statusCode the HTTP status code
 * @param body the response body, empty if the server sent none
 */
public record RawResponse(int statusCode, byte[] body) {

    public RawResponse {
        Assert.checkNotNullParam("body", body);
    }

    public boolean success() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawResponse other)) {
            return false;
        }
        return statusCode == other.statusCode && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * statusCode + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "RawResponse{statusCode=" + statusCode + ", body=" + bodyAsString() + '}';
    }
}
