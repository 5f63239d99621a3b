package io.mcp.client.transport;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import io.mcp.spec.ConnectionError;
import io.mcp.spec.Envelope;
import io.mcp.spec.MCPApiException;
import io.mcp.spec.MCPError;
import io.mcp.spec.MCPErrorCodes;
import org.jspecify.annotations.Nullable;

/**
 * Maps transport outcomes to the SDK's error types and decides which of them are retried.
 * <p>
 * A failure without any HTTP response is a {@link ConnectionError}. A response is an
 * {@link MCPError} when its status is 400 or above or its envelope does not report success.
 * Connection failures, except caller cancellation, and 5xx responses are retryable; 4xx
 * responses never are.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    /**
     * Classifies a failure of an HTTP exchange. {@link MCPApiException}s are returned as they
     * are, anything else becomes a {@link ConnectionError}.
     *
     * @param failure the failure, possibly wrapped by a future
     * @return the classified error
     */
    public static MCPApiException classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof MCPApiException apiException) {
            return apiException;
        }
        return new ConnectionError(cause);
    }

    /**
     * Classifies a decoded response.
     *
     * @param statusCode the HTTP status code
     * @param envelope the decoded envelope
     * @param rawBody the body as received, for diagnostics
     * @return the error the response represents, or {@code null} if it is a success
     */
    public static @Nullable MCPError classify(int statusCode, Envelope envelope, @Nullable String rawBody) {
        String raw = rawBody == null || rawBody.isEmpty() ? null : rawBody;
        if (!envelope.ok()) {
            return new MCPError(statusCode, envelope.error(), raw);
        }
        if (statusCode >= 400) {
            return new MCPError(statusCode, "HTTP " + statusCode, raw);
        }
        return null;
    }

    public static boolean isRetryable(int statusCode) {
        return statusCode >= 500;
    }

    public static boolean isRetryable(Throwable failure) {
        return classify(failure).isTransient();
    }

    /**
     * An error for a response that reported success but whose payload could not be used.
     */
    public static MCPError malformed(int statusCode, String detail, @Nullable String rawBody, @Nullable Throwable cause) {
        String message = MCPErrorCodes.MALFORMED_RESPONSE + ": " + detail;
        String raw = rawBody == null || rawBody.isEmpty() ? null : rawBody;
        return cause == null ? new MCPError(statusCode, message, raw) : new MCPError(statusCode, message, raw, cause);
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
