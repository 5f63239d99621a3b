/**
 * HTTP client abstraction used by the MCP client transport.
 *
 * <p>The transport only depends on {@link io.mcp.client.http.HttpClient} and
 * {@link io.mcp.client.http.HttpResponse}; the default implementation,
 * {@link io.mcp.client.http.jdk.JdkHttpClient}, is backed by {@code java.net.http}.
 * Another implementation can be plugged in by passing a custom
 * {@link io.mcp.client.http.HttpClientBuilder} to the client configuration.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("http://localhost:5005");
 * HttpResponse response = client.get("/status")
 *     .addHeader(HttpClient.ACCEPT, HttpClient.APPLICATION_JSON)
 *     .timeout(Duration.ofSeconds(5))
 *     .send()
 *     .get();
 * }</pre>
 */
@NullMarked
package io.mcp.client.http;

import org.jspecify.annotations.NullMarked;
