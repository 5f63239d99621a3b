package io.mcp.client.transport;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.http.Fault;
import io.mcp.spec.ConnectionError;
import io.mcp.spec.MCPError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

public class McpTransportTest {

    private static final String SERVER_ERROR = "{\"ok\":false,\"error\":\"database unavailable\"}";

    private WireMockServer server;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        configureFor("localhost", server.port());

        logger = (Logger) LoggerFactory.getLogger(McpTransport.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    public void tearDown() {
        logger.detachAppender(logAppender);
        if (server != null) {
            server.stop();
        }
    }

    private String baseUrl() {
        return "http://localhost:" + server.port();
    }

    private McpTransport transport(TransportConfigBuilder builder) {
        return new McpTransport(null, baseUrl(), builder.build(), () -> 0.5);
    }

    private static TransportConfigBuilder fastRetries(int maxRetries) {
        return new TransportConfigBuilder()
                .maxRetries(maxRetries)
                .retryDelay(Duration.ofMillis(10))
                .timeout(Duration.ofSeconds(10));
    }

    @Test
    public void testPersistentServerErrorIsRetriedThenReturned() throws Exception {
        givenThat(get(urlEqualTo("/status"))
                .willReturn(aResponse().withStatus(500).withBody(SERVER_ERROR)));

        RawResponse response = transport(fastRetries(3)).request(HttpMethod.GET, "/status", null, null);

        assertEquals(500, response.statusCode());
        assertEquals(SERVER_ERROR, response.bodyAsString());
        verify(4, getRequestedFor(urlEqualTo("/status")));

        List<ILoggingEvent> warnings = logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .collect(Collectors.toList());
        assertEquals(3, warnings.size());
        assertTrue(warnings.get(0).getFormattedMessage().contains("HTTP 500"));
    }

    @Test
    public void testServerErrorAfterRetriesBecomesMcpError() {
        givenThat(post(urlEqualTo("/run"))
                .willReturn(aResponse().withStatus(503).withBody(SERVER_ERROR)));

        MCPError error = assertThrows(MCPError.class,
                () -> transport(fastRetries(2)).exchange(HttpMethod.POST, "/run", "{\"type\":\"x\"}", null));

        assertEquals(503, error.getStatusCode());
        assertEquals("database unavailable", error.getErrorMessage());
        verify(3, postRequestedFor(urlEqualTo("/run")));
    }

    @Test
    public void testClientErrorIsNotRetried() {
        givenThat(get(urlEqualTo("/tasks/missing"))
                .willReturn(aResponse().withStatus(404).withBody("{\"ok\":false,\"error\":\"Task not found\"}")));

        MCPError error = assertThrows(MCPError.class,
                () -> transport(fastRetries(3)).exchange(HttpMethod.GET, "/tasks/missing", null, null));

        assertEquals(404, error.getStatusCode());
        assertEquals("Task not found", error.getErrorMessage());
        verify(1, getRequestedFor(urlEqualTo("/tasks/missing")));
    }

    @Test
    public void testRecoversAfterTransientFailure() throws Exception {
        givenThat(get(urlEqualTo("/health")).inScenario("flaky")
                .whenScenarioStateIs(STARTED)
                .willReturn(aResponse().withStatus(502).withBody("Bad Gateway"))
                .willSetStateTo("recovered"));
        givenThat(get(urlEqualTo("/health")).inScenario("flaky")
                .whenScenarioStateIs("recovered")
                .willReturn(okForContentType("application/json", "{\"ok\":true,\"status\":\"healthy\"}")));

        McpResponse response = transport(fastRetries(3)).exchange(HttpMethod.GET, "/health", null, null);

        assertEquals("healthy", response.payload().asText());
        verify(2, getRequestedFor(urlEqualTo("/health")));
    }

    @Test
    public void testBackoffPastDeadlineIsNotStarted() throws Exception {
        givenThat(get(urlEqualTo("/status"))
                .willReturn(aResponse().withStatus(500).withBody(SERVER_ERROR)));

        TransportConfigBuilder builder = new TransportConfigBuilder()
                .maxRetries(3)
                .retryDelay(Duration.ofSeconds(5))
                .timeout(Duration.ofSeconds(1));

        long started = System.nanoTime();
        RawResponse response = transport(builder).request(HttpMethod.GET, "/status", null, null);

        assertEquals(500, response.statusCode());
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 1000);
        verify(1, getRequestedFor(urlEqualTo("/status")));
    }

    @Test
    public void testUnreachableServerFailsFast() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        TransportConfig config = new TransportConfigBuilder()
                .maxRetries(0)
                .timeout(Duration.ofSeconds(1))
                .build();
        McpTransport transport = new McpTransport("http://localhost:" + port, config);

        long started = System.nanoTime();
        ConnectionError error = assertThrows(ConnectionError.class,
                () -> transport.exchange(HttpMethod.GET, "/status", null, null));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 2000);
        assertFalse(error.isCancelled());
        assertInstanceOf(IOException.class, error.getCause());
    }

    @Test
    public void testResetConnectionOnGetStaysWithinRequestBound() {
        givenThat(get(urlEqualTo("/status"))
                .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        ConnectionError error = assertThrows(ConnectionError.class,
                () -> transport(fastRetries(3)).request(HttpMethod.GET, "/status", null, null));

        // the JDK client sends a GET twice per attempt when the connection drops
        verify(4, getRequestedFor(urlEqualTo("/status")));
        assertInstanceOf(IOException.class, error.getCause());
        assertEquals(0, error.getSuppressed().length);
        assertFalse(error.isCancelled());
    }

    @Test
    public void testResetConnectionOnGetNeverExceedsRequestBound() {
        givenThat(get(urlEqualTo("/status"))
                .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        assertThrows(ConnectionError.class,
                () -> transport(fastRetries(2)).request(HttpMethod.GET, "/status", null, null));

        assertEquals(2, server.findAll(getRequestedFor(urlEqualTo("/status"))).size());
    }

    @Test
    public void testResetConnectionOnPostIsRetried() {
        givenThat(post(urlEqualTo("/run"))
                .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        ConnectionError error = assertThrows(ConnectionError.class,
                () -> transport(fastRetries(2)).request(HttpMethod.POST, "/run", "{\"type\":\"x\"}", null));

        verify(3, postRequestedFor(urlEqualTo("/run")));
        assertInstanceOf(IOException.class, error.getCause());
        assertEquals(0, error.getSuppressed().length);

        long retries = logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .count();
        assertEquals(2, retries);
    }

    @Test
    public void testCompletedCallReleasesItsDeadline() throws Exception {
        givenThat(get(urlEqualTo("/health"))
                .willReturn(okForContentType("application/json", "{\"ok\":true,\"status\":\"healthy\"}")));

        McpTransport.RetryingCall call = transport(fastRetries(0)).call(HttpMethod.GET, "/health", null, null);

        assertEquals(200, call.result().get(5, TimeUnit.SECONDS).statusCode());
        long waitUntil = System.nanoTime() + TimeUnit.SECONDS.toNanos(1);
        while (!call.deadlineCleared() && System.nanoTime() < waitUntil) {
            Thread.sleep(10);
        }
        assertTrue(call.deadlineCleared());
    }

    @Test
    public void testSlowServerHitsCallTimeout() {
        givenThat(get(urlEqualTo("/status"))
                .willReturn(okForContentType("application/json", "{\"ok\":true,\"status\":{}}").withFixedDelay(3000)));

        long started = System.nanoTime();
        ConnectionError error = assertThrows(ConnectionError.class,
                () -> transport(fastRetries(0)).request(HttpMethod.GET, "/status", null,
                        ClientCallContext.withTimeout(Duration.ofMillis(300))));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 2500);
        assertInstanceOf(IOException.class, error.getCause());
    }

    @Test
    public void testCancellingTheFutureStopsRetries() throws Exception {
        givenThat(get(urlEqualTo("/status"))
                .willReturn(aResponse().withStatus(500).withBody(SERVER_ERROR)));

        TransportConfigBuilder builder = new TransportConfigBuilder()
                .maxRetries(3)
                .retryDelay(Duration.ofSeconds(2))
                .timeout(Duration.ofSeconds(30));
        CompletableFuture<RawResponse> future = transport(builder).requestAsync(HttpMethod.GET, "/status", null, null);

        // wait for the first attempt, the transport is then sleeping before the retry
        long waitUntil = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (server.getAllServeEvents().isEmpty() && System.nanoTime() < waitUntil) {
            Thread.sleep(20);
        }
        Thread.sleep(100);
        assertTrue(future.cancel(true));
        assertThrows(CancellationException.class, future::join);

        Thread.sleep(2500);
        verify(1, getRequestedFor(urlEqualTo("/status")));
    }

    @Test
    public void testRequestHeaders() throws Exception {
        givenThat(post(urlEqualTo("/tasks/task-1/cancel"))
                .willReturn(okForContentType("application/json", "{\"ok\":true,\"message\":\"cancelled\"}")));

        TransportConfigBuilder builder = fastRetries(0).header("Authorization", "Bearer token");
        transport(builder).exchange(HttpMethod.POST, "/tasks/task-1/cancel", null,
                new ClientCallContext(Map.of("X-Request-Id", "req-7")));

        verify(postRequestedFor(urlEqualTo("/tasks/task-1/cancel"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withHeader("Accept", equalTo("application/json"))
                .withHeader("User-Agent", equalTo("mcp-java-sdk/1.0.0"))
                .withHeader("Authorization", equalTo("Bearer token"))
                .withHeader("X-Request-Id", equalTo("req-7"))
                .withRequestBody(equalToJson("{}")));
    }

    @Test
    public void testBaseUrlPathIsPrefixed() throws Exception {
        givenThat(get(urlEqualTo("/mcp/status"))
                .willReturn(okForContentType("application/json", "{\"ok\":true,\"status\":{\"status\":\"running\"}}")));

        McpTransport transport = new McpTransport(baseUrl() + "/mcp/", fastRetries(0).build());
        assertEquals("/mcp", transport.getBasePath());

        McpResponse response = transport.exchange(HttpMethod.GET, "/status", null, null);
        assertEquals("running", response.payload().get("status").asText());
    }

    @Test
    public void testUnmappablePayloadIsMcpError() {
        givenThat(get(urlEqualTo("/status"))
                .willReturn(okForContentType("application/json", "{\"ok\":true,\"data\":null}")));

        MCPError error = assertThrows(MCPError.class,
                () -> transport(fastRetries(0)).exchange(HttpMethod.GET, "/status", null, null, Map.class));

        assertEquals(200, error.getStatusCode());
        assertTrue(error.getErrorMessage().startsWith("Malformed response"));
    }

    @Test
    public void testPathSegmentEncoding() {
        assertEquals("task-1", McpTransport.encodePathSegment("task-1"));
        assertEquals("a%20b%2Fc", McpTransport.encodePathSegment("a b/c"));
        assertEquals("%3F%23", McpTransport.encodePathSegment("?#"));
    }
}
