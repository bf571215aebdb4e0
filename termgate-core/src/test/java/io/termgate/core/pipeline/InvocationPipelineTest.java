package io.termgate.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.termgate.core.audit.AuditEvent;
import io.termgate.core.audit.InvocationStatus;
import io.termgate.core.config.GatewaySettings;
import io.termgate.core.ratelimit.TokenBucketLimiter;
import io.termgate.core.tool.ToolRegistry;
import io.termgate.core.tool.UnknownToolException;
import io.termgate.core.upstream.GlossaryUpstream;
import io.termgate.core.upstream.UpstreamClient;
import io.termgate.core.validation.FieldError;
import io.termgate.core.validation.InputValidator;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.Test;

class InvocationPipelineTest {
    private final List<AuditEvent> events = new ArrayList<>();

    @Test
    void successReturnsUpstreamPayloadAndAuditsOnce() throws Exception {
        String body = "{\"data\": {\"chunks\": [{\"content\": \"Latency is ...\"}]}}";
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody(body));
            server.start();

            try (InvocationPipeline pipeline = pipeline(server, Map.of())) {
                ToolResult result = pipeline.invoke("search_glossary", Map.of("dataset_id", "ds-1", "term", "latency"));

                assertThat(result.ok()).isTrue();
                assertThat(result.payload()).isEqualTo(body);
                assertThat(result.requestId()).hasSize(32);
                assertThat(server.takeRequest().getHeader("X-Request-ID")).isEqualTo(result.requestId());
            }
        }

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.status()).isEqualTo(InvocationStatus.SUCCESS);
            assertThat(event.tool()).isEqualTo("search_glossary");
            assertThat(event.arguments()).containsEntry("dataset_id", "ds-1").containsEntry("query_length", 7);
            assertThat(event.arguments()).doesNotContainValue("latency");
            assertThat(event.error()).isNull();
        });
    }

    @Test
    void validationFailureSpendsNoTokenAndMakesNoCall() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.start();

            try (InvocationPipeline pipeline = pipeline(server, Map.of("MCP_RATE_LIMIT_CAPACITY", "1"))) {
                ToolResult result = pipeline.invoke("search_glossary", Map.of("dataset_id", "!bad", "term", "secret words"));

                assertThat(result.status()).isEqualTo(InvocationStatus.VALIDATION_ERROR);
                assertThat(result.error().fieldErrors()).extracting(FieldError::field).containsExactly("dataset_id");
                assertThat(pipeline.limiter().availableTokens("search_glossary")).isEmpty();
            }
            assertThat(server.getRequestCount()).isZero();
        }

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.status()).isEqualTo(InvocationStatus.VALIDATION_ERROR);
            assertThat(event.arguments()).containsEntry("dataset_id_length", 4).containsEntry("query_length", 12);
            assertThat(event.arguments().toString()).doesNotContain("secret words").doesNotContain("!bad");
        });
    }

    @Test
    void rateLimitedCallDoesNotReachUpstream() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{}"));
            server.start();

            try (InvocationPipeline pipeline = pipeline(server, Map.of("MCP_RATE_LIMIT_CAPACITY", "1"))) {
                Map<String, Object> arguments = Map.of("dataset_id", "ds-1", "term", "x");
                assertThat(pipeline.invoke("search_glossary", arguments).ok()).isTrue();

                ToolResult limited = pipeline.invoke("search_glossary", arguments);

                assertThat(limited.status()).isEqualTo(InvocationStatus.RATE_LIMITED);
                assertThat(limited.error().rateLimitKey()).isEqualTo("search_glossary");
                assertThat(limited.error().retryAfterSeconds()).isPositive();
                assertThat(limited.error().message()).startsWith("Rate limit exceeded for search_glossary");
            }
            assertThat(server.getRequestCount()).isEqualTo(1);
        }

        assertThat(events).extracting(AuditEvent::status)
            .containsExactly(InvocationStatus.SUCCESS, InvocationStatus.RATE_LIMITED);
    }

    @Test
    void upstreamFailureIsReportedWithStatus() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"detail\":\"bad token sk-live-123\"}"));
            server.start();

            try (InvocationPipeline pipeline = pipeline(server, Map.of("MCP_API_KEY", "sk-live-123"))) {
                ToolResult result = pipeline.invoke("retrieve_docs", Map.of("dataset_id", "ds-1", "query", "q"));

                assertThat(result.status()).isEqualTo(InvocationStatus.UPSTREAM_ERROR);
                assertThat(result.error().upstreamStatus()).isEqualTo(401);
                assertThat(result.error().failureKind()).isEqualTo("http_status");
                assertThat(result.error().isTimeout()).isFalse();
            }
        }

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.status()).isEqualTo(InvocationStatus.UPSTREAM_ERROR);
            assertThat(event.error()).startsWith("Upstream request failed with status 401");
            assertThat(event.arguments().toString()).doesNotContain("sk-live-123");
        });
    }

    @Test
    void exhaustedRetriesSpendOneTokenAndAuditOnce() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            for (int i = 0; i < 3; i++) {
                server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"detail\":\"boom\"}"));
            }
            server.start();

            GatewaySettings settings = settings(server, Map.of("MCP_RETRY_ATTEMPTS", "3"));
            try (InvocationPipeline pipeline = frozenLimiterPipeline(settings)) {
                ToolResult result = pipeline.invoke("retrieve_docs", Map.of("dataset_id", "ds-1", "query", "q"));

                assertThat(result.status()).isEqualTo(InvocationStatus.UPSTREAM_ERROR);
                assertThat(result.error().upstreamStatus()).isEqualTo(500);
                assertThat(pipeline.limiter().availableTokens("retrieve_docs")).hasValue(settings.rateLimitCapacity() - 1.0);
            }
            assertThat(server.getRequestCount()).isEqualTo(3);
        }

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.status()).isEqualTo(InvocationStatus.UPSTREAM_ERROR);
            assertThat(event.error()).isEqualTo("Upstream request failed with status 500: boom");
        });
    }

    @Test
    void invocationTimeoutEndsTheCallAsTimeout() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
            server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
            server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
            server.start();

            long started = System.nanoTime();
            try (InvocationPipeline pipeline = pipeline(server, Map.of("MCP_INVOCATION_TIMEOUT", "0.3"))) {
                ToolResult result = pipeline.invoke("search_glossary", Map.of("dataset_id", "ds-1", "term", "x"));

                assertThat(result.status()).isEqualTo(InvocationStatus.UPSTREAM_ERROR);
                assertThat(result.error().isTimeout()).isTrue();
                assertThat(result.error().failureKind()).isEqualTo("timeout");
            }
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(4));
        }

        assertThat(events).extracting(AuditEvent::status).containsExactly(InvocationStatus.UPSTREAM_ERROR);
    }

    @Test
    void unknownToolIsNotAudited() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.start();

            try (InvocationPipeline pipeline = pipeline(server, Map.of())) {
                assertThatThrownBy(() -> pipeline.invoke("drop_glossary", Map.of()))
                    .isInstanceOf(UnknownToolException.class);
            }
        }

        assertThat(events).isEmpty();
    }

    @Test
    void auditFailureDoesNotChangeOutcome() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{\"ok\":true}"));
            server.start();

            GatewaySettings settings = settings(server, Map.of());
            try (InvocationPipeline pipeline = new InvocationPipeline(settings, event -> {
                throw new IllegalStateException("audit sink down");
            })) {
                ToolResult result = pipeline.invoke("search_glossary", Map.of("dataset_id", "ds-1", "term", "x"));

                assertThat(result.ok()).isTrue();
            }
        }
    }

    private InvocationPipeline frozenLimiterPipeline(GatewaySettings settings) {
        ToolRegistry registry = ToolRegistry.create(settings);
        UpstreamClient client = new UpstreamClient(settings.apiBaseUrl(), settings.apiKey(), settings.retryPolicy());
        return new InvocationPipeline(
            registry,
            new InputValidator(settings),
            new TokenBucketLimiter(settings.rateLimitCapacity(), settings.rateLimitInterval(), registry.rateLimitCapacities(), () -> 0L),
            new GlossaryUpstream(client, settings.similarityThreshold(), settings.vectorSimilarityWeight()),
            client,
            events::add,
            settings.invocationTimeout(),
            Clock.systemUTC(),
            System::nanoTime
        );
    }

    private InvocationPipeline pipeline(MockWebServer server, Map<String, String> overrides) {
        return new InvocationPipeline(settings(server, overrides), events::add);
    }

    private static GatewaySettings settings(MockWebServer server, Map<String, String> overrides) {
        Map<String, String> env = new HashMap<>();
        env.put("MCP_API_BASE_URL", server.url("/").toString());
        env.put("MCP_RETRY_WAIT", "0");
        env.put("MCP_HTTP_TIMEOUT", "5");
        env.putAll(overrides);
        return GatewaySettings.fromEnv(env);
    }
}
