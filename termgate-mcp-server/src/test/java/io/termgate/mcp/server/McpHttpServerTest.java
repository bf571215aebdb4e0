package io.termgate.mcp.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.termgate.core.audit.AuditEvent;
import io.termgate.core.config.GatewaySettings;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;

class McpHttpServerTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final List<AuditEvent> events = Collections.synchronizedList(new ArrayList<>());

    @Test
    void servesHealthAndToolListing() throws Exception {
        try (MockWebServer upstream = new MockWebServer()) {
            upstream.start();
            try (McpServerApplication application = application(upstream, Map.of());
                 McpHttpServer server = application.startHttp("127.0.0.1", 0)) {
                assertThat(server.port()).isPositive();

                HttpResponse<String> health = get(server, "/healthz");
                HttpResponse<String> tools = get(server, "/mcp/tools");
                HttpResponse<String> missing = get(server, "/nope");

                assertThat(health.statusCode()).isEqualTo(200);
                assertThat(mapper.readTree(health.body()).get("status").asText()).isEqualTo("ok");
                assertThat(tools.statusCode()).isEqualTo(200);
                assertThat(mapper.readTree(tools.body()).get("tools")).hasSize(2);
                assertThat(missing.statusCode()).isEqualTo(404);
            }
        }
    }

    @Test
    void successfulCallReturnsUpstreamBodyVerbatim() throws Exception {
        String body = "{\"data\":  {\"chunks\": [{\"content\": \"RPO\"}]} }";
        try (MockWebServer upstream = new MockWebServer()) {
            upstream.enqueue(new MockResponse().setBody(body));
            upstream.start();
            try (McpServerApplication application = application(upstream, Map.of());
                 McpHttpServer server = application.startHttp("127.0.0.1", 0)) {
                HttpResponse<String> response = post(server, "/mcp/call",
                    "{\"name\":\"retrieve_docs\",\"arguments\":{\"dataset_id\":\"ds-1\",\"query\":\"RPO\",\"keyword\":true}}");

                assertThat(response.statusCode()).isEqualTo(200);
                assertThat(response.body()).isEqualTo(body);
                assertThat(mapper.readTree(upstream.takeRequest().getBody().readUtf8()).get("keyword").asBoolean()).isTrue();
            }
        }
    }

    @Test
    void mapsOutcomesToStatusCodes() throws Exception {
        try (MockWebServer upstream = new MockWebServer()) {
            upstream.enqueue(new MockResponse().setBody("{}"));
            upstream.enqueue(new MockResponse().setResponseCode(503).setBody("{\"detail\":\"down\"}"));
            upstream.start();
            try (McpServerApplication application = application(upstream, Map.of(
                     "MCP_TOOL_RATE_LIMITS", "{\"search_glossary\": 1}",
                     "MCP_RETRY_ATTEMPTS", "1"));
                 McpHttpServer server = application.startHttp("127.0.0.1", 0)) {
                String search = "{\"name\":\"search_glossary\",\"arguments\":{\"dataset_id\":\"ds-1\",\"term\":\"x\"}}";

                HttpResponse<String> invalid = post(server, "/mcp/call", "{\"name\":\"search_glossary\",\"arguments\":{\"dataset_id\":\"!bad\"}}");
                HttpResponse<String> unknown = post(server, "/mcp/call", "{\"name\":\"get_glossary\",\"arguments\":{}}");
                HttpResponse<String> first = post(server, "/mcp/call", search);
                HttpResponse<String> limited = post(server, "/mcp/call", search);
                HttpResponse<String> failed = post(server, "/mcp/call",
                    "{\"name\":\"retrieve_docs\",\"arguments\":{\"dataset_id\":\"ds-1\",\"query\":\"q\"}}");

                assertThat(invalid.statusCode()).isEqualTo(400);
                JsonNode invalidBody = mapper.readTree(invalid.body());
                assertThat(invalidBody.at("/error/field_errors")).hasSize(2);
                assertThat(unknown.statusCode()).isEqualTo(404);
                assertThat(first.statusCode()).isEqualTo(200);
                assertThat(limited.statusCode()).isEqualTo(429);
                assertThat(limited.headers().firstValue("Retry-After")).isPresent();
                assertThat(mapper.readTree(limited.body()).at("/error/rate_limit_key").asText()).isEqualTo("search_glossary");
                assertThat(failed.statusCode()).isEqualTo(502);
                assertThat(mapper.readTree(failed.body()).at("/error/upstream_status").asInt()).isEqualTo(503);
            }
        }
        assertThat(events).hasSize(4);
    }

    @Test
    void rejectsMalformedCallBodies() throws Exception {
        try (MockWebServer upstream = new MockWebServer()) {
            upstream.start();
            try (McpServerApplication application = application(upstream, Map.of());
                 McpHttpServer server = application.startHttp("127.0.0.1", 0)) {
                assertThat(post(server, "/mcp/call", "{oops").statusCode()).isEqualTo(400);
                assertThat(post(server, "/mcp/call", "{\"name\":\"search_glossary\",\"arguments\":[1]}").statusCode()).isEqualTo(400);
                assertThat(get(server, "/mcp/call").statusCode()).isEqualTo(405);
            }
        }
        assertThat(events).isEmpty();
    }

    @Test
    void oversizedBodiesAreRejectedBeforeParsing() throws Exception {
        String padding = "x".repeat(McpHttpServer.MAX_BODY_BYTES);
        String body = "{\"name\":\"search_glossary\",\"arguments\":{\"term\":\"" + padding + "\"}}";
        try (MockWebServer upstream = new MockWebServer()) {
            upstream.start();
            try (McpServerApplication application = application(upstream, Map.of());
                 McpHttpServer server = application.startHttp("127.0.0.1", 0)) {
                HttpResponse<String> call = post(server, "/mcp/call", body);
                HttpResponse<String> rpc = post(server, "/mcp", body);

                assertThat(call.statusCode()).isEqualTo(413);
                assertThat(mapper.readTree(call.body()).get("error").asText()).isEqualTo("payload_too_large");
                assertThat(rpc.statusCode()).isEqualTo(413);
            }
            assertThat(upstream.getRequestCount()).isZero();
        }
        assertThat(events).isEmpty();
    }

    @Test
    void jsonRpcEndpointSharesTheProtocolHandler() throws Exception {
        try (MockWebServer upstream = new MockWebServer()) {
            upstream.start();
            try (McpServerApplication application = application(upstream, Map.of());
                 McpHttpServer server = application.startHttp("127.0.0.1", 0)) {
                HttpResponse<String> listed = post(server, "/mcp", "{\"jsonrpc\":\"2.0\",\"id\":9,\"method\":\"tools/list\"}");
                HttpResponse<String> notified = post(server, "/mcp", "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");

                assertThat(listed.statusCode()).isEqualTo(200);
                assertThat(mapper.readTree(listed.body()).at("/result/tools")).hasSize(2);
                assertThat(notified.statusCode()).isEqualTo(202);
            }
        }
    }

    private McpServerApplication application(MockWebServer upstream, Map<String, String> overrides) {
        Map<String, String> env = new HashMap<>();
        env.put("MCP_API_BASE_URL", upstream.url("/").toString());
        env.put("MCP_RETRY_WAIT", "0");
        env.putAll(overrides);
        return new McpServerApplication(GatewaySettings.fromEnv(env), events::add);
    }

    private HttpResponse<String> get(McpHttpServer server, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(McpHttpServer server, String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
