package io.termgate.mcp.server.router;

import static org.assertj.core.api.Assertions.assertThat;

import io.termgate.core.audit.AuditEvent;
import io.termgate.core.config.GatewaySettings;
import io.termgate.core.pipeline.InvocationPipeline;
import io.termgate.mcp.server.ToolRouter;
import io.termgate.mcp.server.model.ToolCallResponse;
import io.termgate.mcp.server.model.ToolDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;

class ToolRouterTest {
    private final List<AuditEvent> events = new ArrayList<>();

    @Test
    void routesToolCallsThroughThePipeline() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{\"items\":[{\"id\":\"ds-1\"}]}"));
            server.start();

            try (InvocationPipeline pipeline = new InvocationPipeline(settings(server, "glossary"), events::add)) {
                ToolRouter router = new ToolRouter(pipeline);
                ToolCallResponse response = router.callTool("list_glossaries", null);

                assertThat(response.ok()).isTrue();
                assertThat(response.payload()).isEqualTo("{\"items\":[{\"id\":\"ds-1\"}]}");
                assertThat(router.listTools()).extracting(ToolDefinition::name)
                    .containsExactly("get_glossary", "list_glossaries", "retrieve_definitions", "search_terms");
            }
        }
        assertThat(events).hasSize(1);
    }

    @Test
    void returnsErrorForUnknownTool() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.start();

            try (InvocationPipeline pipeline = new InvocationPipeline(settings(server, "retrieval"), events::add)) {
                ToolCallResponse response = new ToolRouter(pipeline).callTool("list_glossaries", Map.of());

                assertThat(response.ok()).isFalse();
                assertThat(response.isUnknownTool()).isTrue();
                assertThat(response.message()).contains("Unknown tool");
            }
        }
        assertThat(events).isEmpty();
    }

    @Test
    void validationErrorsCarryFieldDetails() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.start();

            try (InvocationPipeline pipeline = new InvocationPipeline(settings(server, "retrieval"), events::add)) {
                ToolCallResponse response = new ToolRouter(pipeline).callTool("search_glossary", Map.of("dataset_id", "ds-1"));

                assertThat(response.status()).isEqualTo("validation_error");
                assertThat(response.errorDocument()).containsKeys("tool", "status", "request_id", "message", "error");
                assertThat(response.message()).contains("term is required");
            }
        }
    }

    private static GatewaySettings settings(MockWebServer server, String variant) {
        return GatewaySettings.fromEnv(Map.of(
            "MCP_API_BASE_URL", server.url("/").toString(),
            "MCP_RETRY_WAIT", "0",
            "MCP_TOOL_VARIANT", variant
        ));
    }
}
