package io.termgate.mcp.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.termgate.core.pipeline.ToolError;
import io.termgate.mcp.server.model.ToolCallResponse;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpHttpServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(McpHttpServer.class);
    private static final String JSON = "application/json; charset=utf-8";
    static final int MAX_BODY_BYTES = 1024 * 1024;
    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };

    private final ToolRouter router;
    private final McpProtocolHandler protocol;
    private final ObjectMapper mapper;
    private final Undertow undertow;
    private final int requestedPort;
    private int actualPort;

    public McpHttpServer(String host, int port, ToolRouter router, McpProtocolHandler protocol, ObjectMapper mapper) {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.protocol = Objects.requireNonNull(protocol, "protocol must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.requestedPort = port;
        this.actualPort = port;

        PathHandler routes = Handlers.path(exchange -> sendJson(exchange, 404, Map.of("error", "not_found")))
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/mcp/tools", this::handleTools)
            .addExactPath("/mcp/call", this::handleCall)
            .addExactPath("/mcp", this::handleJsonRpc);
        this.undertow = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(routes)
            .build();
    }

    public void start() {
        undertow.start();
        actualPort = resolveBoundPort(undertow, requestedPort);
        LOG.info("HTTP transport listening on port {}", actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        undertow.stop();
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleTools(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("tools", router.listTools()));
    }

    private void handleCall(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleCall(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        JsonNode request;
        try {
            request = readJsonBody(exchange);
        } catch (BodyTooLargeException e) {
            sendJson(exchange, 413, Map.of("error", "payload_too_large"));
            return;
        } catch (IOException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }
        if (!request.isObject() || !request.path("name").isTextual()
            || !(request.path("arguments").isMissingNode() || request.path("arguments").isObject())) {
            sendJson(exchange, 400, Map.of("error", "invalid_request", "message", "Body must be {\"name\": string, \"arguments\": object}"));
            return;
        }
        Map<String, Object> arguments = request.path("arguments").isObject()
            ? mapper.convertValue(request.get("arguments"), ARGUMENTS)
            : Map.of();

        ToolCallResponse response = router.callTool(request.get("name").asText(), arguments);
        if (response.ok()) {
            send(exchange, 200, response.payload().getBytes(StandardCharsets.UTF_8));
            return;
        }
        if (response.error() != null && response.error().retryAfterSeconds() != null) {
            long seconds = (long) Math.ceil(response.error().retryAfterSeconds());
            exchange.getResponseHeaders().put(Headers.RETRY_AFTER, String.valueOf(Math.max(1L, seconds)));
        }
        sendJson(exchange, statusFor(response), response.errorDocument());
    }

    private void handleJsonRpc(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleJsonRpc(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        JsonNode message;
        try {
            message = readJsonBody(exchange);
        } catch (BodyTooLargeException e) {
            sendJson(exchange, 413, Map.of("error", "payload_too_large"));
            return;
        } catch (IOException e) {
            send(exchange, 200, mapper.writeValueAsBytes(protocol.error(NullNode.getInstance(), McpProtocolHandler.PARSE_ERROR, "Parse error")));
            return;
        }
        Optional<?> response = protocol.handle(message);
        if (response.isEmpty()) {
            exchange.setStatusCode(202);
            exchange.endExchange();
            return;
        }
        send(exchange, 200, mapper.writeValueAsBytes(response.get()));
    }

    static int statusFor(ToolCallResponse response) {
        if (response.isUnknownTool()) {
            return 404;
        }
        ToolError error = response.error();
        if (error == null) {
            return 500;
        }
        return switch (error.status()) {
            case VALIDATION_ERROR -> 400;
            case RATE_LIMITED -> 429;
            case UPSTREAM_ERROR -> error.isTimeout() ? 504 : 502;
            case SUCCESS -> 200;
        };
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        if (exchange.getRequestContentLength() > MAX_BODY_BYTES) {
            throw new BodyTooLargeException();
        }
        byte[] bytes = exchange.getInputStream().readNBytes(MAX_BODY_BYTES + 1);
        if (bytes.length > MAX_BODY_BYTES) {
            throw new BodyTooLargeException();
        }
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        send(exchange, status, mapper.writeValueAsBytes(payload));
    }

    private void send(HttpServerExchange exchange, int status, byte[] body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON);
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception e) {
        LOG.error("HTTP request {} failed", exchange.getRequestPath(), e);
        if (exchange.isResponseStarted()) {
            exchange.endExchange();
            return;
        }
        send(exchange, 500, "{\"error\":\"internal_error\"}".getBytes(StandardCharsets.UTF_8));
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        if (undertow.getListenerInfo().isEmpty()) {
            return fallbackPort;
        }
        Object address = undertow.getListenerInfo().get(0).getAddress();
        if (address instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    private static final class BodyTooLargeException extends IOException {
        BodyTooLargeException() {
            super("Request body exceeds " + MAX_BODY_BYTES + " bytes");
        }
    }
}
