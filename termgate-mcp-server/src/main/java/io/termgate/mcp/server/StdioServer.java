package io.termgate.mcp.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nothing but protocol messages is written to the output stream.
 */
public final class StdioServer {
    private static final Logger LOG = LoggerFactory.getLogger(StdioServer.class);
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final McpProtocolHandler handler;
    private final ObjectMapper mapper;
    private final ExecutorService executor;
    private final ConcurrentMap<String, Future<?>> inFlight = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public StdioServer(McpProtocolHandler handler, ObjectMapper mapper, int workers) {
        this(handler, mapper, Executors.newFixedThreadPool(workers, workerThreads()));
    }

    StdioServer(McpProtocolHandler handler, ObjectMapper mapper, ExecutorService executor) {
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public void serve(InputStream in, OutputStream out) throws IOException {
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    onLine(line, writer);
                }
            }
        } finally {
            drain();
        }
        LOG.info("stdin closed, stdio transport stopped");
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private void onLine(String line, Writer writer) {
        JsonNode message;
        try {
            message = mapper.readTree(line);
        } catch (IOException e) {
            handler.handleLine(line).ifPresent(response -> send(writer, response));
            return;
        }

        String method = message.path("method").asText("");
        if ("notifications/cancelled".equals(method)) {
            cancel(message.path("params").path("requestId"));
            return;
        }
        if ("tools/call".equals(method) && message.hasNonNull("id")) {
            submit(message, writer);
            return;
        }
        handler.handle(message).ifPresent(response -> send(writer, response.toString()));
    }

    private void submit(JsonNode message, Writer writer) {
        String key = message.get("id").toString();
        Future<?> future = executor.submit(() -> {
            try {
                Optional<String> response = handler.handle(message).map(Object::toString);
                if (!Thread.currentThread().isInterrupted()) {
                    response.ifPresent(text -> send(writer, text));
                } else {
                    LOG.info("Dropping response for cancelled request {}", key);
                }
            } finally {
                inFlight.remove(key);
            }
        });
        inFlight.put(key, future);
        if (future.isDone()) {
            inFlight.remove(key, future);
        }
    }

    private void cancel(JsonNode requestId) {
        if (requestId.isMissingNode() || requestId instanceof NullNode) {
            return;
        }
        Future<?> future = inFlight.remove(requestId.toString());
        if (future != null) {
            LOG.info("Cancelling in-flight request {}", requestId);
            future.cancel(true);
        }
    }

    private void send(Writer writer, String text) {
        synchronized (writeLock) {
            try {
                writer.write(text);
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                LOG.error("Failed to write JSON-RPC response", e);
            }
        }
    }

    private void drain() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("In-flight calls did not finish within {} ms, interrupting", DRAIN_TIMEOUT.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "termgate-stdio-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
