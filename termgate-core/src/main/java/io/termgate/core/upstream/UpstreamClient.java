package io.termgate.core.upstream;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Dispatcher;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Successful bodies must be UTF-8 JSON and are returned exactly as received; the charset in
 * {@code Content-Type} is ignored.
 */
public final class UpstreamClient implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(UpstreamClient.class);
    private static final MediaType JSON = MediaType.get("application/json");
    private static final String USER_AGENT = "termgate-mcp/1.0";
    private static final int MAX_DETAIL_LENGTH = 500;
    private static final int MAX_CONCURRENT_REQUESTS = 64;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final LongSupplier nanoTime;

    public UpstreamClient(String baseUrl, String apiKey, RetryPolicy retryPolicy) {
        this(
            new OkHttpClient.Builder().callTimeout(retryPolicy.attemptTimeout()).dispatcher(dispatcher()).build(),
            new ObjectMapper(),
            baseUrl,
            apiKey,
            retryPolicy,
            Sleeper.SYSTEM,
            System::nanoTime
        );
    }

    public UpstreamClient(
        OkHttpClient client,
        ObjectMapper mapper,
        String baseUrl,
        String apiKey,
        RetryPolicy retryPolicy,
        Sleeper sleeper,
        LongSupplier nanoTime
    ) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null").copy()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.baseUrl = HttpUrl.get(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime must not be null");
    }

    public UpstreamResponse call(UpstreamRequest request, String correlationId) throws UpstreamException {
        return call(request, correlationId, Long.MAX_VALUE);
    }

    /**
     * Executes the request with retries.
     *
     * @param deadlineNanos absolute deadline on this client's nano clock; no attempt starts after it
     * @throws UpstreamException the last failure once retries are exhausted, or the first non-recoverable one
     */
    public UpstreamResponse call(UpstreamRequest request, String correlationId, long deadlineNanos) throws UpstreamException {
        Request httpRequest = buildRequest(request, correlationId);
        int maxAttempts = retryPolicy.maxAttempts();
        UpstreamException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw cancelled(attempt - 1, null);
            }
            long remaining = deadlineNanos == Long.MAX_VALUE ? Long.MAX_VALUE : deadlineNanos - nanoTime.getAsLong();
            if (remaining <= 0) {
                throw deadlineElapsed(last, attempt - 1);
            }

            long attemptNanos = Math.min(retryPolicy.attemptTimeout().toNanos(), remaining);
            Call call = client.newCall(httpRequest);
            call.timeout().timeout(attemptNanos, TimeUnit.NANOSECONDS);
            try {
                RawResponse response = await(call, attemptNanos);
                if (response.isSuccessful()) {
                    String body = requireJson(response.body(), response.code(), attempt);
                    LOG.debug("Upstream {} {} answered {} (request_id={}, attempt={})",
                        request.method(), request.path(), response.code(), correlationId, attempt);
                    return new UpstreamResponse(response.code(), body, attempt);
                }
                String text = new String(response.body(), StandardCharsets.UTF_8);
                UpstreamException failure = UpstreamException.httpStatus(response.code(), detail(text, response.message()), attempt);
                if (!retryPolicy.isRecoverableStatus(response.code())) {
                    throw failure;
                }
                last = failure;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw cancelled(attempt, e);
            } catch (InterruptedIOException e) {
                last = new UpstreamException(
                    UpstreamException.Kind.TIMEOUT,
                    0,
                    "Upstream request timed out after " + retryPolicy.attemptTimeout().toMillis() + " ms",
                    attempt,
                    e
                );
            } catch (IOException e) {
                last = new UpstreamException(
                    UpstreamException.Kind.TRANSPORT,
                    0,
                    "Upstream request failed: " + e.getMessage(),
                    attempt,
                    e
                );
            }

            if (attempt < maxAttempts) {
                LOG.warn("Upstream {} {} attempt {}/{} failed (request_id={}): {}; retrying in {} ms",
                    request.method(), request.path(), attempt, maxAttempts, correlationId, last.getMessage(),
                    retryPolicy.delay().toMillis());
                pause(attempt);
            }
        }
        LOG.warn("Upstream {} {} failed after {} attempts (request_id={}): {}",
            request.method(), request.path(), maxAttempts, correlationId, last.getMessage());
        throw last.withAttempts(maxAttempts);
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private Request buildRequest(UpstreamRequest request, String correlationId) throws UpstreamException {
        HttpUrl.Builder url = baseUrl.newBuilder().addPathSegments(stripLeadingSlash(request.path()));
        for (Map.Entry<String, String> entry : request.queryParameters().entrySet()) {
            url.addQueryParameter(entry.getKey(), entry.getValue());
        }

        RequestBody body = null;
        if (request.hasBody()) {
            try {
                body = RequestBody.create(mapper.writeValueAsString(request.body()), JSON);
            } catch (IOException e) {
                throw new UpstreamException(UpstreamException.Kind.TRANSPORT, 0, "Failed to encode upstream request body", 0, e);
            }
        }

        Request.Builder builder = new Request.Builder()
            .url(url.build())
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .header("X-Request-ID", correlationId);
        if (!apiKey.isEmpty()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.method(request.method(), body).build();
    }

    // The body is read on the dispatcher thread, so the waiting thread stays interruptible.
    private static RawResponse await(Call call, long timeoutNanos) throws IOException, InterruptedException {
        CompletableFuture<RawResponse> result = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call completed, Response response) {
                try (response) {
                    byte[] body = response.body() == null ? new byte[0] : response.body().bytes();
                    result.complete(new RawResponse(response.code(), response.message(), body));
                } catch (IOException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        try {
            return result.get(timeoutNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            call.cancel();
            throw e;
        } catch (TimeoutException e) {
            call.cancel();
            InterruptedIOException timeout = new InterruptedIOException("timeout");
            timeout.initCause(e);
            throw timeout;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IOException("Upstream call failed", e.getCause());
        }
    }

    private String requireJson(byte[] body, int statusCode, int attempt) throws UpstreamException {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(body))
                .toString();
        } catch (CharacterCodingException e) {
            LOG.error("Upstream returned a body that is not valid UTF-8 (status={})", statusCode);
            throw new UpstreamException(
                UpstreamException.Kind.MALFORMED_PAYLOAD,
                statusCode,
                "Upstream returned a body that is not valid UTF-8",
                attempt,
                e
            );
        }
        if (text.isBlank()) {
            throw new UpstreamException(
                UpstreamException.Kind.MALFORMED_PAYLOAD,
                statusCode,
                "Upstream returned an empty body with status " + statusCode,
                attempt,
                null
            );
        }
        try {
            mapper.readTree(body);
        } catch (IOException e) {
            LOG.error("Failed to decode JSON response from upstream (status={})", statusCode);
            throw new UpstreamException(
                UpstreamException.Kind.MALFORMED_PAYLOAD,
                statusCode,
                "Invalid JSON received from upstream service",
                attempt,
                e
            );
        }
        return text;
    }

    private void pause(int attempt) throws UpstreamException {
        Duration delay = retryPolicy.delay();
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(attempt, e);
        }
    }

    private String detail(String body, String reason) {
        String detail = "";
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = mapper.readTree(body);
                if (node.isObject()) {
                    JsonNode raw = node.hasNonNull("detail") ? node.get("detail") : node.get("message");
                    if (raw == null || raw.isNull()) {
                        detail = node.toString();
                    } else if (raw.isValueNode()) {
                        detail = raw.asText();
                    } else {
                        detail = raw.toString();
                    }
                } else {
                    detail = node.isValueNode() ? node.asText() : node.toString();
                }
            } catch (IOException e) {
                detail = body;
            }
        }
        detail = detail.strip();
        if (detail.isEmpty()) {
            detail = reason == null ? "" : reason;
        }
        return truncate(detail);
    }

    private UpstreamException cancelled(int attempts, Throwable cause) {
        return new UpstreamException(UpstreamException.Kind.CANCELLED, 0, "Upstream call cancelled", attempts, cause);
    }

    private UpstreamException deadlineElapsed(UpstreamException last, int attempts) {
        String message = "Invocation deadline elapsed before the upstream call completed";
        if (last != null) {
            message = message + " (last failure: " + last.getMessage() + ")";
        }
        return new UpstreamException(UpstreamException.Kind.TIMEOUT, last == null ? 0 : last.statusCode(), message, attempts, last);
    }

    private static Dispatcher dispatcher() {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(MAX_CONCURRENT_REQUESTS);
        dispatcher.setMaxRequestsPerHost(MAX_CONCURRENT_REQUESTS);
        return dispatcher;
    }

    private static String stripLeadingSlash(String path) {
        String out = path == null ? "" : path;
        while (out.startsWith("/")) {
            out = out.substring(1);
        }
        return out;
    }

    private static String truncate(String value) {
        if (value.length() <= MAX_DETAIL_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_DETAIL_LENGTH) + "...";
    }

    private record RawResponse(int code, String message, byte[] body) {
        boolean isSuccessful() {
            return code >= 200 && code < 300;
        }
    }
}
