package io.termgate.core.pipeline;

import io.termgate.core.audit.ArgumentSanitizer;
import io.termgate.core.audit.AuditEvent;
import io.termgate.core.audit.AuditLogger;
import io.termgate.core.audit.InvocationStatus;
import io.termgate.core.config.GatewaySettings;
import io.termgate.core.ratelimit.RateLimitDecision;
import io.termgate.core.ratelimit.TokenBucketLimiter;
import io.termgate.core.tool.ToolDescriptor;
import io.termgate.core.tool.ToolRegistry;
import io.termgate.core.upstream.GlossaryUpstream;
import io.termgate.core.upstream.UpstreamClient;
import io.termgate.core.upstream.UpstreamException;
import io.termgate.core.validation.InputValidator;
import io.termgate.core.validation.ValidationResult;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class InvocationPipeline implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(InvocationPipeline.class);

    private final ToolRegistry registry;
    private final InputValidator validator;
    private final TokenBucketLimiter limiter;
    private final GlossaryUpstream upstream;
    private final AutoCloseable upstreamResources;
    private final AuditLogger auditLogger;
    private final ArgumentSanitizer sanitizer;
    private final Duration invocationTimeout;
    private final Clock clock;
    private final LongSupplier nanoTime;

    public InvocationPipeline(GatewaySettings settings, AuditLogger auditLogger) {
        this(settings, ToolRegistry.create(settings), new UpstreamClient(settings.apiBaseUrl(), settings.apiKey(), settings.retryPolicy()), auditLogger);
    }

    private InvocationPipeline(GatewaySettings settings, ToolRegistry registry, UpstreamClient client, AuditLogger auditLogger) {
        this(
            registry,
            new InputValidator(settings),
            new TokenBucketLimiter(settings.rateLimitCapacity(), settings.rateLimitInterval(), registry.rateLimitCapacities()),
            new GlossaryUpstream(client, settings.similarityThreshold(), settings.vectorSimilarityWeight()),
            client,
            auditLogger,
            settings.invocationTimeout(),
            Clock.systemUTC(),
            System::nanoTime
        );
    }

    public InvocationPipeline(
        ToolRegistry registry,
        InputValidator validator,
        TokenBucketLimiter limiter,
        GlossaryUpstream upstream,
        AutoCloseable upstreamResources,
        AuditLogger auditLogger,
        Duration invocationTimeout,
        Clock clock,
        LongSupplier nanoTime
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.limiter = Objects.requireNonNull(limiter, "limiter must not be null");
        this.upstream = Objects.requireNonNull(upstream, "upstream must not be null");
        this.upstreamResources = upstreamResources;
        this.auditLogger = Objects.requireNonNull(auditLogger, "auditLogger must not be null");
        this.sanitizer = new ArgumentSanitizer();
        this.invocationTimeout = invocationTimeout == null ? Duration.ZERO : invocationTimeout;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime must not be null");
    }

    /**
     * @throws io.termgate.core.tool.UnknownToolException if the name is not registered; no audit event is written
     */
    public ToolResult invoke(String toolName, Map<String, Object> arguments) {
        ToolDescriptor tool = registry.require(toolName);
        InvocationContext context = InvocationContext.start(tool.name(), clock.instant(), nanoTime.getAsLong(), invocationTimeout);

        ValidationResult validation = validator.validate(tool, arguments);
        if (!validation.isOk()) {
            ToolError error = ToolError.validation(validation.errors());
            audit(context, sanitizer.sanitizeRejected(tool, arguments), InvocationStatus.VALIDATION_ERROR, validation.summary());
            return ToolResult.failure(context, error);
        }
        Map<String, Object> sanitized = sanitizer.sanitize(tool, validation.arguments());

        RateLimitDecision decision = limiter.admit(tool.rateLimitKey());
        if (!decision.admitted()) {
            ToolError error = ToolError.rateLimited(tool.name(), decision);
            audit(context, sanitized, InvocationStatus.RATE_LIMITED, error.message());
            return ToolResult.failure(context, error);
        }

        try {
            String payload = upstream.execute(tool, validation.arguments(), context.requestId(), context.deadlineNanos());
            audit(context, sanitized, InvocationStatus.SUCCESS, null);
            return ToolResult.success(context, payload);
        } catch (UpstreamException e) {
            ToolError error = ToolError.upstream(e);
            audit(context, sanitized, InvocationStatus.UPSTREAM_ERROR, e.getMessage());
            return ToolResult.failure(context, error);
        }
    }

    public ToolRegistry registry() {
        return registry;
    }

    public TokenBucketLimiter limiter() {
        return limiter;
    }

    @Override
    public void close() {
        if (upstreamResources == null) {
            return;
        }
        try {
            upstreamResources.close();
        } catch (Exception e) {
            LOG.warn("Failed to release upstream resources", e);
        }
    }

    private void audit(InvocationContext context, Map<String, Object> arguments, InvocationStatus status, String error) {
        AuditEvent event = new AuditEvent(
            AuditEvent.TOOL_INVOCATION,
            context.toolName(),
            status,
            context.requestId(),
            context.elapsedMillis(nanoTime.getAsLong()),
            arguments,
            clock.instant(),
            error
        );
        try {
            auditLogger.record(event);
        } catch (RuntimeException e) {
            LOG.error("Audit logger failed for tool {} (request_id={})", context.toolName(), context.requestId(), e);
        }
    }
}
