package io.termgate.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Slf4jAuditLogger implements AuditLogger {
    public static final String AUDIT_LOGGER = "termgate.audit";
    public static final String ERROR_LOGGER = "termgate.audit-errors";

    private final Logger audit;
    private final Logger errors;
    private final ObjectMapper mapper;
    private final SecretRedactor redactor;

    public Slf4jAuditLogger(SecretRedactor redactor) {
        this(LoggerFactory.getLogger(AUDIT_LOGGER), LoggerFactory.getLogger(ERROR_LOGGER), defaultMapper(), redactor);
    }

    Slf4jAuditLogger(Logger audit, Logger errors, ObjectMapper mapper, SecretRedactor redactor) {
        this.audit = Objects.requireNonNull(audit, "audit must not be null");
        this.errors = Objects.requireNonNull(errors, "errors must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.redactor = Objects.requireNonNull(redactor, "redactor must not be null");
    }

    @Override
    public void record(AuditEvent event) {
        try {
            AuditEvent safe = event.error() == null ? event : new AuditEvent(
                event.event(),
                event.tool(),
                event.status(),
                event.requestId(),
                event.durationMs(),
                event.arguments(),
                event.timestamp(),
                redactor.redact(event.error())
            );
            audit.info(mapper.writeValueAsString(safe));
        } catch (Exception e) {
            errors.error("Failed to emit audit event for tool {} (request_id={}, status={})",
                event.tool(), event.requestId(), event.status(), e);
        }
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
