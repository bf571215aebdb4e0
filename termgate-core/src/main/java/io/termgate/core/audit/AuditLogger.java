package io.termgate.core.audit;

/**
 * Sink for invocation audit events. Implementations emit synchronously and must not throw.
 */
@FunctionalInterface
public interface AuditLogger {
    void record(AuditEvent event);
}
