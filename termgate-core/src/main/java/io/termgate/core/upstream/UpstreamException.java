package io.termgate.core.upstream;

public final class UpstreamException extends Exception {

    public enum Kind {
        HTTP_STATUS,
        TRANSPORT,
        TIMEOUT,
        MALFORMED_PAYLOAD,
        CANCELLED
    }

    private final Kind kind;
    private final int statusCode;
    private final int attempts;

    public UpstreamException(Kind kind, int statusCode, String message, int attempts, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public static UpstreamException httpStatus(int statusCode, String detail, int attempts) {
        return new UpstreamException(
            Kind.HTTP_STATUS,
            statusCode,
            ("Upstream request failed with status " + statusCode + ": " + detail).trim(),
            attempts,
            null
        );
    }

    public Kind kind() {
        return kind;
    }

    /**
     * HTTP status reported by the upstream, or 0 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }

    public int attempts() {
        return attempts;
    }

    public boolean isTimeout() {
        return kind == Kind.TIMEOUT || kind == Kind.CANCELLED;
    }

    UpstreamException withAttempts(int total) {
        return new UpstreamException(kind, statusCode, getMessage(), total, getCause());
    }
}
