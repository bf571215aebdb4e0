package io.termgate.core.upstream;

public record UpstreamResponse(int statusCode, String body, int attempts) {
}
