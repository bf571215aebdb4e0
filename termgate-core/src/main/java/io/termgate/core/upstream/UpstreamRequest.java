package io.termgate.core.upstream;

import java.util.Map;

public record UpstreamRequest(
    String method,
    String path,
    Map<String, String> queryParameters,
    Map<String, Object> body
) {
    public UpstreamRequest {
        queryParameters = queryParameters == null ? Map.of() : Map.copyOf(queryParameters);
    }

    public static UpstreamRequest get(String path, Map<String, String> queryParameters) {
        return new UpstreamRequest("GET", path, queryParameters, null);
    }

    public static UpstreamRequest post(String path, Map<String, Object> body) {
        return new UpstreamRequest("POST", path, Map.of(), body);
    }

    public boolean hasBody() {
        return body != null;
    }
}
