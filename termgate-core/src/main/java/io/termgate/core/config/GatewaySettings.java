package io.termgate.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.termgate.core.tool.ToolVariant;
import io.termgate.core.upstream.RetryPolicy;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public record GatewaySettings(
    String apiBaseUrl,
    String apiKey,
    boolean requireApiKey,
    Duration httpTimeout,
    int retryAttempts,
    Duration retryWait,
    Duration invocationTimeout,
    int rateLimitCapacity,
    Duration rateLimitInterval,
    Map<String, Integer> toolRateLimits,
    int maxQueryLength,
    int maxTerms,
    int maxTermLength,
    String datasetIdPattern,
    int searchTopK,
    int definitionTopK,
    double similarityThreshold,
    double vectorSimilarityWeight,
    ToolVariant toolVariant,
    String logLevel,
    int port
) {
    public static final String DEFAULT_BASE_URL = "http://127.0.0.1:8000";
    public static final String DEFAULT_DATASET_ID_PATTERN = "^[A-Za-z0-9][A-Za-z0-9._:-]{0,127}$";
    public static final int MAX_TOP_K = 1024;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public GatewaySettings {
        apiBaseUrl = stripTrailingSlash(apiBaseUrl == null || apiBaseUrl.isBlank() ? DEFAULT_BASE_URL : apiBaseUrl.trim());
        apiKey = apiKey == null ? "" : apiKey.trim();
        toolRateLimits = toolRateLimits == null ? Map.of() : Map.copyOf(toolRateLimits);
        datasetIdPattern = datasetIdPattern == null || datasetIdPattern.isBlank() ? DEFAULT_DATASET_ID_PATTERN : datasetIdPattern;
        toolVariant = toolVariant == null ? ToolVariant.RETRIEVAL : toolVariant;
        logLevel = logLevel == null || logLevel.isBlank() ? "INFO" : logLevel.trim().toUpperCase(Locale.ROOT);

        if (!apiBaseUrl.startsWith("http://") && !apiBaseUrl.startsWith("https://")) {
            throw new ConfigurationException("API base URL must be an http(s) URL: " + apiBaseUrl);
        }
        if (requireApiKey && apiKey.isEmpty()) {
            throw new ConfigurationException("API key is required for upstream calls but MCP_API_KEY is not set");
        }
        require(httpTimeout != null && httpTimeout.toMillis() >= 500, "MCP_HTTP_TIMEOUT must be at least 0.5 seconds");
        require(retryAttempts >= 1, "MCP_RETRY_ATTEMPTS must be at least 1");
        require(retryWait != null && !retryWait.isNegative(), "MCP_RETRY_WAIT must not be negative");
        if (invocationTimeout == null || invocationTimeout.isZero()) {
            invocationTimeout = httpTimeout.multipliedBy(retryAttempts).plus(retryWait.multipliedBy(retryAttempts - 1L));
        }
        require(!invocationTimeout.isNegative(), "MCP_INVOCATION_TIMEOUT must not be negative");
        require(rateLimitCapacity >= 1, "MCP_RATE_LIMIT_CAPACITY must be at least 1");
        require(rateLimitInterval != null && !rateLimitInterval.isNegative() && !rateLimitInterval.isZero(),
            "MCP_RATE_LIMIT_INTERVAL_SECONDS must be greater than zero");
        toolRateLimits.forEach((tool, capacity) ->
            require(capacity != null && capacity >= 1, "MCP_TOOL_RATE_LIMITS entry for " + tool + " must be at least 1"));
        require(maxQueryLength >= 1, "MCP_MAX_QUERY_LENGTH must be at least 1");
        require(maxTerms >= 1, "MCP_MAX_TERMS must be at least 1");
        require(maxTermLength >= 1, "MCP_MAX_TERM_LENGTH must be at least 1");
        require(searchTopK >= 1 && searchTopK <= MAX_TOP_K, "MCP_SEARCH_TOP_K must be between 1 and " + MAX_TOP_K);
        require(definitionTopK >= 1 && definitionTopK <= MAX_TOP_K, "MCP_DEFINITION_TOP_K must be between 1 and " + MAX_TOP_K);
        require(similarityThreshold >= 0.0 && similarityThreshold <= 1.0, "MCP_SIMILARITY_THRESHOLD must be between 0 and 1");
        require(vectorSimilarityWeight >= 0.0 && vectorSimilarityWeight <= 1.0,
            "MCP_VECTOR_SIMILARITY_WEIGHT must be between 0 and 1");
        require(port >= 0 && port <= 65_535, "MCP_PORT must be between 0 and 65535");
        try {
            Pattern.compile(datasetIdPattern);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("MCP_DATASET_ID_PATTERN is not a valid regular expression", e);
        }
    }

    public static GatewaySettings defaults() {
        return fromEnv(Map.of());
    }

    public static GatewaySettings fromEnv() {
        return fromEnv(System.getenv());
    }

    public static GatewaySettings fromEnv(Map<String, String> env) {
        return new GatewaySettings(
            string(env, DEFAULT_BASE_URL, "MCP_API_BASE_URL", "API_BASE_URL", "LLM_API_BASE_URL"),
            string(env, "", "MCP_API_KEY", "API_KEY", "LLM_API_KEY"),
            bool(env, false, "MCP_REQUIRE_API_KEY", "REQUIRE_API_KEY"),
            seconds(env, 30.0, "MCP_HTTP_TIMEOUT", "HTTP_TIMEOUT"),
            integer(env, 3, "MCP_RETRY_ATTEMPTS", "RETRY_ATTEMPTS"),
            seconds(env, 0.5, "MCP_RETRY_WAIT", "RETRY_WAIT"),
            seconds(env, 0.0, "MCP_INVOCATION_TIMEOUT", "INVOCATION_TIMEOUT"),
            integer(env, 10, "MCP_RATE_LIMIT_CAPACITY", "RATE_LIMIT_CAPACITY"),
            seconds(env, 60.0, "MCP_RATE_LIMIT_INTERVAL_SECONDS", "RATE_LIMIT_INTERVAL_SECONDS"),
            toolRateLimits(string(env, "", "MCP_TOOL_RATE_LIMITS", "TOOL_RATE_LIMITS")),
            integer(env, 256, "MCP_MAX_QUERY_LENGTH", "MAX_QUERY_LENGTH"),
            integer(env, 10, "MCP_MAX_TERMS", "MAX_TERMS"),
            integer(env, 128, "MCP_MAX_TERM_LENGTH", "MAX_TERM_LENGTH"),
            string(env, DEFAULT_DATASET_ID_PATTERN, "MCP_DATASET_ID_PATTERN", "DATASET_ID_PATTERN"),
            integer(env, 8, "MCP_SEARCH_TOP_K", "SEARCH_TOP_K"),
            integer(env, 12, "MCP_DEFINITION_TOP_K", "DEFINITION_TOP_K"),
            decimal(env, 0.2, "MCP_SIMILARITY_THRESHOLD", "SIMILARITY_THRESHOLD"),
            decimal(env, 0.3, "MCP_VECTOR_SIMILARITY_WEIGHT", "VECTOR_SIMILARITY_WEIGHT"),
            variant(string(env, "", "MCP_TOOL_VARIANT", "TOOL_VARIANT")),
            string(env, "INFO", "MCP_LOG_LEVEL", "LOG_LEVEL"),
            integer(env, 8791, "MCP_PORT", "PORT")
        );
    }

    public boolean hasApiKey() {
        return !apiKey.isEmpty();
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryAttempts, retryWait, httpTimeout);
    }

    @Override
    public String toString() {
        return "GatewaySettings[apiBaseUrl=" + apiBaseUrl
            + ", apiKey=" + (hasApiKey() ? "***" : "<unset>")
            + ", httpTimeout=" + httpTimeout
            + ", retryAttempts=" + retryAttempts
            + ", retryWait=" + retryWait
            + ", invocationTimeout=" + invocationTimeout
            + ", rateLimitCapacity=" + rateLimitCapacity
            + ", rateLimitInterval=" + rateLimitInterval
            + ", toolRateLimits=" + toolRateLimits
            + ", toolVariant=" + toolVariant.wireName()
            + ", logLevel=" + logLevel
            + ", port=" + port + "]";
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }

    private static String stripTrailingSlash(String value) {
        String out = value;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static String lookup(Map<String, String> env, String... keys) {
        for (String key : keys) {
            String value = env.get(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String string(Map<String, String> env, String fallback, String... keys) {
        String value = lookup(env, keys);
        return value == null ? fallback : value;
    }

    private static boolean bool(Map<String, String> env, boolean fallback, String... keys) {
        String value = lookup(env, keys);
        if (value == null) {
            return fallback;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "on" -> true;
            case "0", "false", "no", "off" -> false;
            default -> throw new ConfigurationException(keys[0] + " must be a boolean, got: " + value);
        };
    }

    private static int integer(Map<String, String> env, int fallback, String... keys) {
        String value = lookup(env, keys);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(keys[0] + " must be an integer, got: " + value, e);
        }
    }

    private static double decimal(Map<String, String> env, double fallback, String... keys) {
        String value = lookup(env, keys);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(keys[0] + " must be a number, got: " + value, e);
        }
    }

    private static Duration seconds(Map<String, String> env, double fallback, String... keys) {
        double value = decimal(env, fallback, keys);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ConfigurationException(keys[0] + " must be a finite number of seconds");
        }
        return Duration.ofMillis(Math.round(value * 1000.0));
    }

    private static ToolVariant variant(String raw) {
        if (raw == null || raw.isBlank()) {
            return ToolVariant.RETRIEVAL;
        }
        return ToolVariant.fromWireName(raw)
            .orElseThrow(() -> new ConfigurationException("MCP_TOOL_VARIANT must be one of " + ToolVariant.wireNames() + ", got: " + raw));
    }

    private static Map<String, Integer> toolRateLimits(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        Map<String, Object> parsed;
        try {
            parsed = MAPPER.readValue(raw, new TypeReference<Map<String, Object>>() {
            });
        } catch (Exception e) {
            throw new ConfigurationException("MCP_TOOL_RATE_LIMITS must be a JSON object of tool name to capacity", e);
        }
        if (parsed == null) {
            return Map.of();
        }
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : parsed.entrySet()) {
            Object value = entry.getValue();
            int capacity;
            if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
                double whole = number.doubleValue();
                if (whole < Integer.MIN_VALUE || whole > Integer.MAX_VALUE) {
                    throw new ConfigurationException("MCP_TOOL_RATE_LIMITS entry for " + entry.getKey() + " is out of range");
                }
                capacity = number.intValue();
            } else if (value instanceof String text) {
                try {
                    capacity = Integer.parseInt(text.trim());
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("MCP_TOOL_RATE_LIMITS entry for " + entry.getKey() + " must be an integer", e);
                }
            } else {
                throw new ConfigurationException("MCP_TOOL_RATE_LIMITS entry for " + entry.getKey() + " must be an integer");
            }
            out.put(entry.getKey().trim(), capacity);
        }
        return out;
    }
}
