package io.termgate.core.audit;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SecretRedactor {
    private static final Pattern BEARER = Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9._~+/=-]+");
    private static final Pattern KEY_VALUE = Pattern.compile(
        "(?i)\\b(api[_-]?key|authorization|token|secret|password)(\"?\\s*[:=]\\s*\"?)[^\\s\",}]+"
    );

    private final List<String> secrets;

    public SecretRedactor(List<String> secrets) {
        this.secrets = secrets == null
            ? List.of()
            : secrets.stream().filter(secret -> secret != null && !secret.isBlank()).toList();
    }

    public String redact(String input) {
        if (input == null || input.isBlank()) {
            return input == null ? "" : input;
        }
        String out = input;
        for (String secret : secrets) {
            out = out.replace(secret, "[REDACTED_SECRET]");
        }
        out = BEARER.matcher(out).replaceAll("Bearer [REDACTED]");
        out = KEY_VALUE.matcher(out).replaceAll(match -> Matcher.quoteReplacement(match.group(1) + match.group(2) + "[REDACTED]"));
        return out;
    }
}
