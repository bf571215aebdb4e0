package io.termgate.core.audit;

import io.termgate.core.tool.ArgumentSpec;
import io.termgate.core.tool.ToolDescriptor;
import io.termgate.core.validation.ToolArguments;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ArgumentSanitizer {

    public Map<String, Object> sanitize(ToolDescriptor tool, ToolArguments arguments) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (arguments.datasetId() != null) {
            out.put("dataset_id", arguments.datasetId());
        }
        if (arguments.query() != null) {
            out.put("query_length", length(arguments.query()));
        }
        if (arguments.nameFilter() != null) {
            out.put("name_length", length(arguments.nameFilter()));
        }
        if (tool.argument("terms").isPresent()) {
            out.put("term_count", arguments.terms().size());
        }
        if (arguments.topK() != null) {
            out.put("top_k", arguments.topK());
        }
        if (tool.argument("keyword").isPresent()) {
            out.put("keyword", arguments.keyword());
        }
        if (tool.argument("highlight").isPresent()) {
            out.put("highlight", arguments.highlight());
        }
        return out;
    }

    public Map<String, Object> sanitizeRejected(ToolDescriptor tool, Map<String, Object> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        Map<String, Object> args = raw == null ? Map.of() : raw;
        int unsupported = 0;
        for (String name : args.keySet()) {
            if (tool.argument(name).isEmpty()) {
                unsupported++;
            }
        }
        for (ArgumentSpec spec : tool.arguments()) {
            Object value = args.get(spec.name());
            if (value == null) {
                continue;
            }
            switch (spec.kind()) {
                case DATASET_ID -> {
                    if (value instanceof String text) {
                        out.put("dataset_id_length", length(text));
                    }
                }
                case FREE_TEXT -> {
                    if (value instanceof String text) {
                        out.put("name".equals(spec.name()) ? "name_length" : "query_length", length(text));
                    }
                }
                case TEXT_LIST -> {
                    if (value instanceof List<?> list) {
                        out.put("term_count", list.size());
                    }
                }
                case INTEGER -> {
                    if (value instanceof Number number) {
                        out.put(spec.name(), number.longValue());
                    }
                }
                case BOOLEAN -> {
                    if (value instanceof Boolean flag) {
                        out.put(spec.name(), flag);
                    }
                }
                default -> {
                }
            }
        }
        if (unsupported > 0) {
            out.put("unsupported_argument_count", unsupported);
        }
        return out;
    }

    private static int length(String value) {
        return value.codePointCount(0, value.length());
    }
}
