package io.termgate.core.validation;

import io.termgate.core.config.GatewaySettings;
import io.termgate.core.tool.ArgumentSpec;
import io.termgate.core.tool.GlossaryTool;
import io.termgate.core.tool.ToolDescriptor;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

public final class InputValidator {
    private final Pattern datasetIdPattern;
    private final int maxQueryLength;
    private final int maxTerms;
    private final int maxTermLength;
    private final int searchTopK;
    private final int definitionTopK;

    public InputValidator(GatewaySettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.datasetIdPattern = Pattern.compile(settings.datasetIdPattern());
        this.maxQueryLength = settings.maxQueryLength();
        this.maxTerms = settings.maxTerms();
        this.maxTermLength = settings.maxTermLength();
        this.searchTopK = settings.searchTopK();
        this.definitionTopK = settings.definitionTopK();
    }

    public ValidationResult validate(ToolDescriptor tool, Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        List<FieldError> errors = new ArrayList<>();

        for (String name : args.keySet()) {
            if (tool.argument(name).isEmpty()) {
                errors.add(new FieldError(name, "is not a supported argument for " + tool.name()));
            }
        }

        String datasetId = null;
        String query = null;
        List<String> terms = List.of();
        Integer topK = null;
        boolean keyword = false;
        boolean highlight = false;
        String nameFilter = null;

        for (ArgumentSpec spec : tool.arguments()) {
            Object raw = args.get(spec.name());
            if (raw == null) {
                if (spec.required()) {
                    errors.add(new FieldError(spec.name(), "is required"));
                }
                continue;
            }
            switch (spec.kind()) {
                case DATASET_ID -> datasetId = datasetId(spec.name(), raw, errors);
                case FREE_TEXT -> {
                    String text = freeText(spec, raw, errors);
                    if ("name".equals(spec.name())) {
                        nameFilter = text;
                    } else {
                        query = text;
                    }
                }
                case TEXT_LIST -> terms = termList(spec.name(), raw, errors);
                case INTEGER -> topK = topK(spec.name(), raw, errors);
                case BOOLEAN -> {
                    if (!(raw instanceof Boolean flag)) {
                        errors.add(new FieldError(spec.name(), "must be a boolean"));
                    } else if ("keyword".equals(spec.name())) {
                        keyword = flag;
                    } else {
                        highlight = flag;
                    }
                }
                default -> errors.add(new FieldError(spec.name(), "has an unsupported kind " + spec.kind()));
            }
        }

        if (!errors.isEmpty()) {
            return ValidationResult.rejected(errors);
        }
        if (topK == null && tool.argument("top_k").isPresent()) {
            topK = tool.tool() == GlossaryTool.RETRIEVE_DEFINITIONS ? definitionTopK : searchTopK;
        }
        return ValidationResult.ok(new ToolArguments(datasetId, query, terms, topK, keyword, highlight, nameFilter));
    }

    private String datasetId(String field, Object raw, List<FieldError> errors) {
        if (!(raw instanceof String text)) {
            errors.add(new FieldError(field, "must be a string"));
            return null;
        }
        String value = text.trim();
        if (value.isEmpty()) {
            errors.add(new FieldError(field, "is required"));
            return null;
        }
        if (!datasetIdPattern.matcher(value).matches()) {
            errors.add(new FieldError(field, "contains unsupported characters (must match " + datasetIdPattern.pattern() + ")"));
            return null;
        }
        return value;
    }

    private String freeText(ArgumentSpec spec, Object raw, List<FieldError> errors) {
        if (!(raw instanceof String text)) {
            errors.add(new FieldError(spec.name(), "must be a string"));
            return null;
        }
        String value = text.trim();
        if (value.isEmpty()) {
            if (spec.required()) {
                errors.add(new FieldError(spec.name(), "is required"));
            }
            return null;
        }
        int length = length(value);
        if (length > maxQueryLength) {
            errors.add(new FieldError(
                spec.name(),
                "exceeds maximum length of " + maxQueryLength + " characters (got " + length + ")"
            ));
            return null;
        }
        return value;
    }

    private List<String> termList(String field, Object raw, List<FieldError> errors) {
        if (!(raw instanceof List<?> items)) {
            errors.add(new FieldError(field, "must be a list of strings"));
            return List.of();
        }
        List<String> terms = new ArrayList<>();
        for (Object item : items) {
            if (item == null) {
                continue;
            }
            if (!(item instanceof String text)) {
                errors.add(new FieldError(field, "must contain only strings"));
                return List.of();
            }
            String value = text.trim();
            if (!value.isEmpty()) {
                terms.add(value);
            }
        }
        if (terms.isEmpty()) {
            errors.add(new FieldError(field, "must contain at least one non-blank term"));
            return List.of();
        }
        if (terms.size() > maxTerms) {
            errors.add(new FieldError(field, "must contain at most " + maxTerms + " terms (got " + terms.size() + ")"));
        }
        for (int i = 0; i < terms.size(); i++) {
            int length = length(terms.get(i));
            if (length > maxTermLength) {
                errors.add(new FieldError(
                    field + "[" + i + "]",
                    "exceeds maximum term length of " + maxTermLength + " characters (got " + length + ")"
                ));
            }
        }
        return terms;
    }

    private Integer topK(String field, Object raw, List<FieldError> errors) {
        if (!(raw instanceof Number number) || !isIntegral(number)) {
            errors.add(new FieldError(field, "must be an integer"));
            return null;
        }
        // doubleValue keeps the sign and magnitude of big numbers that longValue would wrap
        double value = number.doubleValue();
        if (value <= 0) {
            errors.add(new FieldError(field, "must be greater than zero"));
            return null;
        }
        if (value >= GatewaySettings.MAX_TOP_K) {
            return GatewaySettings.MAX_TOP_K;
        }
        return number.intValue();
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Double || number instanceof Float || number instanceof BigDecimal) {
            double value = number.doubleValue();
            return !Double.isInfinite(value) && value == Math.rint(value);
        }
        return true;
    }

    private static int length(String value) {
        return value.codePointCount(0, value.length());
    }
}
