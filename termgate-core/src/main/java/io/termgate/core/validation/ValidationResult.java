package io.termgate.core.validation;

import java.util.List;
import java.util.stream.Collectors;

public record ValidationResult(ToolArguments arguments, List<FieldError> errors) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult ok(ToolArguments arguments) {
        return new ValidationResult(arguments, List.of());
    }

    public static ValidationResult rejected(List<FieldError> errors) {
        return new ValidationResult(null, errors);
    }

    public boolean isOk() {
        return errors.isEmpty();
    }

    public String summary() {
        return errors.stream()
            .map(error -> error.field() + ": " + error.reason())
            .collect(Collectors.joining("; "));
    }
}
