package io.termgate.core.validation;

public record FieldError(String field, String reason) {
}
