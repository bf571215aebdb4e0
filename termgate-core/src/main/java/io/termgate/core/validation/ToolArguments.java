package io.termgate.core.validation;

import java.util.List;

public record ToolArguments(
    String datasetId,
    String query,
    List<String> terms,
    Integer topK,
    boolean keyword,
    boolean highlight,
    String nameFilter
) {
    public ToolArguments {
        terms = terms == null ? List.of() : List.copyOf(terms);
    }
}
