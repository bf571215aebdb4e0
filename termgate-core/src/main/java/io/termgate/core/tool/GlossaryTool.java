package io.termgate.core.tool;

import static io.termgate.core.tool.ArgumentSpec.optional;
import static io.termgate.core.tool.ArgumentSpec.required;

import java.util.List;

public enum GlossaryTool {
    SEARCH_GLOSSARY(
        "search_glossary",
        "Search glossary content for passages related to a term. Returns the upstream response unchanged.",
        ToolVariant.RETRIEVAL,
        UpstreamOperation.RETRIEVE,
        List.of(
            required("dataset_id", ArgumentKind.DATASET_ID, "Glossary dataset identifier"),
            required("term", ArgumentKind.FREE_TEXT, "Term or phrase to search for"),
            optional("top_k", ArgumentKind.INTEGER, "Maximum number of chunks to return")
        )
    ),
    RETRIEVE_DOCS(
        "retrieve_docs",
        "Retrieve glossary documents and chunk metadata for a query. Returns the upstream response unchanged.",
        ToolVariant.RETRIEVAL,
        UpstreamOperation.RETRIEVE,
        List.of(
            required("dataset_id", ArgumentKind.DATASET_ID, "Glossary dataset identifier"),
            required("query", ArgumentKind.FREE_TEXT, "Free-text retrieval query"),
            optional("top_k", ArgumentKind.INTEGER, "Maximum number of chunks to return"),
            optional("keyword", ArgumentKind.BOOLEAN, "Enable keyword matching"),
            optional("highlight", ArgumentKind.BOOLEAN, "Return highlighted snippets")
        )
    ),
    LIST_GLOSSARIES(
        "list_glossaries",
        "List available glossaries, optionally filtered by name.",
        ToolVariant.GLOSSARY,
        UpstreamOperation.LIST_GLOSSARIES,
        List.of(
            optional("name", ArgumentKind.FREE_TEXT, "Glossary name filter")
        )
    ),
    GET_GLOSSARY(
        "get_glossary",
        "Fetch metadata for a single glossary.",
        ToolVariant.GLOSSARY,
        UpstreamOperation.GET_GLOSSARY,
        List.of(
            required("dataset_id", ArgumentKind.DATASET_ID, "Glossary dataset identifier")
        )
    ),
    SEARCH_TERMS(
        "search_terms",
        "Search a glossary for passages matching a query.",
        ToolVariant.GLOSSARY,
        UpstreamOperation.RETRIEVE,
        List.of(
            required("dataset_id", ArgumentKind.DATASET_ID, "Glossary dataset identifier"),
            required("query", ArgumentKind.FREE_TEXT, "Free-text search query"),
            optional("top_k", ArgumentKind.INTEGER, "Maximum number of chunks to return")
        )
    ),
    RETRIEVE_DEFINITIONS(
        "retrieve_definitions",
        "Retrieve glossary definitions for a list of terms.",
        ToolVariant.GLOSSARY,
        UpstreamOperation.RETRIEVE,
        List.of(
            required("dataset_id", ArgumentKind.DATASET_ID, "Glossary dataset identifier"),
            required("terms", ArgumentKind.TEXT_LIST, "Terms to define"),
            optional("top_k", ArgumentKind.INTEGER, "Maximum number of chunks to return")
        )
    );

    private final String toolName;
    private final String description;
    private final ToolVariant variant;
    private final UpstreamOperation operation;
    private final List<ArgumentSpec> arguments;

    GlossaryTool(String toolName, String description, ToolVariant variant, UpstreamOperation operation, List<ArgumentSpec> arguments) {
        this.toolName = toolName;
        this.description = description;
        this.variant = variant;
        this.operation = operation;
        this.arguments = arguments;
    }

    public String toolName() {
        return toolName;
    }

    public String description() {
        return description;
    }

    public ToolVariant variant() {
        return variant;
    }

    public UpstreamOperation operation() {
        return operation;
    }

    public List<ArgumentSpec> arguments() {
        return arguments;
    }
}
