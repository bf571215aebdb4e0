package io.termgate.core.tool;

public enum UpstreamOperation {
    LIST_GLOSSARIES,
    GET_GLOSSARY,
    RETRIEVE
}
