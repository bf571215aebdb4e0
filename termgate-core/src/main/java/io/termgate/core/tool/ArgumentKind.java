package io.termgate.core.tool;

public enum ArgumentKind {
    DATASET_ID,
    FREE_TEXT,
    TEXT_LIST,
    INTEGER,
    BOOLEAN
}
