package io.termgate.core.tool;

import io.termgate.core.config.ConfigurationException;

public final class UnknownToolException extends ConfigurationException {
    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
