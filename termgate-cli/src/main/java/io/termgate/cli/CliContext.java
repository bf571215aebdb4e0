package io.termgate.cli;

import io.termgate.core.config.GatewaySettings;

public record CliContext(
    GatewaySettings settings,
    ServerRunner serverRunner
) {
}
