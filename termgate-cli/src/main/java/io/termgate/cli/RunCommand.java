package io.termgate.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "run", description = "Serve the glossary tools over stdio or HTTP")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--transport"}, description = "Transport: stdio or http", defaultValue = "stdio",
        converter = TransportMode.Converter.class)
    TransportMode transport;

    @Option(names = {"--host"}, description = "Bind address for the http transport", defaultValue = "127.0.0.1")
    String host;

    @Option(names = {"--port"}, description = "Port for the http transport (defaults to MCP_PORT)")
    Integer port;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        int resolvedPort = port == null ? context.settings().port() : port;
        if (resolvedPort < 0 || resolvedPort > 65_535) {
            System.err.println("Port must be between 0 and 65535, got " + resolvedPort);
            return 2;
        }
        try {
            return context.serverRunner().run(transport, host, resolvedPort);
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}
