package io.termgate.cli;

import picocli.CommandLine.Command;

@Command(name = "termgate", mixinStandardHelpOptions = true, version = "termgate 1.0.0",
    description = "Read-only MCP gateway for glossary retrieval")
public final class TermgateCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
