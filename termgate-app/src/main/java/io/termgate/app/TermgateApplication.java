package io.termgate.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import io.termgate.cli.CliContext;
import io.termgate.cli.RunCommand;
import io.termgate.cli.ServerRunner;
import io.termgate.cli.TermgateCliCommand;
import io.termgate.cli.TransportMode;
import io.termgate.core.config.ConfigurationException;
import io.termgate.core.config.GatewaySettings;
import io.termgate.mcp.server.McpHttpServer;
import io.termgate.mcp.server.McpServerApplication;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class TermgateApplication {
    private static final Logger LOG = LoggerFactory.getLogger(TermgateApplication.class);

    private TermgateApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) {
        GatewaySettings settings;
        try {
            settings = GatewaySettings.fromEnv(env);
        } catch (ConfigurationException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }
        configureLogging(settings.logLevel());
        LOG.debug("Loaded {}", settings);
        return commandLine(new CliContext(settings, serverRunner(settings))).execute(args);
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new TermgateCliCommand());
        commandLine.addSubcommand("run", new RunCommand(context));
        return commandLine;
    }

    static void configureLogging(String level) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
        }
    }

    private static ServerRunner serverRunner(GatewaySettings settings) {
        return (transport, host, port) -> {
            try (McpServerApplication application = McpServerApplication.create(settings)) {
                if (transport == TransportMode.STDIO) {
                    application.serveStdio(System.in, System.out);
                    return 0;
                }
                return serveHttp(application, host, port);
            }
        };
    }

    private static int serveHttp(McpServerApplication application, String host, int port) throws InterruptedException {
        CountDownLatch shutdown = new CountDownLatch(1);
        try (McpHttpServer server = application.startHttp(host, port)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            LOG.info("Endpoints: GET /healthz, GET /mcp/tools, POST /mcp/call, POST /mcp on http://{}:{}", host, server.port());
            shutdown.await();
        }
        return 0;
    }
}
