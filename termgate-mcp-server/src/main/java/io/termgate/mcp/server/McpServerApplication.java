package io.termgate.mcp.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.termgate.core.audit.AuditLogger;
import io.termgate.core.audit.SecretRedactor;
import io.termgate.core.audit.Slf4jAuditLogger;
import io.termgate.core.config.GatewaySettings;
import io.termgate.core.pipeline.InvocationPipeline;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpServerApplication implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(McpServerApplication.class);

    public static final String SERVER_NAME = "termgate";
    public static final String SERVER_VERSION = "1.0.0";
    private static final int STDIO_WORKERS = 4;

    private final GatewaySettings settings;
    private final ObjectMapper mapper;
    private final InvocationPipeline pipeline;
    private final ToolRouter router;
    private final McpProtocolHandler protocol;

    McpServerApplication(GatewaySettings settings, AuditLogger auditLogger) {
        this.settings = settings;
        this.mapper = new ObjectMapper();
        this.pipeline = new InvocationPipeline(settings, auditLogger);
        this.router = new ToolRouter(pipeline);
        this.protocol = new McpProtocolHandler(router, mapper, SERVER_NAME, SERVER_VERSION);
    }

    public static McpServerApplication create(GatewaySettings settings) {
        AuditLogger auditLogger = new Slf4jAuditLogger(new SecretRedactor(List.of(settings.apiKey())));
        McpServerApplication application = new McpServerApplication(settings, auditLogger);
        LOG.info("Configured {} (variant={}, tools={}, upstream={}, auth={})",
            SERVER_NAME,
            settings.toolVariant().wireName(),
            application.router.listTools().size(),
            settings.apiBaseUrl(),
            settings.hasApiKey() ? "bearer" : "none");
        return application;
    }

    public void serveStdio(InputStream in, OutputStream out) throws IOException {
        LOG.info("Serving MCP over stdio");
        new StdioServer(protocol, mapper, STDIO_WORKERS).serve(in, out);
    }

    public McpHttpServer startHttp(String host, int port) {
        McpHttpServer server = new McpHttpServer(host, port, router, protocol, mapper);
        server.start();
        return server;
    }

    public GatewaySettings settings() {
        return settings;
    }

    public ToolRouter router() {
        return router;
    }

    @Override
    public void close() {
        pipeline.close();
    }
}
