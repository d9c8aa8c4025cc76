package co.fanki.editorguard.config;

import co.fanki.editorguard.analysis.application.ProjectScanService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Exposes the editor usage check as MCP tools over stdio.
 *
 * <p>When the {@code mcp.server.stdio} property is set to {@code true},
 * an MCP server communicating via stdin/stdout with JSON-RPC is started
 * so IDE assistants can check files while they are being edited.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String CHECK_SOURCE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "path": {
                  "type": "string",
                  "description": "The file path, used to detect Editor folders"
                },
                "content": {
                  "type": "string",
                  "description": "The C# source text"
                }
              },
              "required": ["content"]
            }
            """;

    private static final String SCAN_PROJECT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "projectRoot": {
                  "type": "string",
                  "description": "The project root directory"
                }
              },
              "required": ["projectRoot"]
            }
            """;

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates and configures the MCP synchronous server with all tools.
     *
     * @param transportProvider the stdio transport provider
     * @param projectScanService the service that runs the checks
     * @param objectMapper the Jackson ObjectMapper for response serialization
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final ProjectScanService projectScanService,
            final ObjectMapper objectMapper) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("editor-guard", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        server.addTool(checkSourceTool(projectScanService, objectMapper));
        server.addTool(explainSourceTool(projectScanService, objectMapper));
        server.addTool(scanProjectTool(projectScanService, objectMapper));

        LOG.info("MCP stdio server initialized with 3 tools");

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    McpServerFeatures.SyncToolSpecification checkSourceTool(
            final ProjectScanService projectScanService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("check_source",
                        "Check a C# source file for UnityEditor usings"
                                + " that would break player builds."
                                + " Returns the UEA001 diagnostics with"
                                + " line and column. Pass the file path"
                                + " so files under Editor folders are"
                                + " recognized.",
                        CHECK_SOURCE_SCHEMA),
                (exchange, arguments) -> {
                    final String path = (String) arguments.get("path");
                    final String content = (String) arguments.get("content");

                    try {
                        final var result = projectScanService
                                .checkSource(path, content);
                        return toCallToolResult(objectMapper, result);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    McpServerFeatures.SyncToolSpecification explainSourceTool(
            final ProjectScanService projectScanService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("explain_source",
                        "List every using directive of a C# source file"
                                + " with the verdict of the UnityEditor"
                                + " check: ignored namespace, excluded by"
                                + " Editor folder, out of scope, guarded"
                                + " (with the guarding condition) or"
                                + " reported.",
                        CHECK_SOURCE_SCHEMA),
                (exchange, arguments) -> {
                    final String path = (String) arguments.get("path");
                    final String content = (String) arguments.get("content");

                    try {
                        final var result = projectScanService
                                .explainSource(path, content);
                        return toCallToolResult(objectMapper, result);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    McpServerFeatures.SyncToolSpecification scanProjectTool(
            final ProjectScanService projectScanService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("scan_project",
                        "Scan every C# source file of a Unity project"
                                + " and report UnityEditor usings outside"
                                + " Editor folders and #if UNITY_EDITOR"
                                + " blocks.",
                        SCAN_PROJECT_SCHEMA),
                (exchange, arguments) -> {
                    final String projectRoot =
                            (String) arguments.get("projectRoot");

                    try {
                        final var result = projectScanService
                                .scanProject(projectRoot);
                        return toCallToolResult(objectMapper, result);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private CallToolResult toCallToolResult(final ObjectMapper objectMapper,
            final Object result) {
        try {
            final String json = objectMapper.writeValueAsString(result);
            return new CallToolResult(
                    List.of(new McpSchema.TextContent(json)), false);
        } catch (final Exception e) {
            return errorResult(e);
        }
    }

    private CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error", e);
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
