package com.codesearch.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.tools.CodeSearchTools;
import com.codesearch.tools.ToolDefinition;
import com.codesearch.tools.ToolResult;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import io.modelcontextprotocol.spec.McpStreamableServerTransportProvider;

/**
 * Publishes {@link CodeSearchTools} through the MCP SDK. The SDK owns the protocol (version
 * negotiation, request routing, error codes); every tool call is delegated to
 * {@link CodeSearchTools#call}.
 */
public class McpToolBridge {
    private static final Logger log = LoggerFactory.getLogger(McpToolBridge.class);

    private final CodeSearchTools tools;
    private final String serverName;
    private final String serverVersion;

    public McpToolBridge(CodeSearchTools tools, String serverName, String serverVersion) {
        this.tools = tools;
        this.serverName = serverName;
        this.serverVersion = serverVersion;
    }

    /** Starts a single-session server, used for stdio. */
    public McpSyncServer serve(McpServerTransportProvider transport) {
        return McpServer.sync(transport)
                .serverInfo(serverName, serverVersion)
                .capabilities(capabilities())
                .tools(toolSpecifications())
                .build();
    }

    /** Starts a multi-session server, used for streamable HTTP. */
    public McpSyncServer serve(McpStreamableServerTransportProvider transport) {
        return McpServer.sync(transport)
                .serverInfo(serverName, serverVersion)
                .capabilities(capabilities())
                .tools(toolSpecifications())
                .build();
    }

    List<McpServerFeatures.SyncToolSpecification> toolSpecifications() {
        List<McpServerFeatures.SyncToolSpecification> specifications = new ArrayList<>();
        for (ToolDefinition definition : tools.definitions()) {
            specifications.add(McpServerFeatures.SyncToolSpecification.builder()
                    .tool(McpSchema.Tool.builder()
                            .name(definition.name())
                            .description(definition.description())
                            .inputSchema(inputSchema(definition.inputSchema()))
                            .build())
                    .callHandler((exchange, request) -> {
                        Map<String, Object> arguments = request.arguments() == null ? Map.of() : request.arguments();
                        log.debug("MCP tool call {}", request.name());
                        return toCallToolResult(tools.call(request.name(), arguments));
                    })
                    .build());
        }
        return specifications;
    }

    static McpSchema.CallToolResult toCallToolResult(ToolResult result) {
        return McpSchema.CallToolResult.builder()
                .addTextContent(result.text())
                .isError(result.error())
                .build();
    }

    @SuppressWarnings("unchecked")
    private static McpSchema.JsonSchema inputSchema(Map<String, Object> schema) {
        Object properties = schema.getOrDefault("properties", Map.of());
        Object required = schema.getOrDefault("required", List.of());
        return new McpSchema.JsonSchema(
                (String) schema.getOrDefault("type", "object"),
                (Map<String, Object>) properties,
                (List<String>) required,
                null,
                Map.of(),
                Map.of());
    }

    private static McpSchema.ServerCapabilities capabilities() {
        return McpSchema.ServerCapabilities.builder().tools(true).build();
    }
}
