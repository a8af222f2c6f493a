package com.codesearch.transport;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.tools.CodeSearchTools;
import com.codesearch.tools.ToolResult;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Embedded Jetty server exposing the tools over plain HTTP:
 *
 * <ul>
 *   <li>{@code GET /health} service status
 *   <li>{@code GET|POST /} discovery document
 *   <li>{@code POST /tools/list} tool definitions
 *   <li>{@code POST /tools/call} {@code {"name"|"tool": ..., "arguments": {...}}}
 *   <li>{@code /mcp} streamable HTTP tool protocol, served by the MCP SDK
 * </ul>
 */
public class HttpToolServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HttpToolServer.class);
    private static final String MCP_ENDPOINT = "/mcp";
    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final CodeSearchTools tools;
    private final McpToolBridge bridge;
    private final ObjectMapper mapper;
    private final String host;
    private final int port;
    private final Map<String, Object> health;
    private final Object lifecycleLock = new Object();
    private Server server;
    private McpSyncServer mcpServer;

    public HttpToolServer(CodeSearchTools tools,
            McpToolBridge bridge,
            ObjectMapper mapper,
            String host,
            int port,
            Map<String, Object> health) {
        this.tools = tools;
        this.bridge = bridge;
        this.mapper = mapper;
        this.host = host;
        this.port = port;
        this.health = health;
    }

    public void start() throws Exception {
        synchronized (lifecycleLock) {
            if (server != null && server.isStarted()) {
                return;
            }
            server = new Server();
            ServerConnector connector = new ServerConnector(server);
            connector.setHost(host);
            connector.setPort(port);
            server.addConnector(connector);

            ServletContextHandler context = new ServletContextHandler();
            context.setContextPath("/");
            context.addServlet(new ServletHolder(new HealthServlet()), "/health");
            context.addServlet(new ServletHolder(new ToolListServlet()), "/tools/list");
            context.addServlet(new ServletHolder(new ToolCallServlet()), "/tools/call");
            HttpServletStreamableServerTransportProvider mcpTransport = HttpServletStreamableServerTransportProvider.builder()
                    .jsonMapper(McpJsonMapper.createDefault())
                    .mcpEndpoint(MCP_ENDPOINT)
                    .build();
            mcpServer = bridge.serve(mcpTransport);
            ServletHolder mcpHolder = new ServletHolder(mcpTransport);
            mcpHolder.setAsyncSupported(true);
            context.addServlet(mcpHolder, MCP_ENDPOINT);
            context.addServlet(new ServletHolder(new DiscoveryServlet()), "/");
            server.setHandler(context);

            server.start();
            log.info("Code search HTTP server running on http://{}:{}", host, getPort());
            log.info("Health check: http://{}:{}/health", host, getPort());
        }
    }

    public int getPort() {
        synchronized (lifecycleLock) {
            if (server != null && server.isStarted()) {
                return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
            }
            return port;
        }
    }

    public void join() throws InterruptedException {
        Server current;
        synchronized (lifecycleLock) {
            current = server;
        }
        if (current != null) {
            current.join();
        }
    }

    @Override
    public void close() throws Exception {
        synchronized (lifecycleLock) {
            try {
                if (mcpServer != null) {
                    mcpServer.closeGracefully();
                }
            } finally {
                mcpServer = null;
                if (server != null) {
                    try {
                        server.stop();
                    } finally {
                        server = null;
                    }
                }
            }
        }
    }

    private abstract class JsonServlet extends HttpServlet {
        @Override
        protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException, ServletException {
            resp.setHeader("Access-Control-Allow-Origin", "*");
            resp.setHeader("Access-Control-Allow-Methods", "GET, POST, PUT, DELETE, OPTIONS");
            resp.setHeader("Access-Control-Allow-Headers",
                    "Origin, X-Requested-With, Content-Type, Accept, Authorization, x-api-key");
            if ("OPTIONS".equals(req.getMethod())) {
                resp.setStatus(HttpServletResponse.SC_OK);
                return;
            }
            super.service(req, resp);
        }

        void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
            resp.setStatus(status);
            resp.setContentType("application/json");
            resp.setCharacterEncoding("UTF-8");
            mapper.writeValue(resp.getOutputStream(), body);
        }

        JsonNode readBody(HttpServletRequest req) throws IOException {
            JsonNode body = mapper.readTree(req.getInputStream());
            return body == null ? mapper.createObjectNode() : body;
        }
    }

    private final class HealthServlet extends JsonServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "healthy");
            body.putAll(health);
            writeJson(resp, HttpServletResponse.SC_OK, body);
        }
    }

    private final class DiscoveryServlet extends JsonServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            String path = req.getServletPath() + (req.getPathInfo() == null ? "" : req.getPathInfo());
            if (!path.isEmpty() && !"/".equals(path)) {
                writeJson(resp, HttpServletResponse.SC_NOT_FOUND, Map.of("error", "Not found: " + path));
                return;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("name", health.getOrDefault("service", "code-search"));
            body.put("version", health.getOrDefault("version", ""));
            body.put("protocol", "mcp");
            body.put("capabilities", List.of("tools"));
            body.put("endpoints", Map.of(
                    "tools/list", "POST - List available tools",
                    "tools/call", "POST - Call a specific tool",
                    "mcp", "POST - Streamable HTTP tool protocol",
                    "health", "GET - Health check"));
            writeJson(resp, HttpServletResponse.SC_OK, body);
        }

        @Override
        protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            doGet(req, resp);
        }
    }

    private final class ToolListServlet extends JsonServlet {
        @Override
        protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            writeJson(resp, HttpServletResponse.SC_OK, Map.of("tools", tools.definitions()));
        }
    }

    private final class ToolCallServlet extends JsonServlet {
        @Override
        protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            JsonNode body;
            try {
                body = readBody(req);
            } catch (IOException e) {
                writeJson(resp, HttpServletResponse.SC_BAD_REQUEST, Map.of("error", "Invalid JSON body"));
                return;
            }
            String toolName = body.path("name").asText(body.path("tool").asText(""));
            if (toolName.isBlank()) {
                writeJson(resp, HttpServletResponse.SC_BAD_REQUEST,
                        Map.of("error", "Tool name is required (use \"name\" or \"tool\" field)"));
                return;
            }
            JsonNode argumentsNode = body.path("arguments");
            Map<String, Object> arguments;
            try {
                arguments = argumentsNode.isObject() ? mapper.convertValue(argumentsNode, ARGUMENTS_TYPE) : Map.of();
            } catch (IllegalArgumentException e) {
                writeJson(resp, HttpServletResponse.SC_BAD_REQUEST, Map.of("error", "Invalid tool arguments"));
                return;
            }
            log.info("HTTP tool call {}", toolName);
            ToolResult result = tools.call(toolName, arguments);
            writeJson(resp, HttpServletResponse.SC_OK, toolResultNode(result));
        }

        private ObjectNode toolResultNode(ToolResult result) {
            ObjectNode node = mapper.createObjectNode();
            ObjectNode text = node.putArray("content").addObject();
            text.put("type", "text");
            text.put("text", result.text());
            node.put("isError", result.error());
            return node;
        }
    }
}
