package com.codesearch.tools;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.embedding.EmbeddingProvider;
import com.codesearch.embedding.ProviderInfo;
import com.codesearch.ingest.IndexRequest;
import com.codesearch.ingest.IndexingReport;
import com.codesearch.ingest.IndexingService;
import com.codesearch.query.ProjectRegistry;
import com.codesearch.query.QueryEngine;

/**
 * The tool operations every transport exposes. {@link #call} never throws: failures come back as
 * an error result whose text starts with {@code "Error: "}.
 */
public class CodeSearchTools {
    public static final String INDEX_LOCAL_PROJECT = "index_local_project";
    public static final String SEARCH_CODEBASE = "search_codebase";
    public static final String SEARCH_CODE = "search_code";
    public static final String SEARCH_BY_FILE_TYPE = "search_by_file_type";
    public static final String GET_FILE_CONTENT = "get_file_content";
    public static final String LIST_INDEXED_PROJECTS = "list_indexed_projects";
    public static final String GET_EMBEDDING_PROVIDER_INFO = "get_embedding_provider_info";

    private final IndexingService indexingService;
    private final QueryEngine queryEngine;
    private final ProjectRegistry projectRegistry;
    private final EmbeddingProvider embeddingProvider;
    private final Logger log;

    public CodeSearchTools(IndexingService indexingService,
            QueryEngine queryEngine,
            ProjectRegistry projectRegistry,
            EmbeddingProvider embeddingProvider) {
        this(indexingService, queryEngine, projectRegistry, embeddingProvider,
                LoggerFactory.getLogger(CodeSearchTools.class));
    }

    CodeSearchTools(IndexingService indexingService,
            QueryEngine queryEngine,
            ProjectRegistry projectRegistry,
            EmbeddingProvider embeddingProvider,
            Logger log) {
        this.indexingService = indexingService;
        this.queryEngine = queryEngine;
        this.projectRegistry = projectRegistry;
        this.embeddingProvider = embeddingProvider;
        this.log = log;
    }

    public ToolResult call(String name, Map<String, Object> arguments) {
        if (name == null || name.isBlank()) {
            return ToolResult.error("Tool name is required");
        }
        ToolArguments args = new ToolArguments(arguments);
        try {
            switch (name) {
                case INDEX_LOCAL_PROJECT:
                    return ToolResult.success(indexLocalProject(args));
                case SEARCH_CODEBASE:
                    return ToolResult.success(queryEngine.search(
                            args.requireString("query"),
                            args.optionalInt(QueryEngine.DEFAULT_LIMIT, "limit", "n_results"),
                            args.optionalString("project_filter")));
                case SEARCH_CODE:
                    return ToolResult.success(queryEngine.search(
                            args.requireString("query"),
                            args.optionalInt(QueryEngine.DEFAULT_LIMIT, "n_results", "limit"),
                            null));
                case SEARCH_BY_FILE_TYPE:
                    return ToolResult.success(queryEngine.searchByFileType(
                            args.requireString("file_type"),
                            args.optionalString("query"),
                            args.optionalInt(QueryEngine.DEFAULT_LIMIT, "n_results", "limit")));
                case GET_FILE_CONTENT:
                    return ToolResult.success(queryEngine.getFileContent(args.requireString("file_path")));
                case LIST_INDEXED_PROJECTS:
                    return ToolResult.success(projectRegistry.listProjects().toMarkdown());
                case GET_EMBEDDING_PROVIDER_INFO:
                    return ToolResult.success(renderProviderInfo(embeddingProvider.describe()));
                default:
                    return ToolResult.error("Unknown tool: " + name);
            }
        } catch (RuntimeException e) {
            log.warn("Tool {} failed: {}", name, e.getMessage(), e);
            return ToolResult.error(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private String indexLocalProject(ToolArguments args) {
        IndexingReport report = indexingService.index(new IndexRequest(
                Path.of(args.requireString("project_path")),
                args.requireString("project_name"),
                args.optionalStringList("include_patterns"),
                args.optionalStringList("exclude_patterns")));
        StringBuilder text = new StringBuilder()
                .append("Successfully indexed local project: ").append(report.projectName()).append('\n')
                .append("Project ID: ").append(report.projectId()).append('\n')
                .append("Project Path: ").append(report.projectPath()).append('\n')
                .append("Files processed: ").append(report.filesProcessed()).append('\n');
        if (report.filesFailed() > 0) {
            text.append("Files failed: ").append(report.filesFailed()).append('\n');
        }
        return text.append("Chunks created: ").append(report.chunksCreated()).append('\n')
                .append("Embedding provider: ").append(embeddingProvider.name())
                .toString();
    }

    static String renderProviderInfo(ProviderInfo info) {
        StringBuilder text = new StringBuilder()
                .append("# Embedding Provider Information\n\n")
                .append("**Current Provider:** ").append(info.provider()).append("\n\n");
        if (info.apiKeyConfigured() != null) {
            text.append("## OpenAI Configuration\n")
                    .append("- **Model:** ").append(info.model()).append('\n')
                    .append("- **API Key:** ").append(info.apiKeyConfigured() ? "Configured ✓" : "Not configured ✗").append('\n');
            return text.toString();
        }
        text.append("## Ollama Configuration\n")
                .append("- **Host:** ").append(info.host()).append('\n')
                .append("- **Model:** ").append(info.model()).append('\n');
        if (info.connection() == ProviderInfo.Connection.CONNECTED) {
            List<String> models = info.availableModels() == null ? List.of() : info.availableModels();
            text.append("- **Connection:** ✓ Connected\n")
                    .append("- **Available Models:** ").append(models.isEmpty() ? "None" : String.join(", ", models)).append('\n');
        } else if (info.connection() == ProviderInfo.Connection.FAILED) {
            text.append("- **Connection:** ✗ Failed to connect\n");
        } else {
            text.append("- **Connection:** ✗ Error connecting\n");
        }
        return text.toString();
    }

    public List<ToolDefinition> definitions() {
        return List.of(
                new ToolDefinition(INDEX_LOCAL_PROJECT,
                        "Index a local project directory into the vector database",
                        objectSchema(properties(
                                "project_path", stringProperty("Absolute path to the local project directory"),
                                "project_name", stringProperty("Name for the project (used as identifier)"),
                                "include_patterns", arrayProperty("File patterns to include (optional)"),
                                "exclude_patterns", arrayProperty("File patterns to exclude (optional)")),
                                List.of("project_path", "project_name"))),
                new ToolDefinition(SEARCH_CODEBASE,
                        "Search the indexed codebase using semantic search",
                        objectSchema(properties(
                                "query", stringProperty("Search query"),
                                "limit", numberProperty("Maximum number of results", QueryEngine.DEFAULT_LIMIT),
                                "project_filter", stringProperty("Filter by project id")),
                                List.of("query"))),
                new ToolDefinition(SEARCH_CODE,
                        "Search for code using semantic similarity",
                        objectSchema(properties(
                                "query", stringProperty("The search query to find relevant code"),
                                "n_results", numberProperty("Number of results to return (default: 10)", QueryEngine.DEFAULT_LIMIT)),
                                List.of("query"))),
                new ToolDefinition(SEARCH_BY_FILE_TYPE,
                        "Search for code by file type/extension",
                        objectSchema(properties(
                                "file_type", stringProperty("File extension without the leading dot (e.g., js, py, php)"),
                                "query", stringProperty("Optional text query to search within files of this type"),
                                "n_results", numberProperty("Number of results to return (default: 10)", QueryEngine.DEFAULT_LIMIT)),
                                List.of("file_type"))),
                new ToolDefinition(GET_FILE_CONTENT,
                        "Retrieve the full content of a specific file",
                        objectSchema(properties(
                                "file_path", stringProperty("Path to the file, relative to its project root")),
                                List.of("file_path"))),
                new ToolDefinition(LIST_INDEXED_PROJECTS,
                        "List all projects currently indexed",
                        objectSchema(Map.of(), List.of())),
                new ToolDefinition(GET_EMBEDDING_PROVIDER_INFO,
                        "Get information about the current embedding provider",
                        objectSchema(Map.of(), List.of())));
    }

    private static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    private static Map<String, Object> properties(Object... nameAndSchema) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i < nameAndSchema.length; i += 2) {
            properties.put((String) nameAndSchema[i], nameAndSchema[i + 1]);
        }
        return properties;
    }

    private static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }

    private static Map<String, Object> numberProperty(String description, int defaultValue) {
        return Map.of("type", "number", "description", description, "default", defaultValue);
    }

    private static Map<String, Object> arrayProperty(String description) {
        return Map.of("type", "array", "items", Map.of("type", "string"), "description", description);
    }
}
