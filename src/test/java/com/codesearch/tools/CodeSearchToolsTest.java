package com.codesearch.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.codesearch.embedding.HashingEmbeddingProvider;
import com.codesearch.embedding.ProviderInfo;
import com.codesearch.ingest.BatchIngestor;
import com.codesearch.ingest.FileDiscoverer;
import com.codesearch.ingest.IndexingService;
import com.codesearch.ingest.PatternMatcher;
import com.codesearch.ingest.StreamingChunker;
import com.codesearch.query.ProjectRegistry;
import com.codesearch.query.QueryEngine;
import com.codesearch.store.LocalJsonVectorStore;
import com.codesearch.store.VectorCollection;

class CodeSearchToolsTest {

    @TempDir
    Path tempDir;

    private CodeSearchTools tools;
    private Path project;

    @BeforeEach
    void setUp() throws Exception {
        HashingEmbeddingProvider embeddings = new HashingEmbeddingProvider(128);
        VectorCollection collection = new LocalJsonVectorStore().createOrGetCollection("code", embeddings);
        tools = new CodeSearchTools(
                new IndexingService(collection, new FileDiscoverer(new PatternMatcher()), new StreamingChunker(), new BatchIngestor()),
                new QueryEngine(collection),
                new ProjectRegistry(collection, ProjectRegistry.DEFAULT_SCAN_LIMIT),
                embeddings);
        project = tempDir.resolve("shop");
        Files.createDirectories(project.resolve("src"));
        Files.writeString(project.resolve("src/cart.py"), "class Cart:\n    def total(self):\n        return sum(self.items)\n");
        Files.writeString(project.resolve("src/checkout.js"), "export function checkout(cart) { return pay(cart); }\n");
        Files.writeString(project.resolve("README.md"), "# Shop\nCart and checkout.\n");
    }

    @Test
    void shouldSummarizeIndexingRun() {
        ToolResult result = index("Shop App");

        assertFalse(result.error());
        assertEquals("Successfully indexed local project: Shop App\n"
                + "Project ID: shop_app\n"
                + "Project Path: " + project + "\n"
                + "Files processed: 3\n"
                + "Chunks created: 3\n"
                + "Embedding provider: hashing", result.text());
    }

    @Test
    void shouldSearchListAndFetchAfterIndexing() {
        index("shop");

        ToolResult search = tools.call(CodeSearchTools.SEARCH_CODEBASE, Map.of("query", "cart total", "limit", 1));
        ToolResult searchCode = tools.call(CodeSearchTools.SEARCH_CODE, Map.of("query", "checkout", "n_results", "2"));
        ToolResult byType = tools.call(CodeSearchTools.SEARCH_BY_FILE_TYPE, Map.of("file_type", "js"));
        ToolResult file = tools.call(CodeSearchTools.GET_FILE_CONTENT, Map.of("file_path", "src/cart.py"));
        ToolResult projects = tools.call(CodeSearchTools.LIST_INDEXED_PROJECTS, Map.of());

        assertTrue(search.text().startsWith("Found 1 results for: \"cart total\""));
        assertTrue(searchCode.text().startsWith("Found 2 results for: \"checkout\""));
        assertTrue(byType.text().contains("**File:** src/checkout.js"));
        assertTrue(file.text().startsWith("# File: src/cart.py\n**Project:** shop\n**Type:** py\n**Chunks:** 1"));
        assertTrue(projects.text().contains("## shop\n- **ID:** shop\n"));
        assertTrue(projects.text().contains("- **Chunks:** 3"));
    }

    @Test
    void shouldRenderSimilarityWithThreeDecimals() throws Exception {
        Files.writeString(project.resolve("src/auth.py"), "def authenticate(user, password):\n    return check(user, password)\n");
        index("shop");

        ToolResult result = tools.call(CodeSearchTools.SEARCH_CODEBASE, Map.of("query", "authenticate user", "limit", 5));

        assertTrue(result.text().contains("**File:** src/auth.py"));
        assertTrue(Pattern.compile("## Result 1 \\(Similarity: -?\\d+\\.\\d{3}\\)\n").matcher(result.text()).find());
    }

    @Test
    void shouldFilterSearchByProject() {
        index("shop");

        ToolResult result = tools.call(CodeSearchTools.SEARCH_CODEBASE, Map.of("query", "cart", "project_filter", "other"));

        assertEquals("No results found for your query.", result.text());
    }

    @Test
    void shouldRenderFailuresAsErrorResults() {
        ToolResult unknown = tools.call("drop_everything", Map.of());
        ToolResult missingArgument = tools.call(CodeSearchTools.SEARCH_CODE, Map.of());
        ToolResult badPath = tools.call(CodeSearchTools.INDEX_LOCAL_PROJECT,
                Map.of("project_path", tempDir.resolve("missing").toString(), "project_name", "x"));
        ToolResult badLimit = tools.call(CodeSearchTools.SEARCH_CODEBASE, Map.of("query", "q", "limit", "many"));

        assertTrue(unknown.error());
        assertEquals("Error: Unknown tool: drop_everything", unknown.text());
        assertEquals("Error: Missing required argument: query", missingArgument.text());
        assertEquals("Error: Cannot access project path: " + tempDir.resolve("missing"), badPath.text());
        assertTrue(badLimit.error());
    }

    @Test
    void shouldHonorPatternArguments() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("project_path", project.toString());
        arguments.put("project_name", "shop");
        arguments.put("include_patterns", List.of("*.py"));

        ToolResult result = tools.call(CodeSearchTools.INDEX_LOCAL_PROJECT, arguments);

        assertTrue(result.text().contains("Files processed: 1\n"));
    }

    @Test
    void shouldRenderProviderInformation() {
        String openAi = CodeSearchTools.renderProviderInfo(
                new ProviderInfo("openai", "text-embedding-3-small", "https://api.openai.com", true, null, List.of()));
        String ollamaUp = CodeSearchTools.renderProviderInfo(
                new ProviderInfo("ollama", "nomic-embed-text", "http://localhost:11434", null, ProviderInfo.Connection.CONNECTED, List.of("a", "b")));
        String ollamaEmpty = CodeSearchTools.renderProviderInfo(
                new ProviderInfo("ollama", "nomic-embed-text", "http://localhost:11434", null, ProviderInfo.Connection.CONNECTED, List.of()));
        String ollamaDown = CodeSearchTools.renderProviderInfo(
                new ProviderInfo("ollama", "nomic-embed-text", "http://localhost:11434", null, ProviderInfo.Connection.FAILED, List.of()));
        String ollamaUnreachable = CodeSearchTools.renderProviderInfo(
                new ProviderInfo("ollama", "nomic-embed-text", "http://localhost:11434", null, ProviderInfo.Connection.ERROR, List.of()));

        assertTrue(openAi.contains("## OpenAI Configuration\n- **Model:** text-embedding-3-small\n- **API Key:** Configured ✓"));
        assertTrue(ollamaUp.contains("- **Connection:** ✓ Connected\n- **Available Models:** a, b"));
        assertTrue(ollamaEmpty.contains("- **Available Models:** None"));
        assertTrue(ollamaDown.contains("- **Connection:** ✗ Failed to connect"));
        assertTrue(ollamaUnreachable.contains("- **Connection:** ✗ Error connecting"));
        assertFalse(ollamaUnreachable.contains("Failed to connect"));
        assertTrue(ollamaDown.startsWith("# Embedding Provider Information\n\n**Current Provider:** ollama"));
    }

    @Test
    void shouldDescribeEverySupportedTool() {
        List<String> names = tools.definitions().stream().map(ToolDefinition::name).collect(Collectors.toList());

        assertEquals(List.of(
                CodeSearchTools.INDEX_LOCAL_PROJECT,
                CodeSearchTools.SEARCH_CODEBASE,
                CodeSearchTools.SEARCH_CODE,
                CodeSearchTools.SEARCH_BY_FILE_TYPE,
                CodeSearchTools.GET_FILE_CONTENT,
                CodeSearchTools.LIST_INDEXED_PROJECTS,
                CodeSearchTools.GET_EMBEDDING_PROVIDER_INFO), names);
        assertEquals(List.of("project_path", "project_name"), tools.definitions().get(0).inputSchema().get("required"));
    }

    private ToolResult index(String name) {
        return tools.call(CodeSearchTools.INDEX_LOCAL_PROJECT, Map.of("project_path", project.toString(), "project_name", name));
    }
}
