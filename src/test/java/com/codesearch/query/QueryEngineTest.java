package com.codesearch.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.codesearch.store.ChunkMetadata;
import com.codesearch.store.Include;
import com.codesearch.store.MetadataField;
import com.codesearch.store.StubCollection;
import com.codesearch.store.WhereFilter;

class QueryEngineTest {

    @Test
    void shouldRenderSearchResultsWithThreeDecimalSimilarity() {
        StubCollection collection = new StubCollection()
                .withMatch("demo_chunk_0", "def connect():\n    pass", metadata("db/conn.py", "py", 0), 0.1234);

        String text = new QueryEngine(collection).search("database connection", 5, null);

        assertEquals("Found 1 results for: \"database connection\"\n\n"
                + "## Result 1 (Similarity: 0.877)\n"
                + "**File:** db/conn.py\n"
                + "**Project:** Demo\n"
                + "\n"
                + "```py\n"
                + "def connect():\n    pass\n"
                + "```\n", text);
        assertNull(collection.lastFilter);
        assertEquals(5, collection.lastLimit);
    }

    @Test
    void shouldSeparateResultsAndAllowNegativeSimilarity() {
        StubCollection collection = new StubCollection()
                .withMatch("r0", "a", metadata("a.py", "py", 0), 0.0)
                .withMatch("r1", "b", metadata("b.py", "py", 0), 1.5);

        String text = new QueryEngine(collection).search("q", 10, "demo");

        assertTrue(text.contains("## Result 1 (Similarity: 1.000)"));
        assertTrue(text.contains("```\n\n---\n\n## Result 2 (Similarity: -0.500)"));
        assertEquals(WhereFilter.eq(MetadataField.PROJECT_ID, "demo"), collection.lastFilter);
    }

    @Test
    void shouldReportEmptySearch() {
        assertEquals("No results found for your query.", new QueryEngine(new StubCollection()).search("q", 10, ""));
    }

    @Test
    void shouldSearchByFileTypeUsingTypeAsDefaultQuery() {
        StubCollection collection = new StubCollection()
                .withMatch("r0", "<?php echo 1;", metadata("index.php", "php", 0), 0.5);

        String text = new QueryEngine(collection).searchByFileType("php", null, 3);

        assertEquals("php", collection.lastQuery);
        assertEquals(WhereFilter.eq(MetadataField.FILE_TYPE, "php"), collection.lastFilter);
        assertTrue(text.startsWith("Found 1 results for file type \"php\":\n\n## Result 1 (Similarity: 0.500)\n"));
        assertTrue(text.contains("**Type:** php\n"));
    }

    @Test
    void shouldReportEmptyFileTypeSearch() {
        assertEquals("No results found for file type: rs",
                new QueryEngine(new StubCollection()).searchByFileType("rs", "unsafe", 10));
    }

    @Test
    void shouldReassembleFileInChunkIndexOrder() {
        StubCollection collection = new StubCollection()
                .withRecord("demo_chunk_2", "third", metadata("src/app.py", "py", 2))
                .withRecord("demo_chunk_0", "first", metadata("src/app.py", "py", 0))
                .withRecord("other_chunk_0", "unrelated", metadata("src/other.py", "py", 0))
                .withRecord("demo_chunk_1", "second", metadata("src/app.py", "py", 1));

        String text = new QueryEngine(collection).getFileContent("src/app.py");

        assertEquals("# File: src/app.py\n"
                + "**Project:** Demo\n"
                + "**Type:** py\n"
                + "**Chunks:** 3\n\n"
                + "```py\nfirst\nsecond\nthird\n```\n", text);
        assertTrue(collection.lastInclude.contains(Include.DOCUMENTS));
    }

    @Test
    void shouldReadMissingChunkIndexAsZero() {
        StubCollection collection = new StubCollection()
                .withRecord("r1", "later", metadata("a.py", "py", 1))
                .withRecord("r0", "unindexed", new ChunkMetadata("a.py", "py", null, "demo", "Demo", "/w", "local", "t"));

        String text = new QueryEngine(collection).getFileContent("a.py");

        assertTrue(text.contains("```py\nunindexed\nlater\n```"));
    }

    @Test
    void shouldReportMissingFile() {
        assertEquals("File not found: nope.py", new QueryEngine(new StubCollection()).getFileContent("nope.py"));
    }

    @Test
    void shouldRejectInvalidArguments() {
        QueryEngine engine = new QueryEngine(new StubCollection());

        assertThrows(IllegalArgumentException.class, () -> engine.search("q", 0, null));
        assertThrows(IllegalArgumentException.class, () -> engine.search(" ", 10, null));
        assertThrows(IllegalArgumentException.class, () -> engine.searchByFileType("", null, 10));
        assertThrows(IllegalArgumentException.class, () -> engine.getFileContent(null));
    }

    @Test
    void shouldFormatSimilarityWithoutClamping() {
        assertEquals("0.877", QueryEngine.formatSimilarity(0.1234));
        assertEquals("-1.000", QueryEngine.formatSimilarity(2.0));
    }

    private static ChunkMetadata metadata(String filePath, String fileType, int chunkIndex) {
        return new ChunkMetadata(filePath, fileType, chunkIndex, "demo", "Demo", "/work/demo", "local", "2024-01-01T00:00:00Z");
    }
}
