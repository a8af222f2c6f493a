package com.codesearch.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.codesearch.LogCapture;
import com.codesearch.store.ChunkMetadata;
import com.codesearch.store.Include;
import com.codesearch.store.StubCollection;

import ch.qos.logback.classic.Level;

class ProjectRegistryTest {

    @Test
    void shouldReportEmptyStore() {
        StubCollection collection = new StubCollection();

        ProjectListing listing = new ProjectRegistry(collection, 100).listProjects();

        assertEquals("No projects indexed yet.", listing.toMarkdown());
        assertNull(collection.lastFilter);
        assertEquals(EnumSet.of(Include.METADATAS), collection.lastInclude);
    }

    @Test
    void shouldGroupByProjectUsingFirstSeenDisplayFields() {
        StubCollection collection = new StubCollection()
                .withRecord("api_chunk_0", null, metadata("api", "API", "/srv/api", "2024-01-01T00:00:00Z"))
                .withRecord("web_chunk_0", null, metadata("web", "Web", "/srv/web", "2024-02-01T00:00:00Z"))
                .withRecord("api_chunk_1", null, metadata("api", "API renamed", "/srv/api2", "2024-03-01T00:00:00Z"))
                .withRecord("orphan", null, new ChunkMetadata("x.py", "py", 0, null, "Nobody", null, null, null))
                .withRecord("blank", null, new ChunkMetadata("y.py", "py", 0, "", "Blank", null, null, null));

        ProjectListing listing = new ProjectRegistry(collection, 100).listProjects();

        assertEquals(5, listing.scannedRecords());
        List<ProjectSummary> projects = listing.projects();
        assertEquals(2, projects.size());
        assertEquals("API", projects.get(0).projectName());
        assertEquals("/srv/api", projects.get(0).projectPath());
        assertEquals(2, projects.get(0).chunkCount());
        assertEquals(1, projects.get(1).chunkCount());
        assertEquals("# Indexed Projects (2)\n\n"
                + "## API\n- **ID:** api\n- **Path:** /srv/api\n- **Source:** local\n- **Chunks:** 2\n\n"
                + "## Web\n- **ID:** web\n- **Path:** /srv/web\n- **Source:** local\n- **Chunks:** 1\n\n",
                listing.toMarkdown());
    }

    @Test
    void shouldWarnWhenScanLimitIsReached() {
        StubCollection collection = new StubCollection()
                .withRecord("a_chunk_0", null, metadata("a", "A", "/a", "t"))
                .withRecord("a_chunk_1", null, metadata("a", "A", "/a", "t"))
                .withRecord("a_chunk_2", null, metadata("a", "A", "/a", "t"));
        LogCapture logs = new LogCapture();

        ProjectListing listing = new ProjectRegistry(collection, 2, logs.logger()).listProjects();

        assertEquals(2, listing.projects().get(0).chunkCount());
        assertTrue(logs.contains(Level.WARN, "limit of 2 records"));
    }

    private static ChunkMetadata metadata(String projectId, String projectName, String projectPath, String indexedAt) {
        return new ChunkMetadata("f.py", "py", 0, projectId, projectName, projectPath, "local", indexedAt);
    }
}
