package com.codesearch.query;

import java.util.List;

public record ProjectListing(int scannedRecords, List<ProjectSummary> projects) {

    public String toMarkdown() {
        if (scannedRecords == 0) {
            return "No projects indexed yet.";
        }
        StringBuilder builder = new StringBuilder();
        builder.append("# Indexed Projects (").append(projects.size()).append(")\n\n");
        for (ProjectSummary project : projects) {
            builder.append("## ").append(project.projectName()).append('\n')
                    .append("- **ID:** ").append(project.projectId()).append('\n')
                    .append("- **Path:** ").append(project.projectPath()).append('\n')
                    .append("- **Source:** ").append(project.sourceType()).append('\n')
                    .append("- **Chunks:** ").append(project.chunkCount()).append("\n\n");
        }
        return builder.toString();
    }
}
