package com.purchasingpower.depgraph.knowledge;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of writing one {@link FileAnalysisBatch}.
 *
 * @since 2.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {

    private String projectName;
    private String filePath;
    private int nodesWritten;
    private int edgesWritten;
    private int nodesRemoved;
    private long durationMs;

    public static IngestionResult of(FileAnalysisBatch batch, String filePath, int removed, long durationMs) {
        return IngestionResult.builder()
                .projectName(batch.getProjectName())
                .filePath(filePath)
                .nodesWritten(batch.getNodes().size())
                .edgesWritten(batch.getEdges().size())
                .nodesRemoved(removed)
                .durationMs(durationMs)
                .build();
    }
}
