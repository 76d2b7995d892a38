package com.purchasingpower.depgraph.knowledge;

import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the extraction layer produced for one file in one analysis run.
 *
 * @since 2.0.0
 */
@Value
@Builder
public class FileAnalysisBatch {

    String projectName;

    String filePath;

    @Singular
    List<GraphNode> nodes;

    @Singular
    List<GraphEdge> edges;
}
