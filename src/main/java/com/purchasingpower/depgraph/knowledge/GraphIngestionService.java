package com.purchasingpower.depgraph.knowledge;

/**
 * Write path into the graph for the extraction layer.
 *
 * <p>A file is always replaced wholesale: the nodes from its previous analysis
 * are removed before the new batch is written, and one data-change
 * notification is published per call.
 *
 * @since 2.0.0
 */
public interface GraphIngestionService {

    /**
     * Replace the graph content of one file.
     *
     * @param batch Nodes and asserted edges of the file
     * @return Counts of what was written and removed
     * @throws IllegalArgumentException if a node belongs to another file or an edge carries provenance
     */
    IngestionResult ingest(FileAnalysisBatch batch);

    /**
     * Remove every node of a file, together with their outgoing edges.
     *
     * @return Number of nodes removed
     */
    int removeFile(String projectName, String filePath);
}
