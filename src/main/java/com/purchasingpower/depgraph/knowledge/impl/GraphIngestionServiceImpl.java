package com.purchasingpower.depgraph.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.depgraph.core.Address;
import com.purchasingpower.depgraph.core.AddressCodec;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.knowledge.FileAnalysisBatch;
import com.purchasingpower.depgraph.knowledge.GraphIngestionService;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import com.purchasingpower.depgraph.knowledge.IngestionResult;
import com.purchasingpower.depgraph.realtime.DataChangeEvent;
import com.purchasingpower.depgraph.realtime.RealtimeQuerySystem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes analysis batches to the primary {@link GraphStore} and tells the
 * realtime layer about it.
 *
 * @since 2.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphIngestionServiceImpl implements GraphIngestionService {

    static final String TABLE = "files";

    private final GraphStore graphStore;
    private final RealtimeQuerySystem realtime;
    private final Clock clock;

    // Serializes delete-then-write so two batches of one file never interleave.
    private final Object writeLock = new Object();

    @Override
    public IngestionResult ingest(FileAnalysisBatch batch) {
        Preconditions.checkNotNull(batch, "batch");
        Preconditions.checkArgument(batch.getProjectName() != null && !batch.getProjectName().isBlank(),
                "Project name is required");
        String filePath = AddressCodec.normalizePath(batch.getFilePath());
        Preconditions.checkArgument(!filePath.isEmpty(), "File path is required");

        List<String> errors = validate(batch, filePath);
        if (!errors.isEmpty()) {
            log.warn("Rejected batch for {}/{}: {}", batch.getProjectName(), filePath, errors);
            throw new IllegalArgumentException("Invalid analysis batch for " + batch.getProjectName() + "/"
                    + filePath + ": " + String.join("; ", errors));
        }

        long start = System.currentTimeMillis();
        Set<String> touched = new LinkedHashSet<>();
        int removed;
        synchronized (writeLock) {
            List<String> previous = fileNodeIds(batch.getProjectName(), filePath);
            previous.forEach(graphStore::deleteNode);
            removed = previous.size();
            touched.addAll(previous);

            for (GraphNode node : batch.getNodes()) {
                graphStore.putNode(node);
                touched.add(node.getId());
            }
            batch.getEdges().forEach(graphStore::putEdge);
        }
        long duration = System.currentTimeMillis() - start;

        log.info("📥 Ingested {}/{}: {} nodes, {} edges ({} previous nodes replaced) in {} ms",
                batch.getProjectName(), filePath, batch.getNodes().size(), batch.getEdges().size(),
                removed, duration);

        DataChangeEvent.ChangeType type = removed > 0 ? DataChangeEvent.ChangeType.UPDATE
                : DataChangeEvent.ChangeType.INSERT;
        publish(type, batch.getProjectName(), filePath, touched);
        return IngestionResult.of(batch, filePath, removed, duration);
    }

    @Override
    public int removeFile(String projectName, String filePath) {
        String normalized = AddressCodec.normalizePath(filePath);
        List<String> removed;
        synchronized (writeLock) {
            removed = fileNodeIds(projectName, normalized);
            removed.forEach(graphStore::deleteNode);
        }
        if (!removed.isEmpty()) {
            log.info("🗑️ Removed {} nodes of {}/{}", removed.size(), projectName, normalized);
            publish(DataChangeEvent.ChangeType.DELETE, projectName, normalized, new LinkedHashSet<>(removed));
        }
        return removed.size();
    }

    private List<String> validate(FileAnalysisBatch batch, String filePath) {
        List<String> errors = new ArrayList<>();
        for (GraphNode node : batch.getNodes()) {
            if (!belongsTo(node.getAddress(), batch.getProjectName(), filePath)) {
                errors.add("Node " + node.getId() + " does not belong to the file");
            }
        }
        for (GraphEdge edge : batch.getEdges()) {
            if (edge.isInferred()) {
                errors.add("Edge " + edge.key() + " carries provenance; only asserted edges can be ingested");
            }
            if (!belongsTo(edge.getFrom(), batch.getProjectName(), filePath)) {
                errors.add("Edge " + edge.key() + " does not start in the file");
            }
        }
        return errors;
    }

    private List<String> fileNodeIds(String projectName, String filePath) {
        return graphStore.allNodes(node -> belongsTo(node.getAddress(), projectName, filePath)).stream()
                .map(GraphNode::getId)
                .toList();
    }

    private static boolean belongsTo(Address address, String projectName, String filePath) {
        return address.getProjectName().equals(projectName) && address.getFilePath().equals(filePath);
    }

    private void publish(DataChangeEvent.ChangeType type, String projectName, String filePath, Set<String> addresses) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("projectName", projectName);
        record.put("filePath", filePath);
        record.put(DataChangeEvent.ADDRESSES, List.copyOf(addresses));
        realtime.notifyDataChange(new DataChangeEvent(type, TABLE, record, clock.instant()));
    }
}
