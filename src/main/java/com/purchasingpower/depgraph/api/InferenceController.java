package com.purchasingpower.depgraph.api;

import com.purchasingpower.depgraph.exception.InferenceException;
import com.purchasingpower.depgraph.exception.NodeNotFoundException;
import com.purchasingpower.depgraph.inference.GraphValidationReport;
import com.purchasingpower.depgraph.inference.HierarchicalOptions;
import com.purchasingpower.depgraph.inference.InferenceEngine;
import com.purchasingpower.depgraph.inference.InferenceResult;
import com.purchasingpower.depgraph.inference.InferenceSummary;
import com.purchasingpower.depgraph.inference.InheritableOptions;
import com.purchasingpower.depgraph.inference.TransitiveOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * REST controller exposing the inference primitives over the primary graph.
 *
 * @since 2.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/inference")
@RequiredArgsConstructor
public class InferenceController {

    private final InferenceEngine inferenceEngine;

    /**
     * GET /api/v1/inference/hierarchical?root=...&edgeType=contains
     */
    @GetMapping("/hierarchical")
    public ResponseEntity<?> hierarchical(@RequestParam String root,
                                          @RequestParam String edgeType,
                                          @RequestParam(defaultValue = "true") boolean includeChildren,
                                          @RequestParam(required = false) Integer maxDepth,
                                          @RequestParam(defaultValue = "false") boolean includeSubtypes,
                                          @RequestParam(required = false) Long timeoutMs) {
        HierarchicalOptions options = HierarchicalOptions.defaults().toBuilder()
            .includeChildren(includeChildren)
            .maxDepth(maxDepth != null ? maxDepth : Integer.MAX_VALUE)
            .includeSubtypes(includeSubtypes)
            .timeout(toDuration(timeoutMs))
            .build();
        return run(() -> inferenceEngine.inferHierarchical(root, edgeType, options));
    }

    /**
     * GET /api/v1/inference/transitive?root=...&edgeType=depends_on
     */
    @GetMapping("/transitive")
    public ResponseEntity<?> transitive(@RequestParam String root,
                                        @RequestParam String edgeType,
                                        @RequestParam(defaultValue = "10") int maxPathLength,
                                        @RequestParam(defaultValue = "true") boolean includeIntermediate,
                                        @RequestParam(required = false) Long timeoutMs) {
        TransitiveOptions options = TransitiveOptions.defaults().toBuilder()
            .maxPathLength(maxPathLength)
            .includeIntermediate(includeIntermediate)
            .timeout(toDuration(timeoutMs))
            .build();
        return run(() -> inferenceEngine.inferTransitive(root, edgeType, options));
    }

    /**
     * GET /api/v1/inference/inheritable?root=...&edgeType=calls
     */
    @GetMapping("/inheritable")
    public ResponseEntity<?> inheritable(@RequestParam String root,
                                         @RequestParam String edgeType,
                                         @RequestParam(defaultValue = "true") boolean includeInherited,
                                         @RequestParam(required = false) Integer maxInheritanceDepth,
                                         @RequestParam(required = false) Long timeoutMs) {
        InheritableOptions options = InheritableOptions.defaults().toBuilder()
            .includeInherited(includeInherited)
            .maxInheritanceDepth(maxInheritanceDepth != null ? maxInheritanceDepth : Integer.MAX_VALUE)
            .timeout(toDuration(timeoutMs))
            .build();
        return run(() -> inferenceEngine.inferInheritable(root, edgeType, options));
    }

    /**
     * Every inference kind for the given edge types, all registered types when none are given.
     *
     * GET /api/v1/inference/all?root=...&edgeTypes=calls,contains
     */
    @GetMapping("/all")
    public ResponseEntity<?> all(@RequestParam String root,
                                 @RequestParam(required = false) List<String> edgeTypes) {
        try {
            InferenceSummary summary = inferenceEngine.inferAll(root, edgeTypes);
            return ResponseEntity.ok(summary);
        } catch (NodeNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
        } catch (Exception e) {
            log.error("Inference over all edge types failed for {}", root, e);
            return ResponseEntity.internalServerError().body(ErrorResponse.of("Inference failed: " + e.getMessage()));
        }
    }

    /**
     * GET /api/v1/inference/validate
     */
    @GetMapping("/validate")
    public ResponseEntity<?> validate() {
        try {
            GraphValidationReport report = inferenceEngine.validate();
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            log.error("Graph validation failed", e);
            return ResponseEntity.internalServerError().body(ErrorResponse.of("Validation failed: " + e.getMessage()));
        }
    }

    private ResponseEntity<?> run(Supplier<InferenceResult> inference) {
        try {
            return ResponseEntity.ok(inference.get());
        } catch (NodeNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
        } catch (InferenceException e) {
            log.error("Inference failed", e);
            return ResponseEntity.internalServerError().body(ErrorResponse.of(e.getMessage()));
        }
    }

    private static Duration toDuration(Long timeoutMs) {
        return timeoutMs == null ? null : Duration.ofMillis(timeoutMs);
    }
}
