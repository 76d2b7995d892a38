package com.purchasingpower.depgraph.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.depgraph.core.Address;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.core.NodeType;
import com.purchasingpower.depgraph.knowledge.FileAnalysisBatch;
import com.purchasingpower.depgraph.knowledge.GraphIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for QueryController.
 *
 * Seeds project {@code shop}: Order depends_on Cart.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class QueryControllerTest {

    private static final Address CART = Address.of("shop", "src/Cart.ts", NodeType.CLASS, "Cart");
    private static final Address ORDER = Address.of("shop", "src/Order.ts", NodeType.CLASS, "Order");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private GraphIngestionService ingestion;

    @BeforeEach
    void seed() {
        ingestion.ingest(FileAnalysisBatch.builder()
                .projectName("shop").filePath("src/Cart.ts")
                .node(GraphNode.of(CART))
                .build());
        ingestion.ingest(FileAnalysisBatch.builder()
                .projectName("shop").filePath("src/Order.ts")
                .node(GraphNode.of(ORDER))
                .edge(GraphEdge.asserted(ORDER, CART, "depends_on"))
                .build());
    }

    private ResultActions query(String text, String queryType) throws Exception {
        QueryRequest request = QueryRequest.builder().query(text).queryType(queryType).build();
        return mockMvc.perform(post("/api/v1/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)));
    }

    @Test
    void sqlQuery_shouldReturnOrderedRows() throws Exception {
        query("SELECT symbolName FROM classes WHERE projectName = 'shop' ORDER BY symbolName", "SQL")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.queryType").value("SQL"))
            .andExpect(jsonPath("$.totalMatched").value(2))
            .andExpect(jsonPath("$.rows[0].symbolName").value("Cart"))
            .andExpect(jsonPath("$.rows[1].symbolName").value("Order"));
    }

    @Test
    void missingQueryType_shouldBeDetected() throws Exception {
        query("{ nodes(type: \"Class\", projectName: \"shop\") { symbolName } }", null)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.queryType").value("GraphQL"))
            .andExpect(jsonPath("$.rows.length()").value(2));
    }

    @Test
    void traversal_shouldFollowEdgesFromRoot() throws Exception {
        query("MATCH * TRAVERSE depends_on FROM '" + ORDER.toCanonical() + "'", "SQL")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rows.length()").value(1))
            .andExpect(jsonPath("$.rows[0].address").value(CART.toCanonical()))
            .andExpect(jsonPath("$.rows[0].depth").value(1));
    }

    @Test
    void invalidRequests_shouldReturnBadRequest() throws Exception {
        query("  ", "SQL")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Query is required"));
        query("SELECT FROM", "SQL")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error", containsString("at position")));
        query("MATCH Class", "Cypher")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unsupported query dialect: Cypher"));
    }

    @Test
    void unknownRoot_shouldReturnNotFound() throws Exception {
        query("MATCH * TRAVERSE depends_on FROM 'shop/src/Gone.ts#Class:Gone'", "SQL")
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Node not found: shop/src/Gone.ts#Class:Gone"));
    }

    @Test
    void cacheEndpoint_shouldReportStatsAndRejectUnknownActions() throws Exception {
        mockMvc.perform(post("/api/v1/query/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.maxSize").value(1000));
        mockMvc.perform(post("/api/v1/query/cache/clear"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.size").value(0));
        mockMvc.perform(post("/api/v1/query/cache/shrink"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown cache action: shrink"));
    }
}
