package com.purchasingpower.depgraph.query.parser;

import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.NodeType;
import com.purchasingpower.depgraph.exception.QuerySyntaxException;
import com.purchasingpower.depgraph.query.AttributeFilter;
import com.purchasingpower.depgraph.query.FilterOperator;
import com.purchasingpower.depgraph.query.QueryDialect;
import com.purchasingpower.depgraph.query.QueryPlan;
import com.purchasingpower.depgraph.query.TraversalMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SQL query parser")
class SqlQueryParserTest {

    private final SqlQueryParser parser = new SqlQueryParser();

    @Test
    void selectWithProjectionFilterOrderAndPaging() {
        // When
        QueryPlan plan = parser.parse(
                "SELECT name, file AS source FROM classes, interfaces "
                        + "WHERE project = 'shop' AND metadata.loc >= 100 "
                        + "ORDER BY name DESC LIMIT 10 OFFSET 5;");

        // Then
        assertThat(plan.getDialect()).isEqualTo(QueryDialect.SQL);
        assertThat(plan.getNodeTypes()).containsExactly(NodeType.CLASS, NodeType.INTERFACE);
        assertThat(plan.getProjection()).containsExactly(
                new QueryPlan.Projection("symbolName", "symbolName"),
                new QueryPlan.Projection("filePath", "source"));
        assertThat(plan.getFilterGroups()).containsExactly(List.of(
                new AttributeFilter("projectName", FilterOperator.EQ, "shop"),
                new AttributeFilter("metadata.loc", FilterOperator.GE, 100L)));
        assertThat(plan.getOrderBy()).isEqualTo(new QueryPlan.OrderBy("symbolName", true));
        assertThat(plan.getLimit()).isEqualTo(10);
        assertThat(plan.getOffset()).isEqualTo(5);
    }

    @Test
    void starMeansEveryColumnAndType() {
        QueryPlan plan = parser.parse("select * from *");

        assertThat(plan.getProjection()).isEmpty();
        assertThat(plan.getNodeTypes()).isEmpty();
        assertThat(plan.getTraversal()).isNull();
    }

    @Test
    @DisplayName("AND binds tighter than OR")
    void andBindsTighterThanOr() {
        QueryPlan plan = parser.parse("MATCH Function WHERE a = 1 OR b = 2 AND c = 3");

        assertThat(plan.getFilterGroups()).containsExactly(
                List.of(AttributeFilter.eq("a", 1L)),
                List.of(AttributeFilter.eq("b", 2L), AttributeFilter.eq("c", 3L)));
    }

    @Test
    void parenthesesDistributeIntoGroups() {
        QueryPlan plan = parser.parse("MATCH Function WHERE (a = 1 OR b = 2) AND c = 3");

        assertThat(plan.getFilterGroups()).containsExactly(
                List.of(AttributeFilter.eq("a", 1L), AttributeFilter.eq("c", 3L)),
                List.of(AttributeFilter.eq("b", 2L), AttributeFilter.eq("c", 3L)));
    }

    @Test
    void traversalClause() {
        QueryPlan plan = parser.parse(
                "SELECT * FROM nodes TRAVERSE depends_on FROM 'shop/a.ts#Class:A' DEPTH 3 USING TRANSITIVE");

        QueryPlan.Traversal traversal = plan.getTraversal();
        assertThat(traversal.getEdgeType()).isEqualTo("depends_on");
        assertThat(traversal.getRootReference()).isEqualTo("shop/a.ts#Class:A");
        assertThat(traversal.getDepth()).isEqualTo(3);
        assertThat(traversal.getMode()).isEqualTo(TraversalMode.TRANSITIVE);
        assertThat(traversal.getDirection()).isEqualTo(EdgeDirection.OUT);
    }

    @Test
    void nonHierarchicalTraversalMustGoOut() {
        assertThatThrownBy(() -> parser.parse("MATCH * TRAVERSE calls IN FROM 'x' USING TRANSITIVE"))
                .isInstanceOf(QuerySyntaxException.class)
                .hasMessageContaining("only supports OUT direction");
    }

    @Test
    void operatorsAndLiterals() {
        QueryPlan plan = parser.parse("MATCH * WHERE name LIKE 'Cart%' AND kind IN (Class, 'Interface') "
                + "AND metadata.deprecated IS NOT NULL AND metadata.score <> 1.5 AND metadata.flag = true "
                + "AND symbol NOT IN ('x')");

        assertThat(plan.getFilterGroups()).containsExactly(List.of(
                new AttributeFilter("symbolName", FilterOperator.LIKE, "Cart%"),
                new AttributeFilter("nodeType", FilterOperator.IN, List.of("Class", "Interface")),
                new AttributeFilter("metadata.deprecated", FilterOperator.IS_NOT_NULL, null),
                new AttributeFilter("metadata.score", FilterOperator.NE, 1.5),
                new AttributeFilter("metadata.flag", FilterOperator.EQ, Boolean.TRUE),
                new AttributeFilter("symbolName", FilterOperator.NOT_IN, List.of("x"))));
    }

    @Test
    void syntaxErrorsCarryPosition() {
        assertThatThrownBy(() -> parser.parse("SELECT name FROM Widgets"))
                .isInstanceOf(QuerySyntaxException.class)
                .hasMessageContaining("Unknown node type 'Widgets'")
                .extracting(e -> ((QuerySyntaxException) e).getPosition())
                .isEqualTo(17);
        assertThatThrownBy(() -> parser.parse("DELETE FROM nodes"))
                .isInstanceOf(QuerySyntaxException.class)
                .hasMessageStartingWith("Expected SELECT or MATCH");
        assertThatThrownBy(() -> parser.parse("MATCH * WHERE name = 'open"))
                .hasMessageContaining("Unterminated string literal");
        assertThatThrownBy(() -> parser.parse("MATCH * LIMIT -1"))
                .hasMessageContaining("must not be negative");
        assertThatThrownBy(() -> parser.parse("MATCH * extra"))
                .hasMessageContaining("Unexpected");
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(QuerySyntaxException.class);
    }

    @Test
    @DisplayName("AND of many OR pairs is rejected once its normal form grows too large")
    void whereExpansionIsBounded() {
        String pair = "(loc = 1 OR loc = 2)";
        String eightPairs = "MATCH * WHERE " + String.join(" AND ", Collections.nCopies(8, pair));
        String twentyTwoPairs = "MATCH * WHERE " + String.join(" AND ", Collections.nCopies(22, pair));

        assertThat(parser.parse(eightPairs).getFilterGroups()).hasSize(SqlQueryParser.MAX_FILTER_GROUPS);
        assertThatThrownBy(() -> parser.parse(twentyTwoPairs))
                .isInstanceOf(QuerySyntaxException.class)
                .hasMessageContaining("more than 256 condition groups");
    }
}
