package com.purchasingpower.depgraph.query.impl;

import com.purchasingpower.depgraph.config.QueryProperties;
import com.purchasingpower.depgraph.core.Address;
import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.core.NodeType;
import com.purchasingpower.depgraph.exception.NodeNotFoundException;
import com.purchasingpower.depgraph.exception.QuerySyntaxException;
import com.purchasingpower.depgraph.exception.QueryTimeoutException;
import com.purchasingpower.depgraph.exception.UnsupportedDialectException;
import com.purchasingpower.depgraph.inference.CustomRuleEngine;
import com.purchasingpower.depgraph.inference.InferenceEngineProvider;
import com.purchasingpower.depgraph.inference.impl.DefaultInferenceEngine;
import com.purchasingpower.depgraph.inference.impl.SequentialFrontierExpander;
import com.purchasingpower.depgraph.knowledge.EdgeTypeRegistry;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import com.purchasingpower.depgraph.knowledge.ObservableGraphStore;
import com.purchasingpower.depgraph.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.depgraph.query.CacheStats;
import com.purchasingpower.depgraph.query.QueryDialect;
import com.purchasingpower.depgraph.query.QueryResult;
import com.purchasingpower.depgraph.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

import static com.purchasingpower.depgraph.support.GraphFixtures.PROJECT;
import static com.purchasingpower.depgraph.support.GraphFixtures.cls;
import static com.purchasingpower.depgraph.support.GraphFixtures.edge;
import static com.purchasingpower.depgraph.support.GraphFixtures.fn;
import static com.purchasingpower.depgraph.support.GraphFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Runs all three dialects against one small graph:
 *
 * <pre>
 * Order -depends_on-> Cart -depends_on-> Repo
 * Child -extends-> Base -calls-> format
 * </pre>
 */
@DisplayName("Graph query engine")
class GraphQueryEngineTest {

    private ObservableGraphStore store;
    private GraphQueryEngine engine;

    private Address cart;
    private Address order;
    private Address repo;
    private Address format;
    private Address child;

    @BeforeEach
    void setUp() {
        store = new ObservableGraphStore(new InMemoryGraphStore());
        InferenceEngineProvider provider = s -> new DefaultInferenceEngine(s, new EdgeTypeRegistry(),
                new CustomRuleEngine(), new SequentialFrontierExpander(), Duration.ofSeconds(5), false);
        engine = new GraphQueryEngine(new QueryProperties(), provider, MutableClock.startingAtEpoch());
        store.addListener(engine);

        cart = cls("Cart");
        order = cls("Order");
        repo = Address.of(PROJECT, "src/Repo.ts", NodeType.INTERFACE, "Repo");
        format = fn("src/util.ts", "format");
        child = cls("Child");
        Address base = cls("Base");

        node(store, cart, Map.of("loc", 120));
        node(store, order, Map.of("loc", 80));
        node(store, repo);
        node(store, format);
        node(store, child);
        node(store, base);
        edge(store, order, cart, "depends_on");
        edge(store, cart, repo, "depends_on");
        edge(store, child, base, "extends");
        edge(store, base, format, "calls");
    }

    private static List<Object> addresses(QueryResult result) {
        return result.getRows().stream().map(row -> row.get("address")).toList();
    }

    @Test
    @DisplayName("All dialects compile the same traversal to the same rows")
    void dialectsAgree() {
        String root = order.toCanonical();

        QueryResult sql = engine.executeSqlQuery(
                "SELECT address FROM * TRAVERSE depends_on FROM '" + root + "' USING TRANSITIVE", store);
        QueryResult graphQl = engine.executeGraphQlQuery(
                "{ traverse(from: \"" + root + "\", edge: depends_on, mode: TRANSITIVE) { address } }", store);
        QueryResult natural = engine.executeNaturalLanguageQuery("transitive dependencies of Order", store);

        assertThat(addresses(sql)).containsExactly(cart.toCanonical(), repo.toCanonical());
        assertThat(addresses(graphQl)).isEqualTo(addresses(sql));
        assertThat(addresses(natural)).isEqualTo(addresses(sql));
        assertThat(natural.getRows().get(1)).containsEntry("depth", 2).containsEntry("nodeType", "Interface");
    }

    @Test
    void scanWithFilterOrderAndLimit() {
        QueryResult result = engine.executeSqlQuery(
                "SELECT name, loc FROM classes WHERE loc IS NOT NULL ORDER BY loc DESC LIMIT 1", store);

        assertThat(result.getRows()).containsExactly(Map.of("symbolName", "Cart", "loc", 120));
        assertThat(result.getTotalMatched()).isEqualTo(2);
        assertThat(result.getDialect()).isEqualTo(QueryDialect.SQL);
        assertThat(result.isCached()).isFalse();
    }

    @Test
    void metadataComparisonsAreNumeric() {
        QueryResult result = engine.executeGraphQlQuery("{ nodes(type: Class, loc_gt: 100) { address } }", store);

        assertThat(addresses(result)).containsExactly(cart.toCanonical());
    }

    @Test
    void hierarchicalTraversalDefaultsToOneLevel() {
        QueryResult out = engine.executeSqlQuery("MATCH * TRAVERSE depends_on FROM 'Order'", store);
        QueryResult both = engine.executeSqlQuery("MATCH * TRAVERSE depends_on BOTH FROM 'Cart'", store);

        assertThat(addresses(out)).containsExactly(cart.toCanonical());
        assertThat(addresses(both)).containsExactly(order.toCanonical(), repo.toCanonical());
    }

    @Test
    void inheritableTraversalReportsSource() {
        QueryResult result = engine.executeSqlQuery("SELECT address, inheritedFrom FROM * "
                + "TRAVERSE calls FROM '" + child.toCanonical() + "' USING INHERITABLE", store);

        assertThat(result.getRows()).containsExactly(Map.of(
                "address", format.toCanonical(),
                "inheritedFrom", cls("Base").toCanonical()));
    }

    @Test
    void executeQueryDetectsDialect() {
        assertThat(engine.detectDialect("  select * from *")).isEqualTo(QueryDialect.SQL);
        assertThat(engine.detectDialect("MATCH Class")).isEqualTo(QueryDialect.SQL);
        assertThat(engine.detectDialect("{ nodes { address } }")).isEqualTo(QueryDialect.GRAPHQL);
        assertThat(engine.detectDialect("query Q { nodes { address } }")).isEqualTo(QueryDialect.GRAPHQL);
        assertThat(engine.detectDialect("who calls format")).isEqualTo(QueryDialect.NATURAL_LANGUAGE);

        assertThat(engine.executeQuery("who calls format", store).getDialect())
                .isEqualTo(QueryDialect.NATURAL_LANGUAGE);
    }

    @Test
    @DisplayName("Syntax errors never touch the data source")
    void syntaxErrorBeforeStoreAccess() {
        GraphStore untouched = mock(GraphStore.class);

        assertThatThrownBy(() -> engine.executeSqlQuery("SELEC address FROM nodes", untouched))
                .isInstanceOf(QuerySyntaxException.class);
        assertThatThrownBy(() -> engine.executeGraphQlQuery("{ nodes { address }", untouched))
                .isInstanceOf(QuerySyntaxException.class);
        verifyNoInteractions(untouched);
    }

    @Test
    void unknownRootIsNotFound() {
        assertThatThrownBy(() -> engine.executeSqlQuery(
                "MATCH * TRAVERSE calls FROM 'demo/src/Nope.ts#Class:Nope'", store))
                .isInstanceOf(NodeNotFoundException.class);
        assertThatThrownBy(() -> engine.executeNaturalLanguageQuery("who calls nothingAtAll", store))
                .isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    void expiredDeadlineRaisesTimeoutWithPartialRows() {
        assertThatThrownBy(() -> engine.executeSqlQuery(
                "MATCH * TRAVERSE depends_on FROM 'Order' USING TRANSITIVE", store, Duration.ZERO))
                .isInstanceOf(QueryTimeoutException.class)
                .satisfies(e -> assertThat(((QueryTimeoutException) e).getPartialRows()).isEmpty());
        assertThat(engine.manageCache("stats").size()).isZero();
    }

    @Test
    @DisplayName("Results are cached until the graph changes")
    void cacheHitThenInvalidation() {
        String query = "SELECT address FROM classes";

        QueryResult first = engine.executeSqlQuery(query, store);
        QueryResult second = engine.executeSqlQuery("  " + query + " ", store);
        assertThat(first.isCached()).isFalse();
        assertThat(second.isCached()).isTrue();
        assertThat(second.getRows()).isEqualTo(first.getRows());

        node(store, cls("Invoice"));
        QueryResult third = engine.executeSqlQuery(query, store);

        assertThat(third.isCached()).isFalse();
        assertThat(third.getRows()).hasSize(first.getRows().size() + 1);
    }

    @Test
    void cacheIsScopedToDialectAndDataSource() {
        GraphStore other = new InMemoryGraphStore();
        engine.executeSqlQuery("SELECT address FROM classes", store);

        QueryResult fromOther = engine.executeSqlQuery("SELECT address FROM classes", other);

        assertThat(fromOther.isCached()).isFalse();
        assertThat(fromOther.getRows()).isEmpty();
    }

    @Test
    @DisplayName("Stores that cannot report writes are never served from the cache")
    void plainStoreIsNotCached() {
        GraphStore plain = new InMemoryGraphStore();
        node(plain, cls("Cart"));
        String query = "SELECT address FROM classes";

        engine.executeSqlQuery(query, plain);
        node(plain, cls("Invoice"));
        QueryResult second = engine.executeSqlQuery(query, plain);

        assertThat(second.isCached()).isFalse();
        assertThat(addresses(second)).contains(cls("Invoice").toCanonical());
    }

    @Test
    void observableStoreIsSubscribedOnFirstQuery() {
        ObservableGraphStore fresh = new ObservableGraphStore(new InMemoryGraphStore());
        node(fresh, cls("Cart"));
        String query = "SELECT address FROM classes";

        engine.executeSqlQuery(query, fresh);
        assertThat(engine.executeSqlQuery(query, fresh).isCached()).isTrue();

        node(fresh, cls("Invoice"));
        QueryResult afterWrite = engine.executeSqlQuery(query, fresh);

        assertThat(afterWrite.isCached()).isFalse();
        assertThat(afterWrite.getRows()).hasSize(2);
    }

    @Test
    @DisplayName("A result computed while the cache was invalidated is not stored")
    void invalidationDuringExecutionDropsResult() {
        AtomicBoolean invalidateMidScan = new AtomicBoolean(true);
        ObservableGraphStore racing = new ObservableGraphStore(new InMemoryGraphStore() {
            @Override
            public List<GraphNode> allNodes(Predicate<GraphNode> filter) {
                List<GraphNode> nodes = super.allNodes(filter);
                if (invalidateMidScan.compareAndSet(true, false)) {
                    engine.invalidateCache();
                }
                return nodes;
            }
        });
        node(racing, cls("Cart"));
        String query = "SELECT address FROM classes";

        engine.executeSqlQuery(query, racing);
        QueryResult second = engine.executeSqlQuery(query, racing);
        QueryResult third = engine.executeSqlQuery(query, racing);

        assertThat(second.isCached()).isFalse();
        assertThat(third.isCached()).isTrue();
    }

    @Test
    void naturalLanguageTypeWordMatchesSqlFrom() {
        edge(store, child, format, "calls");
        edge(store, child, cart, "calls");
        String root = child.toCanonical();

        QueryResult natural = engine.executeNaturalLanguageQuery("functions called by " + root, store);
        QueryResult sql = engine.executeSqlQuery(
                "SELECT address FROM Function TRAVERSE calls FROM '" + root + "'", store);

        assertThat(addresses(natural)).containsExactly(format.toCanonical());
        assertThat(addresses(natural)).isEqualTo(addresses(sql));
    }

    @Test
    void resultRowsAreReadOnly() {
        QueryResult result = engine.executeSqlQuery("SELECT address FROM classes", store);

        assertThatThrownBy(() -> result.getRows().get(0).put("address", "tampered"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(engine.executeSqlQuery("SELECT address FROM classes", store).getRows().get(0))
                .doesNotContainValue("tampered");
    }

    @Test
    void manageCacheActions() {
        engine.executeSqlQuery("SELECT address FROM classes", store);
        engine.executeSqlQuery("SELECT address FROM classes", store);

        CacheStats stats = engine.manageCache("STATS");
        assertThat(stats.size()).isEqualTo(1);
        assertThat(stats.hits()).isEqualTo(1);

        assertThat(engine.manageCache("optimize").size()).isEqualTo(1);
        assertThat(engine.manageCache("clear").size()).isZero();
        assertThatThrownBy(() -> engine.manageCache("bogus"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown cache action: bogus");
    }

    @Test
    void unsupportedDialectName() {
        assertThatThrownBy(() -> QueryDialect.fromString("xml"))
                .isInstanceOf(UnsupportedDialectException.class)
                .hasMessage("Unsupported query dialect: xml");
        assertThat(QueryDialect.fromString("natural_language")).isEqualTo(QueryDialect.NATURAL_LANGUAGE);
        assertThat(QueryDialect.fromString("GraphQL")).isEqualTo(QueryDialect.GRAPHQL);
    }
}
