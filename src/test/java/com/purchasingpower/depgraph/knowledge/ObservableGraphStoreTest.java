package com.purchasingpower.depgraph.knowledge;

import com.purchasingpower.depgraph.core.Address;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.knowledge.impl.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.purchasingpower.depgraph.support.GraphFixtures.cls;
import static org.assertj.core.api.Assertions.assertThat;

class ObservableGraphStoreTest {

    private ObservableGraphStore store;
    private final List<GraphChangeEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new ObservableGraphStore(new InMemoryGraphStore());
        store.addListener(events::add);
    }

    @Test
    void nodeWritesAreClassifiedAsInsertOrUpdate() {
        Address a = cls("A");

        store.putNode(GraphNode.of(a));
        store.putNode(GraphNode.of(a));
        store.deleteNode(a.toCanonical());
        store.deleteNode(a.toCanonical());

        assertThat(events).extracting(GraphChangeEvent::type).containsExactly(
                GraphChangeEvent.ChangeType.INSERT,
                GraphChangeEvent.ChangeType.UPDATE,
                GraphChangeEvent.ChangeType.DELETE);
        assertThat(events.get(2).node()).isNotNull();
    }

    @Test
    void edgeEventsTouchBothEnds() {
        Address a = cls("A");
        Address b = cls("B");

        store.putEdge(GraphEdge.asserted(a, b, "calls"));
        store.putEdge(GraphEdge.asserted(a, a, "calls"));

        assertThat(events.get(0).touchedAddresses()).containsExactlyInAnyOrder(a.toCanonical(), b.toCanonical());
        assertThat(events.get(1).touchedAddresses()).containsExactly(a.toCanonical());
        assertThat(events.get(0).element()).isEqualTo(GraphChangeEvent.Element.EDGE);
    }

    @Test
    void failingListenerDoesNotBreakWrites() {
        List<GraphChangeEvent> late = new ArrayList<>();
        store.addListener(e -> {
            throw new IllegalStateException("boom");
        });
        store.addListener(late::add);

        store.putNode(GraphNode.of(cls("A")));

        assertThat(store.getNode(cls("A").toCanonical())).isPresent();
        assertThat(late).hasSize(1);
    }

    @Test
    void removedListenerStopsReceiving() {
        GraphChangeListener listener = events::add;
        ObservableGraphStore other = new ObservableGraphStore(new InMemoryGraphStore());
        other.addListener(listener);
        other.removeListener(listener);

        other.putNode(GraphNode.of(cls("A")));

        assertThat(events).isEmpty();
    }

    @Test
    void sameListenerIsRegisteredOnce() {
        GraphChangeListener listener = events::add;
        ObservableGraphStore other = new ObservableGraphStore(new InMemoryGraphStore());
        other.addListener(listener);
        other.addListener(listener);

        other.putNode(GraphNode.of(cls("A")));

        assertThat(events).hasSize(1);
    }
}
