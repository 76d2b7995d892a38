package com.purchasingpower.depgraph.query;

import com.purchasingpower.depgraph.core.GraphNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.purchasingpower.depgraph.support.GraphFixtures.cls;
import static org.assertj.core.api.Assertions.assertThat;

class AttributeFilterTest {

    private final GraphNode cartService = GraphNode.of(cls("CartService"), Map.of("loc", 42));

    @Test
    void likeFactoryMatchesSubstringIgnoringCase() {
        assertThat(AttributeFilter.like(QueryField.SYMBOL_NAME, "cart").matches(cartService, null)).isTrue();
        assertThat(AttributeFilter.like(QueryField.SYMBOL_NAME, "order").matches(cartService, null)).isFalse();
    }

    @Test
    void likeWildcardsAnchorTheWholeValue() {
        assertThat(AttributeFilter.like(QueryField.SYMBOL_NAME, "cart%").matches(cartService, null)).isTrue();
        assertThat(AttributeFilter.like(QueryField.SYMBOL_NAME, "%cart").matches(cartService, null)).isFalse();
        assertThat(AttributeFilter.like(QueryField.SYMBOL_NAME, "c%t%e").matches(cartService, null)).isTrue();
    }

    @Test
    void numericEqualityIgnoresRepresentation() {
        assertThat(AttributeFilter.eq("loc", "42.0").matches(cartService, null)).isTrue();
        assertThat(new AttributeFilter("loc", FilterOperator.GT, 50).matches(cartService, null)).isFalse();
    }
}
