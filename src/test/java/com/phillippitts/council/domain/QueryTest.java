package com.phillippitts.council.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryTest {

    @Test
    void shouldFallBackToDefaultWorkspace() {
        assertThat(Query.of("What changed in the lease?", "  ").workspace()).isEqualTo(Query.DEFAULT_WORKSPACE);
        assertThat(Query.of("What changed in the lease?", null).workspace()).isEqualTo(Query.DEFAULT_WORKSPACE);
    }

    @Test
    void shouldRejectBlankText() {
        assertThatThrownBy(() -> Query.of("   ", "Bellcourt"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldAssignDistinctIds() {
        Query first = Query.of("Same question", "Bellcourt");
        Query second = Query.of("Same question", "Bellcourt");

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(first.history()).isEmpty();
    }
}
