package org.carball.adapt.model.analysis;

import org.carball.adapt.model.query.ColumnReference;
import org.carball.adapt.model.query.QueryClass;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnUsageStatTest {

    private static final ColumnReference ORDER_DATE = new ColumnReference("orders", "order_date");

    @Test
    void shouldCombinePerQueryContributions() {
        // Given
        ColumnUsageStat interactivePredicate = ColumnUsageStat.ofQuery(ORDER_DATE, true, QueryClass.INTERACTIVE);
        ColumnUsageStat batchProjection = ColumnUsageStat.ofQuery(ORDER_DATE, false, QueryClass.BATCH);

        // When
        ColumnUsageStat combined = interactivePredicate.combine(batchProjection);

        // Then
        assertThat(combined.globalMentions()).isEqualTo(2);
        assertThat(combined.predicateMentions()).isEqualTo(1);
        assertThat(combined.interactiveMentions()).isEqualTo(1);
        assertThat(combined.batchMentions()).isEqualTo(1);
        assertThat(combined.predicateRatio()).isEqualTo(0.5);
    }

    @Test
    void shouldReportZeroPredicateRatioForUnusedColumn() {
        assertThat(ColumnUsageStat.unused("orders", "status").predicateRatio()).isZero();
    }

    @Test
    void shouldRejectMorePredicateThanGlobalMentions() {
        assertThatThrownBy(() -> new ColumnUsageStat("orders", "status", 1, 2, 1, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceed global mentions");
    }

    @Test
    void shouldRejectClassCountsThatDoNotSumToGlobal() {
        assertThatThrownBy(() -> new ColumnUsageStat("orders", "status", 3, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("do not sum to global mentions");
    }

    @Test
    void shouldRefuseToCombineDifferentColumns() {
        ColumnUsageStat status = ColumnUsageStat.unused("orders", "status");

        assertThatThrownBy(() -> status.combine(ColumnUsageStat.unused("orders", "order_date")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
