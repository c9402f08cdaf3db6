package com.storeflow.billingservice.service;

import com.storeflow.billingservice.exception.InvalidRequestException;
import com.storeflow.billingservice.exception.StockShortfall;
import com.storeflow.common.model.InvoiceLine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StockDeltaResolverTest {

    private final StockDeltaResolver resolver = new StockDeltaResolver();

    @Test
    void resolveDeltas_newBill_takesEveryLineOutOfStock() {
        Map<String, Integer> deltas = resolver.resolveDeltas(List.of(), List.of(line("p1", 3), line("p2", 1)));

        assertThat(deltas).containsExactly(Map.entry("p1", -3), Map.entry("p2", -1));
    }

    @Test
    void resolveDeltas_quantityIncreased_takesOnlyTheDifference() {
        Map<String, Integer> deltas = resolver.resolveDeltas(List.of(line("p1", 5)), List.of(line("p1", 8)));

        assertThat(deltas).containsExactly(Map.entry("p1", -3));
    }

    @Test
    void resolveDeltas_lineRemoved_returnsItToStock() {
        Map<String, Integer> deltas = resolver.resolveDeltas(List.of(line("p1", 5), line("p2", 2)), List.of(line("p2", 2)));

        assertThat(deltas).containsExactly(Map.entry("p1", 5));
    }

    @Test
    void resolveDeltas_unchangedLines_isEmpty() {
        List<InvoiceLine> lines = List.of(line("p1", 5), line("p2", 2));

        assertThat(resolver.resolveDeltas(lines, lines)).isEmpty();
    }

    @Test
    void resolveDeltas_isAntisymmetric() {
        List<InvoiceLine> before = List.of(line("p1", 5), line("p2", 2));
        List<InvoiceLine> after = List.of(line("p1", 1), line("p3", 4));

        Map<String, Integer> forward = resolver.resolveDeltas(before, after);
        Map<String, Integer> backward = resolver.resolveDeltas(after, before);

        forward.forEach((productId, delta) -> assertThat(backward.get(productId)).isEqualTo(-delta));
        assertThat(backward).hasSameSizeAs(forward);
    }

    @Test
    void resolveDeltas_sumsLinesForTheSameProductAndDropsNonPositiveQuantities() {
        Map<String, Integer> deltas = resolver.resolveDeltas(List.of(),
                List.of(line("p1", 2), line("p1", 3), line("p2", 0), line("p3", -4)));

        assertThat(deltas).containsExactly(Map.entry("p1", -5));
    }

    @Test
    void resolveDeltas_lineWithoutProduct_isRejected() {
        assertThatThrownBy(() -> resolver.resolveDeltas(List.of(), List.of(line(" ", 1))))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void findShortfalls_listsEveryProductThatWouldGoNegative() {
        Map<String, Integer> deltas = Map.of("p1", -12, "p2", -1, "p3", 4);

        List<StockShortfall> shortfalls = resolver.findShortfalls(deltas, Map.of("p1", 10, "p2", 1, "p3", 0));

        assertThat(shortfalls).containsExactly(new StockShortfall("p1", 12, 10));
        assertThat(shortfalls.get(0).getShortfall()).isEqualTo(2);
    }

    @Test
    void findShortfalls_missingProductCountsAsNoStock() {
        List<StockShortfall> shortfalls = resolver.findShortfalls(Map.of("ghost", -1), Map.of());

        assertThat(shortfalls).containsExactly(new StockShortfall("ghost", 1, 0));
    }

    @Test
    void quantitiesByProduct_duplicateLinesOverflowingInt_isRejected() {
        assertThatThrownBy(() -> resolver.quantitiesByProduct(List.of(line("p1", Integer.MAX_VALUE), line("p1", 2))))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void findShortfalls_largeRestockOnLargeStock_isNotAShortfall() {
        assertThat(resolver.findShortfalls(Map.of("p1", Integer.MAX_VALUE), Map.of("p1", 5))).isEmpty();
    }

    @Test
    void applyDelta_resultBeyondIntRange_isRejected() {
        assertThat(resolver.applyDelta("p1", 10, -4)).isEqualTo(6);
        assertThatThrownBy(() -> resolver.applyDelta("p1", Integer.MAX_VALUE, 1))
                .isInstanceOf(InvalidRequestException.class);
    }

    private static InvoiceLine line(String productId, int quantity) {
        return InvoiceLine.builder().productId(productId).quantity(quantity).build();
    }
}
