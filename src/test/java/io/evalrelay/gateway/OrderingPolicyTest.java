package io.evalrelay.gateway;

import io.evalrelay.model.OrderingMode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.stream.IntStream;

final class OrderingPolicyTest {

    @Test
    void fixedSeedGivesTheSameOrderEveryRun() {
        List<Integer> items = IntStream.range(0, 50).boxed().toList();

        List<Integer> first = OrderingPolicy.fixed(20_240_601L).permute(items);
        List<Integer> second = OrderingPolicy.fixed(20_240_601L).permute(items);

        Assertions.assertEquals(first, second);
        Assertions.assertEquals(new HashSet<>(items), new HashSet<>(first));
        Assertions.assertEquals(OrderingMode.FIXED_SEEDED, OrderingPolicy.fixed(1L).mode());
    }

    @Test
    void randomOrderChangesBetweenRuns() {
        List<Integer> items = IntStream.range(0, 50).boxed().toList();
        List<List<Integer>> orders = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            orders.add(OrderingPolicy.random().permute(items));
        }

        Assertions.assertTrue(new HashSet<>(orders).size() > 1, "five random runs produced one order");
        Assertions.assertEquals(OrderingMode.RANDOM, OrderingPolicy.random().mode());
    }

    @Test
    void permutationIsACopy() {
        List<String> items = new ArrayList<>(List.of("a", "b", "c"));

        List<String> permuted = OrderingPolicy.fixed(9L).permute(items);

        Assertions.assertEquals(List.of("a", "b", "c"), items);
        Assertions.assertThrows(UnsupportedOperationException.class, () -> permuted.add("d"));
    }

    @Test
    void fixedModeNeedsACommittedSeed() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> OrderingPolicy.of(OrderingMode.FIXED_SEEDED, null));
        Assertions.assertEquals(OrderingMode.RANDOM, OrderingPolicy.of(OrderingMode.RANDOM, 5L).mode());
        Assertions.assertEquals(OrderingMode.FIXED_SEEDED, OrderingMode.fromString("fixed-seeded"));
        Assertions.assertEquals(OrderingMode.RANDOM, OrderingMode.fromString(" "));
    }
}
