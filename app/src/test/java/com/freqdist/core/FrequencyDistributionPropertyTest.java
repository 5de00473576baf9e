package com.freqdist.core;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.util.AbstractMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property-based tests for the frequency distribution using jqwik.
 */
class FrequencyDistributionPropertyTest {

    @Property
    void totalMatchesSumOfCounts(@ForAll("operations") List<Operation> operations) {
        FrequencyDistribution<String> fdist = new FrequencyDistribution<>();
        Map<String, Long> expected = new HashMap<>();

        for (Operation op : operations) {
            switch (op.kind) {
                case INSERT:
                    fdist.insert(op.key);
                    expected.merge(op.key, 1L, Long::sum);
                    break;
                case EXTEND:
                    fdist.extend(List.of(new AbstractMap.SimpleEntry<>(op.key, op.amount)));
                    expected.merge(op.key, op.amount, Long::sum);
                    break;
                case REMOVE:
                    fdist.remove(op.key);
                    expected.remove(op.key);
                    break;
                case CLEAR:
                    fdist.clear();
                    expected.clear();
                    break;
            }

            long sum = 0;
            for (Map.Entry<String, Long> entry : fdist) {
                sum += entry.getValue();
            }
            assertEquals(sum, fdist.sumCounts(), "Total after " + op);
        }

        assertEquals(expected, fdist.toMap());
    }

    @Property
    void absentKeysReadAsZero(@ForAll("keys") List<String> inserted, @ForAll("keys") List<String> probes) {
        FrequencyDistribution<String> fdist = new FrequencyDistribution<>();
        inserted.forEach(fdist::insert);

        for (String probe : probes) {
            if (!inserted.contains(probe)) {
                assertEquals(0, fdist.get(probe));
            }
        }
    }

    @Property
    void removeIsIdempotent(@ForAll("keys") List<String> inserted, @ForAll("key") String victim) {
        FrequencyDistribution<String> fdist = new FrequencyDistribution<>();
        inserted.forEach(fdist::insert);

        fdist.remove(victim);
        long total = fdist.sumCounts();
        int size = fdist.size();

        assertEquals(0, fdist.remove(victim));
        assertEquals(total, fdist.sumCounts());
        assertEquals(size, fdist.size());
    }

    @Property
    void distinctPairsReadBack(@ForAll @Size(max = 50) Map<@IntRange(max = 1000) Integer,
                                                         @IntRange(max = 10_000) Integer> counts) {
        Map<Integer, Long> pairs = new HashMap<>();
        counts.forEach((key, count) -> pairs.put(key, count.longValue()));

        FrequencyDistribution<Integer> fdist = FrequencyDistribution.from(pairs);

        long expectedTotal = 0;
        for (Map.Entry<Integer, Long> pair : pairs.entrySet()) {
            assertEquals(pair.getValue().longValue(), fdist.get(pair.getKey()));
            expectedTotal += pair.getValue();
        }
        assertEquals(expectedTotal, fdist.sumCounts());
    }

    @Property
    void storageDoesNotChangeCounts(@ForAll("keys") List<String> words) {
        FrequencyDistribution<String> hashed = FrequencyDistribution.withStorage(KeyStorage.hashed());
        FrequencyDistribution<String> linked = FrequencyDistribution.withStorage(KeyStorage.insertionOrdered());
        FrequencyDistribution<String> sorted = FrequencyDistribution.withStorage(KeyStorage.sorted());

        for (String word : words) {
            hashed.insert(word);
            linked.insert(word);
            sorted.insert(word);
        }

        assertEquals(hashed, linked);
        assertEquals(hashed, sorted);
    }

    @Provide
    Arbitrary<String> key() {
        return Arbitraries.strings().withCharRange('a', 'f').ofMinLength(1).ofMaxLength(3);
    }

    @Provide
    Arbitrary<List<String>> keys() {
        return key().list().ofMaxSize(100);
    }

    @Provide
    Arbitrary<List<Operation>> operations() {
        Arbitrary<Operation> operation = Combinators.combine(
            Arbitraries.frequency(
                Tuple.of(6, Kind.INSERT),
                Tuple.of(3, Kind.EXTEND),
                Tuple.of(2, Kind.REMOVE),
                Tuple.of(1, Kind.CLEAR)),
            key(),
            Arbitraries.longs().between(0, 1_000)
        ).as(Operation::new);
        return operation.list().ofMaxSize(200);
    }

    enum Kind { INSERT, EXTEND, REMOVE, CLEAR }

    static class Operation {
        final Kind kind;
        final String key;
        final long amount;

        Operation(Kind kind, String key, long amount) {
            this.kind = kind;
            this.key = key;
            this.amount = amount;
        }

        @Override
        public String toString() {
            return kind + "(" + key + ", " + amount + ")";
        }
    }
}
