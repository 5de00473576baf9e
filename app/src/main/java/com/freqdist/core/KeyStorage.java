package com.freqdist.core;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Strategy creating the map that backs a {@link FrequencyDistribution}.
 * The strategy decides lookup cost and iteration order; it never changes counts.
 *
 * @param <K> key type of the created maps
 */
public interface KeyStorage<K> {

    /**
     * Create an empty backing map.
     *
     * @param expectedKeys number of distinct keys the caller expects to store
     */
    <V> Map<K, V> create(int expectedKeys);

    /**
     * Short name used in configuration and diagnostics.
     */
    String getName();

    /**
     * Hash-based storage with no iteration order guarantee.
     */
    static <K> KeyStorage<K> hashed() {
        return new KeyStorage<K>() {
            @Override
            public <V> Map<K, V> create(int expectedKeys) {
                return new HashMap<>(tableCapacity(expectedKeys));
            }

            @Override
            public String getName() {
                return "hashed";
            }
        };
    }

    /**
     * Hash-based storage that iterates in first-insertion order.
     */
    static <K> KeyStorage<K> insertionOrdered() {
        return new KeyStorage<K>() {
            @Override
            public <V> Map<K, V> create(int expectedKeys) {
                return new LinkedHashMap<>(tableCapacity(expectedKeys));
            }

            @Override
            public String getName() {
                return "insertion-ordered";
            }
        };
    }

    /**
     * Tree storage ordered by the keys' natural ordering. Keys must be {@link Comparable}.
     */
    static <K> KeyStorage<K> sorted() {
        return sorted(null);
    }

    /**
     * Tree storage ordered by a comparator, which must be consistent with equals.
     * The capacity hint is ignored.
     */
    static <K> KeyStorage<K> sorted(Comparator<? super K> comparator) {
        return new KeyStorage<K>() {
            @Override
            public <V> Map<K, V> create(int expectedKeys) {
                return new TreeMap<>(comparator);
            }

            @Override
            public String getName() {
                return "sorted";
            }
        };
    }

    /**
     * Hash table size holding the given number of entries without a resize at the default load factor.
     */
    static int tableCapacity(int expectedKeys) {
        if (expectedKeys < 0) {
            throw new IllegalArgumentException("Expected key count must be non-negative: " + expectedKeys);
        }
        return (int) Math.min(Integer.MAX_VALUE, (long) Math.ceil(expectedKeys / 0.75d));
    }
}
