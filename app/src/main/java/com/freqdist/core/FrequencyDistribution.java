package com.freqdist.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collector;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Frequency distribution: keeps track of how many times each key appears in a
 * larger context, for example how many times a token appears in a piece of text.
 * Keys live in a map created by a {@link KeyStorage}, so they must honour the
 * storage's equality contract.
 *
 * <pre>{@code
 * FrequencyDistribution<String> fdist = new FrequencyDistribution<>();
 * fdist.insert("hello");
 * fdist.insert("hello");
 * fdist.insert("goodbye");
 * fdist.get("hello");   // 2
 * fdist.sumCounts();    // 3
 * }</pre>
 *
 * Not thread-safe. Iteration order is defined by the storage and is unspecified
 * for the default hashed storage.
 *
 * @param <K> type of the counted keys
 */
public class FrequencyDistribution<K> implements Distribution<K>, Iterable<Map.Entry<K, Long>> {

    private static final Logger logger = LoggerFactory.getLogger(FrequencyDistribution.class);
    private static final int DEFAULT_CAPACITY = 16;

    private final KeyStorage<K> storage;
    private Map<K, MutableCount> counts;
    private long sumCounts;
    private boolean consumed;

    /**
     * Create an empty distribution with hashed storage and default sizing.
     */
    public FrequencyDistribution() {
        this(DEFAULT_CAPACITY, KeyStorage.hashed());
    }

    private FrequencyDistribution(int capacity, KeyStorage<K> storage) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.counts = storage.create(capacity);
        this.sumCounts = 0;
        logger.trace("Created distribution: storage={}, capacity={}", storage.getName(), capacity);
    }

    /**
     * Create an empty distribution sized for an expected number of distinct keys.
     */
    public static <K> FrequencyDistribution<K> withCapacity(int capacity) {
        return withCapacityAndStorage(capacity, KeyStorage.hashed());
    }

    /**
     * Create an empty distribution backed by the given storage.
     */
    public static <K> FrequencyDistribution<K> withStorage(KeyStorage<K> storage) {
        return withCapacityAndStorage(DEFAULT_CAPACITY, storage);
    }

    /**
     * Create an empty distribution backed by the given storage and sized for an
     * expected number of distinct keys.
     */
    public static <K> FrequencyDistribution<K> withCapacityAndStorage(int capacity, KeyStorage<K> storage) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must be non-negative: " + capacity);
        }
        return new FrequencyDistribution<>(capacity, storage);
    }

    /**
     * Build a distribution from (key, count) pairs. Repeated keys accumulate.
     * The source's size, when known, pre-sizes the storage.
     */
    public static <K> FrequencyDistribution<K> from(Iterable<? extends Map.Entry<? extends K, Long>> pairs) {
        return from(pairs, KeyStorage.hashed());
    }

    /**
     * Build a distribution from (key, count) pairs using the given storage.
     */
    public static <K> FrequencyDistribution<K> from(Iterable<? extends Map.Entry<? extends K, Long>> pairs,
                                                    KeyStorage<K> storage) {
        Objects.requireNonNull(pairs, "pairs");
        Spliterator<? extends Map.Entry<? extends K, Long>> source = pairs.spliterator();

        FrequencyDistribution<K> fdist = withCapacityAndStorage(sizeHint(pairs, source), storage);
        source.forEachRemaining(pair -> fdist.insertOrIncrementBy(pair.getKey(), pair.getValue()));
        return fdist;
    }

    /**
     * Build a distribution from a map of keys to counts.
     */
    public static <K> FrequencyDistribution<K> from(Map<? extends K, Long> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        return from(pairs.entrySet());
    }

    /**
     * Collector counting each stream element as one occurrence.
     */
    public static <K> Collector<K, ?, FrequencyDistribution<K>> counting() {
        return Collector.of(
            FrequencyDistribution::new,
            FrequencyDistribution::insert,
            (left, right) -> {
                left.extend(right);
                return left;
            });
    }

    private static int sizeHint(Iterable<?> pairs, Spliterator<?> source) {
        if (pairs instanceof Collection) {
            return ((Collection<?>) pairs).size();
        }
        long exact = source.getExactSizeIfKnown();
        if (exact >= 0) {
            return (int) Math.min(Integer.MAX_VALUE, exact);
        }
        return DEFAULT_CAPACITY;
    }

    @Override
    public int size() {
        ensureNotConsumed();
        return counts.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Sum of all stored counts: the number of observations net of removals.
     */
    public long sumCounts() {
        ensureNotConsumed();
        return sumCounts;
    }

    @Override
    public long get(Object key) {
        ensureNotConsumed();
        Objects.requireNonNull(key, "key");
        MutableCount count;
        try {
            count = counts.get(key);
        } catch (ClassCastException e) {
            // sorted storage cannot compare a key of another type; it was never inserted
            return 0;
        }
        return count == null ? 0 : count.value;
    }

    public boolean contains(Object key) {
        ensureNotConsumed();
        Objects.requireNonNull(key, "key");
        try {
            return counts.containsKey(key);
        } catch (ClassCastException e) {
            return false;
        }
    }

    @Override
    public void insert(K key) {
        insertOrIncrementBy(key, 1);
    }

    /**
     * Add (key, count) pairs in order. Later pairs for the same key accumulate.
     */
    public void extend(Iterable<? extends Map.Entry<? extends K, Long>> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        for (Map.Entry<? extends K, Long> pair : pairs) {
            insertOrIncrementBy(pair.getKey(), pair.getValue());
        }
    }

    public void extend(Map<? extends K, Long> pairs) {
        extend(Objects.requireNonNull(pairs, "pairs").entrySet());
    }

    /**
     * Store the increment for an absent key, add it to an existing key, and
     * always add it to the running total. Every insertion path goes through here.
     */
    void insertOrIncrementBy(K key, long increment) {
        ensureNotConsumed();
        Objects.requireNonNull(key, "key");
        if (increment < 0) {
            throw new IllegalArgumentException("Increment must be non-negative: " + key + "=" + increment);
        }

        long newTotal = Math.addExact(sumCounts, increment);
        MutableCount count = counts.get(key);
        if (count == null) {
            counts.put(key, new MutableCount(increment));
        } else {
            count.value = Math.addExact(count.value, increment);
        }
        sumCounts = newTotal;
    }

    @Override
    public long remove(Object key) {
        ensureNotConsumed();
        Objects.requireNonNull(key, "key");
        MutableCount count;
        try {
            count = counts.remove(key);
        } catch (ClassCastException e) {
            return 0;
        }
        if (count == null) {
            return 0;
        }
        sumCounts -= count.value;
        return count.value;
    }

    @Override
    public void clear() {
        ensureNotConsumed();
        logger.debug("Clearing distribution: {} keys, total {}", counts.size(), sumCounts);
        counts.clear();
        sumCounts = 0;
    }

    /**
     * Read-only view of every stored key, including keys with a zero count.
     */
    public Set<K> keys() {
        ensureNotConsumed();
        return Collections.unmodifiableSet(counts.keySet());
    }

    /**
     * Iterator over (key, count) snapshots of every stored entry.
     */
    @Override
    public Iterator<Map.Entry<K, Long>> iterator() {
        ensureNotConsumed();
        return new EntryIterator<>(counts.entrySet().iterator());
    }

    /**
     * Spliterator reporting the exact number of stored entries.
     */
    @Override
    public Spliterator<Map.Entry<K, Long>> spliterator() {
        return Spliterators.spliterator(iterator(), counts.size(), Spliterator.DISTINCT | Spliterator.NONNULL);
    }

    public Stream<Map.Entry<K, Long>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Lazy view of the keys whose count is strictly positive.
     */
    public Iterable<K> nonZeroKeys() {
        ensureNotConsumed();
        return () -> {
            ensureNotConsumed();
            return new NonZeroKeyIterator<>(counts.entrySet().iterator());
        };
    }

    /**
     * Copy of the stored counts.
     */
    public Map<K, Long> toMap() {
        ensureNotConsumed();
        Map<K, Long> copy = new HashMap<>(KeyStorage.tableCapacity(counts.size()));
        for (Map.Entry<K, MutableCount> entry : counts.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().value);
        }
        return copy;
    }

    /**
     * Hand every (key, count) pair to the caller. The distribution is consumed
     * by this call and rejects any further use.
     */
    public Iterator<Map.Entry<K, Long>> drain() {
        ensureNotConsumed();
        Map<K, MutableCount> taken = counts;
        logger.debug("Draining distribution: {} keys, total {}", taken.size(), sumCounts);

        counts = null;
        sumCounts = 0;
        consumed = true;
        return new EntryIterator<>(taken.entrySet().iterator());
    }

    public boolean isConsumed() {
        return consumed;
    }

    public KeyStorage<K> getStorage() {
        return storage;
    }

    private void ensureNotConsumed() {
        if (consumed) {
            throw new IllegalStateException("Distribution has been drained");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrequencyDistribution)) return false;
        FrequencyDistribution<?> other = (FrequencyDistribution<?>) o;
        if (consumed || other.consumed) return false;
        return sumCounts == other.sumCounts && toMap().equals(other.toMap());
    }

    @Override
    public int hashCode() {
        return consumed ? 0 : toMap().hashCode();
    }

    @Override
    public String toString() {
        if (consumed) {
            return "FrequencyDistribution{drained}";
        }
        return String.format("FrequencyDistribution{total=%d, counts=%s}", sumCounts, toMap());
    }

    /**
     * Count cell updated in place so increments avoid re-hashing the key.
     */
    private static final class MutableCount {
        long value;

        MutableCount(long value) {
            this.value = value;
        }
    }

    private static final class EntryIterator<K> implements Iterator<Map.Entry<K, Long>> {
        private final Iterator<Map.Entry<K, MutableCount>> entries;

        EntryIterator(Iterator<Map.Entry<K, MutableCount>> entries) {
            this.entries = entries;
        }

        @Override
        public boolean hasNext() {
            return entries.hasNext();
        }

        @Override
        public Map.Entry<K, Long> next() {
            Map.Entry<K, MutableCount> entry = entries.next();
            return new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue().value);
        }
    }

    private static final class NonZeroKeyIterator<K> implements Iterator<K> {
        private final Iterator<Map.Entry<K, MutableCount>> entries;
        private K next;

        NonZeroKeyIterator(Iterator<Map.Entry<K, MutableCount>> entries) {
            this.entries = entries;
        }

        @Override
        public boolean hasNext() {
            while (next == null && entries.hasNext()) {
                Map.Entry<K, MutableCount> entry = entries.next();
                if (entry.getValue().value > 0) {
                    next = entry.getKey();
                }
            }
            return next != null;
        }

        @Override
        public K next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            K key = next;
            next = null;
            return key;
        }
    }
}
