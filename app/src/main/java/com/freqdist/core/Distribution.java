package com.freqdist.core;

/**
 * A counting container that tracks how many times each key was observed.
 *
 * @param <K> type of the counted keys
 */
public interface Distribution<K> {

    /**
     * Number of distinct keys currently stored, including keys whose count is zero.
     */
    int size();

    /**
     * Current count for a key, or 0 if the key was never inserted or has been removed.
     */
    long get(Object key);

    /**
     * Remove every key and reset the running total.
     */
    void clear();

    /**
     * Record one more occurrence of a key.
     */
    void insert(K key);

    /**
     * Remove a key together with its count.
     *
     * @return the count that was removed, 0 when the key was absent
     */
    long remove(Object key);
}
