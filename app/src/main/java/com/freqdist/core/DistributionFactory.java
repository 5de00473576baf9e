package com.freqdist.core;

import com.freqdist.config.DistributionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Factory for creating distributions based on configuration.
 */
public class DistributionFactory {

    private static final Logger logger = LoggerFactory.getLogger(DistributionFactory.class);

    private DistributionFactory() {
    }

    /**
     * Create an empty distribution with the configured capacity and storage.
     */
    public static <K> FrequencyDistribution<K> create(DistributionConfig config) {
        KeyStorage<K> storage = createStorage(config.getStorage());
        int capacity = config.getInitialCapacity();

        logger.debug("Creating distribution: storage={}, capacity={}", storage.getName(), capacity);
        return FrequencyDistribution.withCapacityAndStorage(capacity, storage);
    }

    /**
     * Resolve a storage by its configuration name. The sorted storage uses natural key ordering.
     */
    public static <K> KeyStorage<K> createStorage(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "hashed":
            case "hash":
                return KeyStorage.hashed();

            case "insertion-ordered":
            case "linked":
                return KeyStorage.insertionOrdered();

            case "sorted":
            case "tree":
                return KeyStorage.sorted();

            default:
                throw new IllegalArgumentException("Unknown distribution storage: " + name);
        }
    }
}
