package com.freqdist.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Configuration wrapper for distributions and token counting.
 */
public class DistributionConfig {

    private final Config config;

    public DistributionConfig() {
        this(ConfigFactory.load());
    }

    public DistributionConfig(Config config) {
        this.config = config.getConfig("freqdist");
    }

    // Distribution settings
    public int getInitialCapacity() {
        return config.getInt("distribution.initial-capacity");
    }

    public String getStorage() {
        return config.getString("distribution.storage");
    }

    // Tokenizer settings
    public String getDelimiterPattern() {
        return config.getString("tokenizer.delimiter-pattern");
    }

    public boolean isLowerCase() {
        return config.getBoolean("tokenizer.lower-case");
    }

    public int getMinTokenLength() {
        return config.getInt("tokenizer.min-token-length");
    }
}
