package com.freqdist.service;

import com.freqdist.config.DistributionConfig;
import com.freqdist.core.DistributionFactory;
import com.freqdist.core.FrequencyDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Counts token occurrences in text.
 */
public class TokenFrequencyService {

    private static final Logger logger = LoggerFactory.getLogger(TokenFrequencyService.class);

    private final DistributionConfig config;
    private final Pattern delimiter;
    private final boolean lowerCase;
    private final int minTokenLength;

    public TokenFrequencyService() {
        this(new DistributionConfig());
    }

    public TokenFrequencyService(DistributionConfig config) {
        this.config = config;
        this.delimiter = Pattern.compile(config.getDelimiterPattern());
        this.lowerCase = config.isLowerCase();
        this.minTokenLength = config.getMinTokenLength();
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("Minimum token length must be positive: " + minTokenLength);
        }
    }

    /**
     * Count the tokens of a text into a new distribution.
     */
    public FrequencyDistribution<String> countTokens(CharSequence text) {
        FrequencyDistribution<String> fdist = DistributionFactory.create(config);
        countTokens(text, fdist);
        return fdist;
    }

    /**
     * Count the tokens of a text into an existing distribution.
     *
     * @return number of tokens counted
     */
    public long countTokens(CharSequence text, FrequencyDistribution<String> into) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(into, "into");

        long tokens = 0;
        for (String token : delimiter.split(text)) {
            if (token.length() < minTokenLength) {
                continue; // split yields a leading empty token
            }
            into.insert(lowerCase ? token.toLowerCase(Locale.ROOT) : token);
            tokens++;
        }

        logger.debug("Counted {} tokens from {} chars, {} distinct so far", tokens, text.length(), into.size());
        return tokens;
    }

    /**
     * Count the tokens of every line into one distribution.
     */
    public FrequencyDistribution<String> countLines(Iterable<String> lines) {
        FrequencyDistribution<String> fdist = DistributionFactory.create(config);
        long tokens = 0;
        int lineCount = 0;

        for (String line : lines) {
            tokens += countTokens(line, fdist);
            lineCount++;
        }

        logger.debug("Counted {} tokens over {} lines", tokens, lineCount);
        return fdist;
    }

    /**
     * The {@code n} highest-count entries, highest first. Ties are ordered by the keys' string form.
     */
    public static <K> List<Map.Entry<K, Long>> mostFrequent(FrequencyDistribution<K> fdist, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Entry count must be non-negative: " + n);
        }

        List<Map.Entry<K, Long>> entries = new ArrayList<>(fdist.size());
        for (Map.Entry<K, Long> entry : fdist) {
            entries.add(entry);
        }
        entries.sort(Comparator.<Map.Entry<K, Long>>comparingLong(Map.Entry::getValue).reversed()
            .thenComparing(entry -> String.valueOf(entry.getKey())));

        return new ArrayList<>(entries.subList(0, Math.min(n, entries.size())));
    }
}
