package com.seasonalesd.core.detection;

import org.slf4j.Logger;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps only anomalies among the last {@code onlyLast} observations.
 *
 * @since 1.0.0
 */
public class RecencyFilter {

    private final Logger log;

    public RecencyFilter(Logger log) {
        this.log = Objects.requireNonNull(log, "Logger must not be null");
    }

    public Set<Integer> apply(int seriesLength, int onlyLast, Set<Integer> anomalies) {
        int cutoff = seriesLength - onlyLast;
        log.debug("onlyLast={}: dropping anomalies before index {}", onlyLast, cutoff);

        Set<Integer> kept = new TreeSet<>();
        for (int index : anomalies) {
            if (index >= cutoff) {
                kept.add(index);
            }
        }
        return kept;
    }
}
