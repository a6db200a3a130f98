package com.tessera.search.metrics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Engine-wide search counters.
 *
 * <p>Lock-free ({@link LongAdder}) so that concurrent searches can record into one
 * instance. {@link #getSnapshot()} builds a fresh map on every call.
 */
public final class SearchMetrics {

    private final LongAdder searches = new LongAdder();
    private final LongAdder placeholderSearches = new LongAdder();
    private final LongAdder timeouts = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder totalSearchTimeNanos = new LongAdder();
    private final LongAdder totalResults = new LongAdder();

    private final LongAdder conditionResolutions = new LongAdder();
    private final LongAdder conditionCacheHits = new LongAdder();
    private final LongAdder conditionNarrowings = new LongAdder();
    private final LongAdder bucketsProduced = new LongAdder();

    public void recordSearch(boolean placeholder, long searchTimeNanos, int results) {
        searches.increment();
        if (placeholder) {
            placeholderSearches.increment();
        }
        totalSearchTimeNanos.add(searchTimeNanos);
        totalResults.add(results);
    }

    public void recordTimeout() {
        timeouts.increment();
    }

    public void recordFailure() {
        failures.increment();
    }

    public void recordConditionResolution() {
        conditionResolutions.increment();
    }

    public void recordConditionCacheHit() {
        conditionCacheHits.increment();
    }

    public void recordConditionNarrowing() {
        conditionNarrowings.increment();
    }

    public void recordBucket() {
        bucketsProduced.increment();
    }

    public long conditionResolutions() {
        return conditionResolutions.sum();
    }

    public long conditionCacheHits() {
        return conditionCacheHits.sum();
    }

    public long conditionNarrowings() {
        return conditionNarrowings.sum();
    }

    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();

        long total = searches.sum();
        snapshot.put("totalSearches", total);
        snapshot.put("placeholderSearches", placeholderSearches.sum());
        snapshot.put("timeouts", timeouts.sum());
        snapshot.put("failures", failures.sum());
        snapshot.put("avgSearchTimeNanos", total > 0 ? totalSearchTimeNanos.sum() / total : 0);
        snapshot.put("avgResultsPerSearch", total > 0 ? (double) totalResults.sum() / total : 0.0);

        long resolutions = conditionResolutions.sum();
        long hits = conditionCacheHits.sum();
        long narrowings = conditionNarrowings.sum();
        long lookups = resolutions + hits + narrowings;
        snapshot.put("conditionResolutions", resolutions);
        snapshot.put("conditionCacheHits", hits);
        snapshot.put("conditionNarrowings", narrowings);
        snapshot.put("conditionCacheReuseRate", lookups > 0 ? (double) (hits + narrowings) / lookups : 0.0);
        snapshot.put("bucketsProduced", bucketsProduced.sum());

        return snapshot;
    }
}
