package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.Timespan;
import com.platform.prioritizer.service.CohortLabelResolver.LabelSet;
import com.platform.prioritizer.service.FeatureAggregationService.RawAggregates;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Run-scoped memo of raw aggregates per (prefix, as-of date) and label sets per
 * (as-of date, label timespan). Consecutive splits share most of their as-of dates,
 * so each is computed once per run.
 */
public class FeatureCache {

    private record AggregateKey(String prefix, LocalDateTime asOfDate) {}

    private record LabelKey(LocalDateTime asOfDate, Timespan labelTimespan) {}

    private final Map<AggregateKey, RawAggregates> aggregates = new ConcurrentHashMap<>();
    private final Map<LabelKey, LabelSet> labels = new ConcurrentHashMap<>();
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger misses = new AtomicInteger();

    public RawAggregates aggregates(String prefix, LocalDateTime asOfDate, Supplier<RawAggregates> loader) {
        return lookup(aggregates, new AggregateKey(prefix, asOfDate), loader);
    }

    public LabelSet labels(LocalDateTime asOfDate, Timespan labelTimespan, Supplier<LabelSet> loader) {
        return lookup(labels, new LabelKey(asOfDate, labelTimespan), loader);
    }

    private <K, V> V lookup(Map<K, V> map, K key, Supplier<V> loader) {
        V cached = map.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        V loaded = loader.get();
        V raced = map.putIfAbsent(key, loaded);
        return raced != null ? raced : loaded;
    }

    public int hits() {
        return hits.get();
    }

    public int misses() {
        return misses.get();
    }

    public int size() {
        return aggregates.size() + labels.size();
    }
}
