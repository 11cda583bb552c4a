package com.safetyrisk.common.cache;

import com.safetyrisk.common.model.EvaluationReport;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Memoizes {@link EvaluationReport}s by {@link InputFingerprint}.
 *
 * <p><strong>Compute once, share the result:</strong> concurrent callers asking for the same
 * fingerprint block on a single computation via {@link ConcurrentHashMap#computeIfAbsent}.
 * A supplier that throws leaves no entry behind, so the next caller retries.
 *
 * <p>Bounded by {@code maxEntries}; the store is cleared wholesale when a new fingerprint
 * arrives at capacity. Evaluation is cheap enough that a cold cache only costs latency.
 */
public final class EvaluationCache {

    private final int maxEntries;
    private final ConcurrentHashMap<InputFingerprint, EvaluationReport> store = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public EvaluationCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache must hold at least one entry: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public EvaluationReport getOrCompute(InputFingerprint fingerprint, Supplier<EvaluationReport> evaluation) {
        EvaluationReport cached = store.get(fingerprint);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        if (store.size() >= maxEntries) {
            store.clear();
        }
        AtomicBoolean computed = new AtomicBoolean(false);
        EvaluationReport report = store.computeIfAbsent(fingerprint, key -> {
            computed.set(true);
            return evaluation.get();
        });
        (computed.get() ? misses : hits).incrementAndGet();
        return report;
    }

    public int size() {
        return store.size();
    }

    public void clear() {
        store.clear();
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), store.size());
    }

    /** Snapshot of the cache counters. */
    public record CacheStats(long hits, long misses, int entries) {

        /** Fraction of lookups served from the cache; 0.0 before the first lookup. */
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }
}
