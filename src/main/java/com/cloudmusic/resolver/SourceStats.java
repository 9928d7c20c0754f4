package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running success/failure counters per provider or catalog source.
 * <p>
 * Workflow:
 * <ul>
 *   <li>The resolution chain records one outcome per provider attempt; the cross-source matcher records one
 *       outcome per catalog source it searched.</li>
 *   <li>{@link #rank(List)} orders candidate sources by success rate; names never seen rate 0.5, so they are
 *       tried ahead of sources with a poor record but behind proven ones.</li>
 *   <li>{@link #persist()} writes through the {@link SourceStatsStore}; storage errors are logged and ignored.</li>
 * </ul>
 * Safe for concurrent use.
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class SourceStats {
    private static final Logger logger = LoggerFactory.getLogger(SourceStats.class);
    static final double NEUTRAL_RATE = 0.5;

    /**
     * Persisted counter pair.
     */
    public record Counter(int success, int failure) {
        public int total() {
            return success + failure;
        }

        public double successRate() {
            return total() == 0 ? NEUTRAL_RATE : (double) success / total();
        }
    }

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final SourceStatsStore store;

    public SourceStats(SourceStatsStore store) {
        this.store = store;
    }

    /**
     * In-memory stats that are never persisted.
     */
    public SourceStats() {
        this(null);
    }

    /**
     * Creates stats pre-populated from the store; an unreadable store yields empty stats.
     */
    public static SourceStats load(SourceStatsStore store) {
        SourceStats stats = new SourceStats(store);
        if (store == null) {
            return stats;
        }
        try {
            Map<String, Counter> loaded = store.load();
            if (loaded != null) {
                loaded.forEach((name, counter) -> {
                    if (name != null && counter != null) stats.counters.put(name, counter);
                });
            }
            logger.debug("Loaded source stats for {} names", stats.counters.size());
        } catch (Exception e) {
            logger.warn("Failed to load source stats, starting empty: {}", e.getMessage());
        }
        return stats;
    }

    public void recordSuccess(String name) {
        counters.merge(name, new Counter(1, 0), (a, b) -> new Counter(a.success() + 1, a.failure()));
    }

    public void recordFailure(String name) {
        counters.merge(name, new Counter(0, 1), (a, b) -> new Counter(a.success(), a.failure() + 1));
    }

    public double successRate(String name) {
        Counter counter = counters.get(name);
        return counter == null ? NEUTRAL_RATE : counter.successRate();
    }

    /**
     * Returns the names ordered by descending success rate; ties keep the input order.
     */
    public List<String> rank(List<String> names) {
        List<String> ranked = new ArrayList<>(names);
        ranked.sort(Comparator.comparingDouble(this::successRate).reversed());
        return ranked;
    }

    /**
     * Sorted copy of all counters.
     */
    public Map<String, Counter> snapshot() {
        return new LinkedHashMap<>(new TreeMap<>(counters));
    }

    /**
     * Best-effort write of the current counters.
     * @return true if the store accepted the write
     */
    public synchronized boolean persist() {
        if (store == null) {
            return false;
        }
        try {
            store.save(snapshot());
            return true;
        } catch (Exception e) {
            logger.warn("Failed to persist source stats: {}", e.getMessage());
            return false;
        }
    }
}
