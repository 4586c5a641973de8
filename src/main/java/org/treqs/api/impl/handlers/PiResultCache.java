package org.treqs.api.impl.handlers;

import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Memoized pi approximations keyed by round count, trimmed by a background task. */
public class PiResultCache {
    private final ConcurrentHashMap<Integer, Double> results = new ConcurrentHashMap<>();
    private final int limit;

    public PiResultCache(int limit) {
        this.limit = Math.max(0, limit);
    }

    public Optional<Double> get(int rounds) {
        return Optional.ofNullable(results.get(rounds));
    }

    public void put(int rounds, double pi) {
        results.put(rounds, pi);
    }

    public int size() {
        return results.size();
    }

    /** @return how many entries were dropped to get back under the limit */
    public int compact() {
        int removed = 0;
        Iterator<Integer> it = results.keySet().iterator();
        while (results.size() > limit && it.hasNext()) {
            it.next();
            it.remove();
            removed++;
        }
        return removed;
    }
}
