package com.bookscrape.scrape.pipeline;

import java.util.HashSet;
import java.util.Set;

/**
 * Exact membership set over record URLs for one pipeline. Check and insert happen in a
 * single critical section so two racing records with the same key yield exactly one
 * first sighting.
 */
class SeenUrlCache {
    private final Object lock = new Object();
    private final Set<String> seen = new HashSet<>();

    /**
     * @return {@code true} if the key was not seen before and has now been recorded
     */
    boolean markSeen(String key) {
        synchronized (lock) {
            return seen.add(key);
        }
    }

    int size() {
        synchronized (lock) {
            return seen.size();
        }
    }
}
