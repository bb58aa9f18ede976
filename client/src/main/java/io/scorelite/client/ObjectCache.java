package io.scorelite.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Hash -> object cache in front of POST /objects.
 *
 * Objects are content-addressed, so an entry never goes stale; the only
 * reason to evict is the size bound (least recently used first).
 * A lookup sends one request for the hashes it does not hold yet, or none.
 */
final class ObjectCache {

    private final int capacity;
    private final Function<Set<String>, Map<String, JsonNode>> fetch;
    private final LinkedHashMap<String, JsonNode> entries;

    ObjectCache(int capacity, Function<Set<String>, Map<String, JsonNode>> fetch) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.fetch = fetch;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, JsonNode> eldest) {
                return size() > ObjectCache.this.capacity;
            }
        };
    }

    /**
     * Resolve every hash, fetching the missing ones in a single call.
     *
     * @throws ApiException 404 OBJECT_NOT_FOUND when the server does not know a hash
     */
    Map<String, JsonNode> getAll(Collection<String> hashes) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        Set<String> missing = new LinkedHashSet<>();
        synchronized (entries) {
            for (String h : hashes) {
                JsonNode hit = entries.get(h);
                if (hit != null) out.put(h, hit);
                else missing.add(h);
            }
        }
        if (missing.isEmpty()) return out;

        Map<String, JsonNode> fetched = fetch.apply(missing);
        for (String h : missing) {
            JsonNode obj = fetched.get(h);
            if (obj == null) throw new ApiException(404, "OBJECT_NOT_FOUND", "object not found: " + h);
            out.put(h, obj);
        }
        synchronized (entries) {
            for (String h : missing) entries.put(h, out.get(h));
        }
        return out;
    }

    JsonNode get(String hash) {
        return getAll(Set.of(hash)).get(hash);
    }

    int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
