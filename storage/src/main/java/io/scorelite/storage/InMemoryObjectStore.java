// file: src/main/java/io/scorelite/storage/InMemoryObjectStore.java
package io.scorelite.storage;

import io.scorelite.core.ScoreHistoryException.ObjectNotFound;
import io.scorelite.core.ScoreObject;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Object store backed by a ConcurrentHashMap. Also the in-memory state of
 * {@link DurableScoreStore}.
 */
public final class InMemoryObjectStore implements ObjectStore {
    private final Map<String, ScoreObject> objects = new ConcurrentHashMap<>();

    @Override
    public String put(ScoreObject object) {
        Objects.requireNonNull(object, "object");
        String hash = object.hash();
        objects.putIfAbsent(hash, object);
        return hash;
    }

    @Override
    public Map<String, ScoreObject> getBatch(Set<String> hashes) {
        Map<String, ScoreObject> found = new HashMap<>(hashes.size() * 2);
        Set<String> missing = new HashSet<>();
        for (String h : hashes) {
            ScoreObject obj = h == null ? null : objects.get(h);
            if (obj == null) missing.add(String.valueOf(h));
            else found.put(h, obj);
        }
        if (!missing.isEmpty()) {
            throw new ObjectNotFound(missing);
        }
        return found;
    }

    @Override
    public boolean contains(String hash) {
        return hash != null && objects.containsKey(hash);
    }

    public int size() {
        return objects.size();
    }

    /** Read-only view for snapshotting. */
    Map<String, ScoreObject> view() {
        return Map.copyOf(objects);
    }
}
