// file: src/main/java/io/scorelite/storage/InMemoryHeadStore.java
package io.scorelite.storage;

import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreId;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Head store backed by ConcurrentHashMap's atomic putIfAbsent / replace.
 */
public final class InMemoryHeadStore implements HeadStore {
    private final Map<ScoreId, ScoreHead> heads = new ConcurrentHashMap<>();

    @Override
    public Optional<ScoreHead> get(ScoreId id) {
        return Optional.ofNullable(heads.get(id));
    }

    @Override
    public boolean createIfAbsent(ScoreId id, ScoreHead head) {
        Objects.requireNonNull(head, "head");
        return heads.putIfAbsent(id, head) == null;
    }

    @Override
    public boolean compareAndSet(ScoreId id, ScoreHead expected, ScoreHead next) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(next, "next");
        return heads.replace(id, expected, next);
    }

    @Override
    public List<ScoreId> list(String owner) {
        return heads.keySet().stream()
                .filter(id -> id.owner().equals(owner))
                .sorted()
                .toList();
    }

    /** Unconditional set, used when replaying an already validated log record. */
    void restore(ScoreId id, ScoreHead head) {
        heads.put(id, head);
    }

    void drop(ScoreId id) {
        heads.remove(id);
    }

    Map<ScoreId, ScoreHead> view() {
        return Map.copyOf(heads);
    }
}
