package io.scorelite.client;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client-side annotation edit. Converted to one "commits" element on the wire.
 */
public sealed interface AnnotationOperation
        permits AnnotationOperation.Add, AnnotationOperation.Remove, AnnotationOperation.Replace {

    /** Wire form: {"type": .., "<type>": {payload}}. */
    Map<String, Object> toCommit();

    record Add(String content) implements AnnotationOperation {
        @Override
        public Map<String, Object> toCommit() {
            return commit("add_annotation", annotation(null, content));
        }
    }

    record Remove(int index) implements AnnotationOperation {
        @Override
        public Map<String, Object> toCommit() {
            return commit("remove_annotation", Map.of("index", index));
        }
    }

    record Replace(int index, String content) implements AnnotationOperation {
        @Override
        public Map<String, Object> toCommit() {
            return commit("replace_annotation", annotation(index, content));
        }
    }

    private static Map<String, Object> annotation(Integer index, String content) {
        Map<String, Object> a = new LinkedHashMap<>();
        if (index != null) a.put("index", index);
        a.put("content", content);
        return a;
    }

    private static Map<String, Object> commit(String type, Map<String, Object> payload) {
        Map<String, Object> c = new LinkedHashMap<>();
        c.put("type", type);
        c.put(type, payload);
        return c;
    }
}
