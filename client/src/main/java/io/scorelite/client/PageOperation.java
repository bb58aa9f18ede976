// file: client/src/main/java/io/scorelite/client/PageOperation.java
package io.scorelite.client;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client-side page edit. Converted to one "commits" element on the wire.
 */
public sealed interface PageOperation
        permits PageOperation.Add, PageOperation.Insert, PageOperation.Remove {

    /** Wire form: {"type": .., "<type>": {payload}}. */
    Map<String, Object> toCommit();

    record Add(String image, String thumbnail, String number) implements PageOperation {
        @Override
        public Map<String, Object> toCommit() {
            return commit("add_page", page(null, image, thumbnail, number));
        }
    }

    record Insert(int index, String image, String thumbnail, String number) implements PageOperation {
        @Override
        public Map<String, Object> toCommit() {
            return commit("insert_page", page(index, image, thumbnail, number));
        }
    }

    record Remove(int index) implements PageOperation {
        @Override
        public Map<String, Object> toCommit() {
            return commit("delete_page", Map.of("index", index));
        }
    }

    private static Map<String, Object> page(Integer index, String image, String thumbnail, String number) {
        Map<String, Object> p = new LinkedHashMap<>();
        if (index != null) p.put("index", index);
        p.put("image", image);
        p.put("thumbnail", thumbnail);
        p.put("number", number);
        return p;
    }

    private static Map<String, Object> commit(String type, Map<String, Object> payload) {
        Map<String, Object> c = new LinkedHashMap<>();
        c.put("type", type);
        c.put(type, payload);
        return c;
    }
}
