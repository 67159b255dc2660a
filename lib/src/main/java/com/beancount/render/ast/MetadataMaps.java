package com.beancount.render.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

final class MetadataMaps {

    private MetadataMaps() {}

    /**
     * Insertion-ordered, unmodifiable copy. A null mapping becomes an empty one; null keys and
     * values are rejected.
     */
    static Map<String, String> copyOf(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>(metadata.size() * 2);
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            String key = Objects.requireNonNull(entry.getKey(), "metadata key");
            copy.put(key, Objects.requireNonNull(entry.getValue(), "metadata value for " + key));
        }
        return Collections.unmodifiableMap(copy);
    }
}
