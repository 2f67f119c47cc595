package io.taskrelay.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy helpers for the free-form metadata maps carried by model records. Values may be
 * {@code null}, so {@link Map#copyOf(Map)} is not usable here.
 */
public final class Maps {

    private Maps() {
    }

    public static Map<String, Object> freeze(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static Map<String, Object> merge(Map<String, ?> base, Map<String, ?> overrides) {
        LinkedHashMap<String, Object> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return freeze(merged);
    }

    public static List<String> freezeList(List<String> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return List.copyOf(source);
    }
}
