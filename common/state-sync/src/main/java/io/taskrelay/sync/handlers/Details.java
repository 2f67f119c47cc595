package io.taskrelay.sync.handlers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small builder for activity details and metadata maps, which may carry {@code null} values.
 */
final class Details {

    private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

    private Details() {
    }

    static Details of(String key, Object value) {
        return new Details().with(key, value);
    }

    Details with(String key, Object value) {
        values.put(key, value);
        return this;
    }

    Details withIfPresent(String key, Object value) {
        if (value != null) {
            values.put(key, value);
        }
        return this;
    }

    Map<String, Object> build() {
        return new LinkedHashMap<>(values);
    }
}
