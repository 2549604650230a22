package io.reactiveactions.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A page of items together with the total count, as joined by {@link CombinationHelper}.
 */
public record CombinedResult<T>(List<T> items, long count) {
    public CombinedResult {
        items = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(items, "items")));
    }

    /**
     * Model entries named after {@code prefix}: {@code <prefix>List} and {@code <prefix>Count}.
     */
    public Map<String, Object> toModel(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        Map<String, Object> model = new LinkedHashMap<>();
        model.put(prefix + "List", items);
        model.put(prefix + "Count", count);
        return model;
    }
}
