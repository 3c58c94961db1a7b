package org.neuralchilli.gantt.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * New sort key for a moved item.
 *
 * @param renormalized every key reassigned by a renormalization pass, in
 *                     display order; empty when the midpoint fitted directly
 */
public record ReorderResult(
        String itemId,
        double sortOrder,
        Map<String, Double> renormalized
) {
    public ReorderResult {
        renormalized = renormalized != null ? Collections.unmodifiableMap(new LinkedHashMap<>(renormalized)) : Map.of();
    }

    public boolean wasRenormalized() {
        return !renormalized.isEmpty();
    }
}
