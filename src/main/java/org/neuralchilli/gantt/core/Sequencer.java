package org.neuralchilli.gantt.core;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.gantt.config.SchedulingConfig;
import org.neuralchilli.gantt.domain.ReorderResult;
import org.neuralchilli.gantt.domain.SequencedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maintains the Gantt display order with real-valued sort keys.
 * <p>
 * Moving an item assigns it the midpoint of its new neighbours' keys, so only
 * the moved item changes. Keys are kept at a fixed number of decimals; when
 * two neighbours get too close for a distinct midpoint, every item of the
 * project is renumbered to evenly spaced integer keys and the move is retried.
 * Tasks and milestones share one key space.
 */
@Singleton
public class Sequencer {

    private static final Logger log = LoggerFactory.getLogger(Sequencer.class);

    private final double gap;
    private final int scale;

    @Inject
    public Sequencer(SchedulingConfig config) {
        this(config.sequencer().gap(), config.sequencer().scale());
    }

    /**
     * @param gap   spacing between keys after renormalization (whole number, at least 1)
     * @param scale decimal places kept on a key
     */
    public Sequencer(int gap, int scale) {
        if (gap < 1) {
            throw new IllegalArgumentException("Sequencer gap must be at least 1, got: " + gap);
        }
        if (scale < 0 || scale > 12) {
            throw new IllegalArgumentException("Sequencer scale must be between 0 and 12, got: " + scale);
        }
        this.gap = gap;
        this.scale = scale;
    }

    /**
     * Place {@code itemId} between two neighbours. A null neighbour id means
     * the item moves to that end of the chart.
     *
     * @param items every task and milestone of the project
     * @throws ValidationException if an id is unknown or the neighbours are out of order
     */
    public ReorderResult reorder(List<SequencedItem> items, String itemId, String prevItemId, String nextItemId) {
        List<SequencedItem> ordered = items.stream().sorted(SequencedItem.DISPLAY_ORDER).toList();
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            position.put(ordered.get(i).id(), i);
        }

        requireItem(position, itemId, "Item");
        if (prevItemId != null) {
            requireNeighbour(position, prevItemId, itemId);
        }
        if (nextItemId != null) {
            requireNeighbour(position, nextItemId, itemId);
        }
        if (prevItemId != null && nextItemId != null && position.get(prevItemId) >= position.get(nextItemId)) {
            throw new ValidationException(
                    "Previous item '" + prevItemId + "' must sort before next item '" + nextItemId + "'"
            );
        }

        try {
            double key = midpoint(keyOf(ordered, position, prevItemId), keyOf(ordered, position, nextItemId));
            return new ReorderResult(itemId, key, Map.of());
        } catch (SequencerPrecisionExhausted e) {
            log.info("{}; renormalizing {} items", e.getMessage(), ordered.size());
        }

        Map<String, Double> renormalized = renormalize(ordered);
        double key;
        try {
            key = midpoint(
                    prevItemId != null ? renormalized.get(prevItemId) : null,
                    nextItemId != null ? renormalized.get(nextItemId) : null
            );
        } catch (SequencerPrecisionExhausted e) {
            // Renormalized neighbours are at least one gap apart
            throw new IllegalStateException("Sort keys still exhausted after renormalization", e);
        }
        renormalized.put(itemId, key);
        return new ReorderResult(itemId, key, renormalized);
    }

    /**
     * Reassign evenly spaced integer keys to every item in current display order.
     */
    public Map<String, Double> renormalize(List<SequencedItem> items) {
        List<SequencedItem> ordered = items.stream().sorted(SequencedItem.DISPLAY_ORDER).toList();
        return assignEvenly(ordered);
    }

    /**
     * First-time key assignment: when every item still has key 0, order them
     * by dates and creation and space them evenly. Otherwise nothing changes.
     */
    public Map<String, Double> initialize(List<SequencedItem> items) {
        if (items.isEmpty() || items.stream().anyMatch(item -> item.sortOrder() != 0.0)) {
            return Map.of();
        }
        List<SequencedItem> ordered = items.stream().sorted(SequencedItem.INITIAL_ORDER).toList();
        log.debug("Initializing sort keys for {} items", ordered.size());
        return assignEvenly(ordered);
    }

    /**
     * Midpoint of two keys at the configured precision. A missing lower key
     * counts as 0, a missing upper key as one gap above the lower key.
     */
    double midpoint(Double prev, Double next) throws SequencerPrecisionExhausted {
        double lower = prev != null ? prev : 0.0;
        double upper = next != null ? next : lower + gap;

        if (upper <= lower) {
            throw new SequencerPrecisionExhausted(lower, upper);
        }

        double mid = round((lower + upper) / 2.0);
        if (mid <= lower || mid >= upper) {
            throw new SequencerPrecisionExhausted(lower, upper);
        }
        return mid;
    }

    private double round(double value) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    private Map<String, Double> assignEvenly(List<SequencedItem> ordered) {
        Map<String, Double> keys = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            keys.put(ordered.get(i).id(), gap * (i + 1));
        }
        return keys;
    }

    private static Double keyOf(List<SequencedItem> ordered, Map<String, Integer> position, String id) {
        return id != null ? ordered.get(position.get(id)).sortOrder() : null;
    }

    private static void requireItem(Map<String, Integer> position, String id, String role) {
        if (id == null || !position.containsKey(id)) {
            throw new ValidationException(role + " '" + id + "' not found");
        }
    }

    private static void requireNeighbour(Map<String, Integer> position, String neighbourId, String itemId) {
        requireItem(position, neighbourId, "Neighbour");
        if (neighbourId.equals(itemId)) {
            throw new ValidationException("Item '" + itemId + "' cannot be its own neighbour");
        }
    }
}
