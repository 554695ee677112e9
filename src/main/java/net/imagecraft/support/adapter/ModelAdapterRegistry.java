package net.imagecraft.support.adapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.imagecraft.exception.ImageValidationException;

/**
 * Ordered set of image backends. Registration order is the default fallback order.
 */
public class ModelAdapterRegistry {

    private final Map<String, ModelAdapter> adapters = new LinkedHashMap<>();

    public ModelAdapterRegistry(List<? extends ModelAdapter> ordered) {
        for (ModelAdapter adapter : ordered) {
            if (adapters.putIfAbsent(adapter.id(), adapter) != null) {
                throw new IllegalArgumentException("Duplicate model adapter id: " + adapter.id());
            }
        }
        if (adapters.isEmpty()) {
            throw new IllegalArgumentException("At least one model adapter must be registered");
        }
    }

    public List<ModelAdapter> ordered() {
        return List.copyOf(adapters.values());
    }

    public List<String> ids() {
        return List.copyOf(adapters.keySet());
    }

    public Optional<ModelAdapter> find(String id) {
        return Optional.ofNullable(id == null ? null : adapters.get(id));
    }

    public ModelAdapter require(String id) {
        return find(id).orElseThrow(() -> new ImageValidationException("Invalid model: " + id + ". Use one of " + ids()));
    }

    /**
     * Registry order with {@code preferredId} moved to the front. A {@code null} or blank
     * preference keeps registry order.
     *
     * @throws ImageValidationException when the preferred id is not registered
     */
    public List<ModelAdapter> orderedWithPreferred(String preferredId) {
        if (preferredId == null || preferredId.isBlank()) {
            return ordered();
        }
        ModelAdapter preferred = require(preferredId);
        List<ModelAdapter> reordered = new ArrayList<>(adapters.size());
        reordered.add(preferred);
        for (ModelAdapter adapter : adapters.values()) {
            if (adapter != preferred) {
                reordered.add(adapter);
            }
        }
        return reordered;
    }
}
