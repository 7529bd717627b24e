package org.relaypad.keypad;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable keypad-layout catalog keyed by layout id.
 */
public final class KeypadLayoutCatalog {

    private final Map<String, KeypadLayout> layoutsById;

    /**
     * Creates a catalog with built-in layouts only.
     */
    public KeypadLayoutCatalog() {
        this.layoutsById = Map.copyOf(materialize(defaultLayouts()));
    }

    /**
     * Creates a catalog by merging built-ins with custom layouts.
     * A custom layout with a built-in id replaces the built-in.
     */
    public KeypadLayoutCatalog(Collection<KeypadLayout> customLayouts) {
        this.layoutsById = Map.copyOf(materialize(mergeWithBuiltIns(customLayouts)));
    }

    /**
     * Creates an explicit catalog from the given layouts.
     */
    public KeypadLayoutCatalog(Collection<KeypadLayout> layouts, boolean includeBuiltIns) {
        Collection<KeypadLayout> source = includeBuiltIns ? mergeWithBuiltIns(layouts) : layouts;
        this.layoutsById = Map.copyOf(materialize(source));
    }

    /**
     * Returns layout by id, or null when not registered.
     */
    public KeypadLayout layout(String layoutId) {
        if (layoutId == null) {
            return null;
        }
        return layoutsById.get(layoutId.trim());
    }

    /**
     * Returns immutable set of registered layout ids.
     */
    public Set<String> layoutIds() {
        return layoutsById.keySet();
    }

    /**
     * Returns a new default catalog instance.
     */
    public static KeypadLayoutCatalog defaultCatalog() {
        return new KeypadLayoutCatalog();
    }

    private static Collection<KeypadLayout> defaultLayouts() {
        return List.of(KeypadLayouts.DIRECTIONAL, KeypadLayouts.NUMERIC);
    }

    private static Collection<KeypadLayout> mergeWithBuiltIns(Collection<KeypadLayout> customLayouts) {
        LinkedHashMap<String, KeypadLayout> merged = new LinkedHashMap<>();
        for (KeypadLayout layout : defaultLayouts()) {
            merged.put(layout.id(), layout);
        }
        if (customLayouts != null) {
            for (KeypadLayout layout : customLayouts) {
                KeypadLayout nonNullLayout = Objects.requireNonNull(layout, "layout");
                merged.put(nonNullLayout.id(), nonNullLayout);
            }
        }
        return merged.values();
    }

    private static LinkedHashMap<String, KeypadLayout> materialize(Collection<KeypadLayout> layouts) {
        Objects.requireNonNull(layouts, "layouts");
        LinkedHashMap<String, KeypadLayout> map = new LinkedHashMap<>();
        for (KeypadLayout layout : layouts) {
            KeypadLayout nonNullLayout = Objects.requireNonNull(layout, "layout");
            map.put(nonNullLayout.id(), nonNullLayout);
        }
        return map;
    }
}
