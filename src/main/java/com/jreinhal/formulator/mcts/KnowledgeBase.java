package com.jreinhal.formulator.mcts;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Layer-wise revision guidance collected during one search.
 *
 * Entries are kept in insertion order, most recent last. A list that grows past
 * {@value #MAX_ENTRIES} entries is cut back to its newest {@value #RETAINED_AFTER_TRIM}.
 * Not thread-safe: each search owns its own instance.
 */
public class KnowledgeBase {

    static final int MAX_ENTRIES = 20;
    static final int RETAINED_AFTER_TRIM = 10;

    private final Map<FormulationElement, List<String>> entries = new EnumMap<>(FormulationElement.class);

    public KnowledgeBase() {
        clear();
    }

    public void add(FormulationElement element, String guidance) {
        if (guidance == null || guidance.isEmpty()) {
            return;
        }
        List<String> list = entries.get(element);
        list.add(guidance);
        if (list.size() > MAX_ENTRIES) {
            List<String> newest = new ArrayList<>(list.subList(list.size() - RETAINED_AFTER_TRIM, list.size()));
            entries.put(element, newest);
        }
    }

    public List<String> guidance(FormulationElement element) {
        return List.copyOf(entries.get(element));
    }

    /**
     * The newest {@code limit} entries, oldest first.
     */
    public List<String> recent(FormulationElement element, int limit) {
        List<String> list = entries.get(element);
        int from = Math.max(0, list.size() - Math.max(0, limit));
        return List.copyOf(list.subList(from, list.size()));
    }

    public int size(FormulationElement element) {
        return entries.get(element).size();
    }

    public void clear() {
        for (FormulationElement element : FormulationElement.values()) {
            entries.put(element, new ArrayList<>());
        }
    }
}
