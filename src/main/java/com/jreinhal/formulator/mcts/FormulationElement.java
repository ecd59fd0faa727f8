package com.jreinhal.formulator.mcts;

import java.util.Locale;
import java.util.Optional;

/**
 * The six elements of an optimization formulation, one per tree layer.
 *
 * Layer 0 is the empty root and has no element; layer 6 completes a formulation.
 */
public enum FormulationElement {
    TYPE(1, "Type"),
    SETS(2, "Sets"),
    PARAMETERS(3, "Parameters"),
    VARIABLES(4, "Variables"),
    OBJECTIVE(5, "Objective"),
    CONSTRAINTS(6, "Constraints");

    /**
     * Layer at which a formulation is complete and can no longer be expanded.
     */
    public static final int COMPLETE_LAYER = 6;

    private final int layer;
    private final String displayName;

    FormulationElement(int layer, String displayName) {
        this.layer = layer;
        this.displayName = displayName;
    }

    public int layer() {
        return layer;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Lower-case key used in evaluator JSON ("type", "sets", ...).
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FormulationElement> forLayer(int layer) {
        if (layer < 1 || layer > COMPLETE_LAYER) {
            return Optional.empty();
        }
        return Optional.of(values()[layer - 1]);
    }
}
