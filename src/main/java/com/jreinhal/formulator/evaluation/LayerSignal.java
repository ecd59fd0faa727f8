package com.jreinhal.formulator.evaluation;

/**
 * Evaluator verdict on one formulation element.
 *
 * @param trigger          whether the element needs revision
 * @param explanation      one sentence on its quality
 * @param guidance         revision advice, empty when no revision is needed
 * @param localUncertainty token-level uncertainty of the evaluator response, in [0, 1]
 */
public record LayerSignal(boolean trigger, String explanation, String guidance, double localUncertainty) {

    public LayerSignal {
        explanation = explanation == null ? "" : explanation;
        guidance = guidance == null ? "" : guidance;
    }

    public static LayerSignal neutral(double localUncertainty) {
        return new LayerSignal(false, "", "", localUncertainty);
    }

    public boolean hasGuidance() {
        return !guidance.isEmpty();
    }
}
