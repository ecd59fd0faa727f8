package com.jreinhal.formulator.mcts;

import com.jreinhal.formulator.evaluation.LayerSignal;
import com.jreinhal.formulator.execution.ExecutionResult;
import java.util.Map;

record SimulationOutcome(double reward, ExecutionResult result, double globalUncertainty,
                         Map<FormulationElement, LayerSignal> signals) {
}
