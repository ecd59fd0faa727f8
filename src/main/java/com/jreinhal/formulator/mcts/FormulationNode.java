package com.jreinhal.formulator.mcts;

import com.jreinhal.formulator.execution.ExecutionResult;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * One element of a formulation in the search tree.
 *
 * A node at layer {@code n} holds the content of element {@code n}; the path from
 * the root down to it is the partial formulation it stands for. Children are owned
 * by their parent. The parent reference is only read (UCB1, backpropagation).
 *
 * <pre>
 * root (layer 0)
 * +-- Type: "LP"                        (layer 1)
 * |   +-- Sets: "I = products"          (layer 2)
 * |   +-- Sets: "I = plants, J = ..."   (layer 2)
 * +-- Type: "MILP"                      (layer 1)
 * </pre>
 */
public class FormulationNode {

    static final String ROOT_NAME = "root";
    static final String UNKNOWN_NAME = "unknown";
    static final String EMPTY_FORMULATION = "(none yet)";

    private final String problem;
    private final int layer;
    private final String content;
    private final FormulationNode parent;
    private final List<FormulationNode> children = new ArrayList<>();

    private int visits;
    private double value;
    private boolean trigger;
    private double localUncertainty;
    private ExecutionResult lastResult;

    private FormulationNode(String problem, int layer, String content, FormulationNode parent) {
        this.problem = problem;
        this.layer = layer;
        this.content = content;
        this.parent = parent;
    }

    public static FormulationNode root(String problem) {
        return new FormulationNode(problem, 0, "", null);
    }

    /**
     * Attach a child holding the next element. Complete nodes never gain children.
     */
    FormulationNode addChild(String childContent) {
        if (isComplete()) {
            throw new IllegalStateException("Cannot expand a complete formulation (layer " + layer + ")");
        }
        if (childContent == null || childContent.isBlank()) {
            throw new IllegalArgumentException("Child content must not be empty");
        }
        FormulationNode child = new FormulationNode(problem, layer + 1, childContent, this);
        children.add(child);
        return child;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isComplete() {
        return layer == FormulationElement.COMPLETE_LAYER;
    }

    public Optional<FormulationElement> element() {
        return FormulationElement.forLayer(layer);
    }

    public String elementName() {
        if (layer == 0) {
            return ROOT_NAME;
        }
        return element().map(FormulationElement::key).orElse(UNKNOWN_NAME);
    }

    /**
     * UCB1 score. Unvisited nodes score {@code +infinity} so each child is tried once
     * before any exploitation.
     */
    public double ucb1(double explorationConstant) {
        if (visits == 0) {
            return Double.POSITIVE_INFINITY;
        }
        int parentVisits = parent == null ? visits : Math.max(1, parent.visits);
        return value + explorationConstant * Math.sqrt(2.0 * Math.log(parentVisits) / visits);
    }

    /**
     * Incremental confidence-weighted mean: {@code value += confidence * (reward - value) / visits}.
     * With reward and confidence in [0, 1] the value stays in [0, 1].
     */
    void recordVisit(double reward, double confidence) {
        visits++;
        value += confidence * (reward - value) / visits;
    }

    void applySignal(boolean needsRevision, double uncertainty) {
        this.trigger = needsRevision;
        this.localUncertainty = uncertainty;
    }

    void setLastResult(ExecutionResult result) {
        this.lastResult = result;
    }

    /**
     * Elements on the path from the root to this node, ordered by layer.
     */
    public Map<FormulationElement, String> formulationPath() {
        Map<FormulationElement, String> path = new EnumMap<>(FormulationElement.class);
        for (FormulationNode node = this; node != null; node = node.parent) {
            FormulationNode current = node;
            current.element().ifPresent(element -> path.put(element, current.content));
        }
        return path;
    }

    public String formatPartial() {
        return format(formulationPath());
    }

    /**
     * Render elements as {@code **Name**: content} lines in layer order.
     */
    public static String format(Map<FormulationElement, String> formulation) {
        StringJoiner lines = new StringJoiner("\n");
        for (FormulationElement element : FormulationElement.values()) {
            String elementContent = formulation.get(element);
            if (elementContent != null) {
                lines.add("**" + element.displayName() + "**: " + elementContent);
            }
        }
        return lines.length() == 0 ? EMPTY_FORMULATION : lines.toString();
    }

    /**
     * Number of nodes in this subtree, counted with an explicit stack.
     */
    public int subtreeSize() {
        int count = 0;
        Deque<FormulationNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            FormulationNode node = stack.pop();
            count++;
            for (FormulationNode child : node.children) {
                stack.push(child);
            }
        }
        return count;
    }

    public String getProblem() {
        return problem;
    }

    public int getLayer() {
        return layer;
    }

    public String getContent() {
        return content;
    }

    public FormulationNode getParent() {
        return parent;
    }

    public List<FormulationNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getVisits() {
        return visits;
    }

    public double getValue() {
        return value;
    }

    public boolean isTrigger() {
        return trigger;
    }

    public double getLocalUncertainty() {
        return localUncertainty;
    }

    public Optional<ExecutionResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }
}
