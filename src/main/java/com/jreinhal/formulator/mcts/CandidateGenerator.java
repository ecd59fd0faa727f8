package com.jreinhal.formulator.mcts;

import com.jreinhal.formulator.llm.TextGenerator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proposes formulation elements with the language model and grows the tree with them.
 */
public class CandidateGenerator {

    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    static final int GUIDANCE_HINTS = 3;

    private static final String ELEMENT_PROMPT = """
            You are an expert in mathematical optimization.

            Problem:
            {problem}

            Formulation so far:
            {partial}
            {knowledge_guidance}
            Generate ONLY the "{element_name}" component of the mathematical formulation.
            Be concise and precise. Do not write code.""";

    private final TextGenerator textGenerator;
    private final KnowledgeBase knowledgeBase;
    private final SimilarityPruner pruner;
    private final MctsSettings settings;
    private final Random random;

    public CandidateGenerator(TextGenerator textGenerator, KnowledgeBase knowledgeBase, SimilarityPruner pruner,
                              MctsSettings settings, Random random) {
        this.textGenerator = textGenerator;
        this.knowledgeBase = knowledgeBase;
        this.pruner = pruner;
        this.settings = settings;
        this.random = random;
    }

    /**
     * One candidate text for {@code element}, with the newest knowledge-base guidance for it.
     */
    public String generateElement(String problem, String partialFormulation, FormulationElement element) {
        String prompt = ELEMENT_PROMPT
                .replace("{problem}", problem)
                .replace("{partial}", partialFormulation == null || partialFormulation.isBlank()
                        ? FormulationNode.EMPTY_FORMULATION : partialFormulation)
                .replace("{knowledge_guidance}", guidanceBlock(element))
                .replace("{element_name}", element.key());
        return textGenerator.generate(prompt, settings.elementTemperature());
    }

    String guidanceBlock(FormulationElement element) {
        List<String> hints = knowledgeBase.recent(element, GUIDANCE_HINTS);
        if (hints.isEmpty()) {
            return "";
        }
        StringBuilder block = new StringBuilder("\nGuidance from previous attempts for '")
                .append(element.key())
                .append("':\n");
        for (String hint : hints) {
            block.append("- ").append(hint).append('\n');
        }
        return block.toString();
    }

    /**
     * Add up to {@code candidatesPerExpansion} distinct children for the next layer and
     * return one of them. When nothing new is added the result is an existing child,
     * unvisited ones first. Empty only for a complete node.
     */
    public Optional<FormulationNode> expand(FormulationNode node) {
        int nextLayer = node.getLayer() + 1;
        Optional<FormulationElement> element = FormulationElement.forLayer(nextLayer);
        if (element.isEmpty()) {
            return Optional.empty();
        }
        if (node.getChildren().size() >= settings.maxChildren()) {
            return Optional.of(pickExisting(node));
        }

        String partial = node.formatPartial();
        List<String> candidates = new ArrayList<>(settings.candidatesPerExpansion());
        for (int i = 0; i < settings.candidatesPerExpansion(); i++) {
            candidates.add(generateElement(node.getProblem(), partial, element.get()));
        }
        List<String> distinct = pruner.prune(candidates);

        List<String> existing = new ArrayList<>();
        for (FormulationNode child : node.getChildren()) {
            existing.add(child.getContent());
        }
        List<FormulationNode> added = new ArrayList<>();
        for (String content : distinct) {
            if (node.getChildren().size() >= settings.maxChildren()) {
                break;
            }
            if (content == null || content.isBlank() || pruner.isDuplicate(content, existing)) {
                continue;
            }
            added.add(node.addChild(content));
            existing.add(content);
        }
        log.debug("Expanded {} at layer {}: {} candidates, {} after pruning, {} added",
                node.elementName(), node.getLayer(), candidates.size(), distinct.size(), added.size());

        if (added.isEmpty()) {
            if (node.isLeaf()) {
                // every candidate was blank
                return Optional.empty();
            }
            return Optional.of(pickExisting(node));
        }
        return Optional.of(added.get(random.nextInt(added.size())));
    }

    private FormulationNode pickExisting(FormulationNode node) {
        List<FormulationNode> unvisited = new ArrayList<>();
        for (FormulationNode child : node.getChildren()) {
            if (child.getVisits() == 0) {
                unvisited.add(child);
            }
        }
        List<FormulationNode> pool = unvisited.isEmpty() ? node.getChildren() : unvisited;
        return pool.get(random.nextInt(pool.size()));
    }

    /**
     * The node's path plus a generated element for every deeper layer. Generated
     * elements are scratch content and are not added to the tree.
     */
    public Map<FormulationElement, String> completeFormulation(FormulationNode node) {
        Map<FormulationElement, String> formulation = node.formulationPath();
        for (int layer = node.getLayer() + 1; layer <= FormulationElement.COMPLETE_LAYER; layer++) {
            FormulationElement element = FormulationElement.forLayer(layer).orElseThrow();
            String partial = formulation.isEmpty() ? "" : FormulationNode.format(formulation);
            formulation.put(element, generateElement(node.getProblem(), partial, element));
        }
        return formulation;
    }
}
