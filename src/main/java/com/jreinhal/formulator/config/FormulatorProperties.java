package com.jreinhal.formulator.config;

import com.jreinhal.formulator.mcts.MctsSettings;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "formulator")
public class FormulatorProperties {

    private Mcts mcts = new Mcts();
    private Execution execution = new Execution();
    private Llm llm = new Llm();
    private Api api = new Api();

    public Mcts getMcts() {
        return mcts;
    }

    public void setMcts(Mcts mcts) {
        this.mcts = mcts;
    }

    public Execution getExecution() {
        return execution;
    }

    public void setExecution(Execution execution) {
        this.execution = execution;
    }

    public Llm getLlm() {
        return llm;
    }

    public void setLlm(Llm llm) {
        this.llm = llm;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public MctsSettings toSettings() {
        return new MctsSettings(mcts.iterations, mcts.explorationConstant, mcts.uncertaintyThreshold,
                mcts.scoreSamples, mcts.maxChildren, mcts.candidatesPerExpansion, mcts.similarityThreshold,
                mcts.maxRepairAttempts, mcts.temperature.element, mcts.temperature.code,
                mcts.temperature.scoring, mcts.temperature.signals);
    }

    public static class Mcts {
        /**
         * Maximum select/expand/simulate/backpropagate rounds per search.
         */
        private int iterations = 20;
        private double explorationConstant = 2.0;
        /**
         * A node flagged for revision is re-expanded when its local uncertainty exceeds this.
         */
        private double uncertaintyThreshold = 0.3;
        private int scoreSamples = 3;
        private int maxChildren = 5;
        private int candidatesPerExpansion = 3;
        private double similarityThreshold = 0.8;
        private int maxRepairAttempts = 12;
        /**
         * Seed for tie-breaking; unset means a fresh random source per search.
         */
        private Long seed;
        private Temperature temperature = new Temperature();

        public int getIterations() {
            return iterations;
        }

        public void setIterations(int iterations) {
            this.iterations = iterations;
        }

        public double getExplorationConstant() {
            return explorationConstant;
        }

        public void setExplorationConstant(double explorationConstant) {
            this.explorationConstant = explorationConstant;
        }

        public double getUncertaintyThreshold() {
            return uncertaintyThreshold;
        }

        public void setUncertaintyThreshold(double uncertaintyThreshold) {
            this.uncertaintyThreshold = uncertaintyThreshold;
        }

        public int getScoreSamples() {
            return scoreSamples;
        }

        public void setScoreSamples(int scoreSamples) {
            this.scoreSamples = scoreSamples;
        }

        public int getMaxChildren() {
            return maxChildren;
        }

        public void setMaxChildren(int maxChildren) {
            this.maxChildren = maxChildren;
        }

        public int getCandidatesPerExpansion() {
            return candidatesPerExpansion;
        }

        public void setCandidatesPerExpansion(int candidatesPerExpansion) {
            this.candidatesPerExpansion = candidatesPerExpansion;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getMaxRepairAttempts() {
            return maxRepairAttempts;
        }

        public void setMaxRepairAttempts(int maxRepairAttempts) {
            this.maxRepairAttempts = maxRepairAttempts;
        }

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }

        public Temperature getTemperature() {
            return temperature;
        }

        public void setTemperature(Temperature temperature) {
            this.temperature = temperature;
        }
    }

    public static class Temperature {
        private double element = 0.7;
        private double code = 0.0;
        private double scoring = 0.5;
        private double signals = 0.2;

        public double getElement() {
            return element;
        }

        public void setElement(double element) {
            this.element = element;
        }

        public double getCode() {
            return code;
        }

        public void setCode(double code) {
            this.code = code;
        }

        public double getScoring() {
            return scoring;
        }

        public void setScoring(double scoring) {
            this.scoring = scoring;
        }

        public double getSignals() {
            return signals;
        }

        public void setSignals(double signals) {
            this.signals = signals;
        }
    }

    public static class Execution {
        /**
         * Interpreter command; the script path is appended as the last argument.
         */
        private List<String> command = new ArrayList<>(List.of("python3"));
        private long timeoutSeconds = 120;

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Llm {
        private int maxAttempts = 8;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 30_000;
        private long requestTimeoutSeconds = 120;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public long getRequestTimeoutSeconds() {
            return requestTimeoutSeconds;
        }

        public void setRequestTimeoutSeconds(long requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }
    }

    public static class Api {
        private int maxProblemLength = 20_000;

        public int getMaxProblemLength() {
            return maxProblemLength;
        }

        public void setMaxProblemLength(int maxProblemLength) {
            this.maxProblemLength = maxProblemLength;
        }
    }
}
