package com.phillippitts.council.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tool coordinator settings.
 */
@Validated
@ConfigurationProperties(prefix = "council.tools")
public class ToolProperties {

    private Duration perToolTimeout = Duration.ofSeconds(10);
    private Duration overallTimeout = Duration.ofSeconds(15);

    /**
     * Catalog priority: tool results are merged in this order. Tools not listed follow in
     * lexical order.
     */
    private List<String> priority = new ArrayList<>(
            List.of("rag_search", "sports_data", "web_search", "calculator", "code_execution"));

    private Rag rag = new Rag();

    public Duration getPerToolTimeout() {
        return perToolTimeout;
    }

    public void setPerToolTimeout(Duration perToolTimeout) {
        this.perToolTimeout = perToolTimeout;
    }

    public Duration getOverallTimeout() {
        return overallTimeout;
    }

    public void setOverallTimeout(Duration overallTimeout) {
        this.overallTimeout = overallTimeout;
    }

    public List<String> getPriority() {
        return priority;
    }

    public void setPriority(List<String> priority) {
        this.priority = priority;
    }

    public Rag getRag() {
        return rag;
    }

    public void setRag(Rag rag) {
        this.rag = rag;
    }

    /**
     * Parameters for the {@code rag_search} tool.
     */
    public static class Rag {
        private int k = 5;
        private double minScore = 0.3;
        private int maxPassageChars = 1200;

        public int getK() {
            return k;
        }

        public void setK(int k) {
            this.k = k;
        }

        public double getMinScore() {
            return minScore;
        }

        public void setMinScore(double minScore) {
            this.minScore = minScore;
        }

        public int getMaxPassageChars() {
            return maxPassageChars;
        }

        public void setMaxPassageChars(int maxPassageChars) {
            this.maxPassageChars = maxPassageChars;
        }
    }
}
