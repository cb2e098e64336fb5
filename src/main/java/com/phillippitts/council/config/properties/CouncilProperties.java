package com.phillippitts.council.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend catalog, routing tables and per-workspace presets.
 *
 * <p>Backend ids contain '/' and '.', so map keys use bracket notation:
 * <pre>
 * council.backends.[openai/gpt-5.1].input-cost-per-million=2.50
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "council")
public class CouncilProperties {

    /** Known backends keyed by backend id. Routing may only reference ids listed here. */
    private Map<String, BackendProperties> backends = new LinkedHashMap<>();

    /** The two general-purpose backends used when classification degrades. */
    private List<String> defaultBackends = new ArrayList<>();

    private Routing routing = new Routing();

    private String classifierBackend;
    private String summarizerBackend;
    private String synthesizerBackend;
    private String judgeBackend;

    @Min(1)
    private int maxCompletionTokens = 2048;

    @Min(1)
    private int classifierMaxTokens = 256;

    @Min(1)
    private int summaryMaxTokens = 512;

    private double temperature = 0.7;

    /** Workspace presets keyed by lower-case workspace name. */
    private Map<String, WorkspaceProperties> workspaces = new LinkedHashMap<>();

    public Map<String, BackendProperties> getBackends() {
        return backends;
    }

    public void setBackends(Map<String, BackendProperties> backends) {
        this.backends = backends;
    }

    public List<String> getDefaultBackends() {
        return defaultBackends;
    }

    public void setDefaultBackends(List<String> defaultBackends) {
        this.defaultBackends = defaultBackends;
    }

    public Routing getRouting() {
        return routing;
    }

    public void setRouting(Routing routing) {
        this.routing = routing;
    }

    public String getClassifierBackend() {
        return classifierBackend;
    }

    public void setClassifierBackend(String classifierBackend) {
        this.classifierBackend = classifierBackend;
    }

    public String getSummarizerBackend() {
        return summarizerBackend;
    }

    public void setSummarizerBackend(String summarizerBackend) {
        this.summarizerBackend = summarizerBackend;
    }

    public String getSynthesizerBackend() {
        return synthesizerBackend;
    }

    public void setSynthesizerBackend(String synthesizerBackend) {
        this.synthesizerBackend = synthesizerBackend;
    }

    public String getJudgeBackend() {
        return judgeBackend;
    }

    public void setJudgeBackend(String judgeBackend) {
        this.judgeBackend = judgeBackend;
    }

    public int getMaxCompletionTokens() {
        return maxCompletionTokens;
    }

    public void setMaxCompletionTokens(int maxCompletionTokens) {
        this.maxCompletionTokens = maxCompletionTokens;
    }

    public int getClassifierMaxTokens() {
        return classifierMaxTokens;
    }

    public void setClassifierMaxTokens(int classifierMaxTokens) {
        this.classifierMaxTokens = classifierMaxTokens;
    }

    public int getSummaryMaxTokens() {
        return summaryMaxTokens;
    }

    public void setSummaryMaxTokens(int summaryMaxTokens) {
        this.summaryMaxTokens = summaryMaxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public Map<String, WorkspaceProperties> getWorkspaces() {
        return workspaces;
    }

    public void setWorkspaces(Map<String, WorkspaceProperties> workspaces) {
        this.workspaces = workspaces;
    }

    /**
     * Pricing of one backend, in USD per million tokens.
     */
    public static class BackendProperties {
        @PositiveOrZero
        private double inputCostPerMillion;
        @PositiveOrZero
        private double outputCostPerMillion;

        public BackendProperties() {
        }

        public BackendProperties(double inputCostPerMillion, double outputCostPerMillion) {
            this.inputCostPerMillion = inputCostPerMillion;
            this.outputCostPerMillion = outputCostPerMillion;
        }

        public double getInputCostPerMillion() {
            return inputCostPerMillion;
        }

        public void setInputCostPerMillion(double inputCostPerMillion) {
            this.inputCostPerMillion = inputCostPerMillion;
        }

        public double getOutputCostPerMillion() {
            return outputCostPerMillion;
        }

        public void setOutputCostPerMillion(double outputCostPerMillion) {
            this.outputCostPerMillion = outputCostPerMillion;
        }
    }

    /**
     * Backend lists per complexity, used when the workspace does not pin its own set.
     */
    public static class Routing {
        private List<String> simple = new ArrayList<>();
        private List<String> moderate = new ArrayList<>();
        private List<String> complex = new ArrayList<>();
        private List<String> expert = new ArrayList<>();

        public List<String> getSimple() {
            return simple;
        }

        public void setSimple(List<String> simple) {
            this.simple = simple;
        }

        public List<String> getModerate() {
            return moderate;
        }

        public void setModerate(List<String> moderate) {
            this.moderate = moderate;
        }

        public List<String> getComplex() {
            return complex;
        }

        public void setComplex(List<String> complex) {
            this.complex = complex;
        }

        public List<String> getExpert() {
            return expert;
        }

        public void setExpert(List<String> expert) {
            this.expert = expert;
        }
    }

    /**
     * Preset for one workspace. Empty or null fields fall back to the global settings.
     */
    public static class WorkspaceProperties {
        private List<String> backends = new ArrayList<>();
        private List<String> tools = new ArrayList<>();
        private String tokenTier;
        private String synthesizerBackend;
        private String style;
        private boolean highStakes;
        private boolean ragEnabled;

        public List<String> getBackends() {
            return backends;
        }

        public void setBackends(List<String> backends) {
            this.backends = backends;
        }

        public List<String> getTools() {
            return tools;
        }

        public void setTools(List<String> tools) {
            this.tools = tools;
        }

        public String getTokenTier() {
            return tokenTier;
        }

        public void setTokenTier(String tokenTier) {
            this.tokenTier = tokenTier;
        }

        public String getSynthesizerBackend() {
            return synthesizerBackend;
        }

        public void setSynthesizerBackend(String synthesizerBackend) {
            this.synthesizerBackend = synthesizerBackend;
        }

        public String getStyle() {
            return style;
        }

        public void setStyle(String style) {
            this.style = style;
        }

        public boolean isHighStakes() {
            return highStakes;
        }

        public void setHighStakes(boolean highStakes) {
            this.highStakes = highStakes;
        }

        public boolean isRagEnabled() {
            return ragEnabled;
        }

        public void setRagEnabled(boolean ragEnabled) {
            this.ragEnabled = ragEnabled;
        }
    }
}
