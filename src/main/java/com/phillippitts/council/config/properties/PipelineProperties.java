package com.phillippitts.council.config.properties;

import com.phillippitts.council.domain.TokenTier;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the deliberation pipeline: stage deadlines, synthesis tier, judge gate
 * and tool-context limits.
 */
@Validated
@ConfigurationProperties(prefix = "council.pipeline")
public class PipelineProperties {

    private final Duration stage1Timeout;
    private final Duration stage2Timeout;
    private final Duration stage3Timeout;
    private final Duration stage4Timeout;

    /** Upper bound on classification latency, including the fallback model call. */
    private final Duration classifierTimeout;

    private final TokenTier tokenTier;

    private final boolean judgeEnabled;

    /** Mean normalised score at or above which a verdict without recommendation approves. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double judgeApproveThreshold;

    /** Shuffle label assignment per query so labels do not mirror selection order. */
    private final boolean shuffleLabels;

    /** Hard cap on tool/RAG context included in prompts, in estimated tokens. */
    @Min(100)
    private final int contextCapTokens;

    /** Tool context above this many estimated tokens is summarized by the cheap backend. */
    @Min(100)
    private final int summarizeThresholdTokens;

    @ConstructorBinding
    public PipelineProperties(Duration stage1Timeout,
                              Duration stage2Timeout,
                              Duration stage3Timeout,
                              Duration stage4Timeout,
                              Duration classifierTimeout,
                              TokenTier tokenTier,
                              Boolean judgeEnabled,
                              Double judgeApproveThreshold,
                              Boolean shuffleLabels,
                              Integer contextCapTokens,
                              Integer summarizeThresholdTokens) {
        this.stage1Timeout = stage1Timeout == null ? Duration.ofSeconds(60) : stage1Timeout;
        this.stage2Timeout = stage2Timeout == null ? Duration.ofSeconds(60) : stage2Timeout;
        this.stage3Timeout = stage3Timeout == null ? Duration.ofSeconds(90) : stage3Timeout;
        this.stage4Timeout = stage4Timeout == null ? Duration.ofSeconds(60) : stage4Timeout;
        this.classifierTimeout = classifierTimeout == null ? Duration.ofMillis(900) : classifierTimeout;
        this.tokenTier = tokenTier == null ? TokenTier.STANDARD : tokenTier;
        this.judgeEnabled = judgeEnabled == null || judgeEnabled;
        this.judgeApproveThreshold = judgeApproveThreshold == null ? 0.7 : judgeApproveThreshold;
        this.shuffleLabels = shuffleLabels == null || shuffleLabels;
        this.contextCapTokens = contextCapTokens == null ? 4000 : contextCapTokens;
        this.summarizeThresholdTokens = summarizeThresholdTokens == null ? 1500 : summarizeThresholdTokens;
    }

    /**
     * Defaults for everything; used by tests and builders.
     */
    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    public Duration getStage1Timeout() {
        return stage1Timeout;
    }

    public Duration getStage2Timeout() {
        return stage2Timeout;
    }

    public Duration getStage3Timeout() {
        return stage3Timeout;
    }

    public Duration getStage4Timeout() {
        return stage4Timeout;
    }

    public Duration getClassifierTimeout() {
        return classifierTimeout;
    }

    public TokenTier getTokenTier() {
        return tokenTier;
    }

    public boolean isJudgeEnabled() {
        return judgeEnabled;
    }

    public double getJudgeApproveThreshold() {
        return judgeApproveThreshold;
    }

    public boolean isShuffleLabels() {
        return shuffleLabels;
    }

    public int getContextCapTokens() {
        return contextCapTokens;
    }

    public int getSummarizeThresholdTokens() {
        return summarizeThresholdTokens;
    }
}
