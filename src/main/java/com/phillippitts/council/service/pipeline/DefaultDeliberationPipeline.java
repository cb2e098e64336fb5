package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.PipelineProperties;
import com.phillippitts.council.domain.AggregateRanking;
import com.phillippitts.council.domain.Complexity;
import com.phillippitts.council.domain.DeliberationResult;
import com.phillippitts.council.domain.FailureKind;
import com.phillippitts.council.domain.IntentDecision;
import com.phillippitts.council.domain.JudgeVerdict;
import com.phillippitts.council.domain.ModelResponse;
import com.phillippitts.council.domain.PipelineState;
import com.phillippitts.council.domain.Query;
import com.phillippitts.council.domain.QueryCostSummary;
import com.phillippitts.council.domain.SynthesisResult;
import com.phillippitts.council.domain.TokenTier;
import com.phillippitts.council.domain.ToolInvocation;
import com.phillippitts.council.domain.Workflow;
import com.phillippitts.council.exception.AdmissionDeniedException;
import com.phillippitts.council.exception.ConfigurationException;
import com.phillippitts.council.exception.PipelineFailureException;
import com.phillippitts.council.service.classifier.IntentClassifier;
import com.phillippitts.council.service.events.LifecycleEmitter;
import com.phillippitts.council.service.events.LifecycleEventType;
import com.phillippitts.council.service.events.LifecycleListener;
import com.phillippitts.council.service.governor.CostGovernor;
import com.phillippitts.council.service.governor.CostLedger;
import com.phillippitts.council.service.governor.PricingTable;
import com.phillippitts.council.service.metrics.CouncilMetricsPublisher;
import com.phillippitts.council.service.tools.AugmentationFormatter;
import com.phillippitts.council.service.tools.ToolBatch;
import com.phillippitts.council.service.tools.ToolCoordinator;
import com.phillippitts.council.service.tools.ToolParameterResolver;
import com.phillippitts.council.service.workspace.StyleGuideProvider;
import com.phillippitts.council.service.workspace.WorkspaceConfig;
import com.phillippitts.council.service.workspace.WorkspaceConfigProvider;
import com.phillippitts.council.util.LogSanitizer;
import com.phillippitts.council.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deliberation state machine.
 *
 * <pre>
 * INIT -> (TOOLS) -> STAGE1 -> (STAGE2) -> (STAGE3) -> (STAGE4) -> DONE
 *                  any state -> FAILED
 * </pre>
 *
 * <ul>
 *   <li><b>Admission:</b> a query is refused up front once the daily budget is exhausted</li>
 *   <li><b>Configuration:</b> every backend the run may call is checked before the first
 *       priced stage call</li>
 *   <li><b>Partial tolerance:</b> failed Stage1 backends are excluded from later stages; only
 *       an empty Stage1 is terminal</li>
 *   <li><b>Degradation:</b> a failed synthesis falls back to the best Stage1 answer; a failed
 *       judge yields an unavailable verdict</li>
 * </ul>
 *
 * <p>MDC keys {@code queryId} and {@code workspace} are set for the duration of the run and
 * propagate to worker threads through the executor task decorator.
 */
@Service
public class DefaultDeliberationPipeline implements DeliberationPipeline {

    private static final Logger LOG = LogManager.getLogger(DefaultDeliberationPipeline.class);

    static final String MDC_QUERY_ID = "queryId";
    static final String MDC_WORKSPACE = "workspace";

    private final CostGovernor governor;
    private final CostLedger ledger;
    private final PricingTable pricing;
    private final IntentClassifier classifier;
    private final ToolCoordinator toolCoordinator;
    private final ToolParameterResolver toolParameters;
    private final ContextCompressor compressor;
    private final CollectionStage collection;
    private final PeerReviewStage peerReview;
    private final SynthesisStage synthesis;
    private final JudgeStage judgeStage;
    private final WorkspaceConfigProvider workspaces;
    private final StyleGuideProvider styleGuide;
    private final CouncilProperties councilProperties;
    private final PipelineProperties pipelineProperties;
    private final CouncilMetricsPublisher metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    DefaultDeliberationPipeline(CostGovernor governor,
                                CostLedger ledger,
                                PricingTable pricing,
                                IntentClassifier classifier,
                                ToolCoordinator toolCoordinator,
                                ToolParameterResolver toolParameters,
                                ContextCompressor compressor,
                                CollectionStage collection,
                                PeerReviewStage peerReview,
                                SynthesisStage synthesis,
                                JudgeStage judgeStage,
                                WorkspaceConfigProvider workspaces,
                                StyleGuideProvider styleGuide,
                                CouncilProperties councilProperties,
                                PipelineProperties pipelineProperties,
                                CouncilMetricsPublisher metrics,
                                ApplicationEventPublisher publisher,
                                Clock clock) {
        this.governor = governor;
        this.ledger = ledger;
        this.pricing = pricing;
        this.classifier = classifier;
        this.toolCoordinator = toolCoordinator;
        this.toolParameters = toolParameters;
        this.compressor = compressor;
        this.collection = collection;
        this.peerReview = peerReview;
        this.synthesis = synthesis;
        this.judgeStage = judgeStage;
        this.workspaces = workspaces;
        this.styleGuide = styleGuide;
        this.councilProperties = councilProperties;
        this.pipelineProperties = pipelineProperties;
        this.metrics = metrics == null ? CouncilMetricsPublisher.NOOP : metrics;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public DeliberationResult deliberate(Query query, LifecycleListener listener) {
        long t0 = System.nanoTime();
        LifecycleEmitter emitter = new LifecycleEmitter(query.id(), listener, publisher, clock);
        List<PipelineState> path = new ArrayList<>(List.of(PipelineState.INIT));
        String previousQueryId = ThreadContext.get(MDC_QUERY_ID);
        String previousWorkspace = ThreadContext.get(MDC_WORKSPACE);
        ThreadContext.put(MDC_QUERY_ID, query.id());
        ThreadContext.put(MDC_WORKSPACE, query.workspace());
        Workflow workflow = null;
        try {
            LOG.info("Deliberation started: workspace={}, query='{}'", query.workspace(),
                    LogSanitizer.preview(query.text()));
            governor.preflight(query.id());

            WorkspaceConfig workspace = workspaces.forWorkspace(query.workspace());
            IntentDecision decision = classifier.classify(query);
            workflow = decision.workflow();
            emitter.emit(LifecycleEventType.INTENT_DECIDED,
                    "complexity", decision.complexity().name(),
                    "workflow", decision.workflow().name(),
                    "backends", decision.backends(),
                    "tools", decision.suggestedTools(),
                    "rationale", decision.rationale(),
                    "confidence", decision.confidence(),
                    "source", decision.source().name());

            String synthesizer = resolveSynthesizer(workspace, decision);
            String judge = shouldJudge(decision, workspace) ? councilProperties.getJudgeBackend() : null;
            validateBackends(decision, synthesizer, judge);
            RunContext ctx = new RunContext(query, decision, workspace, emitter);

            ToolBatch tools = ToolBatch.empty();
            String context = "";
            if (!decision.suggestedTools().isEmpty()) {
                path.add(PipelineState.TOOLS);
                tools = toolCoordinator.execute(toolParameters.requestsFor(decision.suggestedTools(), query));
                emitter.emit(LifecycleEventType.TOOLS_COMPLETED,
                        "tools", toolSummary(tools),
                        "succeeded", tools.successes().size(),
                        "failed", tools.failures().size());
                context = compressor.compress(ctx, AugmentationFormatter.contextBlock(tools));
            }

            path.add(PipelineState.STAGE1);
            String prompt = PromptTemplates.stage1(AugmentationFormatter.augment(query.text(), context),
                    query.history());
            CollectionStage.Outcome stage1 = collection.collect(ctx, prompt);
            List<ModelResponse> successful = stage1.successful();
            emitter.emit(LifecycleEventType.STAGE1_COMPLETE,
                    "succeeded", successful.size(),
                    "failed", stage1.responses().size() - successful.size());
            if (successful.isEmpty()) {
                path.add(PipelineState.FAILED);
                boolean allDenied = stage1.responses().stream()
                        .allMatch(r -> r.failureKind() == FailureKind.ADMISSION_DENIED);
                if (allDenied && stage1.denial() != null) {
                    throw stage1.denial();
                }
                throw new PipelineFailureException(query.id(), decision.backends());
            }

            PeerReviewStage.Outcome review = null;
            if (workflow.peerReview() && successful.size() >= 2) {
                path.add(PipelineState.STAGE2);
                review = peerReview.review(ctx, successful);
                emitter.emit(LifecycleEventType.STAGE2_COMPLETE,
                        "rankings", review.rankings().size(),
                        "parseable", review.rankings().stream().filter(r -> r.parseable()).count(),
                        "aggregate", aggregateSummary(review.aggregate()));
            }

            List<ModelResponse> ranked = TokenTierSelector.rankedOrder(successful,
                    review != null ? review.aggregate() : List.of(), review != null ? review.labels() : null);
            SynthesisResult synthesisResult = null;
            String finalAnswer = ranked.get(0).text();
            boolean degraded = false;
            if (workflow.synthesis()) {
                path.add(PipelineState.STAGE3);
                TokenTier tier = workspace.tokenTierOverride().orElse(pipelineProperties.getTokenTier());
                SynthesisStage.Outcome stage3 = synthesis.synthesize(ctx, synthesizer, tier, successful, review,
                        context, styleGuide.getStyle(query.workspace()).orElse(null));
                synthesisResult = stage3.result();
                degraded = synthesisResult == null;
                if (!degraded) {
                    finalAnswer = synthesisResult.text();
                }
                emitter.emit(LifecycleEventType.STAGE3_COMPLETE,
                        "synthesizer", synthesizer,
                        "tier", tier.name(),
                        "candidates", stage3.candidates().size(),
                        "success", !degraded,
                        "error", stage3.failure());
            }

            JudgeVerdict verdict = null;
            if (judge != null && synthesisResult != null) {
                path.add(PipelineState.STAGE4);
                verdict = judgeStage.judge(ctx, judge, successful, review != null ? review.labels() : null,
                        finalAnswer);
                emitter.emit(LifecycleEventType.STAGE4_COMPLETE,
                        "judge", judge,
                        "available", verdict.available(),
                        "recommendation", verdict.recommendation() == null ? null : verdict.recommendation().name(),
                        "scores", verdict.scores(),
                        "concerns", verdict.concerns());
            }

            path.add(PipelineState.DONE);
            long nanos = System.nanoTime() - t0;
            QueryCostSummary cost = ledger.summarize(query.id(), TimeUtils.nanosToMillis(nanos));
            emitCostSummary(emitter, cost);
            DeliberationResult result = new DeliberationResult(query.id(), decision, tools.invocations(),
                    stage1.responses(), review != null ? review.rankings() : List.of(),
                    review != null ? review.aggregate() : List.of(), synthesisResult, verdict, finalAnswer,
                    degraded, path, cost);
            emitter.emit(LifecycleEventType.COMPLETED,
                    "degraded", degraded,
                    "finalAnswer", finalAnswer);
            metrics.recordPipeline(workflow.name(), degraded ? "degraded" : "completed", nanos);
            LOG.info("Deliberation finished: workflow={}, path={}, responses={}/{}, degraded={}, cost={}, elapsedMs={}",
                    workflow, path, successful.size(), stage1.responses().size(), degraded,
                    String.format("%.6f", cost.totalCost()), cost.elapsedMs());
            return result;
        } catch (RuntimeException e) {
            if (path.get(path.size() - 1) != PipelineState.FAILED) {
                path.add(PipelineState.FAILED);
            }
            long nanos = System.nanoTime() - t0;
            emitCostSummary(emitter, ledger.summarize(query.id(), TimeUtils.nanosToMillis(nanos)));
            emitter.emit(LifecycleEventType.FAILED,
                    "reason", failureReason(e),
                    "error", e.getMessage(),
                    "path", List.copyOf(path));
            metrics.recordPipeline(workflow == null ? "none" : workflow.name(), "failed", nanos);
            if (e instanceof PipelineFailureException pfe) {
                LOG.error("Deliberation failed: all {} backends failed in Stage1: {}", pfe.getAttemptedCount(),
                        pfe.getAttemptedBackends());
            } else if (e instanceof AdmissionDeniedException || e instanceof ConfigurationException) {
                LOG.warn("Deliberation refused: {}", e.getMessage());
            } else {
                LOG.error("Deliberation failed unexpectedly", e);
            }
            throw e;
        } finally {
            restore(MDC_QUERY_ID, previousQueryId);
            restore(MDC_WORKSPACE, previousWorkspace);
        }
    }

    private String resolveSynthesizer(WorkspaceConfig workspace, IntentDecision decision) {
        String configured = workspace.synthesizerOverride().orElse(councilProperties.getSynthesizerBackend());
        return configured == null || configured.isBlank() ? decision.backends().get(0) : configured;
    }

    private boolean shouldJudge(IntentDecision decision, WorkspaceConfig workspace) {
        String judge = councilProperties.getJudgeBackend();
        if (!pipelineProperties.isJudgeEnabled() || judge == null || judge.isBlank()
                || !decision.workflow().synthesis()) {
            return false;
        }
        return decision.workflow() == Workflow.EXPERT_PANEL
                || decision.complexity().isAtLeast(Complexity.COMPLEX)
                || workspace.highStakes();
    }

    private void validateBackends(IntentDecision decision, String synthesizer, String judge) {
        if (!governor.isGatewayConfigured()) {
            throw new ConfigurationException("model-gateway", "no ModelGateway collaborator is configured");
        }
        decision.backends().forEach(pricing::require);
        if (decision.workflow().synthesis()) {
            pricing.require(synthesizer);
        }
        if (judge != null) {
            pricing.require(judge);
            if (judge.equals(synthesizer)) {
                throw new ConfigurationException("council.judge-backend",
                        "judge '" + judge + "' must differ from the synthesizer");
            }
        }
    }

    private static void emitCostSummary(LifecycleEmitter emitter, QueryCostSummary cost) {
        emitter.emit(LifecycleEventType.COST_SUMMARY,
                "totalCost", cost.totalCost(),
                "pricedCalls", cost.pricedCalls(),
                "failedCalls", cost.failedCalls(),
                "totalTokens", cost.totalTokens(),
                "elapsedMs", cost.elapsedMs());
    }

    private static List<Map<String, Object>> toolSummary(ToolBatch tools) {
        List<Map<String, Object>> summary = new ArrayList<>();
        for (ToolInvocation inv : tools.invocations()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("tool", inv.toolId());
            entry.put("success", inv.success());
            entry.put("latencyMs", inv.latencyMs());
            if (!inv.success()) {
                entry.put("failureKind", inv.failureKind().name());
            }
            summary.add(entry);
        }
        return summary;
    }

    private static List<Map<String, Object>> aggregateSummary(List<AggregateRanking> aggregate) {
        List<Map<String, Object>> summary = new ArrayList<>();
        for (AggregateRanking a : aggregate) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("label", a.label());
            entry.put("meanRank", a.meanRank());
            entry.put("votes", a.voteCount());
            entry.put("missingVotes", a.missingVotes());
            summary.add(entry);
        }
        return summary;
    }

    private static String failureReason(RuntimeException e) {
        if (e instanceof PipelineFailureException) {
            return "stage1_empty";
        }
        if (e instanceof AdmissionDeniedException) {
            return "admission_denied";
        }
        if (e instanceof ConfigurationException) {
            return "configuration";
        }
        return "unexpected";
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, previous);
        }
    }
}
