package com.phillippitts.council.service.classifier;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.PipelineProperties;
import com.phillippitts.council.domain.Complexity;
import com.phillippitts.council.domain.DecisionSource;
import com.phillippitts.council.domain.IntentDecision;
import com.phillippitts.council.domain.Query;
import com.phillippitts.council.domain.Workflow;
import com.phillippitts.council.exception.AdmissionDeniedException;
import com.phillippitts.council.exception.BackendFailureException;
import com.phillippitts.council.exception.ConfigurationException;
import com.phillippitts.council.exception.ParseFailureException;
import com.phillippitts.council.service.gateway.ChatMessage;
import com.phillippitts.council.service.gateway.CompletionParams;
import com.phillippitts.council.service.governor.CallPurpose;
import com.phillippitts.council.service.governor.CostGovernor;
import com.phillippitts.council.service.governor.PricedCall;
import com.phillippitts.council.service.metrics.CouncilMetricsPublisher;
import com.phillippitts.council.service.tools.ToolCatalog;
import com.phillippitts.council.service.tools.ToolParameterResolver;
import com.phillippitts.council.service.workspace.WorkspaceConfig;
import com.phillippitts.council.service.workspace.WorkspaceConfigProvider;
import com.phillippitts.council.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Two-tier intent classifier.
 *
 * <ol>
 *   <li><b>Rules:</b> {@link KeywordRules} decide obvious cases at zero cost</li>
 *   <li><b>Model:</b> ambiguous queries go to the configured low-cost classifier backend through
 *       the {@link CostGovernor}, bounded by {@code council.pipeline.classifier-timeout}</li>
 *   <li><b>Default:</b> any fallback failure (timeout, backend error, admission denial,
 *       unparseable reply) yields a moderate decision on the default backends with the
 *       deliberation workflow</li>
 * </ol>
 *
 * <p>Suggested tools are kept only if registered and allowed by the workspace; workspaces with
 * RAG enabled always get {@code rag_search}.
 */
@Service
public class DefaultIntentClassifier implements IntentClassifier {

    private static final Logger LOG = LogManager.getLogger(DefaultIntentClassifier.class);

    static final double DEFAULT_CONFIDENCE = 0.3;
    static final int HISTORY_TURNS = 3;

    static final String SYSTEM_PROMPT = """
            You are an intent classifier for an LLM orchestration system.

            Classify the query complexity and determine which tools might be needed.

            Complexity levels:
            - simple: Quick factual questions, greetings, basic math (use 1 model)
            - moderate: Questions requiring some analysis or current info (use 2-3 models)
            - complex: Multi-faceted questions, comparisons, detailed analysis (use 3-4 models)
            - expert: High-stakes content, deep analysis, multiple domains (use 4+ models)

            Available tools:
            - calculator: Math and numerical computations
            - web_search: Current events, recent information, facts
            - code_execution: Running code, algorithms
            - sports_data: Sports scores, odds, statistics
            - rag_search: Search workspace documents

            Respond with JSON only:
            {
                "complexity": "simple|moderate|complex|expert",
                "reasoning": "brief explanation in 10 words or less",
                "tools_needed": ["tool1", "tool2"],
                "confidence": 0.0-1.0
            }""";

    private final CostGovernor governor;
    private final ModelRouter router;
    private final ToolCatalog catalog;
    private final WorkspaceConfigProvider workspaces;
    private final CouncilProperties councilProperties;
    private final PipelineProperties pipelineProperties;
    private final Executor executor;
    private final CouncilMetricsPublisher metrics;

    public DefaultIntentClassifier(CostGovernor governor,
                                   ModelRouter router,
                                   ToolCatalog catalog,
                                   WorkspaceConfigProvider workspaces,
                                   CouncilProperties councilProperties,
                                   PipelineProperties pipelineProperties,
                                   @Qualifier("councilExecutor") Executor executor,
                                   CouncilMetricsPublisher metrics) {
        this.governor = governor;
        this.router = router;
        this.catalog = catalog;
        this.workspaces = workspaces;
        this.councilProperties = councilProperties;
        this.pipelineProperties = pipelineProperties;
        this.executor = executor;
        this.metrics = metrics == null ? CouncilMetricsPublisher.NOOP : metrics;
    }

    @Override
    public IntentDecision classify(Query query) {
        WorkspaceConfig workspace = workspaces.forWorkspace(query.workspace());
        Optional<RuleMatch> rule = KeywordRules.match(query.text());
        IntentDecision decision;
        if (rule.isPresent()) {
            RuleMatch m = rule.get();
            decision = decide(m.complexity(), m.suggestedTools(), m.rationale(), m.confidence(),
                    DecisionSource.RULES, workspace);
        } else {
            decision = classifyWithModel(query, workspace)
                    .map(c -> decide(c.complexity(), c.tools(), c.reasoning(), c.confidence(),
                            DecisionSource.MODEL, workspace))
                    .orElseGet(() -> defaultDecision(workspace));
        }
        metrics.recordClassification(decision.source().name(), decision.complexity().name());
        LOG.info("Intent decided: complexity={}, workflow={}, backends={}, tools={}, source={}, confidence={}",
                decision.complexity(), decision.workflow(), decision.backends(), decision.suggestedTools(),
                decision.source(), decision.confidence());
        return decision;
    }

    /**
     * The degraded decision: moderate, default backends, deliberation.
     */
    IntentDecision defaultDecision(WorkspaceConfig workspace) {
        return new IntentDecision(Complexity.MODERATE, Workflow.DELIBERATION, router.defaultBackends(),
                selectTools(List.of(), workspace), "Classification unavailable, using defaults",
                DEFAULT_CONFIDENCE, DecisionSource.DEFAULT);
    }

    private IntentDecision decide(Complexity complexity, List<String> tools, String rationale, double confidence,
                                  DecisionSource source, WorkspaceConfig workspace) {
        List<String> backends = router.route(complexity, workspace);
        Workflow workflow = Workflow.forDecision(complexity, backends.size());
        return new IntentDecision(complexity, workflow, backends, selectTools(tools, workspace), rationale,
                confidence, source);
    }

    private List<String> selectTools(List<String> suggested, WorkspaceConfig workspace) {
        Set<String> selected = new LinkedHashSet<>();
        for (String tool : suggested) {
            if (catalog.contains(tool) && workspace.allowsTool(tool)) {
                selected.add(tool);
            }
        }
        if (workspace.ragEnabled() && catalog.contains(ToolParameterResolver.RAG_SEARCH)) {
            selected.add(ToolParameterResolver.RAG_SEARCH);
        }
        return catalog.order(selected);
    }

    private Optional<ModelClassification> classifyWithModel(Query query, WorkspaceConfig workspace) {
        String backend = councilProperties.getClassifierBackend();
        if (backend == null || backend.isBlank()) {
            LOG.warn("No classifier backend configured; using default decision");
            return Optional.empty();
        }
        long timeoutMs = pipelineProperties.getClassifierTimeout().toMillis();
        PricedCall call = new PricedCall(query.id(), query.workspace(), CallPurpose.CLASSIFY, backend,
                List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(userPrompt(query))),
                new CompletionParams(councilProperties.getClassifierMaxTokens(), 0.0,
                        pipelineProperties.getClassifierTimeout()));

        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(() -> governor.call(call).text(), executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Classifier fallback rejected: council executor saturated; using default decision");
            return Optional.empty();
        }
        try {
            String reply = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return Optional.of(ClassificationParser.parse(reply));
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Classifier fallback timed out after {} ms; using default decision", timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted during classification; using default decision");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConfigurationException ce) {
                throw ce;
            }
            if (cause instanceof AdmissionDeniedException || cause instanceof BackendFailureException) {
                LOG.warn("Classifier fallback failed: {}; using default decision", cause.getMessage());
            } else {
                LOG.error("Classifier fallback failed unexpectedly; using default decision", cause);
            }
        } catch (ParseFailureException e) {
            LOG.warn("Classifier reply unparseable for query '{}': {}", LogSanitizer.preview(query.text()),
                    e.getMessage());
        }
        return Optional.empty();
    }

    static String userPrompt(Query query) {
        StringBuilder sb = new StringBuilder();
        List<String> history = query.history();
        if (!history.isEmpty()) {
            List<String> recent = new ArrayList<>(history.subList(Math.max(0, history.size() - HISTORY_TURNS),
                    history.size()));
            sb.append("Recent conversation:\n");
            for (String turn : recent) {
                sb.append("- ").append(turn).append('\n');
            }
            sb.append('\n');
        }
        return sb.append("Classify this query:\n\n").append(query.text()).toString();
    }
}
