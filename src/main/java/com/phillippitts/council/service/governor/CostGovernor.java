package com.phillippitts.council.service.governor;

import com.phillippitts.council.config.properties.CostGovernorProperties;
import com.phillippitts.council.domain.FailureKind;
import com.phillippitts.council.exception.AdmissionDeniedException;
import com.phillippitts.council.exception.BackendFailureException;
import com.phillippitts.council.exception.BackendFailureExceptionBuilder;
import com.phillippitts.council.exception.ConfigurationException;
import com.phillippitts.council.service.gateway.GatewayCompletion;
import com.phillippitts.council.service.gateway.ModelGateway;
import com.phillippitts.council.service.governor.cache.CacheKeys;
import com.phillippitts.council.service.governor.cache.CacheStats;
import com.phillippitts.council.service.governor.cache.ResponseCacheStore;
import com.phillippitts.council.service.metrics.CouncilMetricsPublisher;
import com.phillippitts.council.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Single entry point for priced backend calls.
 *
 * <p>Each call goes through, in order:
 * <ol>
 *   <li><b>Cache:</b> a hit returns the stored completion verbatim at zero cost and is not
 *       written to the ledger</li>
 *   <li><b>Admission:</b> the estimated cost is reserved against the daily and per-query
 *       budgets; a call that would exceed either throws {@link AdmissionDeniedException} and is
 *       never dispatched</li>
 *   <li><b>Gateway call</b>, outside any lock</li>
 *   <li><b>Ledger append:</b> success or failure, with actual tokens, latency and cost</li>
 *   <li><b>Cache put</b> on success</li>
 * </ol>
 *
 * <p>Thread-safe; called concurrently by every stage fan-out.
 */
@Service
public class CostGovernor {

    private static final Logger LOG = LogManager.getLogger(CostGovernor.class);

    private final ModelGateway gateway;
    private final CostLedger ledger;
    private final ResponseCacheStore cache;
    private final PricingTable pricing;
    private final CostEstimator estimator;
    private final CostGovernorProperties properties;
    private final CouncilMetricsPublisher metrics;

    public CostGovernor(Optional<ModelGateway> gateway,
                        CostLedger ledger,
                        ResponseCacheStore cache,
                        PricingTable pricing,
                        CostEstimator estimator,
                        CostGovernorProperties properties,
                        CouncilMetricsPublisher metrics) {
        this.gateway = gateway.orElse(null);
        this.ledger = Objects.requireNonNull(ledger);
        this.cache = Objects.requireNonNull(cache);
        this.pricing = Objects.requireNonNull(pricing);
        this.estimator = Objects.requireNonNull(estimator);
        this.properties = Objects.requireNonNull(properties);
        this.metrics = metrics == null ? CouncilMetricsPublisher.NOOP : metrics;
        if (this.gateway == null) {
            LOG.warn("No ModelGateway bean configured; every priced call will fail with a configuration error");
        }
    }

    /**
     * Executes a priced call.
     *
     * @return the completion and the cost charged for it
     * @throws ConfigurationException   if no gateway is configured or the backend is unknown
     * @throws AdmissionDeniedException if the call would exceed a budget
     * @throws BackendFailureException  if the gateway call failed; the failure is in the ledger
     */
    public GovernedCompletion call(PricedCall call) {
        ensureReady(call.backendId());

        String key = null;
        if (properties.isCacheEnabled()) {
            key = CacheKeys.forCall(call.backendId(), call.messages());
            Optional<GatewayCompletion> hit = cache.get(key);
            metrics.recordCacheLookup(hit.isPresent());
            if (hit.isPresent()) {
                LOG.debug("Cache hit: backend={}, purpose={}", call.backendId(), call.purpose());
                return GovernedCompletion.fromCache(hit.get());
            }
        }

        double estimate = estimator.estimate(call.backendId(), call.messages(), call.params());
        Reservation reservation;
        try {
            reservation = ledger.reserve(call.queryId(), estimate);
        } catch (AdmissionDeniedException e) {
            metrics.recordAdmissionDenied(e.getScope().name());
            LOG.warn("Admission denied: backend={}, purpose={}, scope={}, spent={}, estimate={}, limit={}",
                    call.backendId(), call.purpose(), e.getScope(), e.getSpent(), e.getEstimate(), e.getLimit());
            throw e;
        }

        long t0 = System.nanoTime();
        try {
            GatewayCompletion completion = dispatch(call, t0);
            long nanos = System.nanoTime() - t0;
            long latencyMs = TimeUtils.nanosToMillis(nanos);
            double cost = pricing.cost(call.backendId(), completion.promptTokens(), completion.completionTokens());
            ledger.record(reservation, CallRecord.success(call, completion.promptTokens(),
                    completion.completionTokens(), latencyMs, cost));
            metrics.recordCallSuccess(call.backendId(), call.purpose().name(), nanos, cost);
            if (key != null) {
                cache.set(key, completion, properties.getCacheTtl());
            }
            LOG.debug("Priced call ok: backend={}, purpose={}, tokens={}+{}, cost={}, latencyMs={}",
                    call.backendId(), call.purpose(), completion.promptTokens(), completion.completionTokens(),
                    cost, latencyMs);
            return new GovernedCompletion(completion, cost, latencyMs, false);
        } catch (BackendFailureException e) {
            long nanos = System.nanoTime() - t0;
            ledger.record(reservation, CallRecord.failure(call, TimeUtils.nanosToMillis(nanos), e.getKind()));
            metrics.recordCallFailure(call.backendId(), call.purpose().name(), nanos, e.getKind());
            LOG.warn("Priced call failed: backend={}, purpose={}, kind={}, message={}",
                    call.backendId(), call.purpose(), e.getKind(), e.getMessage());
            throw e;
        } finally {
            ledger.release(reservation);
        }
    }

    /**
     * Pre-query admission check: refuses new queries once the daily budget is exhausted.
     *
     * @throws AdmissionDeniedException if no daily budget remains
     */
    public void preflight(String queryId) {
        try {
            ledger.checkDayOpen();
        } catch (AdmissionDeniedException e) {
            metrics.recordAdmissionDenied(e.getScope().name());
            LOG.warn("Query {} refused: daily budget exhausted (spent={}, limit={})",
                    queryId, e.getSpent(), e.getLimit());
            throw e;
        }
    }

    public boolean isGatewayConfigured() {
        return gateway != null;
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clear();
        LOG.info("Response cache cleared");
    }

    private void ensureReady(String backendId) {
        if (gateway == null) {
            throw new ConfigurationException("model-gateway", "no ModelGateway collaborator is configured");
        }
        pricing.require(backendId);
    }

    private GatewayCompletion dispatch(PricedCall call, long t0) {
        GatewayCompletion completion;
        try {
            completion = gateway.complete(call.backendId(), call.messages(), call.params());
        } catch (BackendFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw BackendFailureExceptionBuilder.create("Gateway call failed unexpectedly")
                    .backend(call.backendId())
                    .kind(FailureKind.UNKNOWN)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .build();
        }
        if (completion == null || completion.text().isBlank()) {
            throw BackendFailureExceptionBuilder.create("Gateway returned an empty completion")
                    .backend(call.backendId())
                    .kind(FailureKind.INVALID_RESPONSE)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .build();
        }
        return completion;
    }
}
