package com.phillippitts.council.presentation.controller;

import com.phillippitts.council.config.logging.MdcFilter;
import com.phillippitts.council.domain.DeliberationResult;
import com.phillippitts.council.domain.Query;
import com.phillippitts.council.service.governor.BackendReport;
import com.phillippitts.council.service.governor.CostGovernor;
import com.phillippitts.council.service.governor.CostLedger;
import com.phillippitts.council.service.governor.CostReport;
import com.phillippitts.council.service.governor.cache.CacheStats;
import com.phillippitts.council.service.pipeline.DeliberationPipeline;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST boundary of the council: run a deliberation, read spend, inspect the response cache.
 */
@RestController
@RequestMapping("/api/council")
@Validated
class DeliberationController {

    private static final Logger LOG = LogManager.getLogger(DeliberationController.class);

    private final DeliberationPipeline pipeline;
    private final CostLedger ledger;
    private final CostGovernor governor;

    DeliberationController(DeliberationPipeline pipeline, CostLedger ledger, CostGovernor governor) {
        this.pipeline = pipeline;
        this.ledger = ledger;
        this.governor = governor;
    }

    /**
     * Runs a deliberation and returns once the final answer is available. Failures are mapped
     * to HTTP statuses by the global exception handler. The body's workspace wins over the
     * X-Workspace header.
     */
    @PostMapping("/queries")
    ResponseEntity<DeliberationResult> deliberate(@Valid @RequestBody DeliberationRequest request,
                                                  @RequestHeader(value = MdcFilter.WORKSPACE_HEADER, required = false)
                                                  String workspaceHeader) {
        String workspace = request.workspace() == null || request.workspace().isBlank()
                ? MdcFilter.workspaceLabel(workspaceHeader)
                : request.workspace();
        Query query = Query.of(request.text(), workspace, request.history());
        LOG.info("Query received: id={}, workspace={}", query.id(), query.workspace());
        return ResponseEntity.ok(pipeline.deliberate(query));
    }

    @GetMapping("/costs")
    ResponseEntity<CostReport> costs(@RequestParam(defaultValue = "7") @Min(1) int days) {
        return ResponseEntity.ok(ledger.report(withinRetention(days)));
    }

    /**
     * Spend and reliability per backend, optionally for a single backend.
     */
    @GetMapping("/costs/backends")
    ResponseEntity<BackendReport> backendCosts(@RequestParam(defaultValue = "30") @Min(1) int days,
                                               @RequestParam(required = false) String backend) {
        return ResponseEntity.ok(ledger.backendReport(withinRetention(days), backend));
    }

    @GetMapping("/cache")
    ResponseEntity<Map<String, Object>> cacheStats() {
        CacheStats stats = governor.cacheStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", stats.size());
        body.put("capacity", stats.capacity());
        body.put("utilisation", stats.utilisation());
        body.put("hits", stats.hits());
        body.put("misses", stats.misses());
        body.put("hitRate", stats.hitRate());
        body.put("evictions", stats.evictions());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/cache")
    ResponseEntity<Void> clearCache() {
        governor.clearCache();
        return ResponseEntity.noContent().build();
    }

    // Older days are pruned from the ledger and would read as zero
    private int withinRetention(int days) {
        int retention = ledger.retentionDays();
        if (days > retention) {
            throw new IllegalArgumentException("days must not exceed the ledger retention of " + retention
                    + ", got: " + days);
        }
        return days;
    }
}
