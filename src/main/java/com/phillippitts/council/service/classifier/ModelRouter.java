package com.phillippitts.council.service.classifier;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.domain.Complexity;
import com.phillippitts.council.domain.IntentDecision;
import com.phillippitts.council.service.workspace.WorkspaceConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Picks the backend set for a complexity.
 *
 * <p>A workspace that pins its own backends always gets exactly those. Otherwise the routing
 * table for the complexity applies. The result is de-duplicated, capped at
 * {@link IntentDecision#MAX_BACKENDS} and never empty: an empty list falls back to
 * {@code council.default-backends}.
 */
@Component
public class ModelRouter {

    private final CouncilProperties properties;

    public ModelRouter(CouncilProperties properties) {
        this.properties = properties;
    }

    public List<String> route(Complexity complexity, WorkspaceConfig workspace) {
        List<String> candidates = workspace != null && !workspace.backends().isEmpty()
                ? workspace.backends()
                : table(complexity);
        List<String> routed = normalise(candidates);
        return routed.isEmpty() ? defaultBackends() : routed;
    }

    /**
     * Backends of the degraded decision used when classification fails.
     */
    public List<String> defaultBackends() {
        List<String> defaults = normalise(properties.getDefaultBackends());
        if (defaults.isEmpty()) {
            defaults = normalise(properties.getRouting().getModerate());
        }
        if (defaults.isEmpty()) {
            defaults = normalise(new ArrayList<>(properties.getBackends().keySet())).stream().limit(2).toList();
        }
        return defaults;
    }

    private List<String> table(Complexity complexity) {
        CouncilProperties.Routing routing = properties.getRouting();
        return switch (complexity) {
            case SIMPLE -> routing.getSimple();
            case MODERATE -> routing.getModerate();
            case COMPLEX -> routing.getComplex();
            case EXPERT -> routing.getExpert();
        };
    }

    private static List<String> normalise(List<String> ids) {
        if (ids == null) {
            return List.of();
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                distinct.add(id.trim());
            }
        }
        return distinct.stream().limit(IntentDecision.MAX_BACKENDS).toList();
    }
}
