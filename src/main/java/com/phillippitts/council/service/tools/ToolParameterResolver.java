package com.phillippitts.council.service.tools;

import com.phillippitts.council.config.properties.ToolProperties;
import com.phillippitts.council.domain.Query;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prepares tool parameters from the query.
 *
 * <p>Every tool receives {@code query} and {@code workspace}; {@code rag_search} also receives
 * {@code k} and {@code min_score}, and {@code calculator} receives the {@code expression}.
 */
@Component
public class ToolParameterResolver {

    public static final String RAG_SEARCH = "rag_search";
    public static final String CALCULATOR = "calculator";

    private final ToolProperties properties;

    public ToolParameterResolver(ToolProperties properties) {
        this.properties = properties;
    }

    public Map<String, Object> resolve(String toolId, Query query) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", query.text());
        params.put("workspace", query.workspace());
        if (RAG_SEARCH.equals(toolId)) {
            params.put("k", properties.getRag().getK());
            params.put("min_score", properties.getRag().getMinScore());
        } else if (CALCULATOR.equals(toolId)) {
            params.put("expression", query.text().trim());
        }
        return params;
    }

    public List<ToolRequest> requestsFor(List<String> toolIds, Query query) {
        List<ToolRequest> requests = new ArrayList<>(toolIds.size());
        for (String id : toolIds) {
            requests.add(new ToolRequest(id, resolve(id, query)));
        }
        return requests;
    }
}
