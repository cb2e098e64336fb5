package com.phillippitts.council.service.tools.rag;

import com.phillippitts.council.config.properties.ToolProperties;
import com.phillippitts.council.domain.ToolFailureKind;
import com.phillippitts.council.service.tools.ToolCollaborator;
import com.phillippitts.council.service.tools.ToolFailureException;
import com.phillippitts.council.service.tools.ToolParameterResolver;
import com.phillippitts.council.service.tools.ToolResult;
import com.phillippitts.council.service.workspace.RagCollaborator;
import com.phillippitts.council.service.workspace.RagPassage;
import com.phillippitts.council.util.LogSanitizer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Adapts the {@link RagCollaborator} to the tool contract as {@code rag_search}.
 *
 * <p>Passages are listed best-first, each truncated to {@code council.tools.rag.max-passage-chars}.
 * Fails with {@link ToolFailureKind#UNAVAILABLE} when no RAG collaborator is configured.
 */
@Component
public class RagSearchTool implements ToolCollaborator {

    private final ObjectProvider<RagCollaborator> rag;
    private final ToolProperties properties;

    public RagSearchTool(ObjectProvider<RagCollaborator> rag, ToolProperties properties) {
        this.rag = rag;
        this.properties = properties;
    }

    @Override
    public String toolId() {
        return ToolParameterResolver.RAG_SEARCH;
    }

    @Override
    public ToolResult invoke(Map<String, Object> params, Duration timeout) {
        RagCollaborator collaborator = rag.getIfAvailable();
        if (collaborator == null) {
            throw new ToolFailureException(toolId(), ToolFailureKind.UNAVAILABLE, "no RAG collaborator configured");
        }
        Object query = params.get("query");
        Object workspace = params.get("workspace");
        if (!(query instanceof String q) || q.isBlank() || !(workspace instanceof String ws)) {
            throw new ToolFailureException(toolId(), ToolFailureKind.INVALID_PARAMS, "query and workspace are required");
        }
        int k = params.get("k") instanceof Number n ? n.intValue() : properties.getRag().getK();
        double minScore = params.get("min_score") instanceof Number n
                ? n.doubleValue() : properties.getRag().getMinScore();

        List<RagPassage> passages;
        try {
            passages = collaborator.semanticSearch(ws, q, k, minScore);
        } catch (RuntimeException e) {
            throw new ToolFailureException(toolId(), ToolFailureKind.ERROR, "semantic search failed", e);
        }
        if (passages == null || passages.isEmpty()) {
            return ToolResult.of("No relevant documents found in workspace " + ws + ".");
        }
        int cap = properties.getRag().getMaxPassageChars();
        StringBuilder sb = new StringBuilder();
        int i = 1;
        for (RagPassage p : passages.subList(0, Math.min(k, passages.size()))) {
            sb.append('[').append(i++).append("] ")
                    .append(p.source())
                    .append(String.format(Locale.ROOT, " (score %.2f)", p.score()))
                    .append('\n')
                    .append(LogSanitizer.truncate(p.text().strip(), cap))
                    .append("\n\n");
        }
        return ToolResult.of(sb.toString().strip());
    }
}
