package com.phillippitts.council.service.tools;

import com.phillippitts.council.domain.ToolInvocation;

import java.util.Locale;

/**
 * Renders tool output into the text block prepended to Stage1 prompts.
 *
 * <pre>
 * User Question: {question}
 *
 * Additional Context from Tools:
 *
 * --- RAG_SEARCH ---
 * {content}
 *
 * Note: Some tools failed:
 * - web_search: timed out
 * </pre>
 *
 * Sections follow the batch order, which is catalog priority.
 */
public final class AugmentationFormatter {

    private AugmentationFormatter() {
    }

    /**
     * @return the context block, or "" when the batch is empty
     */
    public static String contextBlock(ToolBatch batch) {
        if (batch.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (ToolInvocation inv : batch.successes()) {
            sb.append("--- ").append(inv.toolId().toUpperCase(Locale.ROOT)).append(" ---\n")
                    .append(inv.content().strip()).append("\n\n");
        }
        if (!batch.failures().isEmpty()) {
            sb.append("Note: Some tools failed:\n");
            for (ToolInvocation inv : batch.failures()) {
                sb.append("- ").append(inv.toolId()).append(": ")
                        .append(inv.error() == null ? inv.failureKind().name().toLowerCase(Locale.ROOT) : inv.error())
                        .append('\n');
            }
        }
        return sb.toString().strip();
    }

    /**
     * Combines question and context; returns the question unchanged when there is no context.
     */
    public static String augment(String question, String context) {
        if (context == null || context.isBlank()) {
            return question;
        }
        return "User Question: " + question + "\n\nAdditional Context from Tools:\n\n" + context;
    }
}
