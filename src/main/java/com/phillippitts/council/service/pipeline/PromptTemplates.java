package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.domain.AggregateRanking;
import com.phillippitts.council.domain.ModelResponse;
import com.phillippitts.council.domain.PeerRanking;
import com.phillippitts.council.domain.TokenTier;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Prompt text for every stage. Responses are always referred to by label, never by backend.
 */
final class PromptTemplates {

    private PromptTemplates() {
    }

    static String stage1(String augmentedQuestion, List<String> history) {
        if (history.isEmpty()) {
            return augmentedQuestion;
        }
        StringBuilder sb = new StringBuilder("Previous conversation:\n");
        history.forEach(turn -> sb.append("- ").append(turn).append('\n'));
        return sb.append('\n').append(augmentedQuestion).toString();
    }

    static String peerReview(String question, List<String> labels, List<String> texts) {
        StringBuilder responses = new StringBuilder();
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0) {
                responses.append("\n\n");
            }
            responses.append(labels.get(i)).append(":\n").append(texts.get(i));
        }
        return """
                You are evaluating different responses to the following question:

                Question: %s

                Here are the responses from different models (anonymized):

                %s

                Your task:
                1. First, evaluate each response individually. For each response, explain what it does well and what it does poorly.
                2. Then, at the very end of your response, provide a final ranking.

                IMPORTANT: Your final ranking MUST be formatted EXACTLY as follows:
                - Start with the line "FINAL RANKING:" (all caps, with colon)
                - Then list the responses from best to worst as a numbered list
                - Each line should be: number, period, space, then ONLY the response label (e.g., "1. Response A")
                - Do not add any other text or explanations in the ranking section

                Example of the correct format for the ranking section:

                FINAL RANKING:
                1. Response C
                2. Response A
                3. Response B

                Now provide your evaluation and ranking:""".formatted(question, responses);
    }

    /**
     * @param candidates  chosen responses, best first, each paired with its label
     * @param rationale   raw peer review texts; only used by the comprehensive tier
     * @param context     compressed tool context, or "" for none
     * @param style       workspace style instructions, or null
     */
    static String synthesis(String question, TokenTier tier, List<String> candidateLabels,
                            List<ModelResponse> candidates, List<AggregateRanking> aggregate,
                            List<PeerRanking> rationale, String context, String style) {
        StringBuilder stage1 = new StringBuilder();
        for (int i = 0; i < candidates.size(); i++) {
            if (i > 0) {
                stage1.append("\n\n");
            }
            stage1.append(candidateLabels.get(i)).append(":\n").append(candidates.get(i).text());
        }

        String stage2;
        if (tier == TokenTier.MINIMAL || aggregate.isEmpty()) {
            stage2 = "(Rankings omitted)";
        } else if (tier == TokenTier.STANDARD) {
            stage2 = "Aggregate ranking: " + aggregate.stream()
                    .map(a -> String.format(Locale.ROOT, "%s (mean rank %.2f)", a.label(), a.meanRank()))
                    .collect(Collectors.joining(", "));
        } else {
            StringBuilder sb = new StringBuilder("Aggregate ranking: ")
                    .append(aggregate.stream()
                            .map(a -> String.format(Locale.ROOT, "%s (mean rank %.2f)", a.label(), a.meanRank()))
                            .collect(Collectors.joining(", ")));
            int n = 1;
            for (PeerRanking r : rationale) {
                sb.append("\n\nReviewer ").append(n++).append(":\n").append(r.rawText());
            }
            stage2 = sb.toString();
        }

        StringBuilder prompt = new StringBuilder()
                .append("You are the Chairman of an LLM Council. Multiple AI models have provided responses to ")
                .append("a user's question, and then ranked each other's responses.\n\n")
                .append("Original Question: ").append(question).append("\n\n");
        if (context != null && !context.isBlank()) {
            prompt.append("Reference Context:\n").append(context).append("\n\n");
        }
        prompt.append("STAGE 1 - Individual Responses:\n").append(stage1).append("\n\n")
                .append("STAGE 2 - Peer Rankings:\n").append(stage2).append("\n\n")
                .append("Your task as Chairman is to synthesize all of this information into a single, ")
                .append("comprehensive, accurate answer to the user's original question. Consider the individual ")
                .append("responses and their insights, what the peer rankings reveal about response quality, ")
                .append("and any patterns of agreement or disagreement.\n\n");
        if (style != null && !style.isBlank()) {
            prompt.append("Style guide for this workspace:\n").append(style.strip()).append("\n\n");
        }
        return prompt.append("Provide a clear, well-reasoned final answer that represents the council's ")
                .append("collective wisdom:").toString();
    }

    static String judge(String question, List<String> labels, List<ModelResponse> responses, String finalAnswer) {
        StringBuilder stage1 = new StringBuilder();
        for (int i = 0; i < responses.size(); i++) {
            if (i > 0) {
                stage1.append("\n\n");
            }
            stage1.append(labels.get(i)).append(":\n").append(responses.get(i).text());
        }
        return """
                You are an independent judge evaluating the quality of a multi-LLM council's response.

                Original Question:
                %s

                Individual Model Responses (Stage 1):
                %s

                Council's Final Answer (Stage 3):
                %s

                Evaluate the final answer for:
                1. Accuracy: Is the information factually correct?
                2. Completeness: Does it fully address all aspects of the question?
                3. Coherence: Is it well-structured and easy to understand?
                4. Concerns: Are there any errors, contradictions, or missing information?

                Provide your evaluation in the following format:

                ACCURACY SCORE: [0-10]
                COMPLETENESS SCORE: [0-10]
                COHERENCE SCORE: [0-10]

                CONCERNS:
                - [List any concerns, or write "None"]

                RECOMMENDATION: [APPROVE | REVISE | ESCALATE]
                REASONING: [Brief explanation of your recommendation]
                """.formatted(question, stage1, finalAnswer);
    }

    static String summarize(String question, String context) {
        return "Summarize the following reference material so that it stays useful for answering the "
                + "question below. Keep facts, figures, names and sources. Omit everything unrelated.\n\n"
                + "Question: " + question + "\n\nMaterial:\n" + context;
    }
}
