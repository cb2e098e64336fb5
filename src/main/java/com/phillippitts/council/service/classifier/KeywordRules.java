package com.phillippitts.council.service.classifier;

import com.phillippitts.council.domain.Complexity;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * First classification tier: ordered keyword rules. The first matching rule wins; when none
 * matches the query goes to the model fallback.
 *
 * <p>Rule order: short simple queries, math/code, sports, creative, analytical, current events,
 * long queries.
 */
public final class KeywordRules {

    static final int SHORT_QUERY_WORDS = 10;
    static final int LONG_QUERY_WORDS = 50;

    private static final List<Pattern> SIMPLE = compile(
            "\\b(what is|what's|define|meaning of)\\b",
            "^\\d+\\s*[+\\-*/]\\s*\\d+",
            "\\b(hello|hi|hey|thanks|thank you)\\b");

    private static final List<Pattern> COMPLEX = compile(
            "\\b(compare|contrast|analyze|evaluate|assess)\\b",
            "\\b(why|how|explain|elaborate)\\b.*\\b(and|or)\\b",
            "\\b(pros and cons|advantages and disadvantages)\\b",
            "\\b(comprehensive|detailed|thorough)\\b.*\\b(analysis|review|report)\\b");

    private static final List<Pattern> MATH_CODE = compile(
            "\\b(calculate|compute|algorithm|optimize|solve)\\b",
            "\\b(code|script|program|function|class)\\b",
            "\\b(python|javascript|java|sql)\\b",
            "\\b(api|endpoint|database)\\b");

    private static final List<Pattern> CREATIVE = compile(
            "\\b(write|draft|compose|create)\\b.*\\b(article|essay|story|blog|post)\\b",
            "\\b(wooster|bellcourt)\\b",
            "\\b(style|tone|voice)\\b");

    private static final List<Pattern> SPORTS = compile(
            "\\b(spread|total|parlay|slate|vegas|line|odds)\\b",
            "\\b(cfb|nfl|nba|mlb)\\b",
            "\\b(team|player|game|match|score)\\b.*\\b(stats|statistics|data)\\b");

    private static final List<Pattern> WEB_SEARCH = compile(
            "\\b(latest|recent|current|today|this week|news)\\b",
            "\\b(who is|who are|what happened|when did)\\b",
            "\\b(price|cost|value)\\b.*\\b(of|for)\\b");

    private KeywordRules() {
    }

    /**
     * @return the first matching rule, or empty when the query is ambiguous
     */
    public static Optional<RuleMatch> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String query = text.trim();
        int words = countWords(query);

        if (words < SHORT_QUERY_WORDS && matchesAny(query, SIMPLE)) {
            return rule(Complexity.SIMPLE, 0.9, "Short query with simple pattern");
        }
        if (matchesAny(query, MATH_CODE)) {
            return rule(Complexity.MODERATE, 0.8, "Math or code-related query", "calculator", "code_execution");
        }
        if (matchesAny(query, SPORTS)) {
            return rule(Complexity.MODERATE, 0.85, "Sports data query", "sports_data", "web_search");
        }
        if (matchesAny(query, CREATIVE)) {
            return rule(Complexity.COMPLEX, 0.8, "Creative or content production query", "rag_search", "web_search");
        }
        if (matchesAny(query, COMPLEX)) {
            return rule(Complexity.COMPLEX, 0.85, "Complex analytical query requiring multiple perspectives");
        }
        if (matchesAny(query, WEB_SEARCH)) {
            return rule(Complexity.MODERATE, 0.7, "Query requires current information", "web_search");
        }
        if (words > LONG_QUERY_WORDS) {
            return rule(Complexity.COMPLEX, 0.75, "Long, detailed query");
        }
        return Optional.empty();
    }

    static int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static Optional<RuleMatch> rule(Complexity complexity, double confidence, String rationale,
                                            String... tools) {
        return Optional.of(new RuleMatch(complexity, confidence, rationale, List.of(tools)));
    }

    private static boolean matchesAny(String text, List<Pattern> patterns) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
