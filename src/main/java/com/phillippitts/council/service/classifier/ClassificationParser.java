package com.phillippitts.council.service.classifier;

import com.phillippitts.council.domain.Complexity;
import com.phillippitts.council.exception.ParseFailureException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the classifier backend's JSON reply.
 *
 * <p>Expected shape:
 * <pre>
 * {"complexity": "simple|moderate|complex|expert", "reasoning": "...",
 *  "tools_needed": ["web_search"], "confidence": 0.8}
 * </pre>
 * Markdown code fences around the object are tolerated. Confidence is clamped to [0,1]; a
 * missing confidence counts as 0.7.
 */
public final class ClassificationParser {

    static final double DEFAULT_CONFIDENCE = 0.7;

    private ClassificationParser() {
    }

    public static ModelClassification parse(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new ParseFailureException("classification", "empty reply");
        }
        String json = stripFences(reply.trim());
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new ParseFailureException("classification", "reply is not a JSON object", e);
        }
        String label = obj.optString("complexity", "");
        Complexity complexity = Complexity.fromLabel(label)
                .orElseThrow(() -> new ParseFailureException("classification", "unknown complexity '" + label + "'"));

        List<String> tools = new ArrayList<>();
        JSONArray arr = obj.optJSONArray("tools_needed");
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                String t = arr.optString(i, "").trim();
                if (!t.isEmpty()) {
                    tools.add(t);
                }
            }
        }
        double confidence = obj.optDouble("confidence", DEFAULT_CONFIDENCE);
        if (Double.isNaN(confidence)) {
            confidence = DEFAULT_CONFIDENCE;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        return new ModelClassification(complexity, obj.optString("reasoning", "model classification"),
                tools, confidence);
    }

    static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String body = text.substring(3);
        int end = body.indexOf("```");
        if (end >= 0) {
            body = body.substring(0, end);
        }
        body = body.strip();
        if (body.regionMatches(true, 0, "json", 0, 4)) {
            body = body.substring(4);
        }
        return body.strip();
    }
}
