package com.phillippitts.council.service.pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a rater's ordering from the text after the {@value #MARKER} marker.
 *
 * <p>Numbered entries ("1. Response C") are preferred; without them every "Response X" after
 * the marker counts, in order. Unknown and repeated labels are dropped. A reply without the
 * marker yields an empty list.
 */
public final class RankingParser {

    public static final String MARKER = "FINAL RANKING:";

    private static final Pattern NUMBERED = Pattern.compile("\\d+\\.\\s*(Response [A-Z])\\b");
    private static final Pattern BARE = Pattern.compile("Response [A-Z]\\b");

    private RankingParser() {
    }

    public static List<String> parse(String reply, Collection<String> validLabels) {
        if (reply == null) {
            return List.of();
        }
        int idx = reply.toUpperCase(Locale.ROOT).lastIndexOf(MARKER);
        if (idx < 0) {
            return List.of();
        }
        String section = reply.substring(idx + MARKER.length());

        List<String> found = new ArrayList<>();
        Matcher numbered = NUMBERED.matcher(section);
        while (numbered.find()) {
            found.add(numbered.group(1));
        }
        if (found.isEmpty()) {
            Matcher bare = BARE.matcher(section);
            while (bare.find()) {
                found.add(bare.group());
            }
        }

        Set<String> ordered = new LinkedHashSet<>();
        for (String label : found) {
            if (validLabels.contains(label)) {
                ordered.add(label);
            }
        }
        return List.copyOf(ordered);
    }
}
