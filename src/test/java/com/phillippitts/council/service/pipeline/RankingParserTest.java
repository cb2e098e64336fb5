package com.phillippitts.council.service.pipeline;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RankingParserTest {

    private static final List<String> LABELS = List.of("Response A", "Response B", "Response C");

    @Test
    void shouldParseNumberedEntriesAfterMarker() {
        String reply = """
                Response A is thorough but verbose. Response C misses the point.

                FINAL RANKING:
                1. Response B
                2. Response A
                3. Response C
                """;

        assertThat(RankingParser.parse(reply, LABELS))
                .containsExactly("Response B", "Response A", "Response C");
    }

    @Test
    void shouldIgnoreLabelsMentionedBeforeMarker() {
        String reply = "Response C is best. Response A second.\nFINAL RANKING:\n1. Response A\n2. Response C";

        assertThat(RankingParser.parse(reply, LABELS)).containsExactly("Response A", "Response C");
    }

    @Test
    void shouldFallBackToBareLabelsWithoutNumbering() {
        String reply = "FINAL RANKING: Response C, Response A, Response B";

        assertThat(RankingParser.parse(reply, LABELS))
                .containsExactly("Response C", "Response A", "Response B");
    }

    @Test
    void shouldReturnEmptyWhenMarkerMissing() {
        assertThat(RankingParser.parse("1. Response A\n2. Response B", LABELS)).isEmpty();
    }

    @Test
    void shouldReturnEmptyForNullReply() {
        assertThat(RankingParser.parse(null, LABELS)).isEmpty();
    }

    @Test
    void shouldMatchMarkerCaseInsensitively() {
        assertThat(RankingParser.parse("Final Ranking:\n1. Response B", LABELS)).containsExactly("Response B");
    }

    @Test
    void shouldDropUnknownAndRepeatedLabels() {
        String reply = "FINAL RANKING:\n1. Response D\n2. Response A\n3. Response A\n4. Response B";

        assertThat(RankingParser.parse(reply, LABELS)).containsExactly("Response A", "Response B");
    }

    @Test
    void shouldUseLastMarkerWhenRepeated() {
        String reply = "FINAL RANKING:\n1. Response A\nOn reflection...\nFINAL RANKING:\n1. Response C\n2. Response B";

        assertThat(RankingParser.parse(reply, LABELS)).containsExactly("Response C", "Response B");
    }

    @Test
    void shouldKeepPartialRankings() {
        assertThat(RankingParser.parse("FINAL RANKING:\n1. Response B", LABELS)).containsExactly("Response B");
    }
}
