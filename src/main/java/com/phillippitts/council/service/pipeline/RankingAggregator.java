package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.domain.AggregateRanking;
import com.phillippitts.council.domain.PeerRanking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mean-rank aggregation over parseable peer rankings.
 *
 * <p>Each label scores the mean of its 1-based positions across the rankings that include it.
 * Order: lower mean first, then fewer missing votes, then label.
 */
public final class RankingAggregator {

    static final Comparator<AggregateRanking> ORDER = Comparator
            .comparingDouble(AggregateRanking::meanRank)
            .thenComparingInt(AggregateRanking::missingVotes)
            .thenComparing(AggregateRanking::label);

    private RankingAggregator() {
    }

    public static List<AggregateRanking> aggregate(List<PeerRanking> rankings) {
        List<PeerRanking> parseable = rankings.stream().filter(PeerRanking::parseable).toList();
        Map<String, int[]> totals = new TreeMap<>();
        for (PeerRanking ranking : parseable) {
            List<String> labels = ranking.labels();
            for (int i = 0; i < labels.size(); i++) {
                int[] t = totals.computeIfAbsent(labels.get(i), k -> new int[2]);
                t[0] += i + 1;
                t[1]++;
            }
        }
        List<AggregateRanking> result = new ArrayList<>(totals.size());
        totals.forEach((label, t) -> result.add(
                new AggregateRanking(label, (double) t[0] / t[1], t[1], parseable.size() - t[1])));
        result.sort(ORDER);
        return List.copyOf(result);
    }
}
