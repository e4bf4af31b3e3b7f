package com.lunaindex.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

public final class GraphAnalytics {
    static final Set<String> ENTRY_POINTS = Set.of("activate", "deactivate");

    private GraphAnalytics() {
    }

    /**
     * Scores every summarized file: coupling counts its internal dependencies (max 3),
     * impact its dependents (max 3), volatility half its exports plus dependencies (max 4).
     */
    public static List<ComplexityScore> complexity(DependencyGraph graph) {
        List<ComplexityScore> scores = new ArrayList<>();
        for (FileEntry entry : graph.summarizedEntries()) {
            int dependencies = entry.dependencies().internal().size();
            int coupling = Math.min(3, dependencies);
            int impact = Math.min(3, entry.dependents().size());
            int volatility = Math.min(4, (entry.exports().size() + dependencies) / 2);
            int total = coupling + impact + volatility;
            scores.add(new ComplexityScore(entry.id(), coupling, impact, volatility, total, recommend(total)));
        }
        scores.sort(Comparator.comparingInt(ComplexityScore::totalScore).reversed()
                .thenComparing(ComplexityScore::file));
        return scores;
    }

    public static List<OrphanedExport> orphanedExports(DependencyGraph graph) {
        List<OrphanedExport> orphans = new ArrayList<>();
        for (FileEntry entry : graph.summarizedEntries()) {
            if (!entry.dependents().isEmpty()) {
                continue;
            }
            for (String export : entry.exports()) {
                if (!ENTRY_POINTS.contains(export)) {
                    orphans.add(new OrphanedExport(entry.id(), export, "unused_export"));
                }
            }
        }
        return orphans;
    }

    static ComplexityScore.Recommendation recommend(int totalScore) {
        if (totalScore >= 8) {
            return ComplexityScore.Recommendation.REFACTOR;
        }
        if (totalScore >= 6) {
            return ComplexityScore.Recommendation.CONSIDER_REFACTOR;
        }
        return ComplexityScore.Recommendation.OK;
    }
}
