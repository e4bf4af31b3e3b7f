package com.lunaindex.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.lunaindex.store.SummaryDocument;
import com.lunaindex.store.SummaryFixtures;

class GraphAnalyticsTest {

    @Test
    void shouldScoreHubFilesForRefactoring() {
        List<SummaryDocument> documents = new ArrayList<>();
        documents.add(SummaryFixtures.document("src/hub.ts", SummaryFixtures.GENERATED_AT, "hub",
                List.of("one()", "two()", "three()", "four()"), "src/d1.ts", "src/d2.ts", "src/d3.ts"));
        for (String leaf : List.of("src/d1.ts", "src/d2.ts", "src/d3.ts")) {
            documents.add(SummaryFixtures.document(leaf, "leaf"));
        }
        for (String user : List.of("src/u1.ts", "src/u2.ts", "src/u3.ts")) {
            documents.add(SummaryFixtures.document(user, "user", "src/hub.ts"));
        }

        List<ComplexityScore> scores = GraphAnalytics.complexity(DependencyGraph.build(documents));

        ComplexityScore hub = scores.get(0);
        assertEquals("src/hub.ts", hub.file());
        assertEquals(3, hub.coupling());
        assertEquals(3, hub.impact());
        assertEquals(3, hub.volatility());
        assertEquals(9, hub.totalScore());
        assertEquals(ComplexityScore.Recommendation.REFACTOR, hub.recommendation());
        assertEquals(7, scores.size());
    }

    @Test
    void shouldMapScoresToRecommendations() {
        assertEquals(ComplexityScore.Recommendation.OK, GraphAnalytics.recommend(5));
        assertEquals(ComplexityScore.Recommendation.CONSIDER_REFACTOR, GraphAnalytics.recommend(6));
        assertEquals(ComplexityScore.Recommendation.REFACTOR, GraphAnalytics.recommend(8));
    }

    @Test
    void shouldReportUnusedExportsExceptEntryPoints() {
        DependencyGraph graph = DependencyGraph.build(List.of(
                SummaryFixtures.document("src/extension.ts", SummaryFixtures.GENERATED_AT, "extension",
                        List.of("activate(context)", "deactivate()", "helper(x: number): void")),
                SummaryFixtures.document("src/used.ts", SummaryFixtures.GENERATED_AT, "used", List.of("format()")),
                SummaryFixtures.document("src/user.ts", "user", "src/used.ts")));

        List<OrphanedExport> orphans = GraphAnalytics.orphanedExports(graph);

        assertEquals(List.of(new OrphanedExport("src/extension.ts", "helper", "unused_export")), orphans);
    }
}
