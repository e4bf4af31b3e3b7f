package com.lunaindex.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.NavigableSet;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lunaindex.store.InternalDependency;
import com.lunaindex.store.SourcePaths;
import com.lunaindex.store.SummaryStore;

public class DependencyGraphEngine {
    private static final Logger log = LoggerFactory.getLogger(DependencyGraphEngine.class);

    public static final int DEFAULT_SAMPLE_KEY_COUNT = 10;

    private static final Comparator<String> SHORTEST_THEN_LEXICAL = Comparator.comparingInt(String::length)
            .thenComparing(Comparator.naturalOrder());

    private final SummaryStore summaryStore;
    private final int sampleKeyCount;

    public DependencyGraphEngine(SummaryStore summaryStore) {
        this(summaryStore, DEFAULT_SAMPLE_KEY_COUNT);
    }

    public DependencyGraphEngine(SummaryStore summaryStore, int sampleKeyCount) {
        this.summaryStore = summaryStore;
        this.sampleKeyCount = Math.max(1, sampleKeyCount);
    }

    public DependencyGraph build(Path workspaceRoot) {
        return DependencyGraph.build(summaryStore.loadAll(workspaceRoot));
    }

    public GraphView buildFull(Path workspaceRoot) {
        return build(workspaceRoot).view();
    }

    public GraphQueryResult query(Path workspaceRoot, String filePath) {
        return query(build(workspaceRoot), filePath);
    }

    /**
     * Locates {@code filePath} by exact key, then by path suffix or substring, then by
     * file name. Within a tier, segment-aligned suffixes rank before plain substrings,
     * then shorter paths, then lexicographic order.
     */
    public GraphQueryResult query(DependencyGraph graph, String filePath) {
        String wanted = SourcePaths.normalize(filePath);
        NavigableSet<String> files = graph.files();

        if (!wanted.isEmpty() && files.contains(wanted)) {
            return matched(graph, filePath, wanted, MatchTier.EXACT, List.of(wanted));
        }

        List<String> suffixMatches = candidates(files, key -> !wanted.isEmpty() && key.contains(wanted),
                Comparator.comparing((String key) -> !key.endsWith("/" + wanted))
                        .thenComparing(SHORTEST_THEN_LEXICAL));
        if (!suffixMatches.isEmpty()) {
            return matched(graph, filePath, suffixMatches.get(0), MatchTier.SUFFIX, suffixMatches);
        }

        String wantedName = SourcePaths.fileName(wanted);
        List<String> nameMatches = candidates(files,
                key -> !wantedName.isEmpty() && SourcePaths.fileName(key).equals(wantedName),
                SHORTEST_THEN_LEXICAL);
        if (!nameMatches.isEmpty()) {
            return matched(graph, filePath, nameMatches.get(0), MatchTier.FILENAME, nameMatches);
        }

        List<String> sample = files.stream().limit(sampleKeyCount).toList();
        String message = "No dependency data found for '" + filePath + "'. "
                + (files.isEmpty()
                        ? "No summaries exist yet; generate summaries first."
                        : "Available files (" + sample.size() + " of " + files.size() + "): " + String.join(", ", sample));
        log.debug("graph query for {} matched nothing among {} files", filePath, files.size());
        return new GraphQueryResult(filePath, null, MatchTier.NONE, List.of(), List.of(), List.of(), message);
    }

    private static List<String> candidates(NavigableSet<String> files, Predicate<String> filter, Comparator<String> order) {
        return files.stream().filter(filter).sorted(order).toList();
    }

    private GraphQueryResult matched(DependencyGraph graph, String query, String file, MatchTier tier, List<String> candidates) {
        FileEntry entry = graph.entry(file).orElseThrow();
        List<GraphEdge> edges = new ArrayList<>();
        for (InternalDependency dependency : entry.dependencies().internal()) {
            edges.add(new GraphEdge(file, dependency.path(), EdgeType.DEPENDS_ON, dependency.usage()));
        }
        for (Dependent dependent : entry.dependents()) {
            edges.add(new GraphEdge(dependent.file(), file, EdgeType.USED_BY, dependent.usage()));
        }
        String message = tier == MatchTier.EXACT
                ? null
                : "Resolved '" + query + "' to '" + file + "' by " + tier.name().toLowerCase(Locale.ROOT) + " match"
                        + (candidates.size() > 1 ? " (" + candidates.size() + " candidates)" : "");
        if (tier != MatchTier.EXACT) {
            log.debug("graph query {} resolved to {} via {} among {}", query, file, tier, candidates);
        }
        return new GraphQueryResult(query, file, tier, candidates, List.of(entry), edges, message);
    }
}
