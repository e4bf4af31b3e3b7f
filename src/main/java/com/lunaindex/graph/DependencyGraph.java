package com.lunaindex.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

import com.lunaindex.store.ApiEntry;
import com.lunaindex.store.DependencySet;
import com.lunaindex.store.InternalDependency;
import com.lunaindex.store.SourcePaths;
import com.lunaindex.store.SummaryDocument;

public final class DependencyGraph {
    private final Map<String, FileEntry> entries;
    private final List<GraphEdge> dependsOnEdges;

    private DependencyGraph(Map<String, FileEntry> entries, List<GraphEdge> dependsOnEdges) {
        this.entries = entries;
        this.dependsOnEdges = dependsOnEdges;
    }

    public static DependencyGraph build(Collection<SummaryDocument> documents) {
        Map<String, SummaryDocument> bySource = new TreeMap<>();
        for (SummaryDocument document : documents) {
            bySource.putIfAbsent(SourcePaths.normalize(document.sourceFile()), document);
        }
        PathResolver resolver = new PathResolver(bySource.keySet());

        Map<String, List<InternalDependency>> resolvedDependencies = new LinkedHashMap<>();
        Map<String, Map<String, Dependent>> dependents = new TreeMap<>();
        List<GraphEdge> edges = new ArrayList<>();
        for (Map.Entry<String, SummaryDocument> item : bySource.entrySet()) {
            String source = item.getKey();
            List<InternalDependency> resolved = new ArrayList<>();
            for (InternalDependency dependency : item.getValue().summary().dependencies().internal()) {
                String target = resolver.resolve(source, dependency.path());
                if (target.isEmpty() || target.equals(source)) {
                    continue;
                }
                resolved.add(new InternalDependency(target, dependency.usage(), dependency.lines()));
                edges.add(new GraphEdge(source, target, EdgeType.DEPENDS_ON, dependency.usage()));
                dependents.computeIfAbsent(target, unused -> new LinkedHashMap<>())
                        .putIfAbsent(source, new Dependent(source, dependency.usage(), dependency.lines()));
            }
            resolvedDependencies.put(source, resolved);
        }

        Map<String, FileEntry> entries = new TreeMap<>();
        for (Map.Entry<String, SummaryDocument> item : bySource.entrySet()) {
            String source = item.getKey();
            SummaryDocument document = item.getValue();
            List<String> exports = document.summary().publicApi().stream()
                    .map(ApiEntry::exportName)
                    .filter(name -> !name.isEmpty())
                    .toList();
            DependencySet dependencies = new DependencySet(
                    resolvedDependencies.get(source),
                    document.summary().dependencies().external());
            entries.put(source, new FileEntry(
                    source,
                    document.summary().purpose(),
                    exports,
                    dependencies,
                    dependentsOf(dependents, source),
                    true));
        }
        for (String target : dependents.keySet()) {
            if (!entries.containsKey(target)) {
                entries.put(target, new FileEntry(target, "", List.of(), DependencySet.empty(),
                        dependentsOf(dependents, target), false));
            }
        }
        return new DependencyGraph(entries, List.copyOf(edges));
    }

    private static List<Dependent> dependentsOf(Map<String, Map<String, Dependent>> dependents, String file) {
        Map<String, Dependent> found = dependents.get(file);
        return found == null ? List.of() : new ArrayList<>(found.values());
    }

    public Optional<FileEntry> entry(String file) {
        return Optional.ofNullable(entries.get(file));
    }

    public NavigableSet<String> files() {
        return new TreeSet<>(entries.keySet());
    }

    public List<FileEntry> summarizedEntries() {
        return entries.values().stream().filter(FileEntry::summarized).toList();
    }

    public List<Dependent> dependents(String file) {
        return entry(file).map(FileEntry::dependents).orElse(List.of());
    }

    public GraphView view() {
        List<GraphNode> nodes = summarizedEntries().stream()
                .map(entry -> new GraphNode(entry.id(), entry.purpose()))
                .toList();
        return new GraphView(nodes, dependsOnEdges);
    }

    /**
     * Maps declared internal dependency paths onto store keys. {@code ../} paths are
     * relative to the declaring file; anything else is workspace-relative. A path whose
     * extension is missing or differs resolves to the only summarized file with the
     * same extension-less path.
     */
    static final class PathResolver {
        private final Collection<String> keys;
        private final Map<String, List<String>> byStem = new HashMap<>();

        PathResolver(Collection<String> keys) {
            this.keys = keys;
            for (String key : keys) {
                byStem.computeIfAbsent(SourcePaths.stripExtension(key), unused -> new ArrayList<>()).add(key);
            }
        }

        String resolve(String source, String declaredPath) {
            String normalized = SourcePaths.normalize(declaredPath);
            String candidate = normalized.startsWith("../")
                    ? SourcePaths.resolve(SourcePaths.directory(source), normalized)
                    : normalized;
            if (candidate.isEmpty() || keys.contains(candidate)) {
                return candidate;
            }
            List<String> sameStem = byStem.getOrDefault(SourcePaths.stripExtension(candidate), List.of());
            return sameStem.size() == 1 ? sameStem.get(0) : candidate;
        }
    }
}
