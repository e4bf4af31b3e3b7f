package com.lunaindex.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lunaindex.cache.CacheKeys;
import com.lunaindex.cache.LruCache;
import com.lunaindex.graph.ComplexityScore;
import com.lunaindex.graph.DependencyGraphEngine;
import com.lunaindex.graph.GraphAnalytics;
import com.lunaindex.graph.GraphQueryResult;
import com.lunaindex.graph.GraphView;
import com.lunaindex.graph.OrphanedExport;
import com.lunaindex.runtime.AppConfig;
import com.lunaindex.staleness.StalenessOracle;
import com.lunaindex.staleness.StalenessRecord;
import com.lunaindex.store.SearchHit;
import com.lunaindex.store.SearchMode;
import com.lunaindex.store.SourcePaths;
import com.lunaindex.store.SummaryDocument;
import com.lunaindex.store.SummaryListing;
import com.lunaindex.store.SummaryRecord;
import com.lunaindex.store.SummaryStore;
import com.lunaindex.vcs.BranchResolver;
import com.lunaindex.vcs.GitBranchResolver;
import com.lunaindex.vcs.GitCommandRunner;
import com.lunaindex.vcs.GitHistoryReader;

/**
 * Cache-fronted entry point for summary, search, graph and staleness queries on one or
 * more workspaces. Reads go through the LRU caches; any save clears all of them, since
 * one new summary can change arbitrarily many search results and graph views.
 *
 * <p>Cache access is serialized on a single lock; disk reads run outside it. A read that
 * overlaps an invalidation returns its result without caching it. Saves are serialized
 * with each other so an in-process pipeline behaves as a single writer.
 * Cached entries are keyed by workspace and path only, so a branch switch is not seen
 * until the next save or {@link #invalidateAll()}.
 */
public class SummaryIndexService {
    private static final Logger log = LoggerFactory.getLogger(SummaryIndexService.class);

    private final SummaryStore summaryStore;
    private final StalenessOracle stalenessOracle;
    private final DependencyGraphEngine graphEngine;
    private final BranchResolver branchResolver;
    private final Clock clock;

    private final Object cacheLock = new Object();
    private final Object writeLock = new Object();
    private final LruCache<String, SummaryRecord> summaryCache;
    private final LruCache<String, List<SearchHit>> searchCache;
    private final LruCache<String, GraphView> graphViewCache;
    private final LruCache<String, GraphQueryResult> graphQueryCache;
    // bumped on every invalidation; loads begun under an older generation are not cached
    private long generation;

    public SummaryIndexService(
            SummaryStore summaryStore,
            StalenessOracle stalenessOracle,
            DependencyGraphEngine graphEngine,
            BranchResolver branchResolver,
            int summaryCapacity,
            int queryCapacity,
            Clock clock) {
        this.summaryStore = summaryStore;
        this.stalenessOracle = stalenessOracle;
        this.graphEngine = graphEngine;
        this.branchResolver = branchResolver;
        this.clock = clock;
        this.summaryCache = new LruCache<>(summaryCapacity);
        this.searchCache = new LruCache<>(queryCapacity);
        this.graphViewCache = new LruCache<>(queryCapacity);
        this.graphQueryCache = new LruCache<>(queryCapacity);
    }

    public static SummaryIndexService fromConfig(AppConfig config) {
        GitCommandRunner gitCommandRunner = new GitCommandRunner(Duration.ofMillis(config.getGit().getTimeoutMs()));
        GitBranchResolver branchResolver = new GitBranchResolver(gitCommandRunner);
        SummaryStore store = new SummaryStore(
                config.getStore().getDirectory(),
                branchResolver,
                config.getStore().isBranchAware());
        return new SummaryIndexService(
                store,
                new StalenessOracle(store, new GitHistoryReader(gitCommandRunner)),
                new DependencyGraphEngine(store, config.getGraph().getSampleKeyCount()),
                branchResolver,
                config.getCache().getSummaryCapacity(),
                config.getCache().getQueryCapacity(),
                Clock.systemUTC());
    }

    public Optional<SummaryRecord> getSummary(Path workspaceRoot, String filePath) {
        String normalized = SourcePaths.requireFilePath(filePath);
        String key = CacheKeys.fileSummary(workspaceRoot, normalized);
        Optional<SummaryRecord> cached;
        long observed;
        synchronized (cacheLock) {
            cached = summaryCache.get(key);
            observed = generation;
        }
        if (cached.isPresent()) {
            log.debug("summary cache hit {}", key);
            return cached;
        }
        Optional<SummaryRecord> loaded = summaryStore.get(workspaceRoot, normalized);
        loaded.ifPresent(record -> cacheIfCurrent(summaryCache, key, record, observed));
        return loaded;
    }

    public SummaryRecord saveSummary(Path workspaceRoot, String filePath, SummaryDocument document, String markdown)
            throws IOException {
        synchronized (writeLock) {
            SummaryRecord saved = summaryStore.save(workspaceRoot, filePath, document, markdown);
            invalidateAll();
            return saved;
        }
    }

    public SummaryRecord analyze(Path workspaceRoot, String filePath, Analyzer analyzer, boolean forceRegenerate)
            throws IOException {
        String normalized = SourcePaths.requireFilePath(filePath);
        if (!forceRegenerate) {
            Optional<SummaryRecord> existing = getSummary(workspaceRoot, normalized);
            if (existing.isPresent()) {
                return existing.get();
            }
        }
        AnalysisResult result = analyzer.analyze(workspaceRoot, normalized);
        if (result == null || result.summary() == null) {
            throw new IOException("analyzer returned no summary for " + normalized);
        }
        SummaryDocument document = SummaryDocument.of(normalized, Instant.now(clock).truncatedTo(ChronoUnit.MILLIS), result.summary())
                .withVersionControl(
                        branchResolver.currentBranch(workspaceRoot).orElse(null),
                        branchResolver.currentRevision(workspaceRoot).orElse(null));
        return saveSummary(workspaceRoot, normalized, document, result.markdown());
    }

    public List<SummaryListing> listSummaries(Path workspaceRoot) {
        return summaryStore.list(workspaceRoot);
    }

    public List<SearchHit> search(Path workspaceRoot, String query, SearchMode mode) {
        String key = CacheKeys.search(workspaceRoot, query, mode);
        Optional<List<SearchHit>> cached;
        long observed;
        synchronized (cacheLock) {
            cached = searchCache.get(key);
            observed = generation;
        }
        if (cached.isPresent()) {
            log.debug("search cache hit {}", key);
            return cached.get();
        }
        List<SearchHit> hits = List.copyOf(summaryStore.search(workspaceRoot, query, mode));
        cacheIfCurrent(searchCache, key, hits, observed);
        return hits;
    }

    public GraphView fullGraph(Path workspaceRoot) {
        String key = CacheKeys.fullGraph(workspaceRoot);
        Optional<GraphView> cached;
        long observed;
        synchronized (cacheLock) {
            cached = graphViewCache.get(key);
            observed = generation;
        }
        if (cached.isPresent()) {
            return cached.get();
        }
        GraphView view = graphEngine.buildFull(workspaceRoot);
        cacheIfCurrent(graphViewCache, key, view, observed);
        return view;
    }

    public GraphQueryResult dependencies(Path workspaceRoot, String filePath) {
        String key = CacheKeys.graphQuery(workspaceRoot, SourcePaths.normalize(filePath));
        Optional<GraphQueryResult> cached;
        long observed;
        synchronized (cacheLock) {
            cached = graphQueryCache.get(key);
            observed = generation;
        }
        if (cached.isPresent()) {
            return cached.get();
        }
        GraphQueryResult result = graphEngine.query(workspaceRoot, filePath);
        cacheIfCurrent(graphQueryCache, key, result, observed);
        return result;
    }

    public StalenessRecord staleness(Path workspaceRoot, String filePath) {
        return stalenessOracle.isStale(workspaceRoot, filePath);
    }

    public List<StalenessRecord> staleSummaries(Path workspaceRoot) {
        return stalenessOracle.scanWorkspace(workspaceRoot);
    }

    public List<ComplexityScore> complexityHeatmap(Path workspaceRoot) {
        return GraphAnalytics.complexity(graphEngine.build(workspaceRoot));
    }

    public List<OrphanedExport> orphanedExports(Path workspaceRoot) {
        return GraphAnalytics.orphanedExports(graphEngine.build(workspaceRoot));
    }

    public void invalidateAll() {
        synchronized (cacheLock) {
            generation++;
            summaryCache.clear();
            searchCache.clear();
            graphViewCache.clear();
            graphQueryCache.clear();
        }
        log.debug("cleared summary, search and graph caches");
    }

    private <V> void cacheIfCurrent(LruCache<String, V> cache, String key, V value, long observed) {
        synchronized (cacheLock) {
            if (generation == observed) {
                cache.set(key, value);
            } else {
                log.debug("not caching {}: invalidated while loading", key);
            }
        }
    }

    int cachedEntryCount() {
        synchronized (cacheLock) {
            return summaryCache.size() + searchCache.size() + graphViewCache.size() + graphQueryCache.size();
        }
    }
}
