package com.lunaindex.staleness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lunaindex.store.SourcePaths;
import com.lunaindex.store.SummaryDocument;
import com.lunaindex.store.SummaryRecord;
import com.lunaindex.store.SummaryStore;
import com.lunaindex.vcs.GitHistoryReader;

/**
 * Decides whether a stored summary predates the last change of its source file.
 * The change time is the file's last commit time, or its filesystem modification time
 * when git history is unavailable. A summary is stale only when the change is strictly later.
 */
public class StalenessOracle {
    private static final Logger log = LoggerFactory.getLogger(StalenessOracle.class);

    static final String NO_SUMMARY = "No summary exists";
    static final String UNKNOWN_CHANGE_TIME = "Cannot determine file modification time";
    static final String UP_TO_DATE = "Summary is up-to-date";

    private final SummaryStore summaryStore;
    private final GitHistoryReader historyReader;

    public StalenessOracle(SummaryStore summaryStore) {
        this(summaryStore, new GitHistoryReader());
    }

    public StalenessOracle(SummaryStore summaryStore, GitHistoryReader historyReader) {
        this.summaryStore = summaryStore;
        this.historyReader = historyReader;
    }

    public Optional<Instant> lastChangeTime(Path workspaceRoot, String filePath) {
        String normalized = SourcePaths.requireFilePath(filePath);
        Optional<Instant> committed = historyReader.lastCommitTime(workspaceRoot, normalized);
        if (committed.isPresent()) {
            return committed;
        }
        return fileSystemTime(workspaceRoot, normalized);
    }

    public Optional<Instant> summaryTime(Path workspaceRoot, String filePath) {
        return summaryStore.get(workspaceRoot, filePath)
                .map(SummaryRecord::document)
                .flatMap(SummaryDocument::generatedInstant);
    }

    public StalenessRecord isStale(Path workspaceRoot, String filePath) {
        String normalized = SourcePaths.requireFilePath(filePath);
        return evaluate(normalized, summaryTime(workspaceRoot, normalized), lastChangeTime(workspaceRoot, normalized));
    }

    public List<StalenessRecord> scanWorkspace(Path workspaceRoot) {
        List<String> files = summaryStore.loadAll(workspaceRoot).stream()
                .map(SummaryDocument::sourceFile)
                .toList();
        if (files.isEmpty()) {
            return List.of();
        }
        Map<String, Instant> committed = historyReader.lastCommitTimes(workspaceRoot, files);

        List<StalenessRecord> stale = new ArrayList<>();
        for (String file : files) {
            Optional<Instant> changeTime = Optional.ofNullable(committed.get(file))
                    .or(() -> fileSystemTime(workspaceRoot, file));
            StalenessRecord record = evaluate(file, summaryTime(workspaceRoot, file), changeTime);
            if (record.stale()) {
                stale.add(record);
            }
        }
        log.debug("staleness scan of {} found {}/{} stale", workspaceRoot, stale.size(), files.size());
        return stale;
    }

    static StalenessRecord evaluate(String file, Optional<Instant> summaryTime, Optional<Instant> changeTime) {
        if (summaryTime.isEmpty()) {
            return new StalenessRecord(file, null, changeTime.orElse(null), true, NO_SUMMARY);
        }
        if (changeTime.isEmpty()) {
            return new StalenessRecord(file, summaryTime.get(), null, false, UNKNOWN_CHANGE_TIME);
        }
        Instant summary = summaryTime.get();
        Instant changed = changeTime.get();
        boolean stale = changed.isAfter(summary);
        String reason = stale
                ? "File modified after summary (file: " + changed + ", summary: " + summary + ")"
                : UP_TO_DATE;
        return new StalenessRecord(file, summary, changed, stale, reason);
    }

    private static Optional<Instant> fileSystemTime(Path workspaceRoot, String relativePath) {
        try {
            return Optional.of(Files.getLastModifiedTime(workspaceRoot.resolve(relativePath)).toInstant());
        } catch (IOException e) {
            log.debug("no modification time for {}: {}", relativePath, e.getMessage());
            return Optional.empty();
        }
    }
}
