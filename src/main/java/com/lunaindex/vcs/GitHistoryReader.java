package com.lunaindex.vcs;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GitHistoryReader {
    private static final Logger log = LoggerFactory.getLogger(GitHistoryReader.class);
    private static final String COMMIT_MARKER = "@@@";
    private static final int PATHS_PER_BATCH = 200;

    private final GitCommandRunner gitCommandRunner;

    public GitHistoryReader() {
        this(new GitCommandRunner(Duration.ofSeconds(10)));
    }

    public GitHistoryReader(GitCommandRunner gitCommandRunner) {
        this.gitCommandRunner = gitCommandRunner;
    }

    public Optional<Instant> lastCommitTime(Path workspaceRoot, String relativePath) {
        GitCommandResult result = gitCommandRunner.git(workspaceRoot,
                List.of("log", "-1", "--format=%cI", "--", relativePath));
        if (!result.isSuccess()) {
            log.debug("git log failed for {}: {}", relativePath, result.describeFailure());
            return Optional.empty();
        }
        return parseCommitTime(result.stdout().strip());
    }

    public Map<String, Instant> lastCommitTimes(Path workspaceRoot, Collection<String> relativePaths) {
        Map<String, Instant> times = new HashMap<>();
        List<String> pending = new ArrayList<>(new LinkedHashSet<>(relativePaths));
        for (int start = 0; start < pending.size(); start += PATHS_PER_BATCH) {
            List<String> batch = pending.subList(start, Math.min(pending.size(), start + PATHS_PER_BATCH));
            List<String> arguments = new ArrayList<>(List.of(
                    "log", "--format=" + COMMIT_MARKER + "%cI", "--name-only", "--relative", "--"));
            arguments.addAll(batch);
            GitCommandResult result = gitCommandRunner.git(workspaceRoot, arguments);
            if (!result.isSuccess()) {
                log.warn("batched git log failed for {} paths in {}: {}", batch.size(), workspaceRoot, result.describeFailure());
                continue;
            }
            times.putAll(parseNameOnlyLog(result.stdout(), Set.copyOf(batch)));
        }
        return times;
    }

    static Map<String, Instant> parseNameOnlyLog(String output, Set<String> wanted) {
        Map<String, Instant> times = new HashMap<>();
        Instant current = null;
        for (String rawLine : output.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(COMMIT_MARKER)) {
                current = parseCommitTime(line.substring(COMMIT_MARKER.length())).orElse(null);
                continue;
            }
            // log is newest-first, so the first time seen per path is its latest change
            if (current != null && wanted.contains(line)) {
                times.putIfAbsent(line, current);
            }
        }
        return times;
    }

    static Optional<Instant> parseCommitTime(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(text.strip()).toInstant());
        } catch (DateTimeParseException e) {
            log.debug("unparseable commit time '{}'", text);
            return Optional.empty();
        }
    }
}
