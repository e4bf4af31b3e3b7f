package com.lunaindex.vcs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;

class GitHistoryReaderTest {

    @Test
    void shouldParseLastCommitTimeWithOffset() {
        RecordingGitRunner runner = new RecordingGitRunner(arguments -> GitCommandResult.success("2024-03-01T12:00:00+02:00"));
        GitHistoryReader reader = new GitHistoryReader(runner);

        Optional<Instant> time = reader.lastCommitTime(Path.of("."), "src/a.ts");

        assertEquals(Optional.of(Instant.parse("2024-03-01T10:00:00Z")), time);
        assertEquals(List.of("log", "-1", "--format=%cI", "--", "src/a.ts"), runner.invocations().get(0));
    }

    @Test
    void shouldReturnEmptyWhenFileHasNoHistory() {
        GitHistoryReader reader = new GitHistoryReader(new RecordingGitRunner(arguments -> GitCommandResult.success("")));

        assertTrue(reader.lastCommitTime(Path.of("."), "src/new.ts").isEmpty());
    }

    @Test
    void shouldKeepNewestCommitPerPathFromNameOnlyLog() {
        String log = String.join("\n",
                "@@@2024-05-02T10:00:00Z",
                "",
                "src/a.ts",
                "@@@2024-05-01T10:00:00Z",
                "",
                "src/a.ts",
                "src/b.ts",
                "src/unrelated.ts");

        Map<String, Instant> times = GitHistoryReader.parseNameOnlyLog(log, Set.of("src/a.ts", "src/b.ts"));

        assertEquals(Instant.parse("2024-05-02T10:00:00Z"), times.get("src/a.ts"));
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), times.get("src/b.ts"));
        assertFalse(times.containsKey("src/unrelated.ts"));
    }

    @Test
    void shouldBatchPathsIntoFewHistoryCalls() {
        RecordingGitRunner runner = new RecordingGitRunner(arguments -> GitCommandResult.success("@@@2024-01-01T00:00:00Z\nsrc/f0.ts"));
        GitHistoryReader reader = new GitHistoryReader(runner);
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < 450; i++) {
            paths.add("src/f" + i + ".ts");
        }

        Map<String, Instant> times = reader.lastCommitTimes(Path.of("."), paths);

        assertEquals(3, runner.invocations().size());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), times.get("src/f0.ts"));
        assertEquals(1, times.size());
    }

    @Test
    void shouldLeaveFailedBatchAbsent() {
        GitHistoryReader reader = new GitHistoryReader(RecordingGitRunner.unavailable());

        assertTrue(reader.lastCommitTimes(Path.of("."), List.of("src/a.ts")).isEmpty());
    }
}
