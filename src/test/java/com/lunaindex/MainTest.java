package com.lunaindex;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.lunaindex.runtime.AppConfig;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void shouldListEmptyWorkspace() {
        int exitCode = run("--mode", "list");

        assertEquals(0, exitCode);
        assertEquals("[ ]", out.toString().strip());
    }

    @Test
    void shouldExitWithNotFoundForMissingSummary() {
        int exitCode = run("--mode", "get", "--file", "src/missing.ts");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Summary not found for src/missing.ts"));
    }

    @Test
    void shouldRequireQueryInSearchMode() {
        assertEquals(2, run("--mode", "search"));
        assertEquals(2, run("--mode", "save", "--file", "src/a.ts"));
    }

    @Test
    void shouldSaveThenGetSummaryThroughCommandLine() throws IOException {
        Path json = tempDir.resolve("a.summary.json");
        Path markdown = tempDir.resolve("a.summary.md");
        Files.writeString(json, """
                {
                  "sourceFile": "src/a.ts",
                  "generatedAt": "2024-06-01T12:00:00Z",
                  "summary": {
                    "purpose": "Renders the status bar",
                    "publicAPI": [ { "signature": "render(): void", "description": "draws" } ],
                    "dependencies": { "internal": [], "external": [ { "package": "vscode", "usage": "ui" } ] }
                  }
                }
                """, StandardCharsets.UTF_8);
        Files.writeString(markdown, "# status bar", StandardCharsets.UTF_8);

        assertEquals(0, run("--mode", "save", "--file", "src/a.ts",
                "--summary-json", json.toString(), "--summary-markdown", markdown.toString()));
        out.getBuffer().setLength(0);

        assertEquals(0, run("--mode", "get", "--file", "src/a.ts"));
        String printed = out.toString();
        assertTrue(printed.contains("\"purpose\": \"Renders the status bar\""));
        assertTrue(printed.contains("\"markdown\": \"# status bar\""));
        assertFalse(printed.contains("schemaVersion"));

        out.getBuffer().setLength(0);
        assertEquals(0, run("--mode", "search", "--query", "render", "--search-type", "exports"));
        assertTrue(out.toString().contains("Export: render(): void"));

        out.getBuffer().setLength(0);
        assertEquals(0, run("--mode", "orphans"));
        assertTrue(out.toString().contains("\"export\": \"render\""));
    }

    @Test
    void shouldExitWithNotFoundForUnknownGraphFile() {
        assertEquals(1, run("--mode", "graph", "--file", "src/nowhere.ts"));
        assertTrue(err.toString().contains("No summaries exist yet"));
    }

    @Test
    void shouldReportNoStaleFilesForEmptyWorkspace() {
        assertEquals(0, run("--mode", "stale"));
        assertTrue(out.toString().contains("\"total_stale\": 0"));
    }

    @Test
    void shouldLoadYamlConfigAndFallBackToDefaults() throws IOException {
        Path config = tempDir.resolve("luna-index.yml");
        Files.writeString(config, """
                store:
                  directory: .summaries
                  branchAware: false
                cache:
                  summaryCapacity: 5
                unknownSection:
                  ignored: true
                """, StandardCharsets.UTF_8);

        AppConfig loaded = Main.loadConfig(config);

        assertEquals(".summaries", loaded.getStore().getDirectory());
        assertFalse(loaded.getStore().isBranchAware());
        assertEquals(5, loaded.getCache().getSummaryCapacity());
        assertEquals(100, loaded.getCache().getQueryCapacity());
        assertEquals(".codebase", Main.loadConfig(tempDir.resolve("absent.yml")).getStore().getDirectory());
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new Main());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        String[] withWorkspace = new String[args.length + 4];
        withWorkspace[0] = "--workspace";
        withWorkspace[1] = tempDir.toString();
        withWorkspace[2] = "--config";
        withWorkspace[3] = tempDir.resolve("missing.yml").toString();
        System.arraycopy(args, 0, withWorkspace, 4, args.length);
        return commandLine.execute(withWorkspace);
    }
}
