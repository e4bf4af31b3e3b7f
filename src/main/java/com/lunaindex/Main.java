package com.lunaindex;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.lunaindex.graph.GraphQueryResult;
import com.lunaindex.runtime.AppConfig;
import com.lunaindex.service.SummaryIndexService;
import com.lunaindex.staleness.StalenessRecord;
import com.lunaindex.store.SearchMode;
import com.lunaindex.store.SummaryDocument;
import com.lunaindex.store.SummaryJson;
import com.lunaindex.store.SummaryRecord;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "luna-index",
        mixinStandardHelpOptions = true,
        version = "luna-index 0.1.0",
        description = "Query and maintain the branch-aware codebase summary store of a workspace.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "luna-index.yml")
    Path configPath;

    @Option(names = "--mode", description = "Operation: ${COMPLETION-CANDIDATES}", defaultValue = "list")
    Mode mode;

    @Option(names = { "-w", "--workspace" }, description = "Workspace root", defaultValue = ".")
    Path workspace;

    @Option(names = { "-f", "--file" }, description = "Workspace-relative source file (forward slashes)")
    String file;

    @Option(names = "--query", description = "Search keywords, whitespace separated")
    String query;

    @Option(names = "--search-type", description = "Search type: keyword, dependency, component, exports", defaultValue = "keyword")
    String searchType;

    @Option(names = "--summary-json", description = "Structured summary JSON to store in save mode")
    Path summaryJson;

    @Option(names = "--summary-markdown", description = "Rendered markdown to store in save mode")
    Path summaryMarkdown;

    private final ObjectMapper mapper = SummaryJson.newMapper();

    enum Mode {
        get,
        save,
        list,
        search,
        graph,
        stale,
        heatmap,
        orphans
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(configPath);
        SummaryIndexService service = SummaryIndexService.fromConfig(config);
        Path root = workspace.toAbsolutePath().normalize();
        log.info("Running {} on workspace {} (store={}, branchAware={})",
                mode, root, config.getStore().getDirectory(), config.getStore().isBranchAware());

        switch (mode) {
            case get -> {
                if (isBlank(file)) {
                    return missing("--file is required in get mode");
                }
                Optional<SummaryRecord> summary = service.getSummary(root, file);
                if (summary.isEmpty()) {
                    err().println("Summary not found for " + file + ". Generate it with the analyzer, then save it.");
                    return 1;
                }
                print(SummaryJson.merged(mapper, summary.get()));
            }
            case save -> {
                if (isBlank(file) || summaryJson == null || summaryMarkdown == null) {
                    return missing("--file, --summary-json and --summary-markdown are required in save mode");
                }
                SummaryDocument document = mapper.readValue(summaryJson.toFile(), SummaryDocument.class);
                String markdown = Files.readString(summaryMarkdown, StandardCharsets.UTF_8);
                SummaryRecord saved = service.saveSummary(root, file, document, markdown);
                log.info("Saved summary for {} (branchSpecific={})", saved.sourceFile(), saved.branchSpecific());
                print(SummaryJson.merged(mapper, saved));
            }
            case list -> print(service.listSummaries(root));
            case search -> {
                if (isBlank(query)) {
                    return missing("--query is required in search mode");
                }
                print(service.search(root, query, SearchMode.fromWireName(searchType)));
            }
            case graph -> {
                if (isBlank(file)) {
                    print(service.fullGraph(root));
                } else {
                    GraphQueryResult result = service.dependencies(root, file);
                    print(result);
                    if (!result.found()) {
                        err().println(result.message());
                        return 1;
                    }
                }
            }
            case stale -> {
                if (isBlank(file)) {
                    List<StalenessRecord> staleFiles = service.staleSummaries(root);
                    log.info("Found {} stale summaries", staleFiles.size());
                    Map<String, Object> report = new LinkedHashMap<>();
                    report.put("total_stale", staleFiles.size());
                    report.put("stale_files", staleFiles);
                    print(report);
                } else {
                    print(service.staleness(root, file));
                }
            }
            case heatmap -> print(service.complexityHeatmap(root));
            case orphans -> print(service.orphanedExports(root));
        }
        return 0;
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = yamlMapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    private void print(Object value) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        out.println(SummaryJson.prettyWriter(mapper).writeValueAsString(value));
        out.flush();
    }

    private PrintWriter err() {
        return spec.commandLine().getErr();
    }

    private int missing(String message) {
        log.error(message);
        err().println(message);
        return 2;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
