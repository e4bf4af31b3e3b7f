package com.lunaindex.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.lunaindex.vcs.BranchNames;
import com.lunaindex.vcs.BranchResolver;
import com.lunaindex.vcs.GitBranchResolver;

/**
 * Branch-aware on-disk store of summary records. Each source file maps to a
 * {@code .json}/{@code .md} pair under the store directory, mirroring the source tree
 * with the file extension removed. On a non-main branch the pair carries a sanitized
 * branch suffix and reads fall back to the canonical pair.
 *
 * <p>Writers are expected to be a single analysis pipeline saving one file at a time;
 * concurrent saves of the same file and branch are last-writer-wins.
 */
public class SummaryStore {
    private static final Logger log = LoggerFactory.getLogger(SummaryStore.class);

    public static final String DEFAULT_DIRECTORY = ".codebase";

    private final String directoryName;
    private final BranchResolver branchResolver;
    private final boolean branchAware;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public SummaryStore() {
        this(DEFAULT_DIRECTORY, new GitBranchResolver(), true);
    }

    public SummaryStore(String directoryName, BranchResolver branchResolver, boolean branchAware) {
        if (directoryName == null || directoryName.isBlank()) {
            throw new IllegalArgumentException("store directory must not be blank");
        }
        this.directoryName = directoryName;
        this.branchResolver = branchResolver;
        this.branchAware = branchAware;
        this.mapper = SummaryJson.newMapper();
        this.writer = SummaryJson.prettyWriter(mapper);
    }

    public Path storeRoot(Path workspaceRoot) {
        return workspaceRoot.resolve(directoryName);
    }

    public Optional<String> currentBranch(Path workspaceRoot) {
        return branchAware ? branchResolver.currentBranch(workspaceRoot) : Optional.empty();
    }

    public SummaryPaths pathsFor(Path workspaceRoot, String filePath) {
        return pathsFor(workspaceRoot, filePath, BranchNames.suffixFor(currentBranch(workspaceRoot)));
    }

    SummaryPaths pathsFor(Path workspaceRoot, String filePath, Optional<String> branchSuffix) {
        String base = SourcePaths.stripExtension(SourcePaths.requireFilePath(filePath));
        Path storeRoot = storeRoot(workspaceRoot);
        ArtifactPair canonical = pair(storeRoot, base, "");
        if (branchSuffix.isEmpty()) {
            return new SummaryPaths(canonical, Optional.empty(), Optional.empty());
        }
        ArtifactPair branch = pair(storeRoot, base, "." + branchSuffix.get());
        return new SummaryPaths(branch, Optional.of(canonical), branchSuffix);
    }

    private static ArtifactPair pair(Path storeRoot, String base, String suffix) {
        Path json = storeRoot.resolve(base + suffix + ".json").normalize();
        if (!json.startsWith(storeRoot.normalize())) {
            throw new IllegalArgumentException("file path escapes the workspace: " + base);
        }
        return new ArtifactPair(json, storeRoot.resolve(base + suffix + ".md").normalize());
    }

    public Optional<SummaryRecord> get(Path workspaceRoot, String filePath) {
        SummaryPaths paths = pathsFor(workspaceRoot, filePath);
        Optional<SummaryRecord> primary = readPair(paths.primary(), paths.branchSpecific());
        if (primary.isPresent() || paths.fallback().isEmpty()) {
            return primary;
        }
        log.debug("no {} summary for {}, falling back to canonical", paths.branchSuffix().orElse(""), filePath);
        return readPair(paths.fallback().get(), false);
    }

    /**
     * Writes both artifacts for the current branch. Either both replace the previous
     * pair or, on failure, the previous pair is left in place and the error propagates.
     */
    public SummaryRecord save(Path workspaceRoot, String filePath, SummaryDocument document, String markdown)
            throws IOException {
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        String normalized = SourcePaths.requireFilePath(filePath);
        if (document.sourceFile() != null && !document.sourceFile().isBlank()
                && !normalized.equals(SourcePaths.normalize(document.sourceFile()))) {
            throw new IllegalArgumentException("document sourceFile '" + document.sourceFile()
                    + "' does not match '" + normalized + "'");
        }
        SummaryDocument toWrite = document.withSourceFile(normalized);
        try {
            toWrite.validate();
        } catch (InvalidSummaryException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }

        SummaryPaths paths = pathsFor(workspaceRoot, normalized);
        writePair(paths.primary(), writer.writeValueAsBytes(toWrite), markdown == null ? "" : markdown);
        log.debug("saved summary for {} to {}", normalized, paths.primary().json());
        return new SummaryRecord(toWrite, markdown, paths.branchSpecific());
    }

    public List<SummaryListing> list(Path workspaceRoot) {
        return loadAll(workspaceRoot).stream()
                .map(document -> new SummaryListing(document.sourceFile(), document.generatedAt()))
                .toList();
    }

    public List<SearchHit> search(Path workspaceRoot, String query, SearchMode mode) {
        List<String> keywords = keywords(query);
        if (keywords.isEmpty()) {
            return List.of();
        }
        List<SearchHit> hits = new ArrayList<>();
        for (SummaryDocument document : loadAll(workspaceRoot)) {
            List<String> matches;
            try {
                matches = matches(document, keywords, mode);
            } catch (JsonProcessingException e) {
                log.warn("skipping {} during search: {}", document.sourceFile(), e.getOriginalMessage());
                continue;
            }
            if (!matches.isEmpty()) {
                hits.add(new SearchHit(document.sourceFile(), matches));
            }
        }
        return hits;
    }

    public List<SummaryDocument> loadAll(Path workspaceRoot) {
        Path storeRoot = storeRoot(workspaceRoot);
        if (!Files.isDirectory(storeRoot)) {
            return List.of();
        }
        Optional<String> branchSuffix = BranchNames.suffixFor(currentBranch(workspaceRoot));
        Map<String, SummaryDocument> visible = new TreeMap<>();
        for (Path json : findJsonFiles(storeRoot)) {
            SummaryDocument document;
            try {
                document = readDocument(json);
            } catch (InvalidSummaryException e) {
                if (e.getCause() instanceof JsonProcessingException) {
                    log.warn("skipping corrupted summary {}: {}", json, e.getMessage());
                } else {
                    log.debug("skipping non-summary json {}: {}", json, e.getMessage());
                }
                continue;
            } catch (IOException e) {
                log.warn("skipping unreadable summary {}: {}", json, e.getMessage());
                continue;
            }

            String sourceFile = SourcePaths.normalize(document.sourceFile());
            SummaryPaths paths;
            try {
                paths = pathsFor(workspaceRoot, sourceFile, branchSuffix);
            } catch (IllegalArgumentException e) {
                log.warn("skipping summary {} with invalid sourceFile: {}", json, e.getMessage());
                continue;
            }
            Path location = json.toAbsolutePath().normalize();
            if (paths.branchSpecific() && location.equals(paths.primary().json().toAbsolutePath().normalize())) {
                visible.put(sourceFile, document.withSourceFile(sourceFile));
            } else if (location.equals(paths.canonical().json().toAbsolutePath().normalize())) {
                visible.putIfAbsent(sourceFile, document.withSourceFile(sourceFile));
            } else {
                log.debug("skipping {}: belongs to another branch or does not match its sourceFile", json);
            }
        }
        return new ArrayList<>(visible.values());
    }

    SummaryDocument readDocument(Path json) throws IOException, InvalidSummaryException {
        SummaryDocument document;
        try {
            document = mapper.readValue(json.toFile(), SummaryDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidSummaryException("malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new InvalidSummaryException("empty document");
        }
        document.validate();
        return document;
    }

    private Optional<SummaryRecord> readPair(ArtifactPair pair, boolean branchSpecific) {
        if (!Files.isRegularFile(pair.json()) || !Files.isRegularFile(pair.markdown())) {
            return Optional.empty();
        }
        try {
            SummaryDocument document = readDocument(pair.json());
            String markdown = Files.readString(pair.markdown(), StandardCharsets.UTF_8);
            return Optional.of(new SummaryRecord(document, markdown, branchSpecific));
        } catch (IOException | InvalidSummaryException e) {
            log.warn("ignoring unreadable summary pair {}: {}", pair.json(), e.getMessage());
            return Optional.empty();
        }
    }

    private void writePair(ArtifactPair pair, byte[] json, String markdown) throws IOException {
        Path directory = pair.json().getParent();
        Files.createDirectories(directory);
        Path jsonTemp = null;
        Path markdownTemp = null;
        Path markdownBackup = null;
        boolean markdownReplaced = false;
        try {
            jsonTemp = Files.createTempFile(directory, pair.json().getFileName().toString(), ".tmp");
            markdownTemp = Files.createTempFile(directory, pair.markdown().getFileName().toString(), ".tmp");
            Files.write(jsonTemp, json);
            Files.writeString(markdownTemp, markdown, StandardCharsets.UTF_8);
            if (Files.exists(pair.markdown())) {
                markdownBackup = Files.createTempFile(directory, pair.markdown().getFileName().toString(), ".bak");
                Files.copy(pair.markdown(), markdownBackup, StandardCopyOption.REPLACE_EXISTING);
            }
            move(markdownTemp, pair.markdown());
            markdownReplaced = true;
            move(jsonTemp, pair.json());
        } catch (IOException e) {
            if (markdownReplaced) {
                restoreMarkdown(pair.markdown(), markdownBackup, e);
            }
            throw e;
        } finally {
            deleteTemporary(jsonTemp);
            deleteTemporary(markdownTemp);
            deleteTemporary(markdownBackup);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void restoreMarkdown(Path markdown, Path backup, IOException failure) {
        log.warn("json write failed for {}, rolling back markdown", markdown);
        try {
            if (backup != null) {
                Files.copy(backup, markdown, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.deleteIfExists(markdown);
            }
        } catch (IOException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }

    private static void deleteTemporary(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("could not delete temporary file {}: {}", path, e.getMessage());
        }
    }

    private List<Path> findJsonFiles(Path storeRoot) {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(storeRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && file.getFileName().toString().endsWith(".json")) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("cannot read {} while scanning summaries: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("summary scan of {} stopped early: {}", storeRoot, e.getMessage());
        }
        files.sort(null);
        return files;
    }

    private List<String> matches(SummaryDocument document, List<String> keywords, SearchMode mode)
            throws JsonProcessingException {
        SummaryContent summary = document.summary();
        List<String> matches = new ArrayList<>();
        switch (mode) {
            case DEPENDENCY -> {
                for (InternalDependency dependency : summary.dependencies().internal()) {
                    if (containsAny(dependency.path(), keywords)) {
                        matches.add("Internal dependency: " + dependency.path());
                    }
                }
                for (ExternalDependency dependency : summary.dependencies().external()) {
                    if (containsAny(dependency.packageName(), keywords)) {
                        matches.add("External dependency: " + dependency.packageName());
                    }
                }
            }
            case COMPONENT -> {
                for (KeyComponent component : summary.keyComponents()) {
                    if (containsAny(component.name(), keywords)) {
                        matches.add("Component: " + component.name());
                    }
                }
            }
            case EXPORTS -> {
                for (ApiEntry entry : summary.publicApi()) {
                    if (containsAny(entry.signature(), keywords)) {
                        matches.add("Export: " + entry.signature());
                    }
                }
            }
            case KEYWORD -> {
                String serialized = mapper.writeValueAsString(document).toLowerCase(Locale.ROOT);
                List<String> found = keywords.stream().filter(serialized::contains).toList();
                if (!found.isEmpty()) {
                    matches.add("Matched " + found.size() + "/" + keywords.size() + " keywords: "
                            + String.join(", ", found));
                }
            }
        }
        return matches;
    }

    private static boolean containsAny(String value, List<String> keywords) {
        String lower = value.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }

    static List<String> keywords(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(Arrays.asList(query.strip().toLowerCase(Locale.ROOT).split("\\s+"))));
    }
}
