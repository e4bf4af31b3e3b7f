package com.lunaindex.store;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for summary documents used across tests.
 */
public final class SummaryFixtures {
    public static final Instant GENERATED_AT = Instant.parse("2024-06-01T12:00:00Z");

    private SummaryFixtures() {
    }

    public static SummaryDocument document(String sourceFile, String purpose, String... internalDependencies) {
        return document(sourceFile, GENERATED_AT, purpose, List.of(), internalDependencies);
    }

    public static SummaryDocument document(
            String sourceFile,
            Instant generatedAt,
            String purpose,
            List<String> exports,
            String... internalDependencies) {
        List<InternalDependency> internal = Arrays.stream(internalDependencies)
                .map(path -> new InternalDependency(path, "imports helpers"))
                .toList();
        List<ApiEntry> api = exports.stream()
                .map(signature -> new ApiEntry(signature, "exported"))
                .toList();
        SummaryContent content = new SummaryContent(
                purpose,
                List.of(new KeyComponent("Main" + SourcePaths.fileName(sourceFile), "primary component")),
                new DependencySet(internal, List.of(new ExternalDependency("vscode", "editor api"))),
                api,
                List.of(),
                "");
        return SummaryDocument.of(sourceFile, generatedAt, content);
    }
}
