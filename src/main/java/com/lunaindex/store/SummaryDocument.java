package com.lunaindex.store;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

// schemaVersion is absent for version-1 documents
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "schemaVersion", "sourceFile", "generatedAt", "gitBranch", "gitCommit", "summary" })
public record SummaryDocument(
        Integer schemaVersion,
        String sourceFile,
        String generatedAt,
        String gitBranch,
        String gitCommit,
        SummaryContent summary) {

    public static final int SUPPORTED_SCHEMA_VERSION = 1;

    public static SummaryDocument of(String sourceFile, Instant generatedAt, SummaryContent summary) {
        return new SummaryDocument(null, SourcePaths.normalize(sourceFile), generatedAt.toString(), null, null, summary);
    }

    public SummaryDocument withSourceFile(String normalizedSourceFile) {
        return new SummaryDocument(schemaVersion, normalizedSourceFile, generatedAt, gitBranch, gitCommit, summary);
    }

    public SummaryDocument withVersionControl(String branch, String commit) {
        return new SummaryDocument(schemaVersion, sourceFile, generatedAt, branch, commit, summary);
    }

    public int effectiveSchemaVersion() {
        return schemaVersion == null ? SUPPORTED_SCHEMA_VERSION : schemaVersion;
    }

    public Optional<Instant> generatedInstant() {
        return parseTimestamp(generatedAt);
    }

    public void validate() throws InvalidSummaryException {
        if (effectiveSchemaVersion() < 1 || effectiveSchemaVersion() > SUPPORTED_SCHEMA_VERSION) {
            throw new InvalidSummaryException("unsupported schemaVersion " + schemaVersion);
        }
        if (sourceFile == null || sourceFile.isBlank()) {
            throw new InvalidSummaryException("missing sourceFile");
        }
        if (generatedAt == null || generatedAt.isBlank()) {
            throw new InvalidSummaryException("missing generatedAt for " + sourceFile);
        }
        if (summary == null) {
            throw new InvalidSummaryException("missing summary object for " + sourceFile);
        }
    }

    public static Optional<Instant> parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(OffsetDateTime.parse(text).toInstant());
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }
}
