package com.lunaindex.store;

public record SummaryRecord(SummaryDocument document, String markdown, boolean branchSpecific) {
    public SummaryRecord {
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        markdown = markdown == null ? "" : markdown;
    }

    public String sourceFile() {
        return document.sourceFile();
    }
}
