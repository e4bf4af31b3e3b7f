package com.lunaindex.graph;

public record OrphanedExport(String file, String export, String type) {
}
