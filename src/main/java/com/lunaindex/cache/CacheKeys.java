package com.lunaindex.cache;

import java.nio.file.Path;

import com.lunaindex.store.SearchMode;

public final class CacheKeys {
    private CacheKeys() {
    }

    public static String fileSummary(Path workspaceRoot, String filePath) {
        return "file-summary:" + workspaceRoot + ":" + filePath;
    }

    public static String search(Path workspaceRoot, String query, SearchMode mode) {
        return "search:" + workspaceRoot + ":" + query + ":" + mode.wireName();
    }

    public static String fullGraph(Path workspaceRoot) {
        return "graph:" + workspaceRoot;
    }

    public static String graphQuery(Path workspaceRoot, String filePath) {
        return "graph:" + workspaceRoot + ":" + filePath;
    }
}
