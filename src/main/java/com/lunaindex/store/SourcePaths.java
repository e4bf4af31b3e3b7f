package com.lunaindex.store;

import java.util.ArrayDeque;
import java.util.Deque;

public final class SourcePaths {
    private SourcePaths() {
    }

    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.strip().replace('\\', '/');
        while (normalized.contains("//")) {
            normalized = normalized.replace("//", "/");
        }
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    public static String requireFilePath(String path) {
        String normalized = normalize(path);
        if (normalized.isEmpty() || normalized.endsWith("/")) {
            throw new IllegalArgumentException("file path must name a file: '" + path + "'");
        }
        return normalized;
    }

    public static String fileName(String path) {
        String normalized = normalize(path);
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    public static String directory(String path) {
        String normalized = normalize(path);
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(0, slash) : "";
    }

    // final segment only; dot-files keep their name
    public static String stripExtension(String path) {
        String normalized = normalize(path);
        String name = fileName(normalized);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return normalized;
        }
        return normalized.substring(0, normalized.length() - (name.length() - dot));
    }

    public static String resolve(String directory, String relative) {
        Deque<String> segments = new ArrayDeque<>();
        String combined = directory.isEmpty() ? relative : directory + "/" + relative;
        for (String segment : normalize(combined).split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }
}
