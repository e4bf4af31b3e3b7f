package com.lunaindex.graph;

import java.util.List;

import com.lunaindex.store.DependencySet;

public record FileEntry(
        String id,
        String purpose,
        List<String> exports,
        DependencySet dependencies,
        List<Dependent> dependents,
        boolean summarized) {

    public FileEntry {
        exports = List.copyOf(exports);
        dependents = List.copyOf(dependents);
    }
}
