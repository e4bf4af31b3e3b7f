package com.lunaindex.store;

import java.util.List;

public record DependencySet(List<InternalDependency> internal, List<ExternalDependency> external) {
    public DependencySet {
        internal = internal == null ? List.of() : List.copyOf(internal);
        external = external == null ? List.of() : List.copyOf(external);
    }

    public static DependencySet empty() {
        return new DependencySet(List.of(), List.of());
    }
}
