package com.lunaindex.store;

import java.util.Optional;

// fallback is the canonical pair, present only when primary is branch-specific
public record SummaryPaths(ArtifactPair primary, Optional<ArtifactPair> fallback, Optional<String> branchSuffix) {
    public boolean branchSpecific() {
        return branchSuffix.isPresent();
    }

    public ArtifactPair canonical() {
        return fallback.orElse(primary);
    }
}
