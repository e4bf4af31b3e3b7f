package com.lunaindex.vcs;

import java.nio.file.Path;
import java.util.Optional;

public interface BranchResolver {
    Optional<String> currentBranch(Path workspaceRoot);

    default Optional<String> currentRevision(Path workspaceRoot) {
        return Optional.empty();
    }

    static BranchResolver none() {
        return workspaceRoot -> Optional.empty();
    }

    static BranchResolver fixed(String branch) {
        return workspaceRoot -> Optional.ofNullable(branch);
    }
}
