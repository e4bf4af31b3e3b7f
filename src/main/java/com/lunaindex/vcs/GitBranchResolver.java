package com.lunaindex.vcs;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GitBranchResolver implements BranchResolver {
    private static final Logger log = LoggerFactory.getLogger(GitBranchResolver.class);

    private final GitCommandRunner gitCommandRunner;

    public GitBranchResolver() {
        this(new GitCommandRunner(Duration.ofSeconds(10)));
    }

    public GitBranchResolver(GitCommandRunner gitCommandRunner) {
        this.gitCommandRunner = gitCommandRunner;
    }

    @Override
    public Optional<String> currentBranch(Path workspaceRoot) {
        GitCommandResult result = gitCommandRunner.git(workspaceRoot, List.of("rev-parse", "--abbrev-ref", "HEAD"));
        if (!result.isSuccess()) {
            log.debug("branch lookup failed in {}: {}", workspaceRoot, result.describeFailure());
            return Optional.empty();
        }
        String branch = result.stdout().strip();
        return branch.isEmpty() ? Optional.empty() : Optional.of(branch);
    }

    @Override
    public Optional<String> currentRevision(Path workspaceRoot) {
        GitCommandResult result = gitCommandRunner.git(workspaceRoot, List.of("rev-parse", "HEAD"));
        if (!result.isSuccess()) {
            log.debug("revision lookup failed in {}: {}", workspaceRoot, result.describeFailure());
            return Optional.empty();
        }
        String revision = result.stdout().strip();
        return revision.isEmpty() ? Optional.empty() : Optional.of(revision);
    }
}
