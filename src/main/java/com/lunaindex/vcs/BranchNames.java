package com.lunaindex.vcs;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

public final class BranchNames {
    public static final Set<String> MAIN_BRANCHES = Set.of("main", "master", "develop", "dev");

    private static final Pattern UNSAFE_RUN = Pattern.compile("[^A-Za-z0-9_-]+");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_{2,}");

    private BranchNames() {
    }

    public static boolean isMainBranch(Optional<String> branch) {
        return branch.map(BranchNames::isMainBranch).orElse(true);
    }

    public static boolean isMainBranch(String branch) {
        if (branch == null || branch.isBlank()) {
            return true;
        }
        return MAIN_BRANCHES.contains(branch.strip().toLowerCase(Locale.ROOT));
    }

    public static String sanitize(String branch) {
        String replaced = UNSAFE_RUN.matcher(branch.strip()).replaceAll("_");
        return UNDERSCORE_RUN.matcher(replaced).replaceAll("_").toLowerCase(Locale.ROOT);
    }

    public static Optional<String> suffixFor(Optional<String> branch) {
        if (isMainBranch(branch)) {
            return Optional.empty();
        }
        return branch.map(BranchNames::sanitize).filter(sanitized -> !sanitized.isEmpty());
    }
}
