package com.lunaindex.vcs;

public record GitCommandResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut,
        boolean interrupted,
        boolean launchFailed) {

    public static GitCommandResult success(String stdout) {
        return new GitCommandResult(0, stdout, "", false, false, false);
    }

    public static GitCommandResult failure(int exitCode, String stderr) {
        return new GitCommandResult(exitCode, "", stderr, false, false, false);
    }

    public boolean isSuccess() {
        return !timedOut && !interrupted && !launchFailed && exitCode == 0;
    }

    public String describeFailure() {
        return "exitCode=" + exitCode
                + " timedOut=" + timedOut
                + " interrupted=" + interrupted
                + " launchFailed=" + launchFailed
                + " stderr=" + stderr;
    }
}
