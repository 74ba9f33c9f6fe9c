package com.jonathantong.WalShift.bootstrap;

public class CommandResult {

    private final int exitCode;
    private final String stderr;

    public CommandResult(int exitCode, String stderr) {
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public int getExitCode() { return exitCode; }

    public String getStderr() { return stderr; }

    public boolean isSuccess() { return exitCode == 0; }
}
