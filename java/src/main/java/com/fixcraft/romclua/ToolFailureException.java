package com.fixcraft.romclua;

public final class ToolFailureException extends RomcLuaException {
    private final int exitCode;
    private final String stderr;

    public ToolFailureException(String tool, int exitCode, String stderr) {
        super(tool + " failed (code " + exitCode + ")" + (stderr == null || stderr.isEmpty() ? "" : ": " + stderr));
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }
}
