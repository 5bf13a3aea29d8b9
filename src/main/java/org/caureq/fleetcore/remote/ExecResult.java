package org.caureq.fleetcore.remote;

public record ExecResult(int exitCode, String stdout, String stderr, long durationMs) {
    public boolean ok() { return exitCode == 0; }

    /** Last non-blank stderr line, or stdout when stderr is empty. Used for error messages. */
    public String tail() {
        String src = (stderr == null || stderr.isBlank()) ? stdout : stderr;
        if (src == null) return "";
        String[] lines = src.strip().split("\\R");
        return lines.length == 0 ? "" : lines[lines.length - 1];
    }
}
