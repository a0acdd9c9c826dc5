package com.github.ytdle.model;

public enum JobStatus {
    QUEUED("Queued", false),
    RUNNING("Downloading...", false),
    PAUSED("Paused", false),
    RETRYING("Retrying", false),
    COMPLETED("Completed", true),
    FAILED("Failed", true),
    CANCELLED("Cancelled", true),
    SKIPPED("Skipped", true);

    private final String displayName;
    private final boolean terminal;

    JobStatus(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * FAILED counts as terminal for reporting; the retry path leaves it before anyone can observe it.
     */
    public boolean isTerminal() {
        return terminal;
    }
}
