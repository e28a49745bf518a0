package com.mike.contactenricher.orchestrator;

public enum RunOutcome {
    BACKLOG_EXHAUSTED,
    ROW_LIMIT_REACHED,
    STOPPED,
    DATABASE_UNAVAILABLE;

    public int exitCode() {
        return this == DATABASE_UNAVAILABLE ? 1 : 0;
    }
}
