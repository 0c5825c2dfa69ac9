package com.cropadvisor.orchestrator.service;

/** What the post-finalize write step did with the run's proposed state change. */
public enum CommitStatus {
    /** Nothing to write. */
    NONE,
    COMMITTED,
    COMMITTED_AFTER_RETRY,
    /** After a conflict the fresh record already covered every day; nothing left to write. */
    UP_TO_DATE,
    REGISTERED,
    /** Second conflict in a row; the next run will pick up the missed days. */
    CONFLICT,
    FAILED
}
