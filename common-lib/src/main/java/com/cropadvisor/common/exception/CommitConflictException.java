package com.cropadvisor.common.exception;

/**
 * Optimistic-concurrency failure: the crop record changed between snapshot and commit.
 */
public class CommitConflictException extends AdvisoryException {
    private final long expectedVersion;
    private final long actualVersion;

    public CommitConflictException(long farmerId, long expectedVersion, long actualVersion) {
        super("ContextStore", "crop commit conflict for farmer " + farmerId
              + " expectedVersion=" + expectedVersion + " actualVersion=" + actualVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
