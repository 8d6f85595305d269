package de.unibi.cebitec.aws.s3.mirror.model;

import de.unibi.cebitec.aws.s3.mirror.util.UnrecoverableErrorException;

public class MirrorResult {
    private final long completed;
    private final long discovered;
    private final long bytes;
    private final boolean listingComplete;
    private final UnrecoverableErrorException failure;

    public MirrorResult(long completed, long discovered, long bytes, boolean listingComplete,
                        UnrecoverableErrorException failure) {
        this.completed = completed;
        this.discovered = discovered;
        this.bytes = bytes;
        this.listingComplete = listingComplete;
        this.failure = failure;
    }

    public long getCompleted() {
        return completed;
    }

    public long getDiscovered() {
        return discovered;
    }

    public long getBytes() {
        return bytes;
    }

    /**
     * False if a listing page failed and keys after it were never discovered.
     */
    public boolean isListingComplete() {
        return listingComplete;
    }

    public boolean isAborted() {
        return failure != null;
    }

    /**
     * The error that aborted the run, or null.
     */
    public UnrecoverableErrorException getFailure() {
        return failure;
    }
}
