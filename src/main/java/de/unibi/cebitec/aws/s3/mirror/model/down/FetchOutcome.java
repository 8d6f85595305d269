package de.unibi.cebitec.aws.s3.mirror.model.down;

import de.unibi.cebitec.aws.s3.mirror.util.UnrecoverableErrorException;

public final class FetchOutcome {

    public enum Status {
        COMPLETED,
        FAILED,
        /**
         * The worker was interrupted while the run was being aborted.
         */
        ABANDONED
    }

    private static final FetchOutcome ABANDONED_OUTCOME = new FetchOutcome(Status.ABANDONED, 0, null);

    private final Status status;
    private final long bytes;
    private final UnrecoverableErrorException failure;

    private FetchOutcome(Status status, long bytes, UnrecoverableErrorException failure) {
        this.status = status;
        this.bytes = bytes;
        this.failure = failure;
    }

    public static FetchOutcome completed(long bytes) {
        return new FetchOutcome(Status.COMPLETED, bytes, null);
    }

    public static FetchOutcome failed(UnrecoverableErrorException failure) {
        return new FetchOutcome(Status.FAILED, 0, failure);
    }

    public static FetchOutcome abandoned() {
        return ABANDONED_OUTCOME;
    }

    public Status getStatus() {
        return status;
    }

    public long getBytes() {
        return bytes;
    }

    public UnrecoverableErrorException getFailure() {
        return failure;
    }
}
