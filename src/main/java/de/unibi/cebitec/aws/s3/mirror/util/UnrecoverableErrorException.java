package de.unibi.cebitec.aws.s3.mirror.util;

/**
 * Raised when a key cannot be mirrored and the whole run has to be aborted.
 */
public class UnrecoverableErrorException extends Exception {

    public enum Reason {
        /**
         * Directory or file creation, seek or truncate failed.
         */
        FILESYSTEM,
        /**
         * Every download attempt for the key failed.
         */
        DOWNLOAD_EXHAUSTED
    }

    private final String key;
    private final Reason reason;

    public UnrecoverableErrorException(String key, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
        this.reason = reason;
    }

    public String getKey() {
        return key;
    }

    public Reason getReason() {
        return reason;
    }
}
