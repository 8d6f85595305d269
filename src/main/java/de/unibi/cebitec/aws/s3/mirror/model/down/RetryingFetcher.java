package de.unibi.cebitec.aws.s3.mirror.model.down;

import de.unibi.cebitec.aws.s3.mirror.store.LocalFileSystem;
import de.unibi.cebitec.aws.s3.mirror.store.ObjectFetcher;
import de.unibi.cebitec.aws.s3.mirror.util.UnrecoverableErrorException;
import de.unibi.cebitec.aws.s3.mirror.util.UnrecoverableErrorException.Reason;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads one key into its local file. Download failures are retried in place, the file is emptied before every
 * retry so bytes of a failed attempt never end up in the result. Filesystem failures are never retried.
 */
public class RetryingFetcher {

    public static final Logger log = LoggerFactory.getLogger(RetryingFetcher.class);
    public static final int MAX_ATTEMPTS = 3;

    private final ObjectFetcher fetcher;
    private final LocalFileSystem fileSystem;
    private final String bucketName;
    private final Path destination;

    public RetryingFetcher(ObjectFetcher fetcher, LocalFileSystem fileSystem, String bucketName, Path destination) {
        this.fetcher = fetcher;
        this.fileSystem = fileSystem;
        this.bucketName = bucketName;
        this.destination = destination.toAbsolutePath().normalize();
    }

    public FetchOutcome fetch(int workerId, String key) {
        Path targetFile;
        FileChannel out;
        try {
            targetFile = resolveTarget(key);
            Path parentDir = targetFile.getParent();
            if (parentDir != null) {
                this.fileSystem.createDirectories(parentDir);
            }
            out = this.fileSystem.createOrTruncate(targetFile);
        } catch (UnrecoverableErrorException e) {
            return FetchOutcome.failed(e);
        } catch (IOException e) {
            return FetchOutcome.failed(new UnrecoverableErrorException(key, Reason.FILESYSTEM,
                    "Worker " + workerId + ": Failed to create file for " + key + ": " + e, e));
        }

        Exception lastError = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                long bytes = this.fetcher.fetch(this.bucketName, key, out);
                return finish(workerId, key, out, targetFile, bytes);
            } catch (Exception e) {
                if (Thread.currentThread().isInterrupted()) {
                    log.debug("Worker {}: Download of {} abandoned.", workerId, key);
                    closeQuietly(out, targetFile);
                    return FetchOutcome.abandoned();
                }
                lastError = e;
                log.warn("Worker {}: Attempt {}: Failed to download {}: {}", workerId, attempt, key, e.toString());
            } catch (Error e) {
                discard(out, targetFile, e);
                throw e;
            }
            if (attempt < MAX_ATTEMPTS) {
                try {
                    this.fileSystem.reset(out);
                } catch (IOException e) {
                    UnrecoverableErrorException failure = new UnrecoverableErrorException(key, Reason.FILESYSTEM,
                            "Worker " + workerId + ": Failed to reset " + targetFile + " before retry: " + e, e);
                    discard(out, targetFile, failure);
                    return FetchOutcome.failed(failure);
                }
            }
        }

        UnrecoverableErrorException failure = new UnrecoverableErrorException(key, Reason.DOWNLOAD_EXHAUSTED,
                "Worker " + workerId + ": Failed to download " + key + " after " + MAX_ATTEMPTS + " attempts: " + lastError,
                lastError);
        discard(out, targetFile, failure);
        return FetchOutcome.failed(failure);
    }

    private FetchOutcome finish(int workerId, String key, FileChannel out, Path targetFile, long bytes) {
        try {
            out.close();
            return FetchOutcome.completed(bytes);
        } catch (IOException e) {
            UnrecoverableErrorException failure = new UnrecoverableErrorException(key, Reason.FILESYSTEM,
                    "Worker " + workerId + ": Failed to close " + targetFile + ": " + e, e);
            discard(out, targetFile, failure);
            return FetchOutcome.failed(failure);
        }
    }

    Path resolveTarget(String key) throws UnrecoverableErrorException {
        String relative = key;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path target = this.destination.resolve(relative).normalize();
        if (!target.startsWith(this.destination) || target.equals(this.destination)) {
            throw new UnrecoverableErrorException(key, Reason.FILESYSTEM,
                    "Key '" + key + "' does not map to a file inside " + this.destination, null);
        }
        return target;
    }

    private void discard(FileChannel out, Path targetFile, Throwable failure) {
        try {
            out.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
        try {
            this.fileSystem.delete(targetFile);
        } catch (IOException e) {
            log.warn("Could not delete partial file {}: {}", targetFile, e.toString());
            failure.addSuppressed(e);
        }
    }

    private static void closeQuietly(FileChannel out, Path targetFile) {
        try {
            out.close();
        } catch (IOException e) {
            log.debug("Failed to close {} ({})", targetFile, e.getClass().getSimpleName());
        }
    }
}
