package de.unibi.cebitec.aws.s3.mirror.model.down;

import de.unibi.cebitec.aws.s3.mirror.model.KeyQueue;
import de.unibi.cebitec.aws.s3.mirror.model.ProgressTracker;
import de.unibi.cebitec.aws.s3.mirror.util.UnrecoverableErrorException;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the key queue until it is closed and empty. Ends with the fatal error of the first key that could not be
 * mirrored.
 */
public class TransferDownloadWorker implements Callable<Void> {

    public static final Logger log = LoggerFactory.getLogger(TransferDownloadWorker.class);
    private final int id;
    private final KeyQueue queue;
    private final RetryingFetcher fetcher;
    private final ProgressTracker progress;

    public TransferDownloadWorker(int id, KeyQueue queue, RetryingFetcher fetcher, ProgressTracker progress) {
        this.id = id;
        this.queue = queue;
        this.fetcher = fetcher;
        this.progress = progress;
    }

    @Override
    public Void call() throws UnrecoverableErrorException, InterruptedException {
        String key;
        while ((key = this.queue.take()) != null) {
            FetchOutcome outcome = this.fetcher.fetch(this.id, key);
            switch (outcome.getStatus()) {
                case COMPLETED:
                    ProgressTracker.Progress p = this.progress.markCompleted(outcome.getBytes());
                    log.info("Worker {} ({}/{}), downloaded {}", this.id, p.getCompleted(), p.getDiscovered(), key);
                    break;
                case FAILED:
                    throw outcome.getFailure();
                case ABANDONED:
                default:
                    return null;
            }
        }
        log.debug("Worker {}: queue drained.", this.id);
        return null;
    }

    public int getId() {
        return id;
    }
}
