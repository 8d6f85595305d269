package de.unibi.cebitec.aws.s3.mirror.ctrl;

import de.unibi.cebitec.aws.s3.mirror.model.KeyQueue;
import de.unibi.cebitec.aws.s3.mirror.model.MirrorResult;
import de.unibi.cebitec.aws.s3.mirror.model.ProgressTracker;
import de.unibi.cebitec.aws.s3.mirror.model.down.RetryingFetcher;
import de.unibi.cebitec.aws.s3.mirror.model.down.TransferDownloadWorker;
import de.unibi.cebitec.aws.s3.mirror.store.LocalFileSystem;
import de.unibi.cebitec.aws.s3.mirror.store.ObjectFetcher;
import de.unibi.cebitec.aws.s3.mirror.store.ObjectLister;
import de.unibi.cebitec.aws.s3.mirror.util.UnrecoverableErrorException;
import java.nio.file.Path;
import java.util.Timer;
import java.util.TimerTask;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mirrors every key below a prefix into a local directory. Listing and downloading overlap: one lister thread feeds
 * a bounded queue that a fixed pool of workers drains. The first key that cannot be mirrored aborts the whole run.
 */
public class MirrorDownloader {

    public static final Logger log = LoggerFactory.getLogger(MirrorDownloader.class);
    static final long STATUS_DELAY_MS = 3000;
    static final long STATUS_PERIOD_MS = 15000;
    static final long ABORT_GRACE_SECONDS = 30;

    private final ObjectLister lister;
    private final ObjectFetcher fetcher;
    private final LocalFileSystem fileSystem;
    private final String bucketName;
    private final String prefix;
    private final Path destination;
    private final int numberOfThreads;
    private final int queueCapacity;

    public MirrorDownloader(ObjectLister lister, ObjectFetcher fetcher, LocalFileSystem fileSystem, String bucketName,
                            String prefix, Path destination, int numberOfThreads, int queueCapacity) {
        if (numberOfThreads < 1) {
            throw new IllegalArgumentException("Number of threads must be positive: " + numberOfThreads);
        }
        this.lister = lister;
        this.fetcher = fetcher;
        this.fileSystem = fileSystem;
        this.bucketName = bucketName;
        this.prefix = prefix;
        this.destination = destination;
        this.numberOfThreads = numberOfThreads;
        this.queueCapacity = queueCapacity;
    }

    /**
     * Runs until every listed key is downloaded or the run is aborted.
     */
    public MirrorResult download() throws InterruptedException {
        ProgressTracker progress = new ProgressTracker();
        KeyQueue queue = new KeyQueue(this.queueCapacity);
        KeyLister keyLister = new KeyLister(this.lister, this.bucketName, this.prefix, queue, progress);
        RetryingFetcher retryingFetcher = new RetryingFetcher(this.fetcher, this.fileSystem, this.bucketName, this.destination);

        log.info("== Mirroring s3://{}/{} to '{}' in {} threads...", this.bucketName, this.prefix, this.destination, this.numberOfThreads);
        progress.start();

        TimerTask statusUpdates = new TimerTask() {
            @Override
            public void run() {
                log.info("Keys complete: {}", progress.getKeysFinishedCount());
            }
        };
        Timer timer = new Timer("mirror-status", true);
        timer.schedule(statusUpdates, STATUS_DELAY_MS, STATUS_PERIOD_MS);

        ExecutorService listing = Executors.newSingleThreadExecutor();
        ExecutorService threading = Executors.newFixedThreadPool(this.numberOfThreads);
        CompletionService<Void> workers = new ExecutorCompletionService<>(threading);
        UnrecoverableErrorException failure = null;
        try {
            Future<Boolean> listed = listing.submit(keyLister);
            for (int i = 0; i < this.numberOfThreads; i++) {
                workers.submit(new TransferDownloadWorker(i, queue, retryingFetcher, progress));
            }

            // join barrier: every worker has to leave its loop
            for (int i = 0; i < this.numberOfThreads && failure == null; i++) {
                Future<Void> finished = workers.take();
                try {
                    finished.get();
                } catch (ExecutionException e) {
                    if (!(e.getCause() instanceof UnrecoverableErrorException)) {
                        abort(queue, listing, threading);
                        throw new IllegalStateException("Download worker failed unexpectedly", e.getCause());
                    }
                    failure = (UnrecoverableErrorException) e.getCause();
                    log.error("Aborting: {}", failure.getMessage());
                    abort(queue, listing, threading);
                }
            }
            if (failure == null) {
                // the queue is closed, so the lister has returned or is about to
                try {
                    listed.get();
                } catch (ExecutionException e) {
                    log.error("Listing of s3://{}/{} failed unexpectedly: {}", this.bucketName, this.prefix, e.getCause().toString());
                    throw new IllegalStateException("Key listing failed unexpectedly", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            abort(queue, listing, threading);
            throw e;
        } finally {
            timer.cancel();
            threading.shutdown();
            listing.shutdown();
            progress.stop();
        }

        MirrorResult result = new MirrorResult(progress.getCompleted(), progress.getDiscovered(),
                progress.getBytes(), keyLister.isComplete(), failure);
        log.info("== Downloaded {} of {} keys ({}) from S3 bucket '{}', prefix '{}'", result.getCompleted(),
                result.getDiscovered(), progress.getBytesFormatted(), this.bucketName, this.prefix);
        log.info("Overall average download speed: {}", progress.getEndResult());
        return result;
    }

    private void abort(KeyQueue queue, ExecutorService listing, ExecutorService threading) {
        int discarded = queue.abort();
        log.debug("Discarded {} queued keys.", discarded);
        listing.shutdownNow();
        threading.shutdownNow();
        try {
            if (!threading.awaitTermination(ABORT_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Download workers did not stop within {} seconds. Their transfers are abandoned.", ABORT_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
