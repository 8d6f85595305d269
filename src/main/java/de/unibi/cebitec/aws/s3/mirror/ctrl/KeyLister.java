package de.unibi.cebitec.aws.s3.mirror.ctrl;

import de.unibi.cebitec.aws.s3.mirror.model.KeyQueue;
import de.unibi.cebitec.aws.s3.mirror.model.ProgressTracker;
import de.unibi.cebitec.aws.s3.mirror.store.ObjectLister;
import de.unibi.cebitec.aws.s3.mirror.util.ListingException;
import java.util.Iterator;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole producer and sole closer of the key queue. A failing listing page ends the listing, keys queued so far are
 * still downloaded.
 */
public class KeyLister implements Callable<Boolean> {

    public static final Logger log = LoggerFactory.getLogger(KeyLister.class);
    private final ObjectLister lister;
    private final String bucketName;
    private final String prefix;
    private final KeyQueue queue;
    private final ProgressTracker progress;
    private volatile boolean complete;

    public KeyLister(ObjectLister lister, String bucketName, String prefix, KeyQueue queue, ProgressTracker progress) {
        this.lister = lister;
        this.bucketName = bucketName;
        this.prefix = prefix;
        this.queue = queue;
        this.progress = progress;
    }

    /**
     * @return true if every page was listed
     */
    @Override
    public Boolean call() {
        try {
            Iterator<String> keys = this.lister.list(this.bucketName, this.prefix);
            while (keys.hasNext()) {
                String key = keys.next();
                this.progress.markDiscovered();
                if (!this.queue.put(key)) {
                    log.debug("Key queue closed. Listing stopped at {}", key);
                    return false;
                }
            }
            this.complete = true;
            log.info("== Listing done: {} keys found under s3://{}/{}", this.progress.getDiscovered(), this.bucketName, this.prefix);
            return true;
        } catch (ListingException e) {
            log.error("Error listing objects: {} ({})", e.getMessage(), e.getCause() == null ? "" : e.getCause().toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            this.queue.close();
        }
    }

    public boolean isComplete() {
        return complete;
    }
}
