package de.unibi.cebitec.aws.s3.mirror.model;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-wide counters. Only atomic increments, no locking.
 */
public final class ProgressTracker {
    private final AtomicLong discovered = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong bytes = new AtomicLong();
    private volatile long start;
    private volatile long end;

    public long markDiscovered() {
        return this.discovered.incrementAndGet();
    }

    /**
     * Counts a finished key and returns the new completed count together with the current discovered count.
     */
    public Progress markCompleted(long byteCount) {
        this.bytes.addAndGet(byteCount);
        long done = this.completed.incrementAndGet();
        return new Progress(done, this.discovered.get());
    }

    public long getDiscovered() {
        return this.discovered.get();
    }

    public long getCompleted() {
        return this.completed.get();
    }

    public long getBytes() {
        return this.bytes.get();
    }

    public void start() {
        if (this.start == 0) {
            this.start = System.currentTimeMillis();
        }
    }

    public void stop() {
        if (this.start != 0) {
            this.end = System.currentTimeMillis();
        }
    }

    public String getKeysFinishedCount() {
        return this.completed.get() + " / " + this.discovered.get();
    }

    public String getEndResult() {
        long seconds = (this.end - this.start) / 1000;
        if (seconds <= 0) {
            return "unknown";
        }
        return formatResult(this.bytes.get() / seconds, "/s");
    }

    public String getBytesFormatted() {
        return formatResult(this.bytes.get(), "");
    }

    static String formatResult(long bytes, String suffix) {
        DecimalFormat f = new DecimalFormat("#0.00", DecimalFormatSymbols.getInstance(Locale.ENGLISH));
        if (bytes > 1e9) {
            return f.format(bytes / 1e9) + "GB" + suffix;
        }
        if (bytes > 1e6) {
            return f.format(bytes / 1e6) + "MB" + suffix;
        }
        if (bytes > 1e3) {
            return f.format(bytes / 1e3) + "KB" + suffix;
        }
        return bytes + "B" + suffix;
    }

    public static final class Progress {
        private final long completed;
        private final long discovered;

        Progress(long completed, long discovered) {
            this.completed = completed;
            this.discovered = discovered;
        }

        public long getCompleted() {
            return completed;
        }

        public long getDiscovered() {
            return discovered;
        }
    }
}
