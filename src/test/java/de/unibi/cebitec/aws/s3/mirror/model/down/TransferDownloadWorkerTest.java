package de.unibi.cebitec.aws.s3.mirror.model.down;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.unibi.cebitec.aws.s3.mirror.model.KeyQueue;
import de.unibi.cebitec.aws.s3.mirror.model.ProgressTracker;
import de.unibi.cebitec.aws.s3.mirror.store.FakeObjectStore;
import de.unibi.cebitec.aws.s3.mirror.store.NioLocalFileSystem;
import de.unibi.cebitec.aws.s3.mirror.util.UnrecoverableErrorException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TransferDownloadWorkerTest {

    @TempDir
    Path destination;

    @Test
    void drainsQueueAndCountsEveryCompletedKey() throws Exception {
        FakeObjectStore store = new FakeObjectStore()
                .put("file1.txt", "one")
                .put("path/to/file2.txt", "two")
                .put("another/path/file3.txt", "three");
        KeyQueue queue = new KeyQueue(3);
        ProgressTracker progress = new ProgressTracker();
        for (String key : new String[]{"file1.txt", "path/to/file2.txt", "another/path/file3.txt"}) {
            progress.markDiscovered();
            queue.put(key);
        }
        queue.close();
        RetryingFetcher fetcher = new RetryingFetcher(store, new NioLocalFileSystem(), "test-bucket", destination);

        new TransferDownloadWorker(1, queue, fetcher, progress).call();

        assertThat(progress.getCompleted()).isEqualTo(3);
        assertThat(progress.getBytes()).isEqualTo(11);
        assertThat(destination.resolve("file1.txt")).hasContent("one");
        assertThat(destination.resolve("path/to/file2.txt")).hasContent("two");
        assertThat(destination.resolve("another/path/file3.txt")).hasContent("three");
    }

    @Test
    void stopsAtTheFirstFatalKey() throws Exception {
        FakeObjectStore store = new FakeObjectStore()
                .put("bad.txt", "never")
                .put("good.txt", "fine")
                .failFetch("bad.txt", RetryingFetcher.MAX_ATTEMPTS);
        KeyQueue queue = new KeyQueue(2);
        ProgressTracker progress = new ProgressTracker();
        queue.put("bad.txt");
        queue.put("good.txt");
        queue.close();
        RetryingFetcher fetcher = new RetryingFetcher(store, new NioLocalFileSystem(), "test-bucket", destination);
        TransferDownloadWorker worker = new TransferDownloadWorker(0, queue, fetcher, progress);

        assertThatThrownBy(worker::call)
                .isInstanceOf(UnrecoverableErrorException.class)
                .hasMessageContaining("bad.txt");
        assertThat(progress.getCompleted()).isZero();
        assertThat(store.fetchCount("good.txt")).isZero();
        assertThat(destination.resolve("bad.txt")).doesNotExist();
    }
}
