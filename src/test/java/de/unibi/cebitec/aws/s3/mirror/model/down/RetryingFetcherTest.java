package de.unibi.cebitec.aws.s3.mirror.model.down;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.unibi.cebitec.aws.s3.mirror.store.LocalFileSystem;
import de.unibi.cebitec.aws.s3.mirror.store.NioLocalFileSystem;
import de.unibi.cebitec.aws.s3.mirror.store.ObjectFetcher;
import de.unibi.cebitec.aws.s3.mirror.util.UnrecoverableErrorException.Reason;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RetryingFetcherTest {
    private static final String BUCKET = "test-bucket";

    @TempDir
    Path destination;

    private static long write(FileChannel sink, String content) throws IOException {
        return sink.write(ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8)), 0);
    }

    @Test
    void writesObjectBelowDestinationCreatingParentDirectories() throws Exception {
        RetryingFetcher fetcher = new RetryingFetcher((bucket, key, sink) -> write(sink, "hello"),
                new NioLocalFileSystem(), BUCKET, destination);

        FetchOutcome outcome = fetcher.fetch(0, "a/b/c.txt");

        assertThat(outcome.getStatus()).isEqualTo(FetchOutcome.Status.COMPLETED);
        assertThat(outcome.getBytes()).isEqualTo(5);
        assertThat(destination.resolve("a/b/c.txt")).hasContent("hello");
    }

    @Test
    void retryAfterPartialWriteLeavesOnlyTheSuccessfulPayload() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ObjectFetcher flaky = (bucket, key, sink) -> {
            if (attempts.incrementAndGet() == 1) {
                write(sink, "partial");
                throw new IOException("connection reset");
            }
            sink.write(ByteBuffer.wrap("full".getBytes(StandardCharsets.UTF_8)));
            return sink.write(ByteBuffer.wrap(" content".getBytes(StandardCharsets.UTF_8)));
        };
        RetryingFetcher fetcher = new RetryingFetcher(flaky, new NioLocalFileSystem(), BUCKET, destination);

        FetchOutcome outcome = fetcher.fetch(0, "retry.txt");

        assertThat(outcome.getStatus()).isEqualTo(FetchOutcome.Status.COMPLETED);
        assertThat(attempts).hasValue(2);
        assertThat(destination.resolve("retry.txt")).hasContent("full content");
    }

    @Test
    void succeedsOnThirdAttemptAfterLongerPartialWrites() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ObjectFetcher flaky = (bucket, key, sink) -> {
            int attempt = attempts.incrementAndGet();
            if (attempt < 3) {
                write(sink, "garbage from a broken transfer " + attempt);
                throw new IOException("broken pipe");
            }
            return write(sink, "ok");
        };
        RetryingFetcher fetcher = new RetryingFetcher(flaky, new NioLocalFileSystem(), BUCKET, destination);

        FetchOutcome outcome = fetcher.fetch(0, "third.txt");

        assertThat(outcome.getStatus()).isEqualTo(FetchOutcome.Status.COMPLETED);
        assertThat(attempts).hasValue(3);
        assertThat(Files.readAllBytes(destination.resolve("third.txt"))).isEqualTo("ok".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void exhaustedRetriesDeleteThePartialFile() {
        AtomicInteger attempts = new AtomicInteger();
        ObjectFetcher broken = (bucket, key, sink) -> {
            attempts.incrementAndGet();
            write(sink, "partial");
            throw new IOException("503 Slow Down");
        };
        RetryingFetcher fetcher = new RetryingFetcher(broken, new NioLocalFileSystem(), BUCKET, destination);

        FetchOutcome outcome = fetcher.fetch(0, "dir/lost.txt");

        assertThat(outcome.getStatus()).isEqualTo(FetchOutcome.Status.FAILED);
        assertThat(outcome.getFailure().getReason()).isEqualTo(Reason.DOWNLOAD_EXHAUSTED);
        assertThat(outcome.getFailure().getKey()).isEqualTo("dir/lost.txt");
        assertThat(outcome.getFailure().getCause()).hasMessage("503 Slow Down");
        assertThat(attempts).hasValue(RetryingFetcher.MAX_ATTEMPTS);
        assertThat(destination.resolve("dir/lost.txt")).doesNotExist();
    }

    @Test
    void errorsCloseAndRemoveThePartialFileBeforePropagating() {
        List<FileChannel> channels = new ArrayList<>();
        ObjectFetcher crashing = (bucket, key, sink) -> {
            channels.add(sink);
            write(sink, "half");
            throw new OutOfMemoryError("simulated");
        };
        RetryingFetcher fetcher = new RetryingFetcher(crashing, new NioLocalFileSystem(), BUCKET, destination);

        assertThatThrownBy(() -> fetcher.fetch(0, "big/object.bin")).isInstanceOf(OutOfMemoryError.class);

        assertThat(channels).hasSize(1);
        assertThat(channels.get(0).isOpen()).isFalse();
        assertThat(destination.resolve("big/object.bin")).doesNotExist();
    }

    @Test
    void runtimeExceptionsFromTheClientAreRetriedToo() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ObjectFetcher flaky = (bucket, key, sink) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("SDK client failure");
            }
            return write(sink, "data");
        };
        RetryingFetcher fetcher = new RetryingFetcher(flaky, new NioLocalFileSystem(), BUCKET, destination);

        assertThat(fetcher.fetch(0, "k").getStatus()).isEqualTo(FetchOutcome.Status.COMPLETED);
        assertThat(destination.resolve("k")).hasContent("data");
    }

    @Test
    void failingDirectoryCreationIsFatalWithoutDownloading() {
        AtomicInteger attempts = new AtomicInteger();
        LocalFileSystem readOnly = new NioLocalFileSystem() {
            @Override
            public void createDirectories(Path dir) throws IOException {
                throw new IOException("Read-only file system");
            }
        };
        RetryingFetcher fetcher = new RetryingFetcher((bucket, key, sink) -> attempts.incrementAndGet(),
                readOnly, BUCKET, destination);

        FetchOutcome outcome = fetcher.fetch(3, "a/b.txt");

        assertThat(outcome.getStatus()).isEqualTo(FetchOutcome.Status.FAILED);
        assertThat(outcome.getFailure().getReason()).isEqualTo(Reason.FILESYSTEM);
        assertThat(attempts).hasValue(0);
    }

    @Test
    void failingResetIsFatalAndNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        List<Path> deleted = new ArrayList<>();
        LocalFileSystem noTruncate = new NioLocalFileSystem() {
            @Override
            public void reset(FileChannel channel) throws IOException {
                throw new IOException("truncate not supported");
            }

            @Override
            public void delete(Path file) throws IOException {
                deleted.add(file);
                super.delete(file);
            }
        };
        ObjectFetcher broken = (bucket, key, sink) -> {
            attempts.incrementAndGet();
            throw new IOException("timeout");
        };
        RetryingFetcher fetcher = new RetryingFetcher(broken, noTruncate, BUCKET, destination);

        FetchOutcome outcome = fetcher.fetch(0, "x.bin");

        assertThat(outcome.getFailure().getReason()).isEqualTo(Reason.FILESYSTEM);
        assertThat(attempts).hasValue(1);
        assertThat(deleted).containsExactly(destination.toAbsolutePath().normalize().resolve("x.bin"));
        assertThat(destination.resolve("x.bin")).doesNotExist();
    }

    @Test
    void keysEscapingTheDestinationAreRejected() {
        RetryingFetcher fetcher = new RetryingFetcher((bucket, key, sink) -> write(sink, "evil"),
                new NioLocalFileSystem(), BUCKET, destination.resolve("inner"));

        FetchOutcome outcome = fetcher.fetch(0, "../outside.txt");

        assertThat(outcome.getStatus()).isEqualTo(FetchOutcome.Status.FAILED);
        assertThat(outcome.getFailure().getReason()).isEqualTo(Reason.FILESYSTEM);
        assertThat(destination.resolve("outside.txt")).doesNotExist();
    }

    @Test
    void leadingSlashesStayInsideTheDestination() throws Exception {
        RetryingFetcher fetcher = new RetryingFetcher((bucket, key, sink) -> 0,
                new NioLocalFileSystem(), BUCKET, destination);

        Path target = fetcher.resolveTarget("//logs/app.log");

        assertThat(target).isEqualTo(destination.toAbsolutePath().normalize().resolve("logs/app.log"));
    }

    @Test
    void interruptedDownloadIsAbandonedWithoutRetry() {
        AtomicInteger attempts = new AtomicInteger();
        ObjectFetcher interrupted = (bucket, key, sink) -> {
            attempts.incrementAndGet();
            Thread.currentThread().interrupt();
            throw new IOException("interrupted");
        };
        RetryingFetcher fetcher = new RetryingFetcher(interrupted, new NioLocalFileSystem(), BUCKET, destination);
        try {
            FetchOutcome outcome = fetcher.fetch(0, "slow.bin");

            assertThat(outcome.getStatus()).isEqualTo(FetchOutcome.Status.ABANDONED);
            assertThat(attempts).hasValue(1);
        } finally {
            Thread.interrupted();
        }
    }
}
