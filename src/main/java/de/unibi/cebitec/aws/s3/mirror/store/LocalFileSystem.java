package de.unibi.cebitec.aws.s3.mirror.store;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

public interface LocalFileSystem {
    /**
     * Creates the directory and all missing parents. Safe to call concurrently for overlapping paths.
     */
    void createDirectories(Path dir) throws IOException;

    FileChannel createOrTruncate(Path file) throws IOException;

    /**
     * Moves the channel back to offset 0 and truncates the file to zero length.
     */
    void reset(FileChannel channel) throws IOException;

    void delete(Path file) throws IOException;
}
