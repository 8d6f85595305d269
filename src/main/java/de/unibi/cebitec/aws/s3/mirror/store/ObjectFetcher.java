package de.unibi.cebitec.aws.s3.mirror.store;

import java.io.IOException;
import java.nio.channels.FileChannel;

public interface ObjectFetcher {
    /**
     * Writes the object content into {@code sink} at absolute positions starting at 0.
     *
     * @return number of bytes written
     */
    long fetch(String bucketName, String key, FileChannel sink) throws IOException;
}
