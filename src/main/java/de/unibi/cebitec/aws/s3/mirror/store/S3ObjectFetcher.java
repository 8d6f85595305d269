package de.unibi.cebitec.aws.s3.mirror.store;

import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.S3Object;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads an object with a single GET. Interrupted HTTP responses are resumed with ranged GETs starting at the
 * first missing byte.
 */
public class S3ObjectFetcher implements ObjectFetcher {
    public static final Logger log = LoggerFactory.getLogger(S3ObjectFetcher.class);
    public static final int INCOMPLETE_HTTP_RESPONSE_RETRIES = 10;

    private final AmazonS3 s3;

    public S3ObjectFetcher(AmazonS3 s3) {
        this.s3 = s3;
    }

    @Override
    public long fetch(String bucketName, String key, FileChannel sink) throws IOException {
        S3Object obj = this.s3.getObject(new GetObjectRequest(bucketName, key));
        long size = obj.getObjectMetadata().getContentLength();
        long written = transfer(obj, sink, 0, size);
        for (int i = 1; written < size; i++) {
            if (i > INCOMPLETE_HTTP_RESPONSE_RETRIES) {
                throw new IOException("Transfer of '" + key + "' failed after " + INCOMPLETE_HTTP_RESPONSE_RETRIES
                        + " attempts to recover from interrupted HTTP transfers!");
            }
            log.debug("Transfer of '{}' has been interrupted! {} out of {} bytes have already been transferred. Resuming....",
                    key, written, size);
            GetObjectRequest rangeRequest = new GetObjectRequest(bucketName, key);
            rangeRequest.setRange(written, size - 1);
            written += transfer(this.s3.getObject(rangeRequest), sink, written, size - written);
        }
        return written;
    }

    private long transfer(S3Object obj, FileChannel sink, long position, long count) throws IOException {
        try (ReadableByteChannel in = Channels.newChannel(obj.getObjectContent())) {
            return sink.transferFrom(in, position, count);
        }
    }
}
