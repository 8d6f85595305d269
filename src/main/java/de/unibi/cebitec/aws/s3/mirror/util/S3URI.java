package de.unibi.cebitec.aws.s3.mirror.util;

import java.net.URI;
import java.net.URISyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits an {@code s3://bucket/prefix} URI into bucket and key prefix.
 */
public class S3URI {
    private static final Logger log = LoggerFactory.getLogger(S3URI.class);
    private static final String SCHEME = "s3";
    private final String bucket;
    private final String prefix;

    public S3URI(String s3uri) throws URISyntaxException {
        URI uri = new URI(s3uri);
        if (!SCHEME.equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("Invalid S3URI - scheme has to be 's3': " + s3uri);
        }
        this.bucket = uri.getAuthority();
        if (this.bucket == null || this.bucket.isEmpty()) {
            log.warn("URI: {}   BUCKET: null", s3uri);
            throw new IllegalArgumentException("Invalid S3URI - no bucket specified!");
        }
        String path = uri.getPath();
        this.prefix = path == null || path.isEmpty() ? "" : path.substring(1);
        log.debug("URI: {}   BUCKET: {}   PREFIX: {}", s3uri, this.bucket, this.prefix);
    }

    public String getBucket() {
        return bucket;
    }

    public String getPrefix() {
        return prefix;
    }
}
