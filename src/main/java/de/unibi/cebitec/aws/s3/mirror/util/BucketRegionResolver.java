package de.unibi.cebitec.aws.s3.mirror.util;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.s3.AmazonS3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BucketRegionResolver {
    private static final Logger log = LoggerFactory.getLogger(BucketRegionResolver.class);
    public static final String DEFAULT_REGION = "us-east-1";

    private final AmazonS3 s3;
    private final int retries;

    public BucketRegionResolver(AmazonS3 s3, int retries) {
        this.s3 = s3;
        this.retries = retries;
    }

    /**
     * Looks up where the bucket lives. The legacy "US" constraint and an empty one both mean us-east-1.
     * Falls back to {@link #DEFAULT_REGION} when the lookup keeps failing.
     */
    public String resolve(String bucketName) {
        for (int i = 1; i <= this.retries; i++) {
            try {
                String location = this.s3.getBucketLocation(bucketName);
                if (location == null || location.isEmpty() || "US".equals(location)) {
                    return DEFAULT_REGION;
                }
                if ("EU".equals(location)) {
                    return "eu-west-1";
                }
                return location;
            } catch (AmazonClientException e) {
                log.warn("Bucket location request failed! Attempt {} of {} ({})", i, this.retries, e.toString());
            }
        }
        log.warn("Could not determine region of bucket '{}'. Using {}.", bucketName, DEFAULT_REGION);
        return DEFAULT_REGION;
    }
}
