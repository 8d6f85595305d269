package de.unibi.cebitec.aws.s3.mirror.store;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import de.unibi.cebitec.aws.s3.mirror.util.ListingException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class S3ObjectLister implements ObjectLister {
    public static final Logger log = LoggerFactory.getLogger(S3ObjectLister.class);
    public static final int PAGE_SIZE = 1000;

    private final AmazonS3 s3;

    public S3ObjectLister(AmazonS3 s3) {
        this.s3 = s3;
    }

    @Override
    public Iterator<String> list(String bucketName, String prefix) {
        return new PageIterator(bucketName, prefix);
    }

    private final class PageIterator implements Iterator<String> {
        private final String bucketName;
        private final String prefix;
        private final Deque<String> currentPage = new ArrayDeque<>();
        private String continuationToken;
        private boolean lastPageFetched;
        private int pageNumber;

        private PageIterator(String bucketName, String prefix) {
            this.bucketName = bucketName;
            this.prefix = prefix;
        }

        @Override
        public boolean hasNext() {
            while (this.currentPage.isEmpty() && !this.lastPageFetched) {
                fetchNextPage();
            }
            return !this.currentPage.isEmpty();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return this.currentPage.poll();
        }

        private void fetchNextPage() {
            ListObjectsV2Request request = new ListObjectsV2Request()
                    .withBucketName(this.bucketName)
                    .withPrefix(this.prefix)
                    .withMaxKeys(PAGE_SIZE)
                    .withContinuationToken(this.continuationToken);
            ListObjectsV2Result page;
            try {
                page = s3.listObjectsV2(request);
            } catch (AmazonClientException e) {
                throw new ListingException("Listing page " + (this.pageNumber + 1) + " of s3://" + this.bucketName + "/"
                        + this.prefix + " failed", e);
            }
            this.pageNumber++;
            for (S3ObjectSummary summary : page.getObjectSummaries()) {
                if (summary.getKey().endsWith("/") && summary.getSize() == 0) {
                    log.debug("Skipping directory marker: {}", summary.getKey());
                    continue;
                }
                this.currentPage.add(summary.getKey());
            }
            log.trace("Listed page {} with {} keys", this.pageNumber, page.getKeyCount());
            if (page.isTruncated()) {
                this.continuationToken = page.getNextContinuationToken();
            } else {
                this.lastPageFetched = true;
            }
        }
    }
}
