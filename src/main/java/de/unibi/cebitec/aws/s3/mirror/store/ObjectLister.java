package de.unibi.cebitec.aws.s3.mirror.store;

import java.util.Iterator;

/**
 * Streams the keys below a prefix. The returned iterator fetches pages lazily and cannot be restarted;
 * {@link Iterator#hasNext()} and {@link Iterator#next()} throw
 * {@link de.unibi.cebitec.aws.s3.mirror.util.ListingException} when a page cannot be fetched.
 */
public interface ObjectLister {
    Iterator<String> list(String bucketName, String prefix);
}
