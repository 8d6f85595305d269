package de.unibi.cebitec.aws.s3.mirror.util;

public class ListingException extends RuntimeException {

    public ListingException(String message, Throwable cause) {
        super(message, cause);
    }
}
