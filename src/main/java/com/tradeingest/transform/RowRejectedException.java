package com.tradeingest.transform;

/**
 * A single row could not be turned into a canonical record. Caught per row by the ingestion loop and
 * recorded as {@code "Row N: message"}; it never aborts a batch.
 */
public class RowRejectedException extends RuntimeException {

    public RowRejectedException(String message) {
        super(message);
    }
}
