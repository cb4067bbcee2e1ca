package com.mikov.emailvalidator.exception;

public class BatchTooLargeException extends EmailValidationException {

    public BatchTooLargeException(final int size, final int maxSize) {
        super("BATCH_TOO_LARGE", "Batch size " + size + " exceeds maximum allowed (" + maxSize + " emails)");
    }
}
