package com.mikov.emailvalidator.batch;

/**
 * Signals that an item's processor did not settle within the item timeout.
 */
public class ProcessingTimeoutException extends RuntimeException {

    public static final String MESSAGE = "Processing timeout";

    public ProcessingTimeoutException() {
        super(MESSAGE);
    }
}
