package com.mikov.emailvalidator.exception;

public class EmptyBatchException extends EmailValidationException {

    public EmptyBatchException() {
        super("EMPTY_BATCH", "Email list is required");
    }
}
