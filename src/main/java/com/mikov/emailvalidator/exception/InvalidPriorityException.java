package com.mikov.emailvalidator.exception;

public class InvalidPriorityException extends EmailValidationException {

    public InvalidPriorityException(final String priority) {
        super("INVALID_PRIORITY", "Unknown priority: " + priority);
    }
}
