package com.mikov.emailvalidator.exception;

import lombok.Getter;

/**
 * Base class for caller or configuration errors that reject a request outright,
 * as opposed to problems with an address, which are reported inside a result.
 *
 * @author zahari.mikov
 */
@Getter
public abstract class EmailValidationException extends RuntimeException {

    private final String errorCode;

    protected EmailValidationException(final String errorCode, final String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
