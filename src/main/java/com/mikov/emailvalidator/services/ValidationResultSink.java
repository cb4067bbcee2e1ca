package com.mikov.emailvalidator.services;

import com.mikov.emailvalidator.model.BatchValidationResponse;
import com.mikov.emailvalidator.model.EmailValidationResponse;

/**
 * Receives finished validations for storage. Callers never wait on it.
 *
 * @author zahari.mikov
 */
public interface ValidationResultSink {

    void store(final EmailValidationResponse response);

    void storeBatch(final BatchValidationResponse response);
}
