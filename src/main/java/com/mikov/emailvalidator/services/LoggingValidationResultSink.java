package com.mikov.emailvalidator.services;

import com.mikov.emailvalidator.model.BatchValidationResponse;
import com.mikov.emailvalidator.model.EmailValidationResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sink that only logs a one-line summary of every finished validation.
 */
@Slf4j
@Component
public class LoggingValidationResultSink implements ValidationResultSink {

    @Override
    public void store(final EmailValidationResponse response) {
        log.info("Validation {}: {} valid={} score={} risk={}", response.getId(), response.getEmail(),
                response.isValid(), response.getScore(), response.getRiskLevel());
    }

    @Override
    public void storeBatch(final BatchValidationResponse response) {
        final var summary = response.getSummary();
        log.info("Batch {}: total={} valid={} invalid={}", response.getBatchId(), summary.total(),
                summary.valid(), summary.invalid());
    }
}
