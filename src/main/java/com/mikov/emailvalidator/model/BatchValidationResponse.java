package com.mikov.emailvalidator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mikov.emailvalidator.batch.StatisticsSnapshot;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Caller-facing shape of a batch validation. Results are in the caller's input order.
 *
 * @author zahari.mikov
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchValidationResponse {

    private final String batchId;
    private final List<EmailValidationResponse> results;
    private final BatchSummary summary;
    private final StatisticsSnapshot statistics;
    private final String createdAt;
}
