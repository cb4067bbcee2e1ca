package com.mikov.emailvalidator.services;

import com.mikov.emailvalidator.batch.BatchItem;
import com.mikov.emailvalidator.batch.BatchQueue;
import com.mikov.emailvalidator.batch.ItemResult;
import com.mikov.emailvalidator.batch.PriorityBatchScheduler;
import com.mikov.emailvalidator.batch.ProcessingTimeoutException;
import com.mikov.emailvalidator.batch.StatisticsSnapshot;
import com.mikov.emailvalidator.config.ValidatorProperties;
import com.mikov.emailvalidator.exception.BatchTooLargeException;
import com.mikov.emailvalidator.model.BatchSummary;
import com.mikov.emailvalidator.model.BatchValidationResponse;
import com.mikov.emailvalidator.model.EmailValidationResponse;
import com.mikov.emailvalidator.model.ValidationCode;
import com.mikov.emailvalidator.model.ValidationOptions;
import com.mikov.emailvalidator.model.ValidationResult;
import com.mikov.emailvalidator.validation.EmailValidator;
import com.mikov.emailvalidator.validation.RiskScoreCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for single and batch validations.
 * <p>
 * Batches are split by domain and each domain group runs on a queue of its own, so the
 * first item of a group warms the DNS cache for the rest of it. Results come back in the
 * caller's input order, one per input, whatever happened to the individual items.
 *
 * @author zahari.mikov
 */
@Service
public class ValidationOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ValidationOrchestrator.class);

    private final EmailValidator emailValidator;
    private final PriorityBatchScheduler batchScheduler;
    private final RiskScoreCalculator scoreCalculator;
    private final ValidationResultSink resultSink;
    private final Executor sinkExecutor;
    private final Clock clock;
    private final int maxBatchSize;

    public ValidationOrchestrator(final EmailValidator emailValidator,
                                  final PriorityBatchScheduler batchScheduler,
                                  final RiskScoreCalculator scoreCalculator,
                                  final ValidationResultSink resultSink,
                                  @Qualifier("resultSinkExecutor") final Executor sinkExecutor,
                                  final Clock clock,
                                  final ValidatorProperties properties) {
        this.emailValidator = emailValidator;
        this.batchScheduler = batchScheduler;
        this.scoreCalculator = scoreCalculator;
        this.resultSink = resultSink;
        this.sinkExecutor = sinkExecutor;
        this.clock = clock;
        this.maxBatchSize = properties.getBatch().getMaxEmails();
    }

    public CompletableFuture<EmailValidationResponse> validateEmail(final String email, final ValidationOptions options) {
        final var effectiveOptions = options != null ? options : ValidationOptions.defaults();
        logger.debug("Validating {} (dns={})", email, effectiveOptions.isCheckDns());

        return validateOne(email, effectiveOptions)
                .thenApply(result -> {
                    final var response = toResponse(result, UUID.randomUUID().toString());
                    publish(() -> resultSink.store(response));
                    return response;
                });
    }

    /**
     * Validates every email in the list. Item failures, timeouts included, become invalid
     * results in their own slot; the returned future fails only for an invalid request.
     *
     * @throws BatchTooLargeException if the list exceeds the configured maximum
     */
    public CompletableFuture<BatchValidationResponse> validateBatch(final List<String> emails,
                                                                    final ValidationOptions options) {
        final var effectiveOptions = options != null ? options : ValidationOptions.defaults();
        final var batchId = UUID.randomUUID().toString();
        if (emails == null || emails.isEmpty()) {
            return CompletableFuture.completedFuture(buildBatchResponse(batchId, List.of(), StatisticsSnapshot.EMPTY));
        }
        if (emails.size() > maxBatchSize) {
            throw new BatchTooLargeException(emails.size(), maxBatchSize);
        }

        final Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (var i = 0; i < emails.size(); i++) {
            groups.computeIfAbsent(domainKey(emails.get(i)), key -> new ArrayList<>()).add(i);
        }
        logger.info("Batch {}: {} emails across {} domains", batchId, emails.size(), groups.size());

        final var itemTimeout = effectiveOptions.getBatchTimeoutMs() > 0
                ? Duration.ofMillis(effectiveOptions.getBatchTimeoutMs())
                : null;
        final var results = new ValidationResult[emails.size()];
        final List<BatchQueue<String, ValidationResult>> queues = new ArrayList<>();
        final List<CompletableFuture<Void>> groupFutures = new ArrayList<>();

        for (final var group : groups.entrySet()) {
            final var domain = group.getKey();
            final BatchQueue<String, ValidationResult> queue = batchScheduler.newQueue(itemTimeout,
                    (batchNumber, itemIds) -> logger.debug("Batch {} domain '{}': batch {} started with {} items",
                            batchId, domain, batchNumber, itemIds.size()));
            queues.add(queue);

            final Map<String, Integer> indexById = new HashMap<>();
            final List<BatchItem<String, ValidationResult>> items = new ArrayList<>();
            for (final var index : group.getValue()) {
                final var id = domain + "-" + index;
                indexById.put(id, index);
                items.add(new BatchItem<>(id, emails.get(index), email -> validateOne(email, effectiveOptions)));
            }

            final var enqueued = queue.enqueue(items, effectiveOptions.getPriority());
            groupFutures.add(enqueued
                    .thenCombine(queue.whenIdle(), (itemResults, idle) -> itemResults)
                    .thenAccept(itemResults -> {
                        for (final var itemResult : itemResults) {
                            final int index = indexById.get(itemResult.id());
                            results[index] = toResult(emails.get(index), itemResult);
                        }
                    }));
        }

        return CompletableFuture.allOf(groupFutures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    final var statistics = StatisticsSnapshot.merge(queues.stream()
                            .map(BatchQueue::getStatistics)
                            .toList());
                    final var response = buildBatchResponse(batchId, Arrays.asList(results), statistics);
                    logger.info("Batch {} finished: {}", batchId, response.getSummary());
                    publish(() -> resultSink.storeBatch(response));
                    return response;
                });
    }

    private CompletableFuture<ValidationResult> validateOne(final String email, final ValidationOptions options) {
        if (options.isCheckDns()) {
            return emailValidator.validateWithDns(email, options);
        }
        return CompletableFuture.completedFuture(emailValidator.validate(email, options));
    }

    private ValidationResult toResult(final String email, final ItemResult<ValidationResult> itemResult) {
        if (itemResult.isSuccess()) {
            return itemResult.value();
        }
        if (itemResult.error() instanceof ProcessingTimeoutException) {
            logger.warn("Validation of {} timed out", email);
            return ValidationResult.failure(email, ValidationCode.TIMEOUT, ProcessingTimeoutException.MESSAGE);
        }
        logger.error("Validation of {} failed", email, itemResult.error());
        return ValidationResult.systemError(email);
    }

    private EmailValidationResponse toResponse(final ValidationResult result, final String id) {
        final var score = scoreCalculator.calculateScore(result);
        return EmailValidationResponse.from(result)
                .id(id)
                .score(score)
                .riskLevel(scoreCalculator.riskLevel(score))
                .createdAt(now())
                .build();
    }

    private BatchValidationResponse buildBatchResponse(final String batchId, final List<ValidationResult> results,
                                                       final StatisticsSnapshot statistics) {
        final List<EmailValidationResponse> responses = new ArrayList<>(results.size());
        for (var i = 0; i < results.size(); i++) {
            responses.add(toResponse(results.get(i), batchId + "-" + i));
        }
        return BatchValidationResponse.builder()
                .batchId(batchId)
                .results(responses)
                .summary(BatchSummary.of(results))
                .statistics(statistics)
                .createdAt(now())
                .build();
    }

    private void publish(final Runnable task) {
        try {
            CompletableFuture.runAsync(task, sinkExecutor)
                    .exceptionally(ex -> {
                        logger.warn("Result sink failed", ex);
                        return null;
                    });
        } catch (final RejectedExecutionException e) {
            logger.warn("Result sink executor rejected task", e);
        }
    }

    private String now() {
        return OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    /**
     * Text between the first and second {@code @}, or empty when there is none.
     */
    static String domainKey(final String email) {
        if (email == null) {
            return "";
        }
        final var parts = email.split("@", -1);
        return parts.length > 1 ? parts[1] : "";
    }
}
