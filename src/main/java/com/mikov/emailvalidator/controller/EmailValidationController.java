package com.mikov.emailvalidator.controller;

import com.mikov.emailvalidator.dns.CacheStatistics;
import com.mikov.emailvalidator.dns.DnsResultCache;
import com.mikov.emailvalidator.exception.EmptyBatchException;
import com.mikov.emailvalidator.model.BatchValidationRequest;
import com.mikov.emailvalidator.model.EmailValidationRequest;
import com.mikov.emailvalidator.model.ValidationOptions;
import com.mikov.emailvalidator.model.ValidationOptionsRequest;
import com.mikov.emailvalidator.services.ValidationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * REST controller for email validation
 *
 * @author zahari.mikov
 */
@RestController
@RequestMapping("/api/v1")
public class EmailValidationController {

    private static final Logger logger = LoggerFactory.getLogger(EmailValidationController.class);
    private static final long RESPONSE_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(300);

    private final ValidationOrchestrator orchestrator;
    private final DnsResultCache dnsResultCache;

    @Autowired
    public EmailValidationController(final ValidationOrchestrator orchestrator, final DnsResultCache dnsResultCache) {
        this.orchestrator = orchestrator;
        this.dnsResultCache = dnsResultCache;
    }

    @PostMapping("/validate/email")
    public DeferredResult<ResponseEntity<?>> validateEmail(@RequestBody final EmailValidationRequest request) {
        final var deferredResult = new DeferredResult<ResponseEntity<?>>(RESPONSE_TIMEOUT_MS);
        final var options = toOptions(request.getOptions());

        orchestrator.validateEmail(request.getEmail(), options)
                .whenComplete((response, ex) -> {
                    if (ex != null) {
                        deferredResult.setErrorResult(unwrap(ex));
                    } else {
                        deferredResult.setResult(ResponseEntity.ok(response));
                    }
                });
        return deferredResult;
    }

    @PostMapping("/validate/batch")
    public DeferredResult<ResponseEntity<?>> validateBatch(@RequestBody final BatchValidationRequest request) {
        if (request.getEmails() == null || request.getEmails().isEmpty()) {
            throw new EmptyBatchException();
        }

        final var deferredResult = new DeferredResult<ResponseEntity<?>>(RESPONSE_TIMEOUT_MS);
        final var options = toOptions(request.getOptions());
        logger.info("Received batch of {} emails", request.getEmails().size());

        orchestrator.validateBatch(request.getEmails(), options)
                .whenComplete((response, ex) -> {
                    if (ex != null) {
                        deferredResult.setErrorResult(unwrap(ex));
                    } else {
                        deferredResult.setResult(ResponseEntity.ok(response));
                    }
                });
        return deferredResult;
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatistics> cacheStatistics() {
        return ResponseEntity.ok(dnsResultCache.getStatistics());
    }

    private static ValidationOptions toOptions(final ValidationOptionsRequest request) {
        return request != null ? request.toOptions() : ValidationOptions.defaults();
    }

    private static Throwable unwrap(final Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }
}
