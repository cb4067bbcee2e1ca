package com.mikov.emailvalidator.batch;

import java.util.List;

/**
 * Notified each time a queue starts executing a batch.
 */
@FunctionalInterface
public interface BatchListener {

    BatchListener NO_OP = (batchNumber, itemIds) -> {
    };

    void onBatchStarted(final int batchNumber, final List<String> itemIds);
}
