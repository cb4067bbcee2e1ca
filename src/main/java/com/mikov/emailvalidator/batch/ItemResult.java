package com.mikov.emailvalidator.batch;

/**
 * Outcome of one batch item: either a value or the failure cause.
 *
 * @param id    identifier the item was enqueued with
 * @param value processor result, {@code null} on failure
 * @param error failure cause, {@code null} on success
 */
public record ItemResult<R>(String id, R value, Throwable error) {

    public boolean isSuccess() {
        return error == null;
    }

    public static <R> ItemResult<R> success(final String id, final R value) {
        return new ItemResult<>(id, value, null);
    }

    public static <R> ItemResult<R> failure(final String id, final Throwable error) {
        return new ItemResult<>(id, null, error);
    }
}
