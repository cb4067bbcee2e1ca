package com.mikov.emailvalidator.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class BatchItemTest {

    @Test
    @DisplayName("An item can be resolved only once")
    void secondResolutionIsRejected() {
        final var item = new BatchItem<String, String>("a-0", "a", CompletableFuture::completedFuture);

        item.succeed("first");

        assertTrue(item.isResolved());
        assertThrows(IllegalStateException.class, () -> item.succeed("second"));
        assertThrows(IllegalStateException.class, () -> item.fail(new RuntimeException("late")));
        assertEquals("first", item.completion().join());
    }

    @Test
    void completingTheViewDoesNotResolveTheItem() {
        final var item = new BatchItem<String, String>("a-0", "a", CompletableFuture::completedFuture);

        item.completion().complete("forged");

        assertFalse(item.isResolved());
        assertFalse(item.completion().isDone());
    }

    @Test
    void requiresIdAndProcessor() {
        assertThrows(IllegalArgumentException.class, () -> new BatchItem<String, String>(null, "a", CompletableFuture::completedFuture));
        assertThrows(IllegalArgumentException.class, () -> new BatchItem<String, String>("a-0", "a", null));
    }
}
