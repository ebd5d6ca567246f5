package com.mirrorswarm.mirror.console;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds at most one pending operator confirmation. The answer is the next
 * console message; the pending future fails with a
 * {@link java.util.concurrent.TimeoutException} when none arrives in time.
 * Nothing blocks while waiting.
 */
public class ConfirmationGate {

    private final AtomicReference<CompletableFuture<String>> pending = new AtomicReference<>();

    /**
     * Start waiting for an answer.
     *
     * @throws IllegalStateException when a confirmation is already pending
     */
    public CompletableFuture<String> open(Duration timeout) {
        CompletableFuture<String> answer = new CompletableFuture<>();
        if (!pending.compareAndSet(null, answer)) {
            throw new IllegalStateException("A confirmation is already pending");
        }
        answer.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        // dependents of the returned stage see the gate already closed
        return answer.whenComplete((value, error) -> pending.compareAndSet(answer, null));
    }

    public boolean isPending() {
        return pending.get() != null;
    }

    /**
     * Deliver a console message to the pending confirmation.
     *
     * @return true when the message was consumed as the answer
     */
    public boolean offer(String answer) {
        CompletableFuture<String> current = pending.getAndSet(null);
        if (current == null) {
            return false;
        }
        return current.complete(answer);
    }
}
