package io.codegraph.enhance;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Signal for aborting enhancer work that waits on the language server.
 * Once cancelled a token stays cancelled.
 */
public final class CancellationToken {

    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.complete(null);
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    /**
     * Returns a future that mirrors {@code future} but fails with a
     * {@link CancellationException} as soon as this token is cancelled.
     */
    <T> CompletableFuture<T> guard(CompletableFuture<T> future) {
        if (isCancelled()) {
            return CompletableFuture.failedFuture(new CancellationException("Cancelled"));
        }
        CompletableFuture<T> guarded = new CompletableFuture<>();
        future.whenComplete((value, error) -> {
            if (error != null) {
                guarded.completeExceptionally(error);
            } else {
                guarded.complete(value);
            }
        });
        cancelled.thenRun(() -> guarded.completeExceptionally(new CancellationException("Cancelled")));
        return guarded;
    }
}
