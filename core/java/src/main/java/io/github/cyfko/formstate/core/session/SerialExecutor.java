package io.github.cyfko.formstate.core.session;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs tasks one at a time, in submission order, on an underlying executor.
 * <p>
 * Each task is chained behind the previous one; a failing task completes its own future
 * exceptionally and does not stop the chain. Tasks may submit further tasks, which run after the
 * current one.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SerialExecutor {

    private final Executor executor;
    private final AtomicReference<CompletableFuture<Void>> tail =
            new AtomicReference<>(CompletableFuture.completedFuture(null));

    public SerialExecutor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Queues a task.
     *
     * @param task the task
     * @return completes with the task's result once it ran
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        CompletableFuture<T> out = new CompletableFuture<>();
        CompletableFuture<Void> next = new CompletableFuture<>();
        CompletableFuture<Void> previous = tail.getAndSet(next);
        previous.whenCompleteAsync((ignored, error) -> {
            try {
                out.complete(task.call());
            } catch (Throwable t) {
                out.completeExceptionally(t);
            } finally {
                next.complete(null);
            }
        }, executor);
        return out;
    }
}
