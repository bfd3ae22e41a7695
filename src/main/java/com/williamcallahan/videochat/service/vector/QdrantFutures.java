package com.williamcallahan.videochat.service.vector;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Time-bounded handling of the Guava futures returned by the Qdrant gRPC client.
 */
final class QdrantFutures {

    private QdrantFutures() {}

    /**
     * Blocks for a Qdrant call, unwrapping its failure.
     *
     * @throws IllegalStateException on failure, interruption or timeout; the message names the operation
     */
    static <T> T await(ListenableFuture<T> future, long timeoutSeconds, String operation) {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Qdrant " + operation + " interrupted", interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
            throw new IllegalStateException("Qdrant " + operation + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            throw new IllegalStateException(
                    "Qdrant " + operation + " timed out after " + timeoutSeconds + "s", timeoutException);
        }
    }

    /**
     * Adapts a Qdrant call for composition with the lexical search. The gRPC call is cancelled if the
     * adapted future times out or is cancelled first.
     */
    static <T> CompletableFuture<T> toCompletable(ListenableFuture<T> future, long timeoutSeconds) {
        CompletableFuture<T> adapted = new CompletableFuture<>();
        Futures.addCallback(future, new FutureCallback<>() {
            @Override
            public void onSuccess(T result) {
                adapted.complete(result);
            }

            @Override
            public void onFailure(Throwable failure) {
                adapted.completeExceptionally(failure);
            }
        }, MoreExecutors.directExecutor());
        adapted.whenComplete((result, failure) -> {
            if (failure != null && !future.isDone()) {
                future.cancel(true);
            }
        });
        return adapted.orTimeout(timeoutSeconds, TimeUnit.SECONDS);
    }
}
