package io.github.goodees.ledger.core;

/*-
 * #%L
 * ledger
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */


import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Helper class for constructing asynchronous responses. Results of the asynchronous event store and of services
 * built on top of it are AsyncResults, and they always complete with the original exception rather than a
 * {@link CompletionException}.
 *
 * @param <T> the type of result
 */
public class AsyncResult<T> extends CompletableFuture<T> {
    private AsyncResult() {
        super();
    }

    private AsyncResult(CompletionStage<T> parent) {
        super();
        subscribe(parent);
    }

    private void subscribe(CompletionStage<T> parent) {
        parent.whenComplete((r, t) -> {
            if (t == null) {
                complete(r);
            } else {
                completeExceptionally(unwrapCompletionException(t));
            }
        });
    }

    private BiConsumer<T, Throwable> asCallback() {
        return (r, t) -> {
            if (t == null) {
                complete(r);
            } else {
                completeExceptionally(unwrapCompletionException(t));
            }
        };
    }

    @Override
    public AsyncResult<T> whenComplete(BiConsumer<? super T, ? super Throwable> action) {
        return new AsyncResult<>(super.whenComplete(action));
    }

    @Override
    public <U> AsyncResult<U> thenApply(Function<? super T, ? extends U> transformation) {
        return new AsyncResult<>(super.thenApply(transformation));
    }

    @Override
    public <U> AsyncResult<U> thenCompose(Function<? super T, ? extends CompletionStage<U>> fn) {
        return new AsyncResult<>(super.thenCompose(fn));
    }

    /**
     * Wrap a result of callable. The callable is invoked immediately.
     * @param action The action to perform
     * @param <V> type of result
     * @return Async result wrapping the return value or exception thrown from a callable
     */
    public static <V> AsyncResult<V> invoke(Callable<V> action) {
        AsyncResult<V> result = new AsyncResult<>();
        try {
            result.complete(action.call());
        } catch (Exception e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Wrap a result of callable executed by an executor. When the result is cancelled before the executor gets to
     * it, the callable is not invoked at all.
     * @param action The action to perform
     * @param executor executor to run the action in
     * @param <V> type of result
     * @return Async result wrapping the return value or exception thrown from a callable
     */
    public static <V> AsyncResult<V> invokeAsync(Callable<V> action, Executor executor) {
        AsyncResult<V> result = new AsyncResult<>();
        try {
            executor.execute(() -> {
                if (result.isDone()) {
                    return;
                }
                try {
                    result.complete(action.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Wrap a value.
     * @param result value to wrap
     * @param <V> type of result
     * @return an AsyncResult that completed successfully with the result.
     */
    public static <V> AsyncResult<V> returning(V result) {
        AsyncResult<V> r = new AsyncResult<>();
        r.complete(result);
        return r;
    }

    /**
     * Wrap an exception
     * @param t Throwable to wrap.
     * @param <V> The original return type of the throwable.
     * @return an AsyncResult that completed exceptionally with given throwable.
     */
    public static <V> AsyncResult<V> throwing(Throwable t) {
        AsyncResult<V> r = new AsyncResult<>();
        r.completeExceptionally(t);
        return r;
    }

    /**
     * Create an AsyncResult bound to other object. For example to bind to a CompletionStage you may use:
     * {@code asyncResult = AsyncResult.bindTo(completionStage::whenComplete);}
     * @param callbackConsumer the method accepting a callback for result and throwable
     * @param <V> type of result
     * @return new AsyncResult that completes when its callback is called
     */
    public static <V> AsyncResult<V> bindTo(Consumer<BiConsumer<V, Throwable>> callbackConsumer) {
        AsyncResult<V> r = new AsyncResult<>();
        callbackConsumer.accept(r.asCallback());
        return r;
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }
}
