package io.github.goodees.ledger.core.store;

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


import io.github.goodees.ledger.core.AsyncResult;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.StoredEvent;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Asynchronous view of an {@link EventStore}. Every operation runs in the executor and its result completes with
 * the exception thrown by the underlying store. Operation cancelled before the executor started it never reaches
 * the store. Once started, it runs to completion, and since stores append all-or-nothing, no partial write is
 * possible.
 */
public class AsyncEventStore {
    private final EventStore delegate;
    private final Executor executor;

    public AsyncEventStore(EventStore delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "Event store must be provided");
        this.executor = Objects.requireNonNull(executor, "Executor must be provided");
    }

    public AsyncResult<Void> append(String streamId, List<? extends Event> events, long expectedVersion) {
        return AsyncResult.invokeAsync(() -> {
            delegate.append(streamId, events, expectedVersion);
            return null;
        }, executor);
    }

    public AsyncResult<List<StoredEvent>> readStream(String streamId) {
        return AsyncResult.invokeAsync(() -> delegate.readStream(streamId), executor);
    }

    public AsyncResult<List<Event>> read(String streamId) {
        return AsyncResult.invokeAsync(() -> delegate.read(streamId), executor);
    }

    public AsyncResult<Set<String>> listStreams() {
        return AsyncResult.invokeAsync(delegate::listStreams, executor);
    }

    public AsyncResult<Void> rebuildDerivedViews() {
        return AsyncResult.invokeAsync(() -> {
            delegate.rebuildDerivedViews();
            return null;
        }, executor);
    }

    public EventStore getDelegate() {
        return delegate;
    }
}
