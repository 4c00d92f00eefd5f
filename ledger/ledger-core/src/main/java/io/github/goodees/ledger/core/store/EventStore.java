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


import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.StoredEvent;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Append-only storage of event streams.
 *
 * <p>Every stream is an ordered sequence of events of a single aggregate, and its version is the sequence of its last
 * event, i. e. {@code count - 1}. Stream that doesn't exist has version {@link #NO_STREAM}.</p>
 * <p>Appends are guarded by optimistic concurrency: the caller states which version it based its decision on, and the
 * store accepts the events only if the stream is still at that version. Appending is atomic per stream, either all
 * events are stored with contiguous sequences, or none. Appends to different streams never contend.</p>
 */
public interface EventStore {
    long NO_STREAM = -1;

    /**
     * Append events at the end of the stream.
     * @param streamId the stream to append to
     * @param events events to append, all of them must belong to the stream. Empty list only checks the version
     * @param expectedVersion version of the stream the caller observed, {@link #NO_STREAM} if it must not exist yet
     * @throws ConcurrencyConflictException when the stream is at different version
     * @throws EventStoreException when storing fails, or events belong to other stream
     */
    void append(String streamId, List<? extends Event> events, long expectedVersion) throws EventStoreException;

    /**
     * Read all records of a stream.
     * @param streamId the stream to read
     * @return records in ascending sequence order, empty for unknown stream
     * @throws EventStoreException when reading fails
     */
    List<StoredEvent> readStream(String streamId) throws EventStoreException;

    /**
     * Read all events of a stream.
     * @param streamId the stream to read
     * @return events in ascending sequence order, empty for unknown stream
     * @throws EventStoreException when reading fails
     */
    default List<Event> read(String streamId) throws EventStoreException {
        return readStream(streamId).stream().map(StoredEvent::getEvent).collect(Collectors.toList());
    }

    default long currentVersion(String streamId) throws EventStoreException {
        return readStream(streamId).size() - 1;
    }

    /**
     * Ids of all streams with at least one event.
     * @return set of stream ids
     * @throws EventStoreException when reading fails
     */
    Set<String> listStreams() throws EventStoreException;

    /**
     * Hook for stores maintaining derived views of the streams. Does nothing by default.
     * @throws EventStoreException when rebuilding fails
     */
    default void rebuildDerivedViews() throws EventStoreException {
    }
}
