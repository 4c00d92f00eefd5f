package io.github.goodees.ledger.store.inmemory;

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
import io.github.goodees.ledger.core.store.EventStore;
import io.github.goodees.ledger.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Event store keeping streams in memory. Every stream has its own monitor, so appends to one stream are serialized,
 * while different streams proceed in parallel. A stream is only registered by an append that creates it, so a
 * rejected append never leaves an empty stream behind.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<String, StreamLog> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void append(String streamId, List<? extends Event> events, long expectedVersion)
            throws EventStoreException {
        for (Event event : events) {
            if (!streamId.equals(event.streamId())) {
                throw EventStoreException.multipleStreams(streamId, event);
            }
        }
        if (events.isEmpty()) {
            long actual = currentVersion(streamId);
            if (actual != expectedVersion) {
                throw EventStoreException.concurrencyConflict(streamId, expectedVersion, actual);
            }
            return;
        }
        StreamLog log = expectedVersion == NO_STREAM
                ? storage.computeIfAbsent(streamId, StreamLog::new)
                : storage.get(streamId);
        if (log == null) {
            logger.debug("Stream {} conflict, expected version {}, but it does not exist", streamId, expectedVersion);
            throw EventStoreException.concurrencyConflict(streamId, expectedVersion, NO_STREAM);
        }
        log.append(events, expectedVersion);
    }

    @Override
    public List<StoredEvent> readStream(String streamId) {
        StreamLog log = storage.get(streamId);
        return log == null ? Collections.emptyList() : log.snapshot();
    }

    @Override
    public long currentVersion(String streamId) {
        StreamLog log = storage.get(streamId);
        return log == null ? NO_STREAM : log.version();
    }

    @Override
    public Set<String> listStreams() {
        return new HashSet<>(storage.keySet());
    }

    private class StreamLog {
        private final String streamId;
        private final List<StoredEvent> events = new ArrayList<>();

        StreamLog(String streamId) {
            this.streamId = streamId;
        }

        synchronized void append(List<? extends Event> newEvents, long expectedVersion)
                throws EventStoreException {
            long actual = events.size() - 1;
            if (actual != expectedVersion) {
                logger.debug("Stream {} conflict, expected version {}, actual {}", streamId, expectedVersion, actual);
                throw EventStoreException.concurrencyConflict(streamId, expectedVersion, actual);
            }
            long sequence = events.size();
            for (Event event : newEvents) {
                events.add(new StoredEvent(event, sequence++, clock.instant()));
            }
            logger.trace("Stream {} now at version {}", streamId, events.size() - 1);
        }

        synchronized List<StoredEvent> snapshot() {
            return Collections.unmodifiableList(new ArrayList<>(events));
        }

        synchronized long version() {
            return events.size() - 1;
        }
    }
}
