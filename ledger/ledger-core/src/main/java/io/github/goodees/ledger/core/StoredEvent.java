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

import java.time.Instant;
import java.util.Objects;

/**
 * An event as recorded by the event store. The sequence is the zero-based position of the event within its stream,
 * assigned at append time and never reassigned.
 */
public final class StoredEvent {
    private final Event event;
    private final long sequence;
    private final Instant storedAt;

    public StoredEvent(Event event, long sequence, Instant storedAt) {
        this.event = Objects.requireNonNull(event, "Event cannot be null");
        if (sequence < 0) {
            throw new IllegalArgumentException("Sequence cannot be negative, was " + sequence);
        }
        this.sequence = sequence;
        this.storedAt = Objects.requireNonNull(storedAt, "Stored at cannot be null");
    }

    public Event getEvent() {
        return event;
    }

    public String streamId() {
        return event.streamId();
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getStoredAt() {
        return storedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        StoredEvent that = (StoredEvent) o;

        if (sequence != that.sequence)
            return false;
        if (!event.equals(that.event))
            return false;
        return storedAt.equals(that.storedAt);
    }

    @Override
    public int hashCode() {
        int result = event.hashCode();
        result = 31 * result + Long.hashCode(sequence);
        return result;
    }

    @Override
    public String toString() {
        return "StoredEvent{" + "sequence=" + sequence + ", storedAt=" + storedAt + ", event=" + event + '}';
    }
}
