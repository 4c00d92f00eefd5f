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
import java.util.UUID;

/**
 * Metadata of an event about to be emitted by an aggregate. Event builders copy these values via their
 * {@code from(Event)} method, so that every emitted event gets a fresh id, the identity of the aggregate and the
 * instant of the aggregate's clock.
 */
public final class EventHeader implements Event {
    private final UUID id;
    private final String streamId;
    private final Instant occurredAt;

    public EventHeader(UUID id, String streamId, Instant occurredAt) {
        this.id = Objects.requireNonNull(id);
        this.streamId = Objects.requireNonNull(streamId);
        this.occurredAt = Objects.requireNonNull(occurredAt);
    }

    public static EventHeader forAggregate(Aggregate aggregate) {
        return new EventHeader(UUID.randomUUID(), aggregate.getIdentity(), aggregate.getClock().instant());
    }

    @Override
    public UUID getId() {
        return id;
    }

    @Override
    public String streamId() {
        return streamId;
    }

    @Override
    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return "EventHeader{" + "id=" + id + ", streamId=" + streamId + ", occurredAt=" + occurredAt + '}';
    }
}
