package io.github.goodees.ledger.store.jdbc;

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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public class JdbcTestEvent implements Event {
    private final UUID id;
    private final String streamId;
    private final Instant occurredAt;
    private final int payload;

    public JdbcTestEvent(UUID id, String streamId, Instant occurredAt, int payload) {
        this.id = id;
        this.streamId = streamId;
        this.occurredAt = occurredAt;
        this.payload = payload;
    }

    public JdbcTestEvent(String streamId, int payload) {
        this(UUID.randomUUID(), streamId, Instant.parse("2024-03-01T10:00:00Z"), payload);
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

    public int getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        JdbcTestEvent that = (JdbcTestEvent) o;
        return payload == that.payload && id.equals(that.id) && streamId.equals(that.streamId)
                && occurredAt.equals(that.occurredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, streamId);
    }

    @Override
    public String toString() {
        return "JdbcTestEvent{" + streamId + ", payload=" + payload + '}';
    }
}
