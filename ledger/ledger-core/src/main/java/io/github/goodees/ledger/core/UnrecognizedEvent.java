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
 * Stored event the running code cannot deserialize, usually because it was written by a newer version of the
 * system. It keeps its place in the stream, so that versions stay contiguous, and aggregates ignore it on replay.
 */
public final class UnrecognizedEvent implements Event {
    private final UUID id;
    private final String streamId;
    private final String kind;
    private final Instant occurredAt;
    private final int payloadVersion;
    private final String payload;

    public UnrecognizedEvent(UUID id, String streamId, String kind, Instant occurredAt, int payloadVersion,
            String payload) {
        this.id = id;
        this.streamId = Objects.requireNonNull(streamId);
        this.kind = kind;
        this.occurredAt = occurredAt;
        this.payloadVersion = payloadVersion;
        this.payload = payload;
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
    public String getKind() {
        return kind;
    }

    public int getPayloadVersion() {
        return payloadVersion;
    }

    public String getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        UnrecognizedEvent that = (UnrecognizedEvent) o;
        return payloadVersion == that.payloadVersion && Objects.equals(id, that.id)
                && streamId.equals(that.streamId) && Objects.equals(kind, that.kind)
                && Objects.equals(occurredAt, that.occurredAt) && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, streamId, kind);
    }

    @Override
    public String toString() {
        return "UnrecognizedEvent{" + "streamId=" + streamId + ", kind=" + kind + ", id=" + id + '}';
    }
}
