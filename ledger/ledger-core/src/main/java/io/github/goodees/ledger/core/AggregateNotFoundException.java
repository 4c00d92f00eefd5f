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
import java.util.Optional;

/**
 * Thrown when an aggregate has no events, or no events up to requested instant.
 */
public class AggregateNotFoundException extends RuntimeException {
    private final String streamId;
    private final Instant asOf;

    public AggregateNotFoundException(String streamId) {
        super("Aggregate " + streamId + " not found");
        this.streamId = streamId;
        this.asOf = null;
    }

    public AggregateNotFoundException(String streamId, Instant asOf) {
        super("Aggregate " + streamId + " did not exist at " + asOf);
        this.streamId = streamId;
        this.asOf = asOf;
    }

    public String getStreamId() {
        return streamId;
    }

    public Optional<Instant> getAsOf() {
        return Optional.ofNullable(asOf);
    }
}
