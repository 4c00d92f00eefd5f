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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reconstruction of aggregates from their history. Live state and state at a point in time share the same fold,
 * so that state as of an instant at or after the last event equals the live state.
 */
public class AggregateReplay {
    private AggregateReplay() {

    }

    /**
     * Reconstruct the current state of an aggregate.
     * @param streamId identity of the aggregate
     * @param history all events of the stream in ascending sequence order
     * @param factory creates fresh instance for given identity
     * @param <A> type of aggregate
     * @return aggregate with whole history folded
     * @throws AggregateNotFoundException when history is empty
     */
    public static <A extends Aggregate> A replay(String streamId, List<? extends Event> history,
            Function<String, A> factory) {
        if (history.isEmpty()) {
            throw new AggregateNotFoundException(streamId);
        }
        return fold(streamId, history, factory);
    }

    /**
     * Reconstruct the state of an aggregate at given instant. Only the leading events that occurred at or before
     * the cutoff are folded.
     * @param streamId identity of the aggregate
     * @param history all events of the stream in ascending sequence order
     * @param cutoff the instant, inclusive
     * @param factory creates fresh instance for given identity
     * @param <A> type of aggregate
     * @return aggregate as it was at the cutoff
     * @throws AggregateNotFoundException when no event occurred at or before the cutoff
     */
    public static <A extends Aggregate> A asOf(String streamId, List<? extends Event> history, Instant cutoff,
            Function<String, A> factory) {
        Objects.requireNonNull(cutoff, "Cutoff instant cannot be null");
        List<Event> prefix = new ArrayList<>();
        for (Event event : history) {
            if (event.getOccurredAt().isAfter(cutoff)) {
                break;
            }
            prefix.add(event);
        }
        if (prefix.isEmpty()) {
            throw new AggregateNotFoundException(streamId, cutoff);
        }
        return fold(streamId, prefix, factory);
    }

    private static <A extends Aggregate> A fold(String streamId, List<? extends Event> events,
            Function<String, A> factory) {
        A aggregate = factory.apply(streamId);
        aggregate.loadFromHistory(events);
        return aggregate;
    }
}
