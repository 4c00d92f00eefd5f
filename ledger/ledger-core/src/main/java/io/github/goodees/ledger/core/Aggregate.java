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


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single event sourced aggregate. The aggregate is a consistency boundary identified by unique String id, which is
 * also the id of the stream holding its events.
 *
 * <p>An aggregate preserves its internal state. This state can <strong>only</strong> change as result of application
 * of an event in method {@link #applyEvent(Event)}. Past events are applied via {@link #loadFromHistory(Iterable)},
 * new ones by behavior methods of subclasses via {@link #emit(Event)}.</p>
 *
 * <p>Behavior methods validate first and emit afterwards. When validation fails they throw and neither the state nor
 * the pending events change. Emitted events are kept in a pending buffer until the caller drains it with
 * {@link #takePendingEvents()} and appends the events to the store, passing {@link #getLoadedStreamVersion()} as the
 * expected version.</p>
 *
 * <p>Instances are not thread safe. Every read-modify-append cycle works with its own instance.</p>
 */
public abstract class Aggregate {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final String identity;
    private final Clock clock;
    private long version;
    private final List<Event> pendingEvents = new ArrayList<>();

    protected Aggregate(String identity) {
        this(identity, Clock.systemUTC());
    }

    /**
     * Constructor for subclasses.
     * @param identity the identity of the aggregate, and the id of its stream
     * @param clock clock used for timestamps of emitted events
     */
    protected Aggregate(String identity, Clock clock) {
        this.identity = Objects.requireNonNull(identity, "Aggregate identity cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Return aggregate's identity.
     * @return aggregate's identity
     */
    public final String getIdentity() {
        return identity;
    }

    public final Clock getClock() {
        return clock;
    }

    /**
     * Number of historical events folded into this instance.
     * @return version after replay, 0 for a fresh instance
     */
    public final long getVersion() {
        return version;
    }

    /**
     * Version of the stream as observed when history was loaded. This is the value to pass as expected version when
     * appending pending events.
     * @return {@code getVersion() - 1}, therefore -1 for an aggregate without history
     */
    public final long getLoadedStreamVersion() {
        return version - 1;
    }

    /**
     * Version including pending events, i. e. the version the aggregate will have once pending events are appended.
     * @return version of current state
     */
    public final long getStateVersion() {
        return version + pendingEvents.size();
    }

    /**
     * Fold past events into the state of this instance.
     * @param history events in ascending sequence order
     * @throws IllegalStateException when there are pending events, i. e. the history would be applied after them
     */
    public final void loadFromHistory(Iterable<? extends Event> history) {
        if (!pendingEvents.isEmpty()) {
            throw new IllegalStateException("Aggregate " + identity + " has " + pendingEvents.size()
                    + " pending events and cannot load history");
        }
        for (Event event : history) {
            applyEvent(event);
            version++;
        }
        logger.trace("Aggregate {} loaded at version {}", identity, version);
    }

    /**
     * Update the state as result of application of an event. This method must be very robust - it may not throw
     * an exception or break state invariants under any input. Failing to do so will make the aggregate irrecoverable.
     * Events the aggregate doesn't know are ignored.
     *
     * @param event event to apply
     */
    protected abstract void applyEvent(Event event);

    /**
     * Apply a new event to the state and buffer it for append. Called by behavior methods after validation passed.
     * @param event the event to emit
     */
    protected final void emit(Event event) {
        if (!identity.equals(event.streamId())) {
            throw new IllegalArgumentException("Event for stream " + event.streamId() + " emitted by aggregate "
                    + identity);
        }
        applyEvent(event);
        pendingEvents.add(event);
    }

    public final boolean hasPendingEvents() {
        return !pendingEvents.isEmpty();
    }

    /**
     * Drain the pending buffer. Second call returns empty list, unless new events were emitted in between.
     * @return the events emitted since load or last call, in emission order
     */
    public final List<Event> takePendingEvents() {
        List<Event> result = Collections.unmodifiableList(new ArrayList<>(pendingEvents));
        pendingEvents.clear();
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{identity=" + identity + ", version=" + version + '}';
    }
}
