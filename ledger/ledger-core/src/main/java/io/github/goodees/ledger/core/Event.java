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
import java.util.UUID;

/**
 * Immutable fact about the business domain that became true.
 *
 * <p>Every aggregate class defines its own set of events. Events are created exactly once, inside a behavior method of
 * an {@link Aggregate}, and become durable when an {@link io.github.goodees.ledger.core.store.EventStore} accepts them.
 * They are never changed or deleted afterwards.</p>
 *
 * <p>The serialization format is not prescribed, but events may define annotations to support specific
 * serialization kinds, e. g. Jackson annotations. The actual serialization is the task of the EventStore
 * implementation in use.</p>
 *
 * <p>The methods provided in this interface define metadata that will be stored outside the journaled payload to enable
 * querying and deserialization. The payload itself are the fields of the implementing class.</p>
 *
 * Support for events based on <a href="http://immutables.github.io">Immutables</a> is in package
 * {@link io.github.goodees.ledger.immutables}.
 */
public interface Event {

    /**
     * Unique id of this event.
     * @return the event id
     */
    UUID getId();

    /**
     * The id of the stream this event belongs to. It is the identity of the aggregate that produced it.
     * @return the stream id
     * @see Aggregate#getIdentity()
     */
    String streamId();

    /**
     * The time when the event occurred. Point in time reconstruction compares against this instant.
     * @return the instant of event creation
     */
    Instant getOccurredAt();

    /**
     * The kind of the event. For every aggregate class this must uniquely identify the event to be created. If in
     * future an event is removed, the store must be able to translate it to an equivalent event in new model.
     * @return textual description of the kind of event, uses class name by default, stripped from suffix Event
     */
    default String getKind() {
        return EventKind.defaultKindName(getClass());
    }
}
