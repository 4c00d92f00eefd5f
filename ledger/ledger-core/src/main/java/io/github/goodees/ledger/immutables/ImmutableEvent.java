package io.github.goodees.ledger.immutables;

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


import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import io.github.goodees.ledger.core.Aggregate;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.EventHeader;
import io.github.goodees.ledger.core.EventKind;

import java.util.function.Function;

/**
 * Base interface for aggregate events using <a href="http://immutables.github.io">Immutables library</a>.
 * When an aggregate wants to use this approach for event serialization, it shall define its base interface of events,
 * that extends ImmutableEvent.
 * <p><strong>All events for an aggregate need to be defined in same package!</strong>
 * <p>The package they reside in must have annotation {@link ImmutablesSupport} in their {@code package-info.java}
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonTypeIdResolver(ImmutableEventKindResolver.class)
// allow for future changes in an event
@JsonIgnoreProperties(ignoreUnknown = true)
// Put key values at the front
@JsonPropertyOrder({ "id", "streamId", "occurredAt" })
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface ImmutableEvent extends Event {

    @Override
    @JsonIgnore
    // type property is written by resolver, and it requires default naming scheme
    default String getKind() {
        return EventKind.fromClassStripping(getClass(), "Immutable", "Event");
    }

    /**
     * Start building an event of given aggregate. Builder receives new event id, stream id and occurrence time.
     * @param aggregate the aggregate emitting the event
     * @param buildFromEvent usually {@code new Builder()::from}
     * @param <T> type of builder
     * @return builder with header attributes set
     */
    static <T> T builderFor(Aggregate aggregate, Function<Event, T> buildFromEvent) {
        return buildFromEvent.apply(EventHeader.forAggregate(aggregate));
    }

}
