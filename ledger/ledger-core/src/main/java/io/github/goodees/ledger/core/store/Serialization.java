package io.github.goodees.ledger.core.store;

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

/**
 * Serialization of events into textual payload of durable stores.
 * @param <T> base type of events this serialization handles
 */
public interface Serialization<T extends Event> {

    /**
     * Version of the payload format for given event. Stored alongside the payload.
     * @param object event to serialize
     * @return payload version
     */
    int payloadVersion(T object);

    String serialize(T object);

    /**
     * Deserialize a payload.
     * @param payloadVersion version of payload format as stored
     * @param payload the payload
     * @param kind the kind of the event as stored
     * @return deserialized event, or null when the kind or payload version is unknown to this serialization
     */
    T deserialize(int payloadVersion, String payload, String kind);

    /**
     * Cast the event into type supported by this serialization.
     * @param event event to store
     * @return the same event
     * @throws EventStoreException when the event is not supported
     */
    T toSerializable(Event event) throws EventStoreException;
}
