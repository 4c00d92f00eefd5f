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


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.store.EventStoreException;
import io.github.goodees.ledger.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON serialization of ImmutableEvents of single aggregate. The payload is a tagged JSON object, where property
 * {@code type} holds the event kind, and unknown properties are ignored on read. Payload of a kind this code does
 * not implement is read as {@code null}.
 *
 * @param <E> the base interface of aggregate's events
 */
public class JsonEventSerialization<E extends ImmutableEvent> implements Serialization<E> {
    private static final Logger logger = LoggerFactory.getLogger(JsonEventSerialization.class);

    public static final int PAYLOAD_VERSION = 1;

    private final ObjectMapper mapper;
    private final Class<E> baseType;
    private final ObjectReader reader;

    public JsonEventSerialization(Class<E> baseType) {
        this(defaultMapper(), baseType);
    }

    public JsonEventSerialization(ObjectMapper mapper, Class<E> baseType) {
        this.mapper = Objects.requireNonNull(mapper);
        this.baseType = Objects.requireNonNull(baseType);
        this.reader = mapper.readerFor(baseType).without(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE);
    }

    /**
     * Mapper with Java 8 and java.time support, writing dates as ISO-8601 strings.
     * @return new mapper
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public int payloadVersion(E object) {
        return PAYLOAD_VERSION;
    }

    @Override
    public String serialize(E object) {
        try {
            return mapper.writerFor(baseType).writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + object, e);
        }
    }

    @Override
    public E deserialize(int payloadVersion, String payload, String kind) {
        if (payloadVersion > PAYLOAD_VERSION) {
            logger.debug("Payload version {} of kind {} is newer than supported", payloadVersion, kind);
            return null;
        }
        try {
            E event = reader.readValue(payload);
            if (event == null) {
                logger.debug("Kind {} has no event class extending {}", kind, baseType.getName());
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot deserialize event of kind " + kind, e);
        }
    }

    @Override
    public E toSerializable(Event event) throws EventStoreException {
        if (baseType.isInstance(event)) {
            return baseType.cast(event);
        }
        throw EventStoreException.unsupported(event);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
