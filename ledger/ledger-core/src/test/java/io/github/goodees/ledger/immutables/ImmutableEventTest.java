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


import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.immutables.events.AddressChangedEvent;
import io.github.goodees.ledger.immutables.events.ParcelDispatchedEvent;
import io.github.goodees.ledger.immutables.events.Shipment;
import io.github.goodees.ledger.immutables.events.ShipmentEvent;
import org.junit.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class ImmutableEventTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ObjectMapper mapper = JsonEventSerialization.defaultMapper();

    @Test
    public void builder_fills_header_from_aggregate() {
        Shipment shipment = new Shipment("shipment-1", clock);
        ParcelDispatchedEvent event = ParcelDispatchedEvent.builder(shipment)
                .carrier("Daddy's Van")
                .trackingNumber("2017/23")
                .build();
        assertEquals("shipment-1", event.streamId());
        assertEquals(NOW, event.getOccurredAt());
        assertNotNull(event.getId());
        assertEquals("ParcelDispatched", event.getKind());
    }

    @Test
    public void emitted_events_are_applied() {
        Shipment shipment = new Shipment("shipment-1", clock);
        shipment.changeAddress("Hlavná 34", "Košice", "Slovakia");
        shipment.dispatch("Daddy's Van", "2017/23");
        assertEquals("Košice", shipment.getCity());
        assertEquals("2017/23", shipment.getTrackingNumber());
        List<Event> pending = shipment.takePendingEvents();
        assertThat(pending.get(0), instanceOf(AddressChangedEvent.class));
        assertThat(pending.get(1), instanceOf(ParcelDispatchedEvent.class));
    }

    @Test
    public void events_serialize_with_kind() throws IOException {
        Shipment shipment = new Shipment("shipment-1", clock);
        AddressChangedEvent event = AddressChangedEvent.builder(shipment).street("street").city("city")
                .country("country").build();
        JsonNode json = mapper.readTree(mapper.writerFor(ShipmentEvent.class).writeValueAsString(event));
        assertEquals("AddressChanged", json.get("type").asText());
        assertEquals("shipment-1", json.get("streamId").asText());
        assertEquals("2024-03-01T10:00:00Z", json.get("occurredAt").asText());
        assertFalse(json.has("state"));
        assertFalse(json.has("kind"));
    }

    @Test
    public void events_deserialize_from_json() throws IOException {
        String json = "{\n"
                + "  \"type\" : \"AddressChanged\",\n"
                + "  \"id\" : \"0b3a7f8e-3d55-4a58-9d61-0c8b4d6c8a11\",\n"
                + "  \"streamId\" : \"shipment-1\",\n"
                + "  \"occurredAt\" : \"2017-11-13T20:18:40.439Z\",\n"
                + "  \"street\" : \"street\",\n"
                + "  \"city\" : \"city\",\n"
                + "  \"country\" : \"country\",\n"
                + "  \"addedInFutureVersion\" : true\n"
                + "}";
        ShipmentEvent event = mapper.readValue(json, ShipmentEvent.class);
        assertTrue(event instanceof AddressChangedEvent);
        assertFalse(((AddressChangedEvent) event).getState().isPresent());
        assertEquals(Instant.parse("2017-11-13T20:18:40.439Z"), event.getOccurredAt());
    }
}
