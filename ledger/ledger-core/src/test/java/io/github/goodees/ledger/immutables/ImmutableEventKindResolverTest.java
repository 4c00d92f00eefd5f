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


import com.fasterxml.jackson.databind.type.TypeFactory;
import io.github.goodees.ledger.immutables.events.AddressChangedEvent;
import io.github.goodees.ledger.immutables.events.ImmutableAddressChangedEvent;
import io.github.goodees.ledger.immutables.events.ParcelDispatchedEvent;
import io.github.goodees.ledger.immutables.events.ShipmentEvent;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ImmutableEventKindResolverTest {

    private ImmutableEventKindResolver resolver;
    private TypeFactory tf;

    @Before
    public void setUp() {
        resolver = new ImmutableEventKindResolver();
        tf = TypeFactory.defaultInstance();
        resolver.init(tf.constructType(ShipmentEvent.class));
    }

    @Test
    public void kind_generated_for_supported_types() {
        AddressChangedEvent event = new AddressChangedEvent.Builder().id(UUID.randomUUID())
                .streamId("test")
                .occurredAt(Instant.now())
                .street("Hlavná 34")
                .city("Košice")
                .country("Slovakia")
                .build();
        assertEquals("AddressChanged", resolver.idFromValueAndType(event, AddressChangedEvent.class));
    }

    @Test(expected = IllegalArgumentException.class)
    public void kind_generation_fails_on_unsupported_types() {
        resolver.idFromValue(13);
    }

    @Test
    public void class_is_resolved_for_known_kinds() {
        assertTrue(AddressChangedEvent.class.isAssignableFrom(resolver.typeFromId("AddressChanged", tf)
                .getRawClass()));
        assertTrue(ParcelDispatchedEvent.class.isAssignableFrom(resolver.typeFromId("ParcelDispatched", tf)
                .getRawClass()));
    }

    @Test
    public void unknown_kind_is_not_resolved() {
        assertNull(resolver.typeFromId("Teleported", tf));
        assertNull(resolver.typeFromId("", tf));
    }

    @Test
    public void classes_outside_of_aggregate_are_not_resolved() {
        assertEquals(Optional.of(ImmutableAddressChangedEvent.class),
            ImmutableEventKindResolver.eventClass(ShipmentEvent.class, "AddressChanged"));
        assertFalse(ImmutableEventKindResolver.eventClass(ParcelDispatchedEvent.class, "AddressChanged").isPresent());
    }

    @Test
    public void known_kinds_are_described() {
        assertEquals("kinds implemented as io.github.goodees.ledger.immutables.events.Immutable<Kind>Event "
                + "extending ShipmentEvent", resolver.getDescForKnownTypeIds());
    }
}
