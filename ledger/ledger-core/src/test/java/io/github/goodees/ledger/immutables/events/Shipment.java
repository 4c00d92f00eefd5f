package io.github.goodees.ledger.immutables.events;

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


import io.github.goodees.ledger.core.Aggregate;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.matching.EventHandlers;

import java.time.Clock;

public class Shipment extends Aggregate {
    private String city;
    private String trackingNumber;

    private final EventHandlers handlers = EventHandlers.builder()
            .on(AddressChangedEvent.class, e -> city = e.getCity())
            .on(ParcelDispatchedEvent.class, e -> trackingNumber = e.getTrackingNumber())
            .build();

    public Shipment(String identity, Clock clock) {
        super(identity, clock);
    }

    public void changeAddress(String street, String city, String country) {
        emit(AddressChangedEvent.builder(this).street(street).city(city).country(country).build());
    }

    public void dispatch(String carrier, String trackingNumber) {
        emit(ParcelDispatchedEvent.builder(this).carrier(carrier).trackingNumber(trackingNumber).build());
    }

    public String getCity() {
        return city;
    }

    public String getTrackingNumber() {
        return trackingNumber;
    }

    @Override
    protected void applyEvent(Event event) {
        handlers.apply(event);
    }
}
