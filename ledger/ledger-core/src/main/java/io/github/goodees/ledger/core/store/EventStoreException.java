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
 * Exception generated when storing or reading of events fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * The stream moved on since the caller read it. Reload and retry.
         */
        CONCURRENCY_CONFLICT,
        /**
         * Underlying storage failed. Cause is attached.
         */
        STORAGE_FAILURE,
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isRetryable() {
        return fault == Fault.CONCURRENCY_CONFLICT;
    }

    public static ConcurrencyConflictException concurrencyConflict(String streamId, long expectedVersion,
            long actualVersion) {
        return new ConcurrencyConflictException(streamId, expectedVersion, actualVersion, null);
    }

    public static EventStoreException storeFailed(String streamId, Throwable cause) {
        return new EventStoreException(Fault.STORAGE_FAILURE,
            "Store of stream " + streamId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(String streamId, Throwable cause) {
        return new EventStoreException(Fault.STORAGE_FAILURE,
            "Read of stream " + streamId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException multipleStreams(String expected, Event violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Stored events span multiple streams: " + expected
                + " and " + violating.streamId(), null);
    }

    public static EventStoreException unsupported(Event event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + event, null);
    }

    public static EventStoreException unserializable(String streamId, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR,
            "Events of stream " + streamId + " cannot be serialized. " + cause.getMessage(), cause);
    }

    public static EventStoreException undecodable(String streamId, long sequence, String kind) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event " + sequence + " of stream " + streamId
                + " has unknown kind " + kind, null);
    }
}
