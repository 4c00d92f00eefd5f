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


/**
 * Append was rejected, because the stream version differs from the version the caller based its decision on.
 * Nothing was appended.
 */
public class ConcurrencyConflictException extends EventStoreException {
    /**
     * Actual version could not be determined, e. g. when the conflict was detected by a constraint violation.
     */
    public static final long UNKNOWN_VERSION = -2;

    private final String streamId;
    private final long expectedVersion;
    private final long actualVersion;

    ConcurrencyConflictException(String streamId, long expectedVersion, long actualVersion, Throwable cause) {
        super(Fault.CONCURRENCY_CONFLICT, "Stream " + streamId + " expected at version " + expectedVersion
                + " but was at " + (actualVersion == UNKNOWN_VERSION ? "unknown version" : actualVersion), cause);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public static ConcurrencyConflictException detectedBy(String streamId, long expectedVersion, long actualVersion,
            Throwable cause) {
        return new ConcurrencyConflictException(streamId, expectedVersion, actualVersion, cause);
    }

    public String getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
