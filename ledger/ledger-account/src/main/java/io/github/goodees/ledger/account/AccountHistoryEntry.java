package io.github.goodees.ledger.account;

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


import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.time.Instant;

/**
 * Single event of account history.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAccountHistoryEntry.class)
@JsonDeserialize(as = ImmutableAccountHistoryEntry.class)
public interface AccountHistoryEntry {
    /**
     * Version of the account after this event, starting at 1.
     * @return version
     */
    long getVersion();

    /**
     * Position of the event in the stream, starting at 0.
     * @return sequence
     */
    long getSequence();

    String getKind();

    /**
     * The event as JSON.
     * @return stored payload
     */
    String getData();

    Instant getOccurredAt();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableAccountHistoryEntry.Builder {

    }
}
