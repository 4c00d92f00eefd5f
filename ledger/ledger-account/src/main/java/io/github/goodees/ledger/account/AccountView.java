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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * State of an account as returned by queries.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAccountView.class)
@JsonDeserialize(as = ImmutableAccountView.class)
public interface AccountView {
    String getAccountId();

    String getHolderName();

    String getEmail();

    BigDecimal getBalance();

    boolean isClosed();

    Instant getOpenedAt();

    Optional<Instant> getClosedAt();

    /**
     * Number of events the state was folded from.
     * @return version of the account
     */
    long getVersion();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableAccountView.Builder {

    }
}
