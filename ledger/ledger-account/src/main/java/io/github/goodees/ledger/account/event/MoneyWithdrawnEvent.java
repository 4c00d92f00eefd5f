package io.github.goodees.ledger.account.event;

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
import org.immutables.value.Value;

import java.math.BigDecimal;
import java.util.Optional;

import static io.github.goodees.ledger.immutables.ImmutableEvent.builderFor;

@Value.Immutable
public interface MoneyWithdrawnEvent extends AccountEvent {
    BigDecimal getAmount();

    Optional<String> getDescription();

    static Builder builder(Aggregate source) {
        return builderFor(source, new Builder()::from);
    }

    class Builder extends ImmutableMoneyWithdrawnEvent.Builder {

    }
}
