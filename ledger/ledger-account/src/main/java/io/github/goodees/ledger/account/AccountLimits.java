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


import org.immutables.value.Value;

import java.math.BigDecimal;

/**
 * Input limits enforced by {@link AccountRequestValidator}.
 */
@Value.Immutable
public interface AccountLimits {

    @Value.Default
    default int getMinHolderNameLength() {
        return 2;
    }

    @Value.Default
    default int getMaxHolderNameLength() {
        return 100;
    }

    @Value.Default
    default BigDecimal getMaxInitialDeposit() {
        return new BigDecimal("1000000");
    }

    @Value.Default
    default BigDecimal getMaxDeposit() {
        return new BigDecimal("100000");
    }

    @Value.Default
    default BigDecimal getMaxWithdrawal() {
        return new BigDecimal("50000");
    }

    @Value.Default
    default int getMaxDescriptionLength() {
        return 500;
    }

    static AccountLimits defaults() {
        return builder().build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableAccountLimits.Builder {

    }
}
