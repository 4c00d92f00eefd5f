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


import io.github.goodees.ledger.core.ValidationException;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validation of incoming requests, performed before any stream is read. Business rules that depend on the state of
 * the account are checked by {@link Account} itself.
 */
public class AccountRequestValidator {
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

    private final AccountLimits limits;

    public AccountRequestValidator(AccountLimits limits) {
        this.limits = Objects.requireNonNull(limits, "Limits must be specified");
    }

    public void validateOpen(String holderName, String email, BigDecimal initialDeposit) {
        if (holderName == null || holderName.trim().isEmpty()) {
            throw new ValidationException("Account holder name is required");
        }
        int nameLength = holderName.trim().length();
        if (nameLength < limits.getMinHolderNameLength() || nameLength > limits.getMaxHolderNameLength()) {
            throw new ValidationException("Account holder name must be between " + limits.getMinHolderNameLength()
                    + " and " + limits.getMaxHolderNameLength() + " characters");
        }
        if (email == null || email.trim().isEmpty()) {
            throw new ValidationException("Email is required");
        }
        if (!EMAIL.matcher(email).matches()) {
            throw new ValidationException("Invalid email format: " + email);
        }
        if (initialDeposit == null || initialDeposit.signum() < 0) {
            throw new ValidationException("Initial deposit cannot be negative");
        }
        if (initialDeposit.compareTo(limits.getMaxInitialDeposit()) > 0) {
            throw new ValidationException("Initial deposit cannot exceed "
                    + limits.getMaxInitialDeposit().toPlainString());
        }
    }

    public void validateDeposit(String accountId, BigDecimal amount, String description) {
        requireAccountId(accountId);
        requireAmount(amount, limits.getMaxDeposit(), "Deposit");
        requireDescription(description);
    }

    public void validateWithdrawal(String accountId, BigDecimal amount, String description) {
        requireAccountId(accountId);
        requireAmount(amount, limits.getMaxWithdrawal(), "Withdrawal");
        requireDescription(description);
    }

    public void validateClose(String accountId, String reason) {
        requireAccountId(accountId);
        if (reason != null && reason.length() > limits.getMaxDescriptionLength()) {
            throw new ValidationException("Reason cannot exceed " + limits.getMaxDescriptionLength()
                    + " characters");
        }
    }

    private static void requireAccountId(String accountId) {
        if (accountId == null || accountId.trim().isEmpty()) {
            throw new ValidationException("Account id is required");
        }
    }

    private static void requireAmount(BigDecimal amount, BigDecimal max, String operation) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(operation + " amount must be greater than zero");
        }
        if (amount.compareTo(max) > 0) {
            throw new ValidationException(operation + " amount cannot exceed " + max.toPlainString());
        }
    }

    private void requireDescription(String description) {
        if (description == null || description.trim().isEmpty()) {
            throw new ValidationException("Description is required");
        }
        if (description.length() > limits.getMaxDescriptionLength()) {
            throw new ValidationException("Description cannot exceed " + limits.getMaxDescriptionLength()
                    + " characters");
        }
    }
}
