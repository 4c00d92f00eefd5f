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


import io.github.goodees.ledger.account.event.AccountClosedEvent;
import io.github.goodees.ledger.account.event.AccountOpenedEvent;
import io.github.goodees.ledger.account.event.MoneyDepositedEvent;
import io.github.goodees.ledger.account.event.MoneyWithdrawnEvent;
import io.github.goodees.ledger.core.Aggregate;
import io.github.goodees.ledger.core.AggregateNotFoundException;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.ValidationException;
import io.github.goodees.ledger.core.matching.EventHandlers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Bank account. It is open from its first event until it is closed, closed account accepts no further operation.
 * The balance never goes below zero.
 */
public class Account extends Aggregate {
    private final EventHandlers handlers = EventHandlers.builder()
            .on(AccountOpenedEvent.class, this::onOpened)
            .on(MoneyDepositedEvent.class, this::onDeposited)
            .on(MoneyWithdrawnEvent.class, this::onWithdrawn)
            .on(AccountClosedEvent.class, this::onClosed)
            .build();

    private boolean opened;
    private String holderName;
    private String email;
    private BigDecimal balance = BigDecimal.ZERO;
    private boolean closed;
    private Instant openedAt;
    private Instant closedAt;

    public Account(String id) {
        super(id);
    }

    public Account(String id, Clock clock) {
        super(id, clock);
    }

    /**
     * Open new account.
     * @param id identity of the new account
     * @param holderName name of account holder, not blank
     * @param email contact email, not blank
     * @param initialDeposit initial balance, zero or more
     * @param clock clock of the new instance
     * @return account with single pending event
     * @throws ValidationException when any of the parameters is invalid
     */
    public static Account open(String id, String holderName, String email, BigDecimal initialDeposit, Clock clock) {
        if (isBlank(holderName)) {
            throw new ValidationException("Account holder name is required");
        }
        if (isBlank(email)) {
            throw new ValidationException("Email is required");
        }
        if (initialDeposit == null || initialDeposit.signum() < 0) {
            throw new ValidationException("Initial deposit cannot be negative");
        }
        Account account = new Account(id, clock);
        account.emit(AccountOpenedEvent.builder(account)
                .holderName(holderName)
                .email(email)
                .initialDeposit(initialDeposit)
                .build());
        return account;
    }

    public void deposit(BigDecimal amount, String description) {
        requireModifiable();
        requirePositive(amount);
        emit(MoneyDepositedEvent.builder(this).amount(amount).description(description).build());
    }

    public void withdraw(BigDecimal amount, String description) {
        requireModifiable();
        requirePositive(amount);
        if (amount.compareTo(balance) > 0) {
            throw new InsufficientFundsException(getIdentity(), balance, amount);
        }
        emit(MoneyWithdrawnEvent.builder(this).amount(amount).description(description).build());
    }

    public void close(String reason) {
        requireModifiable();
        if (balance.compareTo(BigDecimal.ZERO) != 0) {
            throw new ValidationException("Cannot close account " + getIdentity() + " with non-zero balance "
                    + balance.toPlainString());
        }
        emit(AccountClosedEvent.builder(this).reason(reason).build());
    }

    private void requireModifiable() {
        if (!opened) {
            throw new AggregateNotFoundException(getIdentity());
        }
        if (closed) {
            throw new AccountClosedException(getIdentity());
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    @Override
    protected void applyEvent(Event event) {
        if (!handlers.apply(event)) {
            logger.debug("Account {} ignores event of kind {}", getIdentity(), event.getKind());
        }
    }

    private void onOpened(AccountOpenedEvent event) {
        this.opened = true;
        this.holderName = event.getHolderName();
        this.email = event.getEmail();
        this.balance = event.getInitialDeposit();
        this.openedAt = event.getOccurredAt();
    }

    private void onDeposited(MoneyDepositedEvent event) {
        this.balance = balance.add(event.getAmount());
    }

    private void onWithdrawn(MoneyWithdrawnEvent event) {
        this.balance = balance.subtract(event.getAmount());
    }

    private void onClosed(AccountClosedEvent event) {
        this.closed = true;
        this.closedAt = event.getOccurredAt();
    }

    public boolean isOpened() {
        return opened;
    }

    public String getHolderName() {
        return holderName;
    }

    public String getEmail() {
        return email;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public boolean isClosed() {
        return closed;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public Optional<Instant> getClosedAt() {
        return Optional.ofNullable(closedAt);
    }

    /**
     * Snapshot of the current state, including pending events.
     * @return view of the account
     * @throws AggregateNotFoundException when account was never opened
     */
    public AccountView toView() {
        if (!opened) {
            throw new AggregateNotFoundException(getIdentity());
        }
        return AccountView.builder()
                .accountId(getIdentity())
                .holderName(holderName)
                .email(email)
                .balance(balance)
                .closed(closed)
                .openedAt(openedAt)
                .closedAt(Optional.ofNullable(closedAt))
                .version(getStateVersion())
                .build();
    }
}
