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


import io.github.goodees.ledger.account.event.AccountEvent;
import io.github.goodees.ledger.core.AggregateReplay;
import io.github.goodees.ledger.core.AsyncResult;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.StoredEvent;
import io.github.goodees.ledger.core.UnrecognizedEvent;
import io.github.goodees.ledger.core.ValidationException;
import io.github.goodees.ledger.core.store.AsyncEventStore;
import io.github.goodees.ledger.core.store.ConcurrencyConflictException;
import io.github.goodees.ledger.core.store.EventStore;
import io.github.goodees.ledger.immutables.JsonEventSerialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import static java.util.stream.Collectors.toList;

/**
 * Commands and queries over accounts.
 *
 * <p>Every command is validated, and then executed as read-modify-append cycle: the stream of the account is read,
 * folded into fresh {@link Account}, the behavior is invoked and its event is appended with the version observed at
 * read. When another writer appended in the meantime, the cycle is repeated as long as
 * {@link AccountServiceConfiguration#retryDelay(String, Throwable, int)} allows.</p>
 *
 * <p>All operations are asynchronous. Returned results complete exceptionally with {@link ValidationException} or its
 * subclasses for rejected commands, {@link io.github.goodees.ledger.core.AggregateNotFoundException} for unknown
 * accounts, and {@link io.github.goodees.ledger.core.store.EventStoreException} for storage failures and conflicts
 * that were not resolved by retries.</p>
 */
public class AccountService {
    private static final Logger logger = LoggerFactory.getLogger(AccountService.class);

    private final AsyncEventStore eventStore;
    private final AccountServiceConfiguration config;
    private final AccountRequestValidator validator;
    private final JsonEventSerialization<AccountEvent> serialization;

    public AccountService(EventStore eventStore, AccountServiceConfiguration config) {
        this.config = Objects.requireNonNull(config, "Configuration must be specified");
        this.eventStore = new AsyncEventStore(eventStore, config.executorService());
        this.validator = new AccountRequestValidator(config.limits());
        this.serialization = new JsonEventSerialization<>(AccountEvent.class);
    }

    /**
     * Open new account.
     * @param holderName name of the account holder
     * @param email contact email
     * @param initialDeposit initial balance
     * @return id of the new account
     */
    public AsyncResult<String> openAccount(String holderName, String email, BigDecimal initialDeposit) {
        long start = System.nanoTime();
        String accountId = UUID.randomUUID().toString();
        AsyncResult<String> result = AsyncResult.invoke(() -> {
            validator.validateOpen(holderName, email, initialDeposit);
            return Account.open(accountId, holderName.trim(), email.trim(), initialDeposit, config.clock());
        }).thenCompose(account -> eventStore.append(accountId, account.takePendingEvents(), EventStore.NO_STREAM))
                .thenApply(v -> accountId);
        return timed("openAccount", accountId, start, result);
    }

    public AsyncResult<AccountView> deposit(String accountId, BigDecimal amount, String description) {
        try {
            validator.validateDeposit(accountId, amount, description);
        } catch (ValidationException e) {
            return AsyncResult.throwing(e);
        }
        return execute("deposit", accountId, account -> account.deposit(amount, description));
    }

    public AsyncResult<AccountView> withdraw(String accountId, BigDecimal amount, String description) {
        try {
            validator.validateWithdrawal(accountId, amount, description);
        } catch (ValidationException e) {
            return AsyncResult.throwing(e);
        }
        return execute("withdraw", accountId, account -> account.withdraw(amount, description));
    }

    public AsyncResult<AccountView> close(String accountId, String reason) {
        try {
            validator.validateClose(accountId, reason);
        } catch (ValidationException e) {
            return AsyncResult.throwing(e);
        }
        return execute("close", accountId, account -> account.close(reason));
    }

    /**
     * Current state of an account.
     * @param accountId the account
     * @return view of the account, failing with AggregateNotFoundException for unknown account
     */
    public AsyncResult<AccountView> getAccount(String accountId) {
        long start = System.nanoTime();
        return timed("getAccount", accountId, start, eventStore.readStream(accountId)
                .thenApply(history -> AggregateReplay.replay(accountId, events(history), this::newAccount).toView()));
    }

    /**
     * State of an account at given instant, including events that occurred exactly at that instant.
     * @param accountId the account
     * @param asOf the instant
     * @return view of the account, failing with AggregateNotFoundException when the account did not exist yet
     */
    public AsyncResult<AccountView> getAccountAsOf(String accountId, Instant asOf) {
        long start = System.nanoTime();
        return timed("getAccountAsOf", accountId, start, eventStore.readStream(accountId)
                .thenApply(history -> AggregateReplay.asOf(accountId, events(history), asOf, this::newAccount)
                        .toView()));
    }

    /**
     * All events of an account.
     * @param accountId the account
     * @return history entries in order, empty for unknown account
     */
    public AsyncResult<List<AccountHistoryEntry>> getHistory(String accountId) {
        long start = System.nanoTime();
        return timed("getHistory", accountId, start, eventStore.readStream(accountId)
                .thenApply(history -> history.stream().map(this::toHistoryEntry).collect(toList())));
    }

    /**
     * Views of all accounts, ordered by account id.
     * @return account views
     */
    public AsyncResult<List<AccountView>> listAccounts() {
        long start = System.nanoTime();
        return timed("listAccounts", "*", start, eventStore.listStreams().thenCompose(ids -> {
            List<AsyncResult<Optional<AccountView>>> views = ids.stream().sorted().map(this::findAccount)
                    .collect(toList());
            return CompletableFuture.allOf(views.toArray(new CompletableFuture<?>[0]))
                    .thenApply(v -> views.stream().map(CompletableFuture::join).filter(Optional::isPresent)
                            .map(Optional::get).collect(toList()));
        }));
    }

    public AsyncResult<Void> rebuildProjections() {
        logger.info("Rebuilding derived views");
        return eventStore.rebuildDerivedViews();
    }

    private AsyncResult<Optional<AccountView>> findAccount(String accountId) {
        return eventStore.readStream(accountId).thenApply(history -> {
            Account account = newAccount(accountId);
            account.loadFromHistory(events(history));
            return account.isOpened() ? Optional.of(account.toView()) : Optional.<AccountView>empty();
        });
    }

    private AsyncResult<AccountView> execute(String operation, String accountId, Consumer<Account> behavior) {
        long start = System.nanoTime();
        AsyncResult<AccountView> result = AsyncResult.bindTo(callback -> attempt(accountId, behavior, 1, callback));
        return timed(operation, accountId, start, result);
    }

    private void attempt(String accountId, Consumer<Account> behavior, int attempt,
            BiConsumer<AccountView, Throwable> callback) {
        eventStore.readStream(accountId).thenApply(history -> {
            Account account = AggregateReplay.replay(accountId, events(history), this::newAccount);
            behavior.accept(account);
            return account;
        }).thenCompose(account -> {
            AccountView view = account.toView();
            return eventStore.append(accountId, account.takePendingEvents(), account.getLoadedStreamVersion())
                    .thenApply(v -> view);
        }).whenComplete((view, t) -> {
            Throwable failure = AsyncResult.unwrapCompletionException(t);
            if (failure == null) {
                callback.accept(view, null);
            } else if (failure instanceof ConcurrencyConflictException) {
                retry(accountId, behavior, attempt, callback, failure);
            } else {
                callback.accept(null, failure);
            }
        });
    }

    private void retry(String accountId, Consumer<Account> behavior, int attempt,
            BiConsumer<AccountView, Throwable> callback, Throwable conflict) {
        long delay = config.retryDelay(accountId, conflict, attempt);
        if (delay < 0) {
            logger.warn("Account {} still conflicting after {} attempts", accountId, attempt);
            callback.accept(null, conflict);
        } else if (delay == 0) {
            logger.info("Account {} was modified concurrently, retrying. Attempt {}", accountId, attempt);
            attempt(accountId, behavior, attempt + 1, callback);
        } else {
            logger.info("Account {} was modified concurrently, retrying in {} ms. Attempt {}", accountId, delay,
                attempt);
            try {
                config.schedulerService().schedule(() -> attempt(accountId, behavior, attempt + 1, callback), delay,
                    TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                e.addSuppressed(conflict);
                callback.accept(null, e);
            }
        }
    }

    private AccountHistoryEntry toHistoryEntry(StoredEvent stored) {
        Event event = stored.getEvent();
        return AccountHistoryEntry.builder()
                .version(stored.getSequence() + 1)
                .sequence(stored.getSequence())
                .kind(event.getKind())
                .data(eventData(event))
                .occurredAt(event.getOccurredAt() != null ? event.getOccurredAt() : stored.getStoredAt())
                .build();
    }

    private String eventData(Event event) {
        if (event instanceof AccountEvent) {
            return serialization.serialize((AccountEvent) event);
        } else if (event instanceof UnrecognizedEvent) {
            return ((UnrecognizedEvent) event).getPayload();
        } else {
            return String.valueOf(event);
        }
    }

    private Account newAccount(String accountId) {
        return new Account(accountId, config.clock());
    }

    private static List<Event> events(List<StoredEvent> history) {
        return history.stream().map(StoredEvent::getEvent).collect(toList());
    }

    private <T> AsyncResult<T> timed(String operation, String accountId, long startNanos, AsyncResult<T> result) {
        return result.whenComplete((r, t) -> {
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            if (elapsed > config.slowOperationThresholdMillis()) {
                logger.warn("Slow operation {} on account {} took {} ms", operation, accountId, elapsed);
            }
            if (t != null) {
                logger.debug("Operation {} on account {} failed", operation, accountId, t);
            }
        });
    }
}
