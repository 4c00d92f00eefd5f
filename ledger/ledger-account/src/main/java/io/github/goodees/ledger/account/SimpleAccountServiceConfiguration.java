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


import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * General service configuration implementation, as alternative to defining own subclass. Its dependencies are
 * passed to constructor, and {@linkplain RetryStrategy retries} are represented by functional interface.
 */
public class SimpleAccountServiceConfiguration implements AccountServiceConfiguration {
    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final Clock clock;
    private final AccountLimits limits;
    private final RetryStrategy retryStrategy;
    private final long slowOperationThresholdMillis;

    /**
     * Create service configuration.
     * @param executorService executor service to use
     * @param schedulerService scheduler service to use
     * @param clock clock for new events
     * @param limits request limits
     * @param retryStrategy retry strategy to delegate retryDelay to
     * @param slowOperationThresholdMillis threshold for logging slow operations
     */
    public SimpleAccountServiceConfiguration(ExecutorService executorService,
            ScheduledExecutorService schedulerService, Clock clock, AccountLimits limits,
            RetryStrategy retryStrategy, long slowOperationThresholdMillis) {
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduled executor must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
        this.limits = Objects.requireNonNull(limits, "Limits must be specified");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy must be specified");
        if (slowOperationThresholdMillis < 0) {
            throw new IllegalArgumentException("Slow operation threshold cannot be negative");
        }
        this.slowOperationThresholdMillis = slowOperationThresholdMillis;
    }

    /**
     * Create service configuration with system clock, default limits and three immediate retries.
     * @param executorService executor service to use
     * @param schedulerService scheduler service to use
     */
    public SimpleAccountServiceConfiguration(ExecutorService executorService,
            ScheduledExecutorService schedulerService) {
        this(executorService, schedulerService, Clock.systemUTC(), AccountLimits.defaults(),
            fixedRetries(3, 0, TimeUnit.MILLISECONDS), 500);
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public ScheduledExecutorService schedulerService() {
        return schedulerService;
    }

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public AccountLimits limits() {
        return limits;
    }

    @Override
    public long slowOperationThresholdMillis() {
        return slowOperationThresholdMillis;
    }

    @Override
    public long retryDelay(String accountId, Throwable t, int completedAttempts) {
        return retryStrategy.retryDelay(accountId, t, completedAttempts);
    }

    /**
     * Strategy for retrying a command
     * @see AccountServiceConfiguration#retryDelay(String, Throwable, int)
     */
    @FunctionalInterface
    public interface RetryStrategy {
        long DO_NOT_RETRY = -1;
        long RETRY_NOW = 0;

        long retryDelay(String accountId, Throwable t, int completedAttempts);
    }

    static final RetryStrategy NO_RETRIES = (id, t, attempts) -> RetryStrategy.DO_NOT_RETRY;

    /**
     * Retry strategy that doesn't retry any failed command.
     * @return a retry strategy
     */
    public static RetryStrategy noRetries() {
        return NO_RETRIES;
    }

    /**
     * Create retry strategy that allows fix number of attempts before failing the command, with delay of 100
     * milliseconds.
     * @param attempts number of attempts to allow
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts) {
        return new FixedRepeat(attempts, 100);
    }

    /**
     * Create retry strategy that allows fix number of attempts with defined retry delay.
     * @param attempts number of attempts to allow
     * @param delay delay before retrying the command
     * @param unit unit of delay
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts, long delay, TimeUnit unit) {
        return new FixedRepeat(attempts, unit.toMillis(delay));
    }

    static class FixedRepeat implements RetryStrategy {
        final int attempts;
        final long delay;

        FixedRepeat(int attempts, long delay) {
            this.attempts = attempts;
            this.delay = delay;
        }

        @Override
        public long retryDelay(String accountId, Throwable t, int completedAttempts) {
            return completedAttempts < attempts ? delay : DO_NOT_RETRY;
        }
    }
}
