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
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Dependencies and strategies for {@link AccountService}.
 */
public interface AccountServiceConfiguration {

    /**
     * The thread pool event store operations and account behaviors run on.
     * @return the executor service instance
     */
    ExecutorService executorService();

    /**
     * Threadpool for scheduling delayed retries. Should be different from executorService.
     * @return scheduled executor service instance
     */
    ScheduledExecutorService schedulerService();

    /**
     * Clock for timestamps of new events.
     * @return the clock
     */
    Clock clock();

    AccountLimits limits();

    /**
     * Operations taking longer than this are logged as warnings.
     * @return threshold in milliseconds
     */
    default long slowOperationThresholdMillis() {
        return 500;
    }

    /**
     * Decide whether and when the command should be retried after it failed with a concurrency conflict.
     * Should return retry delay in milliseconds. Returning {@code 0} means to retry immediately, returning less
     * than {@code 0} means not to retry.
     * @param accountId identity of the account
     * @param t the throwable the command failed with
     * @param completedAttempts number of attempts so far, at least {@code 1}
     * @return negative in order to fail the command, zero to immediately retry it, positive for delay in ms until next
     *         attempt
     */
    long retryDelay(String accountId, Throwable t, int completedAttempts);
}
