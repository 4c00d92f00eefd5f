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


import org.junit.After;
import org.junit.Test;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class SimpleAccountServiceConfigurationTest {
    ExecutorService executorService = Executors.newSingleThreadExecutor();
    ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @After
    public void shutdown() {
        executorService.shutdownNow();
        scheduler.shutdownNow();
    }

    private SimpleAccountServiceConfiguration withRetry(SimpleAccountServiceConfiguration.RetryStrategy retry) {
        return new SimpleAccountServiceConfiguration(executorService, scheduler, Clock.systemUTC(),
                AccountLimits.defaults(), retry, 500);
    }

    @Test
    public void retries_three_times_immediately_by_default() {
        SimpleAccountServiceConfiguration conf = new SimpleAccountServiceConfiguration(executorService, scheduler);
        assertEquals(0, conf.retryDelay("test", null, 1));
        assertEquals(0, conf.retryDelay("test", null, 2));
        assertEquals(-1, conf.retryDelay("test", null, 3));
        assertEquals(500, conf.slowOperationThresholdMillis());
        assertSame(executorService, conf.executorService());
        assertSame(scheduler, conf.schedulerService());
    }

    @Test
    public void does_not_retry_with_no_retries() {
        SimpleAccountServiceConfiguration conf = withRetry(SimpleAccountServiceConfiguration.noRetries());
        assertEquals(-1, conf.retryDelay("test", null, 1));
    }

    @Test
    public void delays_by_100ms_with_fixed_retry() {
        SimpleAccountServiceConfiguration conf = withRetry(SimpleAccountServiceConfiguration.fixedRetries(5));
        assertEquals(100, conf.retryDelay("test", null, 1));
        assertEquals(100, conf.retryDelay("test", null, 4));
        assertEquals(-1, conf.retryDelay("test", null, 5));
    }

    @Test
    public void delays_converted_to_milliseconds_with_fixed_retry() {
        SimpleAccountServiceConfiguration conf = withRetry(SimpleAccountServiceConfiguration.fixedRetries(5, 1,
            TimeUnit.MINUTES));
        assertEquals(60000, conf.retryDelay("test", null, 1));
        assertEquals(60000, conf.retryDelay("test", null, 4));
        assertEquals(-1, conf.retryDelay("test", null, 5));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negative_threshold_is_rejected() {
        new SimpleAccountServiceConfiguration(executorService, scheduler, Clock.systemUTC(), AccountLimits.defaults(),
                SimpleAccountServiceConfiguration.noRetries(), -1);
    }

    @Test(expected = NullPointerException.class)
    public void executor_is_required() {
        new SimpleAccountServiceConfiguration(null, scheduler);
    }
}
