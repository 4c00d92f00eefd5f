/**
 * Event sourced bank account.
 *
 * <p>{@link io.github.goodees.ledger.account.Account} is the aggregate, its events are in
 * {@linkplain io.github.goodees.ledger.account.event event package}. Commands and queries are served by
 * {@link io.github.goodees.ledger.account.AccountService}, which validates requests, runs read-modify-append cycles
 * against an {@link io.github.goodees.ledger.core.store.EventStore} and retries them on concurrency conflicts.</p>
 */
@ImmutablesSupport
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


import io.github.goodees.ledger.immutables.ImmutablesSupport;
