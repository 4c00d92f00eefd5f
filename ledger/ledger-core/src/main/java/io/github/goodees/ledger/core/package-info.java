/**
 * Event sourced aggregates.
 *
 * <p>The state of an {@link io.github.goodees.ledger.core.Aggregate} is never stored, it is derived by folding
 * the ordered {@linkplain io.github.goodees.ledger.core.Event events} of its stream. A command is processed in single
 * read-modify-append cycle:</p>
 * <ol>
 * <li>Stream is read from an {@link io.github.goodees.ledger.core.store.EventStore}</li>
 * <li>Fresh aggregate instance folds the events via
 * {@link io.github.goodees.ledger.core.AggregateReplay#replay(java.lang.String, java.util.List, java.util.function.Function)}</li>
 * <li>A behavior method validates the command and emits an event into the pending buffer</li>
 * <li>Pending events are appended with the stream version observed at load,
 * {@link io.github.goodees.ledger.core.Aggregate#getLoadedStreamVersion()}. If another writer appended in the
 * meantime, the append fails with {@link io.github.goodees.ledger.core.store.ConcurrencyConflictException} and the
 * whole cycle can be repeated</li>
 * </ol>
 *
 * <p>State at a point in time is reconstructed by folding only the events that occurred up to that instant, see
 * {@link io.github.goodees.ledger.core.AggregateReplay#asOf(java.lang.String, java.util.List, java.time.Instant, java.util.function.Function)}.</p>
 *
 * @see io.github.goodees.ledger.core.store.EventStore
 * @see io.github.goodees.ledger.core.store.AsyncEventStore
 */
package io.github.goodees.ledger.core;

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

