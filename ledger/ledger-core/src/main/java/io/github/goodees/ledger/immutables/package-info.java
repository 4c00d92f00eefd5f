/**
 * Events defined with <a href="http://immutables.github.io">Immutables</a> and serialized to JSON by Jackson.
 *
 * <p>Aggregate defines its base event interface extending {@link io.github.goodees.ledger.immutables.ImmutableEvent}
 * and all its events in the same package, which is annotated with
 * {@link io.github.goodees.ledger.immutables.ImmutablesSupport}. Events are then stored by
 * {@link io.github.goodees.ledger.immutables.JsonEventSerialization}, their kind being the simple name of the event
 * interface without suffix Event.</p>
 */
package io.github.goodees.ledger.immutables;

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

