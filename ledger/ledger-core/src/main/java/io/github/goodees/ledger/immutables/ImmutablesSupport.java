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


import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Style of immutable events and query views. Put it on package-info of the package holding
 * {@code @Value.Immutable} interfaces.
 *
 * <p>Generated implementations are package private and hidden behind nested {@code Builder} of the interface. Events
 * are recorded facts, so no copy-with methods are generated. Optional attributes accept null in builders, and both
 * {@code get} and {@code is} prefixes are stripped from attribute names, so JSON property of {@code isClosed()} is
 * {@code closed}.</p>
 */
@Target({ ElementType.PACKAGE, ElementType.TYPE })
@Retention(RetentionPolicy.CLASS)
@Value.Style(get = { "get*", "is*" },
        visibility = Value.Style.ImplementationVisibility.PACKAGE,
        overshadowImplementation = true,
        optionalAcceptNullable = true,
        jdkOnly = true,
        defaults = @Value.Immutable(copy = false))
@JsonSerialize
public @interface ImmutablesSupport {

}
