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

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.EventKind;

import java.util.Optional;

/**
 * Maps event kinds of one aggregate to its Immutables-generated classes.
 *
 * <p>Kind {@code MoneyDeposited} of aggregate whose events extend {@code com.example.AccountEvent} is read as
 * {@code com.example.ImmutableMoneyDepositedEvent}, which is consistent with {@link ImmutableEvent#getKind()}.
 * A kind without such class, or with a class outside of aggregate's hierarchy, is not resolved, and is left for
 * the reader to decide: a mapper with {@code DeserializationFeature.FAIL_ON_INVALID_SUBTYPE} disabled reads it as
 * {@code null}, which storage treats as an event written by a newer version of the application.
 */
public class ImmutableEventKindResolver extends TypeIdResolverBase {
    private static final String PREFIX = "Immutable";
    private static final String SUFFIX = "Event";

    private JavaType baseType;

    @Override
    public void init(JavaType baseType) {
        this.baseType = baseType;
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) {
        return eventClass(baseType.getRawClass(), id).map(c -> context.constructSpecializedType(baseType, c))
                .orElse(null);
    }

    JavaType typeFromId(String id, TypeFactory typeFactory) {
        return eventClass(baseType.getRawClass(), id).map(c -> typeFactory.constructSpecializedType(baseType, c))
                .orElse(null);
    }

    /**
     * Find implementation of event kind within aggregate's events.
     * @param baseType the base interface of aggregate's events
     * @param kind event kind
     * @return the generated class, or empty when running code does not know the kind
     */
    public static Optional<Class<?>> eventClass(Class<?> baseType, String kind) {
        if (kind == null || kind.isEmpty()) {
            return Optional.empty();
        }
        try {
            Class<?> eventClass = Class.forName(eventClassName(baseType.getPackage().getName(), kind), false,
                baseType.getClassLoader());
            return baseType.isAssignableFrom(eventClass) ? Optional.of(eventClass) : Optional.empty();
        } catch (ClassNotFoundException e) {
            return Optional.empty();
        }
    }

    static String eventClassName(String basePackage, String kind) {
        return basePackage + "." + EventKind.toSimpleClassname(kind, PREFIX, SUFFIX);
    }

    @Override
    public String idFromValue(Object value) {
        if (value instanceof ImmutableEvent) {
            return ((Event) value).getKind();
        }
        throw new IllegalArgumentException("Only events extending ImmutableEvent have a kind, was given " + value);
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        return idFromValue(value);
    }

    @Override
    public String getDescForKnownTypeIds() {
        return "kinds implemented as " + eventClassName(baseType.getRawClass().getPackage().getName(), "<Kind>")
                + " extending " + baseType.getRawClass().getSimpleName();
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }
}
