package io.github.goodees.eventcontext.core;

/*-
 * #%L
 * eventcontext
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Closed registry of event classes of one aggregate type, keyed by their type name.
 *
 * <p>Stores write the type name next to every payload and use this registry to find the class when reading the
 * stream back. A type name that is not registered is a versioning error; how it is treated during reading is decided
 * by the store (strict stores fail, lenient ones skip the event).</p>
 *
 * @param <E> common supertype of the events
 */
public final class EventTypes<E extends DomainEvent> {
    private static final String EVENT_SUFFIX = "Event";

    private final Class<E> baseType;
    private final Map<String, Class<? extends E>> byName;

    private EventTypes(Class<E> baseType, Map<String, Class<? extends E>> byName) {
        this.baseType = baseType;
        this.byName = Collections.unmodifiableMap(byName);
    }

    /**
     * Registry of event classes named by {@link #defaultTypeName(Class)}.
     * @param baseType common supertype of the events
     * @param variants all concrete event classes
     * @param <E> common supertype
     * @return the registry
     * @throws IllegalArgumentException if two classes share the same type name
     */
    @SafeVarargs
    public static <E extends DomainEvent> EventTypes<E> of(Class<E> baseType, Class<? extends E>... variants) {
        Builder<E> builder = builder(baseType);
        for (Class<? extends E> variant : variants) {
            builder.add(variant);
        }
        return builder.build();
    }

    /**
     * Type name of an event class, its simple name without the {@code Event} suffix.
     * @param eventClass the event class
     * @return type name, {@code TruckAddedEvent} becomes {@code TruckAdded}
     */
    public static String defaultTypeName(Class<?> eventClass) {
        String name = eventClass.getSimpleName();
        return name.endsWith(EVENT_SUFFIX) && name.length() > EVENT_SUFFIX.length()
                ? name.substring(0, name.length() - EVENT_SUFFIX.length())
                : name;
    }

    public static <E extends DomainEvent> Builder<E> builder(Class<E> baseType) {
        return new Builder<>(baseType);
    }

    public Class<E> getBaseType() {
        return baseType;
    }

    public Set<String> names() {
        return byName.keySet();
    }

    public Optional<Class<? extends E>> lookup(String typeName) {
        return Optional.ofNullable(byName.get(typeName));
    }

    /**
     * Check that an object is an instance of the class registered under the type name it reports.
     * @param event object to check, may be of any type
     * @return true if the event may be stored in this context
     */
    public boolean isSupported(Object event) {
        if (!baseType.isInstance(event)) {
            return false;
        }
        Class<? extends E> registered = byName.get(((DomainEvent) event).getType());
        return registered != null && registered.isInstance(event);
    }

    @Override
    public String toString() {
        return "EventTypes{" + baseType.getSimpleName() + byName.keySet() + '}';
    }

    public static final class Builder<E extends DomainEvent> {
        private final Class<E> baseType;
        private final Map<String, Class<? extends E>> byName = new LinkedHashMap<>();

        private Builder(Class<E> baseType) {
            this.baseType = Objects.requireNonNull(baseType);
        }

        public Builder<E> add(Class<? extends E> variant) {
            return add(defaultTypeName(variant), variant);
        }

        public Builder<E> add(String typeName, Class<? extends E> variant) {
            Objects.requireNonNull(typeName);
            Objects.requireNonNull(variant);
            Class<? extends E> previous = byName.putIfAbsent(typeName, variant);
            if (previous != null && previous != variant) {
                throw new IllegalArgumentException("Event type " + typeName + " is registered for both "
                        + previous.getName() + " and " + variant.getName());
            }
            return this;
        }

        public EventTypes<E> build() {
            return new EventTypes<>(baseType, new LinkedHashMap<>(byName));
        }
    }
}
