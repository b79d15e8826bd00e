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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Events decided by {@link EventContext#handle(Object, Object, Object)}, not yet appended to any stream.
 *
 * <p>Causation and correlation ids set here are copied into the metadata of every envelope created from these
 * events.</p>
 *
 * @param <E> type of events
 */
public final class PreparedEvents<E extends DomainEvent> implements Iterable<E> {
    private final List<E> events;
    private final String causationId;
    private final String correlationId;

    private PreparedEvents(List<E> events, String causationId, String correlationId) {
        this.events = events;
        this.causationId = causationId;
        this.correlationId = correlationId;
    }

    @SafeVarargs
    public static <E extends DomainEvent> PreparedEvents<E> of(E... events) {
        return of(Arrays.asList(events));
    }

    public static <E extends DomainEvent> PreparedEvents<E> of(Collection<? extends E> events) {
        List<E> copy = new ArrayList<>(events);
        if (copy.contains(null)) {
            throw new IllegalArgumentException("Prepared events may not contain null");
        }
        return new PreparedEvents<>(Collections.unmodifiableList(copy), null, null);
    }

    /**
     * Decision that produced no events. Executing it does not write to the stream.
     * @param <E> type of events
     * @return empty instance
     */
    public static <E extends DomainEvent> PreparedEvents<E> none() {
        return new PreparedEvents<>(Collections.emptyList(), null, null);
    }

    public PreparedEvents<E> causedBy(String causationId) {
        return new PreparedEvents<>(events, causationId, correlationId);
    }

    public PreparedEvents<E> correlatedWith(String correlationId) {
        return new PreparedEvents<>(events, causationId, correlationId);
    }

    public List<E> getEvents() {
        return events;
    }

    public Optional<String> getCausationId() {
        return Optional.ofNullable(causationId);
    }

    public Optional<String> getCorrelationId() {
        return Optional.ofNullable(correlationId);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    @Override
    public Iterator<E> iterator() {
        return events.iterator();
    }

    @Override
    public String toString() {
        return "PreparedEvents{" + events + '}';
    }
}
