package io.github.goodees.eventcontext.core.store;

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

import io.github.goodees.eventcontext.core.Appended;
import io.github.goodees.eventcontext.core.DomainEvent;
import io.github.goodees.eventcontext.core.EventContext;
import io.github.goodees.eventcontext.core.EventEnvelope;
import io.github.goodees.eventcontext.core.EventMetadata;
import io.github.goodees.eventcontext.core.PreparedEvents;
import io.github.goodees.eventcontext.core.Rehydrated;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Load-decide-append protocol common to all stores. Subclasses only read slices of streams and append to them
 * under their native concurrency primitive.
 *
 * @param <P> type of stream position
 */
public abstract class AbstractEventStore<P> implements EventStore<P> {
    private static final Logger logger = LoggerFactory.getLogger(AbstractEventStore.class);

    private final Clock clock;

    protected AbstractEventStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Read events of a stream.
     * @param context the aggregate type
     * @param aggregateId id of the aggregate
     * @param after read only events after this position, {@code null} to read from the start
     * @param <E> type of events
     * @return events in append order and the tail position. For an empty slice the tail is {@code after}, or
     *         {@link #emptyPosition()} when reading from the start
     * @throws EventStoreException when reading fails
     */
    protected abstract <E extends DomainEvent> StreamSlice<E, P> readStream(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, P after) throws EventStoreException;

    /**
     * Atomically append the events, checking the precondition with the native concurrency primitive.
     * @param context the aggregate type
     * @param aggregateId id of the aggregate
     * @param events events to append, never empty and all supported by the context
     * @param metadata metadata for all the events
     * @param expectedPosition required tail position, {@code null} for unconditional append
     * @param <E> type of events
     * @return stored envelopes and new tail
     * @throws EventStoreException when precondition is not met or storing fails
     */
    protected abstract <E extends DomainEvent> Appended<E, P> appendToStream(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, List<E> events, EventMetadata metadata, P expectedPosition)
            throws EventStoreException;

    @Override
    public <E extends DomainEvent, S> Rehydrated<S, P> load(EventContext<?, E, S, ?, ?> context, String aggregateId)
            throws EventStoreException {
        StreamSlice<E, P> slice = readStream(context, aggregateId, null);
        return fold(context, new Rehydrated<>(context.initialState(), emptyPosition(), 0), slice);
    }

    @Override
    public <E extends DomainEvent, S> Rehydrated<S, P> loadAfter(EventContext<?, E, S, ?, ?> context,
            String aggregateId, Rehydrated<S, P> from) throws EventStoreException {
        StreamSlice<E, P> slice = readStream(context, aggregateId, from.getPosition());
        if (slice.getEvents().isEmpty()) {
            return from;
        }
        return fold(context, from, slice);
    }

    private <E extends DomainEvent, S> Rehydrated<S, P> fold(EventContext<?, E, S, ?, ?> context,
            Rehydrated<S, P> start, StreamSlice<E, P> slice) {
        S state = start.getState();
        for (EventEnvelope<E> event : slice.getEvents()) {
            state = context.apply(state, event);
        }
        long count = start.getEventCount() + slice.getEvents().size();
        logger.debug("Rehydrated {} from {} events, position {}", context.contextName(), count, slice.getTail());
        return new Rehydrated<>(state, slice.getTail(), count);
    }

    @Override
    public <E extends DomainEvent> Appended<E, P> append(EventContext<?, E, ?, ?, ?> context, String aggregateId,
            PreparedEvents<E> events) throws EventStoreException {
        return append(context, aggregateId, events, null);
    }

    @Override
    public <E extends DomainEvent> Appended<E, P> append(EventContext<?, E, ?, ?, ?> context, String aggregateId,
            PreparedEvents<E> events, P expectedPosition) throws EventStoreException {
        String streamName = StreamNames.streamName(context.contextName(), aggregateId);
        for (E event : events) {
            if (!context.eventTypes().isSupported(event)) {
                throw EventStoreException.unsupported(context.contextName(), event);
            }
        }
        if (events.isEmpty()) {
            P tail = readStream(context, aggregateId, null).getTail();
            if (expectedPosition != null && !expectedPosition.equals(tail)) {
                throw EventStoreException.conflict(streamName, expectedPosition, tail);
            }
            return Appended.nothing(tail);
        }
        EventMetadata metadata = EventMetadata.builder()
                .timestamp(clock.instant())
                .causationId(events.getCausationId())
                .correlationId(events.getCorrelationId())
                .build();
        Appended<E, P> result = appendToStream(context, aggregateId, events.getEvents(), metadata, expectedPosition);
        logger.debug("Appended {} events to {}, position {}", events.size(), streamName, result.getPosition());
        return result;
    }

    @Override
    public <C, E extends DomainEvent, S, X extends Exception, V> Appended<E, P> execute(
            EventContext<C, E, S, X, V> context, String aggregateId, C command, V services)
            throws EventStoreException {
        return execute(context, aggregateId, command, services, null);
    }

    @Override
    public <C, E extends DomainEvent, S, X extends Exception, V> Appended<E, P> execute(
            EventContext<C, E, S, X, V> context, String aggregateId, C command, V services, P expectedPosition)
            throws EventStoreException {
        Rehydrated<S, P> current = load(context, aggregateId);
        P precondition = expectedPosition != null ? expectedPosition : current.getPosition();
        PreparedEvents<E> decided;
        try {
            decided = context.handle(current.getState(), command, services);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception rejection) {
            String streamName = StreamNames.streamName(context.contextName(), aggregateId);
            logger.debug("Command {} for {} rejected: {}", command, streamName, rejection.getMessage());
            throw EventStoreException.rejected(streamName, rejection);
        }
        if (decided == null || decided.isEmpty()) {
            return Appended.nothing(current.getPosition());
        }
        return append(context, aggregateId, decided, precondition);
    }

    /**
     * Wrap events stored in one append into envelopes.
     * @param context the aggregate type
     * @param aggregateId id of the aggregate
     * @param events stored events
     * @param metadata metadata of the append
     * @param firstPosition position of first event, following events have consecutive positions
     * @param <E> type of events
     * @return envelopes in order of events
     */
    protected <E extends DomainEvent> List<EventEnvelope<E>> envelopes(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, List<E> events, EventMetadata metadata, long firstPosition) {
        return envelopes(context, aggregateId, events, metadata, firstPosition, newEventIds(events.size()));
    }

    protected <E extends DomainEvent> List<EventEnvelope<E>> envelopes(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, List<E> events, EventMetadata metadata, long firstPosition, List<UUID> eventIds) {
        List<EventEnvelope<E>> result = new ArrayList<>(events.size());
        long position = firstPosition;
        for (int i = 0; i < events.size(); i++) {
            result.add(new EventEnvelope<>(eventIds.get(i), context.contextName(), aggregateId, position++, metadata,
                events.get(i)));
        }
        return result;
    }

    protected static List<UUID> newEventIds(int count) {
        List<UUID> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ids.add(UUID.randomUUID());
        }
        return ids;
    }
}
