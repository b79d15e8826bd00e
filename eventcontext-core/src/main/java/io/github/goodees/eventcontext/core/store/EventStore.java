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
import io.github.goodees.eventcontext.core.PreparedEvents;
import io.github.goodees.eventcontext.core.Rehydrated;

/**
 * Storage for streams of events of any number of aggregate types.
 *
 * <p>A stream is addressed by the context name and aggregate id. Every implementation maps it to its own addressable
 * unit, expresses the stream's tail with its own position type {@code P}, and guards appends with its native
 * optimistic concurrency primitive. Backend errors never leak: every failure is reported as
 * {@link EventStoreException} with one of its {@linkplain EventStoreException.Fault faults}.</p>
 *
 * <p>No operation retries on its own. A {@link EventStoreException.Fault#CONCURRENCY_CONFLICT} means the decision
 * was based on stale state, and the caller needs to run the whole cycle again.</p>
 *
 * @param <P> type of stream position
 */
public interface EventStore<P> {

    /**
     * Position of a stream that has no events.
     * @return empty stream sentinel
     */
    P emptyPosition();

    /**
     * Read the whole stream in append order and fold it into state.
     * @param context the aggregate type
     * @param aggregateId id of the aggregate
     * @param <E> type of events
     * @param <S> type of state
     * @return state and position of the last event read, or {@link #emptyPosition()} for empty stream
     * @throws EventStoreException when store is not available or stored event cannot be read
     */
    <E extends DomainEvent, S> Rehydrated<S, P> load(EventContext<?, E, S, ?, ?> context, String aggregateId)
            throws EventStoreException;

    /**
     * Continue rehydration of an earlier result with events appended after its position.
     * @param context the aggregate type
     * @param aggregateId id of the aggregate
     * @param from result of earlier load of the same stream from this store
     * @param <E> type of events
     * @param <S> type of state
     * @return state after newer events were applied, {@code from} itself when there are none
     * @throws EventStoreException when store is not available or stored event cannot be read
     */
    <E extends DomainEvent, S> Rehydrated<S, P> loadAfter(EventContext<?, E, S, ?, ?> context, String aggregateId,
            Rehydrated<S, P> from) throws EventStoreException;

    /**
     * Append events without any concurrency precondition. Last writer wins.
     * @param context the aggregate type
     * @param aggregateId id of the aggregate
     * @param events events to append
     * @param <E> type of events
     * @return stored envelopes and new tail position
     * @throws EventStoreException when storing fails
     */
    <E extends DomainEvent> Appended<E, P> append(EventContext<?, E, ?, ?, ?> context, String aggregateId,
            PreparedEvents<E> events) throws EventStoreException;

    /**
     * Append events only if the tail of the stream is still at expected position.
     * @param context the aggregate type
     * @param aggregateId id of the aggregate
     * @param events events to append
     * @param expectedPosition position the stream must be at, or {@code null} for unconditional append
     * @param <E> type of events
     * @return stored envelopes and new tail position
     * @throws EventStoreException with fault {@code CONCURRENCY_CONFLICT} if the stream moved
     */
    <E extends DomainEvent> Appended<E, P> append(EventContext<?, E, ?, ?, ?> context, String aggregateId,
            PreparedEvents<E> events, P expectedPosition) throws EventStoreException;

    /**
     * Load current state, decide, and append the decided events under the position just read.
     * @see #execute(EventContext, String, Object, Object, Object)
     */
    <C, E extends DomainEvent, S, X extends Exception, V> Appended<E, P> execute(EventContext<C, E, S, X, V> context,
            String aggregateId, C command, V services) throws EventStoreException;

    /**
     * Load current state, decide, and append the decided events.
     *
     * <p>If the decision is rejected, nothing is written and the exception has fault
     * {@code DECISION_REJECTED} with the rejection as its cause. If the decision produces no events, nothing is
     * written either and the result is empty.</p>
     *
     * @param context the aggregate type
     * @param aggregateId id of the aggregate
     * @param command command to handle
     * @param services external collaborators for the decision
     * @param expectedPosition position the stream must be at, or {@code null} to use the position just loaded
     * @return stored envelopes and new tail position
     * @throws EventStoreException when the command is rejected, the stream moved, or storing fails
     */
    <C, E extends DomainEvent, S, X extends Exception, V> Appended<E, P> execute(EventContext<C, E, S, X, V> context,
            String aggregateId, C command, V services, P expectedPosition) throws EventStoreException;
}
