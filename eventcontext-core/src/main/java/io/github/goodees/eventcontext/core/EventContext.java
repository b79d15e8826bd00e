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

/**
 * Decision and state reconstruction logic of one aggregate type.
 *
 * <p>An implementation exists once per aggregate type and is stateless. Stores combine it with an aggregate id to
 * address a stream named {@code <contextName>-<id>}, rebuild the state by folding {@link #apply(Object, EventEnvelope)}
 * over the stored events, and hand that state to {@link #handle(Object, Object, Object)}.</p>
 *
 * <p>Both methods must be deterministic with respect to their arguments. {@code handle} may call out to
 * {@code services}, but must not change any persisted state on its own; the only effect of a decision is the
 * events it returns.</p>
 *
 * @param <C> type of commands
 * @param <E> type of events
 * @param <S> type of state
 * @param <X> type of exception reporting a rejected command
 * @param <V> type of external services available to decisions
 */
public interface EventContext<C, E extends DomainEvent, S, X extends Exception, V> {

    /**
     * Stable name of the aggregate type. Used to namespace streams, so it must be unique among all contexts sharing
     * a store, and it must never change once events were stored.
     * @return the context name
     */
    String contextName();

    /**
     * The state of an aggregate before any event exists.
     * @return a new initial state
     */
    S initialState();

    /**
     * All event classes this context produces and is able to apply.
     * @return the registry of event types
     */
    EventTypes<E> eventTypes();

    /**
     * Decide which events follow from a command given current state.
     * @param state current state
     * @param command the command
     * @param services external collaborators
     * @return events to append, possibly none
     * @throws X when the command is rejected. No events will be stored.
     */
    PreparedEvents<E> handle(S state, C command, V services) throws X;

    /**
     * Apply stored event to the state. This method must be total: it may not throw an exception or break state
     * invariants under any input that was successfully appended. Failing to do so makes the aggregate irrecoverable.
     * @param state state before the event
     * @param event stored event
     * @return state after the event
     */
    S apply(S state, EventEnvelope<E> event);
}
