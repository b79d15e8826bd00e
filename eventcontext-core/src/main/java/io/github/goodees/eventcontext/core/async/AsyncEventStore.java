package io.github.goodees.eventcontext.core.async;

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
import io.github.goodees.eventcontext.core.store.EventStore;
import io.github.goodees.eventcontext.core.store.EventStoreException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Non-blocking facade of an {@link EventStore}. Every operation runs on the executor supplied by the host, the
 * returned future completes exceptionally with the {@link EventStoreException} the store threw.
 *
 * <p>Cancelling the future does not interrupt a running operation; an append either commits or not as a whole.</p>
 *
 * @param <P> type of stream position
 */
public class AsyncEventStore<P> {
    private final EventStore<P> store;
    private final Executor executor;

    public AsyncEventStore(EventStore<P> store, Executor executor) {
        this.store = store;
        this.executor = executor;
    }

    public EventStore<P> getStore() {
        return store;
    }

    public <E extends DomainEvent, S> CompletableFuture<Rehydrated<S, P>> load(EventContext<?, E, S, ?, ?> context,
            String aggregateId) {
        return invoke(() -> store.load(context, aggregateId));
    }

    public <E extends DomainEvent, S> CompletableFuture<Rehydrated<S, P>> loadAfter(
            EventContext<?, E, S, ?, ?> context, String aggregateId, Rehydrated<S, P> from) {
        return invoke(() -> store.loadAfter(context, aggregateId, from));
    }

    public <E extends DomainEvent> CompletableFuture<Appended<E, P>> append(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, PreparedEvents<E> events) {
        return invoke(() -> store.append(context, aggregateId, events));
    }

    public <E extends DomainEvent> CompletableFuture<Appended<E, P>> append(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, PreparedEvents<E> events, P expectedPosition) {
        return invoke(() -> store.append(context, aggregateId, events, expectedPosition));
    }

    public <C, E extends DomainEvent, S, X extends Exception, V> CompletableFuture<Appended<E, P>> execute(
            EventContext<C, E, S, X, V> context, String aggregateId, C command, V services) {
        return execute(context, aggregateId, command, services, null);
    }

    public <C, E extends DomainEvent, S, X extends Exception, V> CompletableFuture<Appended<E, P>> execute(
            EventContext<C, E, S, X, V> context, String aggregateId, C command, V services, P expectedPosition) {
        return invoke(() -> store.execute(context, aggregateId, command, services, expectedPosition));
    }

    private <T> CompletableFuture<T> invoke(StoreCall<T> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (EventStoreException e) {
                throw new CompletionException(e);
            }
        }, executor).whenComplete((r, t) -> {
            if (t == null) {
                result.complete(r);
            } else {
                result.completeExceptionally(unwrapCompletionException(t));
            }
        });
        return result;
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }

    @FunctionalInterface
    interface StoreCall<T> {
        T call() throws EventStoreException;
    }
}
