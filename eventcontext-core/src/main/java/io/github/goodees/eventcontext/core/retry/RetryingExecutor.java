package io.github.goodees.eventcontext.core.retry;

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
import io.github.goodees.eventcontext.core.store.EventStore;
import io.github.goodees.eventcontext.core.store.EventStoreException;
import io.github.goodees.eventcontext.core.store.StreamNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in wrapper that repeats the whole load-decide-append cycle when the stream moved between load and append.
 *
 * <p>Only {@code CONCURRENCY_CONFLICT} is retried, and only when the caller didn't pin an expected position. A
 * rejected decision, unreadable stream or unavailable store is reported after the first attempt.</p>
 *
 * @param <P> type of stream position
 */
public class RetryingExecutor<P> {
    private static final Logger logger = LoggerFactory.getLogger(RetryingExecutor.class);

    private final EventStore<P> store;
    private final int maxAttempts;

    public RetryingExecutor(EventStore<P> store, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is needed, was " + maxAttempts);
        }
        this.store = store;
        this.maxAttempts = maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Execute the command, re-deciding against fresh state on conflict.
     * @throws EventStoreException the last conflict if all attempts failed, or any other failure immediately
     * @see EventStore#execute(EventContext, String, Object, Object)
     */
    public <C, E extends DomainEvent, S, X extends Exception, V> Appended<E, P> execute(
            EventContext<C, E, S, X, V> context, String aggregateId, C command, V services)
            throws EventStoreException {
        EventStoreException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return store.execute(context, aggregateId, command, services);
            } catch (EventStoreException e) {
                if (!e.isConflict()) {
                    throw e;
                }
                lastConflict = e;
                logger.warn("Conflict on {}, attempt {} of {}: {}",
                    StreamNames.streamName(context.contextName(), aggregateId), attempt, maxAttempts,
                    e.getMessage());
            }
        }
        throw lastConflict;
    }
}
