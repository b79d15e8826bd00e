package io.github.goodees.eventcontext.store.inmemory;

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
import io.github.goodees.eventcontext.core.store.AbstractEventStore;
import io.github.goodees.eventcontext.core.store.EventStoreException;
import io.github.goodees.eventcontext.core.store.StreamNames;
import io.github.goodees.eventcontext.core.store.StreamSlice;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Event store keeping typed envelopes in memory of the process. Suitable for tests and single process use, all
 * events are lost with the store instance.
 *
 * <p>Position is the number of events in the stream, an empty stream is at position 0 and the n-th event of a stream
 * has position n. Every stream has its own lock, which covers only the comparison of stream length with expected
 * position and the append itself. Streams of different aggregates never contend.</p>
 *
 * <p>Envelopes are kept as objects, so events of unknown type never reach {@code apply}.</p>
 */
public class InMemoryEventStore extends AbstractEventStore<Long> {
    private final ConcurrentMap<String, List<EventEnvelope<?>>> storage = new ConcurrentHashMap<>();

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        super(clock);
    }

    @Override
    public Long emptyPosition() {
        return 0L;
    }

    private List<EventEnvelope<?>> streamLog(String streamName) {
        return storage.computeIfAbsent(streamName, (n) -> new ArrayList<>());
    }

    @Override
    @SuppressWarnings("unchecked")
    protected <E extends DomainEvent> StreamSlice<E, Long> readStream(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, Long after) {
        List<EventEnvelope<?>> events = storage.get(StreamNames.streamName(context.contextName(), aggregateId));
        long start = after == null ? 0 : after;
        if (events == null) {
            return new StreamSlice<>(new ArrayList<>(), start);
        }
        List<EventEnvelope<E>> slice = new ArrayList<>();
        synchronized (events) {
            for (int i = (int) Math.min(start, events.size()); i < events.size(); i++) {
                slice.add((EventEnvelope<E>) events.get(i));
            }
            return new StreamSlice<>(slice, (long) events.size());
        }
    }

    @Override
    protected <E extends DomainEvent> Appended<E, Long> appendToStream(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, List<E> events, EventMetadata metadata, Long expectedPosition)
            throws EventStoreException {
        String streamName = StreamNames.streamName(context.contextName(), aggregateId);
        List<EventEnvelope<?>> log = streamLog(streamName);
        synchronized (log) {
            long tail = log.size();
            if (expectedPosition != null && expectedPosition != tail) {
                throw EventStoreException.conflict(streamName, expectedPosition, tail);
            }
            List<EventEnvelope<E>> envelopes = envelopes(context, aggregateId, events, metadata, tail + 1);
            log.addAll(envelopes);
            return new Appended<>(envelopes, (long) log.size());
        }
    }

    /**
     * Number of streams that were written or appended to.
     * @return number of streams
     */
    public int streamCount() {
        return storage.size();
    }

    /**
     * Drop all streams.
     */
    public void clear() {
        storage.clear();
    }
}
