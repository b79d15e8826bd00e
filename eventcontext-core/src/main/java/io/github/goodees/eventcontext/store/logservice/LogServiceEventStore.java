package io.github.goodees.eventcontext.store.logservice;

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
import io.github.goodees.eventcontext.core.store.EventCodec;
import io.github.goodees.eventcontext.core.store.EventStoreException;
import io.github.goodees.eventcontext.core.store.JacksonSerialization;
import io.github.goodees.eventcontext.core.store.SerializedEvent;
import io.github.goodees.eventcontext.core.store.Serialization;
import io.github.goodees.eventcontext.core.store.StreamNames;
import io.github.goodees.eventcontext.core.store.StreamSlice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Event store backed by a log service. Each aggregate maps to the stream {@code <contextName>-<id>}, the position is
 * the service's {@link StreamRevision}, and appends use the service's append with expected revision.
 *
 * <p>Reading is strict by default: an event of a type the context doesn't declare fails the load with
 * {@code DESERIALIZATION}. A lenient store skips such events and logs an error.</p>
 */
public class LogServiceEventStore extends AbstractEventStore<StreamRevision> {
    private static final Logger logger = LoggerFactory.getLogger(LogServiceEventStore.class);

    private final LogServiceClient client;
    private final EventCodec codec;

    public LogServiceEventStore(LogServiceClient client) {
        this(client, new JacksonSerialization(), true, Clock.systemUTC());
    }

    public LogServiceEventStore(LogServiceClient client, Serialization serialization, boolean strict, Clock clock) {
        super(clock);
        this.client = client;
        this.codec = new EventCodec(serialization, strict);
    }

    @Override
    public StreamRevision emptyPosition() {
        return StreamRevision.NO_STREAM;
    }

    @Override
    protected <E extends DomainEvent> StreamSlice<E, StreamRevision> readStream(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, StreamRevision after) throws EventStoreException {
        String streamName = StreamNames.streamName(context.contextName(), aggregateId);
        StreamRevision from = after == null ? StreamRevision.NO_STREAM : after;
        List<RecordedEvent> recorded;
        try {
            recorded = client.readStream(streamName, from);
        } catch (LogServiceException e) {
            logger.error("Cannot read stream {}", streamName, e);
            throw EventStoreException.unavailable(streamName, e);
        }
        List<EventEnvelope<E>> events = new ArrayList<>(recorded.size());
        StreamRevision tail = from;
        for (RecordedEvent event : recorded) {
            if (event.getRevision() <= from.toRawLong()) {
                continue;
            }
            Optional<EventEnvelope<E>> envelope = codec.decode(context, aggregateId, event.getRevision(),
                event.getEvent());
            envelope.ifPresent(events::add);
            tail = StreamRevision.of(event.getRevision());
        }
        return new StreamSlice<>(events, tail);
    }

    @Override
    protected <E extends DomainEvent> Appended<E, StreamRevision> appendToStream(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, List<E> events, EventMetadata metadata, StreamRevision expectedPosition)
            throws EventStoreException {
        String streamName = StreamNames.streamName(context.contextName(), aggregateId);
        List<UUID> eventIds = newEventIds(events.size());
        List<SerializedEvent> serialized = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            serialized.add(codec.encode(streamName, eventIds.get(i), events.get(i), metadata));
        }
        StreamRevision tail;
        try {
            tail = client.appendToStream(streamName, expectedPosition, serialized);
        } catch (LogServiceException e) {
            if (e.getReason() == LogServiceException.Reason.WRONG_EXPECTED_REVISION) {
                logger.debug("Stream {} moved past {}", streamName, expectedPosition);
                throw EventStoreException.conflict(streamName, expectedPosition, e);
            }
            logger.error("Cannot append to stream {}", streamName, e);
            throw EventStoreException.unavailable(streamName, e);
        }
        long first = tail.toRawLong() - events.size() + 1;
        return new Appended<>(envelopes(context, aggregateId, events, metadata, first, eventIds), tail);
    }
}
