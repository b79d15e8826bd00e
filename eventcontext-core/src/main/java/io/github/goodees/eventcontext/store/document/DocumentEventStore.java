package io.github.goodees.eventcontext.store.document;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
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
 * Event store keeping every stream as a single document keyed by {@code <contextName>-<id>}.
 *
 * <p>The document version is the number of events it holds, which is also the position. Appending reads the
 * document, adds the events and writes it back only if the version did not change in the meantime. Unconditional
 * appends repeat this compare-and-swap up to {@code maxCasAttempts} times before reporting a conflict.</p>
 *
 * <p>Reading is strict by default, see {@link EventCodec}.</p>
 */
public class DocumentEventStore extends AbstractEventStore<Long> {
    private static final Logger logger = LoggerFactory.getLogger(DocumentEventStore.class);
    public static final int DEFAULT_CAS_ATTEMPTS = 10;

    private final DocumentStoreClient client;
    private final EventCodec codec;
    private final ObjectMapper mapper;
    private final int maxCasAttempts;

    public DocumentEventStore(DocumentStoreClient client) {
        this(client, new JacksonSerialization(), true, DEFAULT_CAS_ATTEMPTS, Clock.systemUTC());
    }

    public DocumentEventStore(DocumentStoreClient client, Serialization serialization, boolean strict,
            int maxCasAttempts, Clock clock) {
        super(clock);
        if (maxCasAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is needed, was " + maxCasAttempts);
        }
        this.client = client;
        this.codec = new EventCodec(serialization, strict);
        this.mapper = JacksonSerialization.createMapper();
        this.maxCasAttempts = maxCasAttempts;
    }

    @Override
    public Long emptyPosition() {
        return 0L;
    }

    private Optional<VersionedDocument> fetch(String key) throws EventStoreException {
        try {
            return client.get(key);
        } catch (DocumentStoreException e) {
            logger.error("Cannot read document {}", key, e);
            throw EventStoreException.unavailable(key, e);
        }
    }

    private StreamDocument parse(VersionedDocument document) throws EventStoreException {
        try {
            return mapper.readValue(document.getBody(), StreamDocument.class);
        } catch (JsonProcessingException e) {
            throw EventStoreException.unreadable(document.getKey(), e);
        }
    }

    @Override
    protected <E extends DomainEvent> StreamSlice<E, Long> readStream(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, Long after) throws EventStoreException {
        String key = StreamNames.streamName(context.contextName(), aggregateId);
        long start = after == null ? 0 : after;
        Optional<VersionedDocument> document = fetch(key);
        if (!document.isPresent()) {
            return new StreamSlice<>(new ArrayList<>(), start);
        }
        List<SerializedEvent> stored = parse(document.get()).getEvents();
        List<EventEnvelope<E>> events = new ArrayList<>();
        for (int i = (int) Math.min(start, stored.size()); i < stored.size(); i++) {
            codec.decode(context, aggregateId, i + 1, stored.get(i)).ifPresent(events::add);
        }
        return new StreamSlice<>(events, document.get().getVersion());
    }

    @Override
    protected <E extends DomainEvent> Appended<E, Long> appendToStream(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, List<E> events, EventMetadata metadata, Long expectedPosition)
            throws EventStoreException {
        String key = StreamNames.streamName(context.contextName(), aggregateId);
        List<UUID> eventIds = newEventIds(events.size());
        List<SerializedEvent> serialized = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            serialized.add(codec.encode(key, eventIds.get(i), events.get(i), metadata));
        }
        int attempts = expectedPosition == null ? maxCasAttempts : 1;
        long current = 0;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Optional<VersionedDocument> document = fetch(key);
            current = document.map(VersionedDocument::getVersion).orElse(0L);
            if (expectedPosition != null && expectedPosition != current) {
                throw EventStoreException.conflict(key, expectedPosition, current);
            }
            StreamDocument body = document.isPresent() ? parse(document.get()) : StreamDocument.empty(key);
            long next = current + events.size();
            if (write(key, current, next, body.with(serialized))) {
                return new Appended<>(envelopes(context, aggregateId, events, metadata, current + 1, eventIds), next);
            }
            logger.debug("Document {} changed during append, attempt {} of {}", key, attempt, attempts);
        }
        throw EventStoreException.conflict(key, expectedPosition == null ? current : expectedPosition,
            "a newer version");
    }

    private boolean write(String key, long expected, long next, StreamDocument body) throws EventStoreException {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw EventStoreException.serializationFailed(key, body, e);
        }
        try {
            return client.put(key, expected, next, json);
        } catch (DocumentStoreException e) {
            logger.error("Cannot write document {}", key, e);
            throw EventStoreException.unavailable(key, e);
        }
    }
}
