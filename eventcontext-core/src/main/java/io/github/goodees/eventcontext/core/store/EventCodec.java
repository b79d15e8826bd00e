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

import io.github.goodees.eventcontext.core.DomainEvent;
import io.github.goodees.eventcontext.core.EventContext;
import io.github.goodees.eventcontext.core.EventEnvelope;
import io.github.goodees.eventcontext.core.EventMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Conversion between envelopes and their serialized form, shared by stores that keep events outside of the process.
 *
 * <p>When codec is in strict mode, it will throw an exception when an event being read cannot be deserialized.
 * This can usually happen in two cases: Either there was an error in payload serialization, or an event could have
 * belong to a future version of the system, code was rolled back and currently running code doesn't yet know such
 * event. When {@code strict} is false, such event is skipped. Skipping changes the state the aggregate is rebuilt to,
 * so in case the aggregate needs strong state consistency guarantees, strict mode should be used.</p>
 */
public class EventCodec {
    private static final Logger logger = LoggerFactory.getLogger(EventCodec.class);

    static final String TIMESTAMP = "timestamp";
    static final String CAUSATION_ID = "causationId";
    static final String CORRELATION_ID = "correlationId";
    static final String PAYLOAD_VERSION = "payloadVersion";

    private final Serialization serialization;
    private final boolean strict;

    public EventCodec(Serialization serialization, boolean strict) {
        this.serialization = serialization;
        this.strict = strict;
    }

    /**
     * Indicate whether failure to deserialize event causes exception to be thrown.
     * @return true for strict mode
     */
    public boolean isStrict() {
        return strict;
    }

    public SerializedEvent encode(String streamName, UUID eventId, DomainEvent event, EventMetadata metadata)
            throws EventStoreException {
        try {
            Map<String, String> meta = new LinkedHashMap<>();
            meta.put(TIMESTAMP, metadata.getTimestamp().toString());
            metadata.getCausationId().ifPresent(id -> meta.put(CAUSATION_ID, id));
            metadata.getCorrelationId().ifPresent(id -> meta.put(CORRELATION_ID, id));
            meta.put(PAYLOAD_VERSION, Integer.toString(serialization.payloadVersion(event)));
            return new SerializedEvent(eventId, event.getType(), serialization.serialize(event),
                serialization.serializeMetadata(meta));
        } catch (IOException e) {
            throw EventStoreException.serializationFailed(streamName, event, e);
        }
    }

    /**
     * Turn stored event into an envelope.
     * @param context the aggregate type
     * @param aggregateId id of the aggregate
     * @param position position of the event in its stream
     * @param stored the stored event
     * @param <E> type of events
     * @return the envelope, or empty if the event was skipped in lenient mode
     * @throws EventStoreException with fault {@code DESERIALIZATION} in strict mode
     */
    public <E extends DomainEvent> Optional<EventEnvelope<E>> decode(EventContext<?, E, ?, ?, ?> context,
            String aggregateId, long position, SerializedEvent stored) throws EventStoreException {
        String streamName = StreamNames.streamName(context.contextName(), aggregateId);
        Optional<Class<? extends E>> type = context.eventTypes().lookup(stored.getType());
        if (!type.isPresent()) {
            if (strict) {
                throw EventStoreException.unknownType(streamName, stored.getType(), position);
            }
            logger.error("{} Skipping event {} of unknown type {}", streamName, position, stored.getType());
            return Optional.empty();
        }
        try {
            Map<String, String> meta = serialization.deserializeMetadata(stored.getMetadata());
            int payloadVersion = Integer.parseInt(meta.getOrDefault(PAYLOAD_VERSION, "1"));
            E data = serialization.deserialize(type.get(), payloadVersion, stored.getPayload());
            if (data == null) {
                throw new IOException("Payload deserialized to null");
            }
            EventMetadata metadata = EventMetadata.builder()
                    .timestamp(meta.containsKey(TIMESTAMP) ? Instant.parse(meta.get(TIMESTAMP)) : Instant.EPOCH)
                    .causationId(Optional.ofNullable(meta.get(CAUSATION_ID)))
                    .correlationId(Optional.ofNullable(meta.get(CORRELATION_ID)))
                    .build();
            return Optional.of(new EventEnvelope<>(stored.getEventId(), context.contextName(), aggregateId, position,
                metadata, data));
        } catch (IOException | RuntimeException e) {
            if (strict) {
                throw EventStoreException.undecodable(streamName, position, e);
            }
            logger.error("{} Could not deserialize event {}", streamName, position, e);
            return Optional.empty();
        }
    }
}
