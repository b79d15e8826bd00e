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

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one stored event together with its storage metadata.
 *
 * <p>The type name is captured from the payload when the envelope is created and is never recomputed. The position
 * is the backend-native offset of this event in its stream; it is only meaningful for the store that produced the
 * envelope.</p>
 *
 * @param <E> type of the payload
 */
public final class EventEnvelope<E extends DomainEvent> {
    private final UUID eventId;
    private final String context;
    private final String aggregateId;
    private final String eventType;
    private final long position;
    private final EventMetadata metadata;
    private final E data;

    public EventEnvelope(UUID eventId, String context, String aggregateId, long position, EventMetadata metadata,
            E data) {
        this.eventId = Objects.requireNonNull(eventId);
        this.context = Objects.requireNonNull(context);
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.data = Objects.requireNonNull(data);
        this.eventType = data.getType();
        this.position = position;
        this.metadata = Objects.requireNonNull(metadata);
    }

    public UUID getEventId() {
        return eventId;
    }

    /**
     * Name of the aggregate type that owns the event.
     * @return the context name
     * @see EventContext#contextName()
     */
    public String getContext() {
        return context;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getEventType() {
        return eventType;
    }

    public long getPosition() {
        return position;
    }

    public EventMetadata getMetadata() {
        return metadata;
    }

    public E getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EventEnvelope<?> that = (EventEnvelope<?>) o;
        return position == that.position && eventId.equals(that.eventId) && context.equals(that.context)
                && aggregateId.equals(that.aggregateId) && eventType.equals(that.eventType)
                && metadata.equals(that.metadata) && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, context, aggregateId, eventType, position);
    }

    @Override
    public String toString() {
        return "EventEnvelope{" + context + "-" + aggregateId + "@" + position + ", type=" + eventType + ", data="
                + data + '}';
    }
}
