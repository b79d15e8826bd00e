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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * Event in the form it is handed to a backend: id, type name, serialized payload and serialized metadata.
 */
public final class SerializedEvent {
    private final UUID eventId;
    private final String type;
    private final String payload;
    private final String metadata;

    @JsonCreator
    public SerializedEvent(@JsonProperty("eventId") UUID eventId, @JsonProperty("type") String type,
            @JsonProperty("payload") String payload, @JsonProperty("metadata") String metadata) {
        this.eventId = Objects.requireNonNull(eventId);
        this.type = Objects.requireNonNull(type);
        this.payload = payload;
        this.metadata = metadata;
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getType() {
        return type;
    }

    public String getPayload() {
        return payload;
    }

    public String getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SerializedEvent that = (SerializedEvent) o;
        return eventId.equals(that.eventId) && type.equals(that.type) && Objects.equals(payload, that.payload)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, type, payload, metadata);
    }

    @Override
    public String toString() {
        return "SerializedEvent{" + type + " " + eventId + '}';
    }
}
