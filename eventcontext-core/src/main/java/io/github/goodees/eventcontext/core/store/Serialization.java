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

import java.io.IOException;
import java.util.Map;

/**
 * Common interface for serialization and deserialization of events into String payload.
 * <p>We expect that during lifetime of the project, the serialization scenarios might change. Whenever the serialized
 * object changes in incompatible manner, serialization should start using different unique payload version for it.</p>
 * <p>Payload version will be stored separately by the store, and will be provided to method
 * {@link #deserialize(Class, int, String)}. Usually an application writes into most recent payload version, however
 * needs to be able to read the past versions of the object.</p>
 */
public interface Serialization {
    /**
     * Determine version of payload to be used for serialization.
     * @param event object to be serialized
     * @return payload version.
     */
    int payloadVersion(DomainEvent event);

    /**
     * Serialize the event into a String payload.
     * @param event event to serialize
     * @return String serialization of the event
     * @throws IOException when event cannot be serialized
     */
    String serialize(DomainEvent event) throws IOException;

    /**
     * Deserialize a payload given its version. As noted above, serialization must support reading all past versions
     * of payloads.
     *
     * @param type class registered for the stored type name
     * @param payloadVersion the version of the payload as stored in the store
     * @param payload payload to deserialize
     * @param <E> type of event
     * @return deserialized event
     * @throws IOException when payload cannot be read
     */
    <E extends DomainEvent> E deserialize(Class<E> type, int payloadVersion, String payload) throws IOException;

    /**
     * Serialize flat metadata map.
     * @param metadata metadata entries
     * @return serialized form
     * @throws IOException when metadata cannot be serialized
     */
    String serializeMetadata(Map<String, String> metadata) throws IOException;

    /**
     * Read metadata written by {@link #serializeMetadata(Map)}.
     * @param metadata serialized form, may be null or empty for events without metadata
     * @return metadata entries
     * @throws IOException when metadata cannot be read
     */
    Map<String, String> deserializeMetadata(String metadata) throws IOException;
}
