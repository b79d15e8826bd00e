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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.eventcontext.core.DomainEvent;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON serialization of events with Jackson. All events are written with payload version 1.
 * <p>Unknown properties are ignored, so that fields can be added to events without a new payload version.</p>
 */
public class JacksonSerialization implements Serialization {
    private static final TypeReference<LinkedHashMap<String, String>> METADATA_TYPE =
            new TypeReference<LinkedHashMap<String, String>>() {
            };

    private final ObjectMapper mapper;

    public JacksonSerialization() {
        this(createMapper());
    }

    public JacksonSerialization(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public int payloadVersion(DomainEvent event) {
        return 1;
    }

    @Override
    public String serialize(DomainEvent event) throws IOException {
        return mapper.writeValueAsString(event);
    }

    @Override
    public <E extends DomainEvent> E deserialize(Class<E> type, int payloadVersion, String payload)
            throws IOException {
        return mapper.readValue(payload, type);
    }

    @Override
    public String serializeMetadata(Map<String, String> metadata) throws IOException {
        return mapper.writeValueAsString(metadata);
    }

    @Override
    public Map<String, String> deserializeMetadata(String metadata) throws IOException {
        if (metadata == null || metadata.isEmpty()) {
            return Collections.emptyMap();
        }
        return mapper.readValue(metadata, METADATA_TYPE);
    }
}
