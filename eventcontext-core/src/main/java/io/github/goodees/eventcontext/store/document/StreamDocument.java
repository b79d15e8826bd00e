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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.goodees.eventcontext.core.store.SerializedEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Body of a document holding a whole stream. The n-th event of the list has position n.
 */
final class StreamDocument {
    private final String stream;
    private final List<SerializedEvent> events;

    @JsonCreator
    StreamDocument(@JsonProperty("stream") String stream, @JsonProperty("events") List<SerializedEvent> events) {
        this.stream = stream;
        this.events = events == null ? Collections.emptyList() : Collections.unmodifiableList(events);
    }

    static StreamDocument empty(String stream) {
        return new StreamDocument(stream, Collections.emptyList());
    }

    @JsonProperty("stream")
    String getStream() {
        return stream;
    }

    @JsonProperty("events")
    List<SerializedEvent> getEvents() {
        return events;
    }

    StreamDocument with(List<SerializedEvent> appended) {
        List<SerializedEvent> merged = new ArrayList<>(events.size() + appended.size());
        merged.addAll(events);
        merged.addAll(appended);
        return new StreamDocument(stream, merged);
    }
}
