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
import io.github.goodees.eventcontext.core.EventEnvelope;

import java.util.List;

/**
 * Events read from a stream in append order, and the position of the stream's tail at the time of reading.
 */
public final class StreamSlice<E extends DomainEvent, P> {
    private final List<EventEnvelope<E>> events;
    private final P tail;

    public StreamSlice(List<EventEnvelope<E>> events, P tail) {
        this.events = events;
        this.tail = tail;
    }

    public List<EventEnvelope<E>> getEvents() {
        return events;
    }

    public P getTail() {
        return tail;
    }
}
