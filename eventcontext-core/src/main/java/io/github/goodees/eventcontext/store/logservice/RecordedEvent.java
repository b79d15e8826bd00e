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

import io.github.goodees.eventcontext.core.store.SerializedEvent;

/**
 * Event read from a log service stream, with its revision.
 */
public final class RecordedEvent {
    private final long revision;
    private final SerializedEvent event;

    public RecordedEvent(long revision, SerializedEvent event) {
        this.revision = revision;
        this.event = event;
    }

    public long getRevision() {
        return revision;
    }

    public SerializedEvent getEvent() {
        return event;
    }

    @Override
    public String toString() {
        return "RecordedEvent{" + revision + " " + event + '}';
    }
}
