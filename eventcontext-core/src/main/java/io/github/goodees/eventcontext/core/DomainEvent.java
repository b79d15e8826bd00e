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

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Payload of a fact that became true for a single aggregate instance.
 *
 * <p>Every {@link EventContext} defines its own closed set of event classes, registered in its {@link EventTypes}.
 * Payloads must be immutable. Storage metadata (position, timestamp, causation) is kept outside of the payload in
 * {@link EventEnvelope}.</p>
 */
public interface DomainEvent {
    /**
     * The type of event. For every context this must uniquely identify the event class, as it is stored next to
     * the payload and used to pick the class during deserialization.
     * @return textual description of the type of event, uses class name by default, stripped from suffix Event
     */
    @JsonIgnore
    default String getType() {
        return EventTypes.defaultTypeName(getClass());
    }
}
