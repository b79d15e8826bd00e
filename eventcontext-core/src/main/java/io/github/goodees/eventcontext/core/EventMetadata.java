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

import org.immutables.value.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage metadata of a single event.
 */
@Value.Immutable
public abstract class EventMetadata {

    /**
     * The time when the event was appended.
     * @return the instant of event creation
     */
    public abstract Instant getTimestamp();

    /**
     * Identifier of the message that caused the event, usually id of a command.
     * @return causation id, if supplied with the decision
     */
    public abstract Optional<String> getCausationId();

    /**
     * Identifier shared by all messages of one business transaction.
     * @return correlation id, if supplied with the decision
     */
    public abstract Optional<String> getCorrelationId();

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableEventMetadata.Builder {

    }
}
