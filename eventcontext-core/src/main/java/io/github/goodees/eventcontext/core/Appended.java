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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a successful append: the stored envelopes and the new tail position of the stream.
 *
 * @param <E> type of events
 * @param <P> position type of the store
 */
public final class Appended<E extends DomainEvent, P> {
    private final List<EventEnvelope<E>> envelopes;
    private final P position;

    public Appended(List<EventEnvelope<E>> envelopes, P position) {
        this.envelopes = Collections.unmodifiableList(envelopes);
        this.position = Objects.requireNonNull(position);
    }

    public static <E extends DomainEvent, P> Appended<E, P> nothing(P position) {
        return new Appended<>(Collections.emptyList(), position);
    }

    public List<EventEnvelope<E>> getEnvelopes() {
        return envelopes;
    }

    /**
     * The last stored envelope, which for the common single event decisions is the only one.
     * @return last envelope, empty if nothing was appended
     */
    public Optional<EventEnvelope<E>> last() {
        return envelopes.isEmpty() ? Optional.empty() : Optional.of(envelopes.get(envelopes.size() - 1));
    }

    public P getPosition() {
        return position;
    }

    public boolean isEmpty() {
        return envelopes.isEmpty();
    }

    @Override
    public String toString() {
        return "Appended{" + "position=" + position + ", envelopes=" + envelopes + '}';
    }
}
