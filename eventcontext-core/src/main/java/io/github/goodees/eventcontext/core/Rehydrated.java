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

/**
 * State of an aggregate rebuilt from its stream, together with the position of the last event read.
 *
 * @param <S> type of state
 * @param <P> position type of the store
 */
public final class Rehydrated<S, P> {
    private final S state;
    private final P position;
    private final long eventCount;

    public Rehydrated(S state, P position, long eventCount) {
        this.state = state;
        this.position = Objects.requireNonNull(position);
        this.eventCount = eventCount;
    }

    public S getState() {
        return state;
    }

    public P getPosition() {
        return position;
    }

    /**
     * Number of events folded into the state, including those folded into a state this one continued from.
     * @return number of applied events
     */
    public long getEventCount() {
        return eventCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Rehydrated<?, ?> that = (Rehydrated<?, ?>) o;
        return eventCount == that.eventCount && Objects.equals(state, that.state) && position.equals(that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, position, eventCount);
    }

    @Override
    public String toString() {
        return "Rehydrated{" + "position=" + position + ", eventCount=" + eventCount + ", state=" + state + '}';
    }
}
