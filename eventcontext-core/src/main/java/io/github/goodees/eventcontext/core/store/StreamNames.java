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

import java.util.Objects;

/**
 * Physical identity of aggregate streams.
 */
public final class StreamNames {
    public static final String SEPARATOR = "-";

    private StreamNames() {

    }

    /**
     * Name of a stream of one aggregate instance.
     * @param contextName the aggregate type
     * @param aggregateId id of the aggregate
     * @return {@code <contextName>-<aggregateId>}
     * @throws IllegalArgumentException if either part is empty
     */
    public static String streamName(String contextName, String aggregateId) {
        Objects.requireNonNull(contextName, "contextName");
        Objects.requireNonNull(aggregateId, "aggregateId");
        if (contextName.isEmpty() || aggregateId.isEmpty()) {
            throw new IllegalArgumentException("Context name and aggregate id may not be empty");
        }
        return contextName + SEPARATOR + aggregateId;
    }
}
