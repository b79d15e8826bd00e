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

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class StreamNamesTest {

    @Test
    public void stream_name_joins_context_and_id() {
        assertEquals("Trucks-42", StreamNames.streamName("Trucks", "42"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void empty_aggregate_id_is_refused() {
        StreamNames.streamName("Trucks", "");
    }

    @Test(expected = NullPointerException.class)
    public void missing_context_is_refused() {
        StreamNames.streamName(null, "42");
    }
}
