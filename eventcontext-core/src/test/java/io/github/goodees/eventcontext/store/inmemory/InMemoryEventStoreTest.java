package io.github.goodees.eventcontext.store.inmemory;

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

import io.github.goodees.eventcontext.core.Appended;
import io.github.goodees.eventcontext.core.store.EventStore;
import io.github.goodees.eventcontext.core.store.EventStoreContract;
import io.github.goodees.eventcontext.core.store.EventStoreException;
import io.github.goodees.eventcontext.example.truck.TruckCommand;
import io.github.goodees.eventcontext.example.truck.TruckEvent;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class InMemoryEventStoreTest extends EventStoreContract<Long> {
    static final Instant NOW = Instant.parse("2017-06-01T10:15:30Z");

    @Override
    protected EventStore<Long> createStore() {
        return new InMemoryEventStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Override
    protected Long positionAfter(long eventCount) {
        return eventCount;
    }

    @Test
    public void first_event_has_position_one() throws EventStoreException {
        Appended<TruckEvent, Long> result = store.execute(trucks, fleet(), TruckCommand.addTruck("T1"), services);
        assertEquals("TruckAdded", result.last().get().getEventType());
        assertEquals(1L, result.last().get().getPosition());
        assertEquals(Long.valueOf(1), result.getPosition());
        assertEquals(NOW, result.last().get().getMetadata().getTimestamp());
    }

    @Test
    public void expecting_empty_stream_after_first_event_conflicts() throws EventStoreException {
        String id = addTruck("T1");
        try {
            store.execute(trucks, fleet(), TruckCommand.updateTruck(id, "T2"), services, 0L);
            fail("Position 0 is stale");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CONCURRENCY_CONFLICT, e.getFault());
        }
    }

    @Test
    public void streams_are_counted_and_cleared() throws EventStoreException {
        InMemoryEventStore memory = (InMemoryEventStore) store;
        addTruck("T1");
        store.execute(trucks, fleet() + "-2", TruckCommand.addTruck("T1"), services);
        assertEquals(2, memory.streamCount());
        memory.clear();
        assertEquals(0, memory.streamCount());
        assertEquals(0, store.load(trucks, fleet()).getEventCount());
    }
}
