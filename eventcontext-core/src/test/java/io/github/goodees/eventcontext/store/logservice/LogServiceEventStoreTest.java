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

import io.github.goodees.eventcontext.core.Appended;
import io.github.goodees.eventcontext.core.PreparedEvents;
import io.github.goodees.eventcontext.core.Rehydrated;
import io.github.goodees.eventcontext.core.store.EventStore;
import io.github.goodees.eventcontext.core.store.EventStoreContract;
import io.github.goodees.eventcontext.core.store.EventStoreException;
import io.github.goodees.eventcontext.core.store.JacksonSerialization;
import io.github.goodees.eventcontext.core.store.SerializedEvent;
import io.github.goodees.eventcontext.example.truck.TruckAddedEvent;
import io.github.goodees.eventcontext.example.truck.TruckCommand;
import io.github.goodees.eventcontext.example.truck.TruckEvent;
import io.github.goodees.eventcontext.example.truck.TruckFleet;
import org.junit.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class LogServiceEventStoreTest extends EventStoreContract<StreamRevision> {
    private InMemoryLogServiceClient client;

    @Override
    protected EventStore<StreamRevision> createStore() {
        client = new InMemoryLogServiceClient();
        return new LogServiceEventStore(client);
    }

    @Override
    protected StreamRevision positionAfter(long eventCount) {
        return eventCount == 0 ? StreamRevision.NO_STREAM : StreamRevision.of(eventCount - 1);
    }

    private String streamName() {
        return "Trucks-" + fleet();
    }

    private SerializedEvent foreignEvent() {
        return new SerializedEvent(UUID.randomUUID(), "TruckScrapped", "{\"truckId\":\"truck-1\"}", "{}");
    }

    @Test
    public void first_event_has_revision_zero() throws EventStoreException {
        Appended<TruckEvent, StreamRevision> result = store.execute(trucks, fleet(), TruckCommand.addTruck("T1"),
            services);
        assertEquals(0L, result.last().get().getPosition());
        assertEquals(StreamRevision.of(0), result.getPosition());
    }

    @Test
    public void unknown_event_type_fails_strict_store() throws EventStoreException {
        addTruck("T1");
        client.write(streamName(), foreignEvent());
        try {
            store.load(trucks, fleet());
            fail("Strict store should not skip unknown events");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.DESERIALIZATION, e.getFault());
        }
    }

    @Test
    public void unknown_event_type_is_skipped_by_lenient_store() throws EventStoreException {
        LogServiceEventStore lenient = new LogServiceEventStore(client, new JacksonSerialization(), false,
            Clock.systemUTC());
        addTruck("T1");
        client.write(streamName(), foreignEvent());
        lenient.execute(trucks, fleet(), TruckCommand.addTruck("T2"), services);

        Rehydrated<TruckFleet, StreamRevision> loaded = lenient.load(trucks, fleet());
        assertEquals(2, loaded.getState().size());
        assertEquals(2, loaded.getEventCount());
        assertEquals(StreamRevision.of(2), loaded.getPosition());
    }

    @Test
    public void corrupted_payload_fails_strict_store() throws EventStoreException {
        client.write(streamName(), new SerializedEvent(UUID.randomUUID(), "TruckAdded", "{not json", "{}"));
        try {
            store.load(trucks, fleet());
            fail("Payload cannot be read");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.DESERIALIZATION, e.getFault());
        }
    }

    @Test
    public void unreachable_log_service_is_unavailable() throws EventStoreException {
        addTruck("T1");
        client.failWith(LogServiceException.unavailable(streamName(), new IOException("connection refused")));
        try {
            store.load(trucks, fleet());
            fail("Log service is down");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.STORE_UNAVAILABLE, e.getFault());
        }
        try {
            store.append(trucks, fleet(), PreparedEvents.of(new TruckAddedEvent("x", "X")),
                StreamRevision.of(0));
            fail("Log service is down");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.STORE_UNAVAILABLE, e.getFault());
            assertTrue(e.getCause() instanceof LogServiceException);
        }
    }
}
