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
import io.github.goodees.eventcontext.core.EventMetadata;
import io.github.goodees.eventcontext.example.truck.TruckAddedEvent;
import io.github.goodees.eventcontext.example.truck.TruckEvent;
import io.github.goodees.eventcontext.example.truck.TruckFleetContext;
import io.github.goodees.eventcontext.example.truck.TruckUpdatedEvent;
import org.junit.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

public class EventCodecTest {
    private static final Instant TIME = Instant.parse("2017-03-04T05:06:07.123Z");

    private final TruckFleetContext trucks = new TruckFleetContext();
    private final JacksonSerialization serialization = new JacksonSerialization();
    private final EventCodec strict = new EventCodec(serialization, true);
    private final EventCodec lenient = new EventCodec(serialization, false);

    private final EventMetadata metadata = EventMetadata.builder()
            .timestamp(TIME)
            .causationId("cmd-1")
            .build();

    @Test
    public void metadata_is_stored_as_json_map() throws Exception {
        SerializedEvent stored = strict.encode("Trucks-f", UUID.randomUUID(), new TruckAddedEvent("a", "A"), metadata);
        assertEquals("TruckAdded", stored.getType());
        Map<String, String> meta = serialization.deserializeMetadata(stored.getMetadata());
        assertEquals("2017-03-04T05:06:07.123Z", meta.get(EventCodec.TIMESTAMP));
        assertEquals("cmd-1", meta.get(EventCodec.CAUSATION_ID));
        assertEquals("1", meta.get(EventCodec.PAYLOAD_VERSION));
        assertFalse(meta.containsKey(EventCodec.CORRELATION_ID));
        assertThat(stored.getPayload(), containsString("\"truckId\":\"a\""));
    }

    @Test
    public void event_type_is_kept_out_of_the_payload() throws Exception {
        SerializedEvent stored = strict.encode("Trucks-f", UUID.randomUUID(), new TruckUpdatedEvent("a", "B"),
            metadata);
        assertEquals("TruckUpdated", stored.getType());
        assertThat(stored.getPayload(), not(containsString("\"type\"")));
        assertThat(stored.getPayload(), not(containsString("TruckUpdated")));
    }

    @Test
    public void decoded_envelope_carries_identity_and_metadata() throws Exception {
        UUID id = UUID.randomUUID();
        SerializedEvent stored = strict.encode("Trucks-f", id, new TruckAddedEvent("a", "A"), metadata);
        EventEnvelope<TruckEvent> envelope = strict.decode(trucks, "f", 7, stored).get();
        assertEquals(id, envelope.getEventId());
        assertEquals(7, envelope.getPosition());
        assertEquals("f", envelope.getAggregateId());
        assertEquals(new TruckAddedEvent("a", "A"), envelope.getData());
        assertEquals(metadata, envelope.getMetadata());
    }

    @Test
    public void missing_metadata_defaults_to_epoch() throws Exception {
        SerializedEvent stored = new SerializedEvent(UUID.randomUUID(), "TruckAdded",
            "{\"truckId\":\"a\",\"name\":\"A\",\"color\":\"red\"}", null);
        EventEnvelope<TruckEvent> envelope = strict.decode(trucks, "f", 1, stored).get();
        assertEquals(Instant.EPOCH, envelope.getMetadata().getTimestamp());
        assertEquals("A", ((TruckAddedEvent) envelope.getData()).getName());
    }

    @Test
    public void unknown_type_is_skipped_only_when_lenient() throws Exception {
        SerializedEvent stored = new SerializedEvent(UUID.randomUUID(), "TruckScrapped", "{}", "{}");
        assertEquals(Optional.empty(), lenient.decode(trucks, "f", 1, stored));
        try {
            strict.decode(trucks, "f", 1, stored);
            fail("Unknown type in strict mode");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.DESERIALIZATION, e.getFault());
            assertThat(e.getMessage(), containsString("TruckScrapped"));
        }
    }

    @Test
    public void broken_payload_is_skipped_only_when_lenient() throws Exception {
        SerializedEvent stored = new SerializedEvent(UUID.randomUUID(), "TruckAdded", "null", "{}");
        assertEquals(Optional.empty(), lenient.decode(trucks, "f", 1, stored));
        try {
            strict.decode(trucks, "f", 1, stored);
            fail("Null payload in strict mode");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.DESERIALIZATION, e.getFault());
        }
    }

    @Test
    public void serialization_failure_is_programmatic_error() {
        EventCodec failing = new EventCodec(new JacksonSerialization() {
            @Override
            public String serialize(DomainEvent event) throws IOException {
                throw new IOException("cannot write");
            }
        }, true);
        try {
            failing.encode("Trucks-f", UUID.randomUUID(), new TruckAddedEvent("a", "A"), metadata);
            fail("Serializer fails");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
    }
}
