package io.github.goodees.eventcontext.store.esdb;

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

import com.eventstore.dbclient.AppendToStreamOptions;
import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.EventDataBuilder;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.EventStoreDBClientSettings;
import com.eventstore.dbclient.EventStoreDBConnectionString;
import com.eventstore.dbclient.ExpectedRevision;
import com.eventstore.dbclient.ReadResult;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.ResolvedEvent;
import com.eventstore.dbclient.StreamNotFoundException;
import com.eventstore.dbclient.WriteResult;
import com.eventstore.dbclient.WrongExpectedVersionException;
import io.github.goodees.eventcontext.core.store.SerializedEvent;
import io.github.goodees.eventcontext.store.logservice.LogServiceClient;
import io.github.goodees.eventcontext.store.logservice.LogServiceException;
import io.github.goodees.eventcontext.store.logservice.RecordedEvent;
import io.github.goodees.eventcontext.store.logservice.StreamRevision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * {@link LogServiceClient} talking to EventStoreDB over gRPC.
 *
 * <p>Payload and metadata are stored as JSON, the event type of the log service record is the event type name.
 * Stream revisions map one to one to {@link StreamRevision}; a missing stream reads as empty.</p>
 */
public class EventStoreDbLogServiceClient implements LogServiceClient, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventStoreDbLogServiceClient.class);

    private final EventStoreDBClient client;

    public EventStoreDbLogServiceClient(EventStoreDBClient client) {
        this.client = client;
    }

    /**
     * Connect to EventStoreDB.
     * @param connectionString connection string, e. g. {@code esdb://localhost:2113?tls=false}
     * @return new client owning the connection
     */
    public static EventStoreDbLogServiceClient connect(String connectionString) {
        EventStoreDBClientSettings settings = EventStoreDBConnectionString.parseOrThrow(connectionString);
        return new EventStoreDbLogServiceClient(EventStoreDBClient.create(settings));
    }

    @Override
    public List<RecordedEvent> readStream(String streamName, StreamRevision after) throws LogServiceException {
        ReadResult result;
        try {
            result = client.readStream(streamName, readOptions(after)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw LogServiceException.unavailable(streamName, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof StreamNotFoundException) {
                return new ArrayList<>();
            }
            throw LogServiceException.unavailable(streamName, e.getCause());
        }
        List<RecordedEvent> events = new ArrayList<>();
        for (ResolvedEvent resolved : result.getEvents()) {
            com.eventstore.dbclient.RecordedEvent recorded = resolved.getOriginalEvent();
            if (after != null && recorded.getRevision() <= after.toRawLong()) {
                continue;
            }
            events.add(new RecordedEvent(recorded.getRevision(), new SerializedEvent(recorded.getEventId(),
                recorded.getEventType(), text(recorded.getEventData()), text(recorded.getUserMetadata()))));
        }
        return events;
    }

    @Override
    public StreamRevision appendToStream(String streamName, StreamRevision expectedRevision,
            List<SerializedEvent> events) throws LogServiceException {
        EventData[] data = new EventData[events.size()];
        for (int i = 0; i < data.length; i++) {
            SerializedEvent event = events.get(i);
            data[i] = EventDataBuilder.json(event.getEventId(), event.getType(), bytes(event.getPayload()))
                    .metadataAsBytes(bytes(event.getMetadata()))
                    .build();
        }
        AppendToStreamOptions options = AppendToStreamOptions.get().expectedRevision(expected(expectedRevision));
        try {
            WriteResult result = client.appendToStream(streamName, options, data).get();
            return StreamRevision.fromRawLong(result.getNextExpectedRevision().toRawLong());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw LogServiceException.unavailable(streamName, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof WrongExpectedVersionException) {
                logger.debug("Append to {} rejected, expected revision {}", streamName, expectedRevision);
                throw LogServiceException.wrongExpectedRevision(streamName, expectedRevision, e.getCause());
            }
            throw LogServiceException.unavailable(streamName, e.getCause());
        }
    }

    static ReadStreamOptions readOptions(StreamRevision after) {
        long first = firstRevisionAfter(after);
        ReadStreamOptions options = ReadStreamOptions.get().forwards();
        return first == 0 ? options.fromStart() : options.fromRevision(first);
    }

    static long firstRevisionAfter(StreamRevision after) {
        return after == null || after.isNoStream() ? 0 : after.toRawLong() + 1;
    }

    static ExpectedRevision expected(StreamRevision revision) {
        if (revision == null) {
            return ExpectedRevision.any();
        } else if (revision.isNoStream()) {
            return ExpectedRevision.noStream();
        } else {
            return ExpectedRevision.expectedRevision(revision.toRawLong());
        }
    }

    private static byte[] bytes(String text) {
        return text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] bytes) {
        return bytes == null || bytes.length == 0 ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public void close() throws Exception {
        client.shutdown();
    }
}
