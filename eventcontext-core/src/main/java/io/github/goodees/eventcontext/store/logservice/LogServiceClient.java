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

import io.github.goodees.eventcontext.core.store.SerializedEvent;

import java.util.List;

/**
 * Client of a log structured event store service, such as EventStoreDB. Implementations translate their transport's
 * failures into {@link LogServiceException}.
 */
public interface LogServiceClient {

    /**
     * Read a stream forwards.
     * @param streamName name of the stream
     * @param after return only events with revision higher than this
     * @return events in revision order, empty list if the stream does not exist
     * @throws LogServiceException when the service cannot be reached
     */
    List<RecordedEvent> readStream(String streamName, StreamRevision after) throws LogServiceException;

    /**
     * Atomically append events to a stream.
     * @param streamName name of the stream
     * @param expectedRevision revision the stream must be at, {@link StreamRevision#NO_STREAM} if it may not exist
     *                         yet, {@code null} for any revision
     * @param events events to append
     * @return revision of the last appended event
     * @throws LogServiceException with {@code WRONG_EXPECTED_REVISION} when the stream is at a different revision
     */
    StreamRevision appendToStream(String streamName, StreamRevision expectedRevision, List<SerializedEvent> events)
            throws LogServiceException;
}
