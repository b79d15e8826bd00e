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

/**
 * Exception generated when an event store operation fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * The aggregate rejected the command. Nothing was written, the cause is the rejection.
         */
        DECISION_REJECTED,
        /**
         * The stream is not at expected position. Loading, deciding and appending needs to be repeated.
         */
        CONCURRENCY_CONFLICT,
        /**
         * A stored event cannot be turned into an event of the context. The stream cannot be used until the event
         * model is fixed.
         */
        DESERIALIZATION,
        /**
         * The backend cannot be reached or failed to complete the operation.
         */
        STORE_UNAVAILABLE,
        /**
         * The store was used in a way that never succeeds, e. g. with an event type the context doesn't declare.
         */
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isConflict() {
        return fault == Fault.CONCURRENCY_CONFLICT;
    }

    /**
     * Return the exception of the aggregate that rejected the command.
     * @param rejectionType the rejection type declared by the context
     * @param <X> the rejection type
     * @return the rejection
     * @throws IllegalStateException if this exception doesn't report a rejection of given type
     */
    public <X extends Exception> X getRejection(Class<X> rejectionType) {
        if (fault == Fault.DECISION_REJECTED && rejectionType.isInstance(getCause())) {
            return rejectionType.cast(getCause());
        }
        throw new IllegalStateException("Not a rejection of type " + rejectionType.getName() + ": " + getMessage(),
            this);
    }

    public static EventStoreException rejected(String streamName, Exception rejection) {
        return new EventStoreException(Fault.DECISION_REJECTED, "Command for " + streamName + " was rejected: "
                + rejection.getMessage(), rejection);
    }

    public static EventStoreException conflict(String streamName, Object expectedPosition, Object actualPosition) {
        return new EventStoreException(Fault.CONCURRENCY_CONFLICT, "Stream " + streamName + " expected at position "
                + expectedPosition + " is at position " + actualPosition, null);
    }

    public static EventStoreException conflict(String streamName, Object expectedPosition, Throwable cause) {
        return new EventStoreException(Fault.CONCURRENCY_CONFLICT, "Stream " + streamName + " is no longer at position "
                + expectedPosition, cause);
    }

    public static EventStoreException unknownType(String streamName, String type, long position) {
        return new EventStoreException(Fault.DESERIALIZATION, "Event of stream " + streamName + " at " + position
                + " has unknown type " + type, null);
    }

    public static EventStoreException undecodable(String streamName, long position, Throwable cause) {
        return new EventStoreException(Fault.DESERIALIZATION, "Event of stream " + streamName + " at " + position
                + " could not be deserialized. " + cause.getMessage(), cause);
    }

    public static EventStoreException unreadable(String streamName, Throwable cause) {
        return new EventStoreException(Fault.DESERIALIZATION, "Stream " + streamName + " could not be read. "
                + cause.getMessage(), cause);
    }

    public static EventStoreException unavailable(String streamName, Throwable cause) {
        return new EventStoreException(Fault.STORE_UNAVAILABLE, "Store of stream " + streamName + " failed. "
                + cause.getMessage(), cause);
    }

    public static EventStoreException unsupported(String context, Object event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type for context " + context
                + ": " + event, null);
    }

    public static EventStoreException serializationFailed(String streamName, Object event, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event " + event + " for stream " + streamName
                + " could not be serialized. " + cause.getMessage(), cause);
    }
}
