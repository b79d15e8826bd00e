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

/**
 * Revision of a log service stream: the 0-based revision of its last event, or {@link #NO_STREAM} when the stream
 * has no events.
 */
public final class StreamRevision implements Comparable<StreamRevision> {
    public static final StreamRevision NO_STREAM = new StreamRevision(-1);

    private final long value;

    private StreamRevision(long value) {
        this.value = value;
    }

    public static StreamRevision of(long revision) {
        if (revision < 0) {
            throw new IllegalArgumentException("Revision must not be negative, was " + revision);
        }
        return new StreamRevision(revision);
    }

    /**
     * Inverse of {@link #toRawLong()}.
     * @param raw revision, -1 for no stream
     * @return the revision
     */
    public static StreamRevision fromRawLong(long raw) {
        return raw < 0 ? NO_STREAM : of(raw);
    }

    public boolean isNoStream() {
        return value < 0;
    }

    public long toRawLong() {
        return value;
    }

    /**
     * Revision of the n-th event following this one.
     * @param n number of following events
     * @return advanced revision
     */
    public StreamRevision advance(long n) {
        return of(value + n);
    }

    @Override
    public int compareTo(StreamRevision o) {
        return Long.compare(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StreamRevision && ((StreamRevision) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isNoStream() ? "NoStream" : Long.toString(value);
    }
}
