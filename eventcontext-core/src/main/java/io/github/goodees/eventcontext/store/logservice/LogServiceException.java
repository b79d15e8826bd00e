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
 * Failure reported by {@link LogServiceClient}.
 */
public class LogServiceException extends Exception {
    private final Reason reason;

    public enum Reason {
        WRONG_EXPECTED_REVISION, UNAVAILABLE
    }

    protected LogServiceException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public static LogServiceException wrongExpectedRevision(String streamName, StreamRevision expected,
            Throwable cause) {
        return new LogServiceException(Reason.WRONG_EXPECTED_REVISION, "Stream " + streamName
                + " is not at expected revision " + expected, cause);
    }

    public static LogServiceException unavailable(String streamName, Throwable cause) {
        return new LogServiceException(Reason.UNAVAILABLE, "Operation on stream " + streamName + " failed. "
                + (cause == null ? "" : cause.getMessage()), cause);
    }
}
