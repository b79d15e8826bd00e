package io.github.goodees.eventcontext.store.document;

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

import java.util.Optional;

/**
 * Client of a key-value document store with an optimistic lock on a version stored alongside each document.
 */
public interface DocumentStoreClient {

    /**
     * Read a document.
     * @param key document key
     * @return the document, empty if none is stored under the key
     * @throws DocumentStoreException when the store cannot be reached
     */
    Optional<VersionedDocument> get(String key) throws DocumentStoreException;

    /**
     * Store a document only if the stored version equals expected version.
     * @param key document key
     * @param expectedVersion version the stored document must have, 0 if it may not exist yet
     * @param newVersion version to store with the new body, greater than expected version
     * @param body new body
     * @return true if document was written, false if its version didn't match
     * @throws DocumentStoreException when the store cannot be reached
     */
    boolean put(String key, long expectedVersion, long newVersion, String body) throws DocumentStoreException;
}
