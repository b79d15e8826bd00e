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

import java.util.Objects;

/**
 * Document body together with the version stored alongside it.
 */
public final class VersionedDocument {
    private final String key;
    private final long version;
    private final String body;

    public VersionedDocument(String key, long version, String body) {
        this.key = Objects.requireNonNull(key);
        this.version = version;
        this.body = body;
    }

    public String getKey() {
        return key;
    }

    public long getVersion() {
        return version;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "VersionedDocument{" + key + "@" + version + '}';
    }
}
