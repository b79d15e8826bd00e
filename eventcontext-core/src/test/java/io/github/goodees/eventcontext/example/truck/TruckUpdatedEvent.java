package io.github.goodees.eventcontext.example.truck;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class TruckUpdatedEvent implements TruckEvent {
    private final String truckId;
    private final String name;

    @JsonCreator
    public TruckUpdatedEvent(@JsonProperty("truckId") String truckId, @JsonProperty("name") String name) {
        this.truckId = truckId;
        this.name = name;
    }

    @Override
    public String getTruckId() {
        return truckId;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TruckUpdatedEvent)) {
            return false;
        }
        TruckUpdatedEvent that = (TruckUpdatedEvent) o;
        return Objects.equals(truckId, that.truckId) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(truckId, name);
    }

    @Override
    public String toString() {
        return "TruckUpdated{" + truckId + ", " + name + '}';
    }
}
