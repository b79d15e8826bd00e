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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * State of a fleet: trucks by their id.
 */
public final class TruckFleet {
    public static final TruckFleet EMPTY = new TruckFleet(Collections.emptyMap());

    private final Map<String, Truck> trucks;

    private TruckFleet(Map<String, Truck> trucks) {
        this.trucks = trucks;
    }

    public Map<String, Truck> getTrucks() {
        return trucks;
    }

    public Optional<Truck> truck(String id) {
        return Optional.ofNullable(trucks.get(id));
    }

    public int size() {
        return trucks.size();
    }

    TruckFleet with(Truck truck) {
        Map<String, Truck> copy = new LinkedHashMap<>(trucks);
        copy.put(truck.getId(), truck);
        return new TruckFleet(Collections.unmodifiableMap(copy));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TruckFleet && trucks.equals(((TruckFleet) o).trucks);
    }

    @Override
    public int hashCode() {
        return trucks.hashCode();
    }

    @Override
    public String toString() {
        return "TruckFleet" + trucks.values();
    }
}
