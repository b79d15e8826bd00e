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
 * Aggregate definitions and the records they exchange with event stores.
 *
 * <p>An aggregate type is described by an {@link io.github.goodees.eventcontext.core.EventContext}: a decision
 * function turning a command into events, and a fold function rebuilding state from stored
 * {@link io.github.goodees.eventcontext.core.EventEnvelope envelopes}. The context never touches storage, the same
 * definition runs against any {@link io.github.goodees.eventcontext.core.store.EventStore}.</p>
 *
 * <p>Immutable values of this package hide their generated implementation behind the abstract type.</p>
 */
@Value.Style(overshadowImplementation = true,
        optionalAcceptNullable = true,
        jdkOnly = true,
        get = { "get*", "is*" },
        defaults = @Value.Immutable(copy = false),
        visibility = Value.Style.ImplementationVisibility.PACKAGE)
package io.github.goodees.eventcontext.core;

import org.immutables.value.Value;
