/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.fold.handlers;

import jakarta.validation.constraints.NotNull;

/**
 * Computes the next state from the current state and an event. {@code InputState} and {@code InputEvent}
 * are the (possibly narrowed) types the handler was registered for, {@code S} is the state type of the aggregate.
 */
@FunctionalInterface
public interface EventSourcingHandlerFunction<InputState, InputEvent, S> {
    S apply(InputState state, @NotNull InputEvent event);
}
