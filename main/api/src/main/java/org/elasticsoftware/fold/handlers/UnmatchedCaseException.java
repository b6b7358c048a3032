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

import org.elasticsoftware.fold.FoldException;

public class UnmatchedCaseException extends FoldException {
    private final Class<?> eventClass;
    private final Class<?> stateClass;

    public UnmatchedCaseException(Class<?> eventClass, Class<?> stateClass) {
        super("No match found for event [" + eventClass + "] and state [" + stateClass + "]. " +
                "Has this event been stored using an EventAdapter?");
        this.eventClass = eventClass;
        this.stateClass = stateClass;
    }

    public Class<?> getEventClass() {
        return eventClass;
    }

    /**
     * @return the runtime class of the unmatched state, or {@code null} when the state was {@code null}
     */
    public Class<?> getStateClass() {
        return stateClass;
    }
}
