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

package org.elasticsoftware.fold.aggregate;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.fold.events.DomainEvent;
import org.elasticsoftware.fold.handlers.EventSourcingHandler;
import org.elasticsoftware.fold.handlers.UnmatchedCaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds DomainEvents into the state of a single Aggregate type, both when replaying the event log
 * and right after a new event has been persisted. Stateless, can be shared between threads.
 */
public final class AggregateStateFolder<S extends AggregateState> {
    private static final Logger log = LoggerFactory.getLogger(AggregateStateFolder.class);
    private final String aggregateName;
    private final EventSourcingHandler<S, DomainEvent> eventSourcingHandler;
    private final int replayLogInterval;

    public AggregateStateFolder(String aggregateName,
                                EventSourcingHandler<S, DomainEvent> eventSourcingHandler,
                                int replayLogInterval) {
        if (replayLogInterval <= 0) {
            throw new IllegalArgumentException("replayLogInterval must be positive, got " + replayLogInterval);
        }
        this.aggregateName = aggregateName;
        this.eventSourcingHandler = eventSourcingHandler;
        this.replayLogInterval = replayLogInterval;
    }

    /**
     * Replays the events in order, starting from {@code initialState} ({@code null} if the aggregate
     * does not exist yet).
     *
     * @throws UnmatchedCaseException if one of the events cannot be applied, replay stops at that event
     */
    public S replay(S initialState, @NotNull Iterable<? extends DomainEvent> events) {
        S state = initialState;
        long count = 0;
        for (DomainEvent event : events) {
            state = apply(state, event);
            count++;
            if (count % replayLogInterval == 0) {
                log.debug("Replayed {} events for {} Aggregate with id {}", count, aggregateName, event.getAggregateId());
            }
        }
        log.debug("Finished replay of {} events for {} Aggregate", count, aggregateName);
        return state;
    }

    public S applyPersisted(S currentState, @NotNull DomainEvent event) {
        return apply(currentState, event);
    }

    private S apply(S state, DomainEvent event) {
        try {
            S nextState = eventSourcingHandler.apply(state, event);
            log.trace("Applied {} to {} Aggregate with id {}", event.getClass().getSimpleName(), aggregateName, event.getAggregateId());
            return nextState;
        } catch (UnmatchedCaseException e) {
            log.error("No EventSourcingHandler found on {} Aggregate for DomainEvent {} and state {}",
                    aggregateName,
                    e.getEventClass().getName(),
                    e.getStateClass() != null ? e.getStateClass().getName() : "null");
            throw e;
        }
    }

    public String getAggregateName() {
        return aggregateName;
    }

    public EventSourcingHandler<S, DomainEvent> getEventSourcingHandler() {
        return eventSourcingHandler;
    }

    public int getReplayLogInterval() {
        return replayLogInterval;
    }
}
