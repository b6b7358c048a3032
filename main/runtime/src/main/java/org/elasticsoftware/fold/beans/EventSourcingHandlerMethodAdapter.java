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

package org.elasticsoftware.fold.beans;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.fold.aggregate.Aggregate;
import org.elasticsoftware.fold.aggregate.AggregateState;
import org.elasticsoftware.fold.events.DomainEvent;
import org.elasticsoftware.fold.handlers.EventSourcingHandlerFunction;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

public class EventSourcingHandlerMethodAdapter<S extends AggregateState, E extends DomainEvent> implements EventSourcingHandlerFunction<S, E, S> {
    private final Aggregate<S> aggregate;
    private final Method adapterMethod;
    private final Class<E> domainEventClass;
    private final Class<S> stateClass;
    private final boolean create;

    public EventSourcingHandlerMethodAdapter(Aggregate<S> aggregate,
                                             Method adapterMethod,
                                             Class<E> domainEventClass,
                                             Class<S> stateClass,
                                             boolean create) {
        this.aggregate = aggregate;
        this.adapterMethod = adapterMethod;
        this.domainEventClass = domainEventClass;
        this.stateClass = stateClass;
        this.create = create;
    }

    @Override
    public S apply(S state, @NotNull E event) {
        try {
            return stateClass.cast(adapterMethod.invoke(aggregate, event, state));
        } catch (IllegalAccessException e) {
            throw new RuntimeException(e);
        } catch (InvocationTargetException e) {
            if (e.getCause() != null) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                } else {
                    throw new RuntimeException(e.getCause());
                }
            } else {
                throw new RuntimeException(e);
            }
        }
    }

    public Class<E> getDomainEventClass() {
        return domainEventClass;
    }

    public boolean isCreate() {
        return create;
    }

    @Override
    public String toString() {
        return aggregate.getName() + "." + adapterMethod.getName() + "(" + domainEventClass.getSimpleName() + ")";
    }
}
