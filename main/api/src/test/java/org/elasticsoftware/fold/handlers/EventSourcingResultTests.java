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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class EventSourcingResultTests {
    private static final String ACCOUNT_ID = "d43a3afc-3e5a-11ed-b878-0242ac120002";

    private final EventSourcingHandler<AccountState, AccountEvent> handler = EventSourcingHandlerBuilder.<AccountState, AccountEvent>builder()
            .withEventAndStateHandler(DepositedEvent.class, OpenAccountState.class,
                    (state, event) -> new OpenAccountState(state.id(), state.balance().add(event.amount())))
            .build();

    @Test
    public void testTryApplyReturnsAppliedState() {
        EventSourcingResult<AccountState> result = handler.tryApply(
                new OpenAccountState(ACCOUNT_ID, BigDecimal.TEN),
                new DepositedEvent(ACCOUNT_ID, BigDecimal.ONE));

        assertTrue(result.isApplied());
        assertInstanceOf(EventSourcingResult.Applied.class, result);
        assertEquals(new OpenAccountState(ACCOUNT_ID, new BigDecimal("11")), result.orElseThrow());
    }

    @Test
    public void testTryApplyReturnsUnmatchedWithoutThrowing() {
        EventSourcingResult<AccountState> result = handler.tryApply(
                new ClosedAccountState(ACCOUNT_ID),
                new DepositedEvent(ACCOUNT_ID, BigDecimal.ONE));

        assertFalse(result.isApplied());
        EventSourcingResult.Unmatched<AccountState> unmatched = assertInstanceOf(EventSourcingResult.Unmatched.class, result);
        assertEquals(DepositedEvent.class, unmatched.eventClass());
        assertEquals(ClosedAccountState.class, unmatched.stateClass());
        UnmatchedCaseException exception = assertThrows(UnmatchedCaseException.class, result::orElseThrow);
        assertEquals(DepositedEvent.class, exception.getEventClass());
    }

    @Test
    public void testDefaultTryApplyOnLambdaHandler() {
        EventSourcingHandler<AccountState, AccountEvent> lambda = (state, event) -> {
            throw new UnmatchedCaseException(event.getClass(), null);
        };

        EventSourcingResult<AccountState> result = lambda.tryApply(null, new ClosedEvent(ACCOUNT_ID));

        EventSourcingResult.Unmatched<AccountState> unmatched = assertInstanceOf(EventSourcingResult.Unmatched.class, result);
        assertEquals(ClosedEvent.class, unmatched.eventClass());
        assertNull(unmatched.stateClass());
    }
}
