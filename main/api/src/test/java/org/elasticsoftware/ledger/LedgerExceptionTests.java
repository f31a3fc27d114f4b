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

package org.elasticsoftware.ledger;

import org.elasticsoftware.ledger.store.EventStoreConflictException;
import org.elasticsoftware.ledger.store.StoreContentionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LedgerExceptionTests {

    @Test
    public void testLedgerExceptionCarriesAggregate() {
        TestLedgerException exception = new TestLedgerException("Wallet", "wallet-123");

        assertEquals("Wallet", exception.getAggregateName());
        assertEquals("wallet-123", exception.getAggregateId());
        assertInstanceOf(RuntimeException.class, exception);
    }

    @Test
    public void testEventStoreConflictException() {
        EventStoreConflictException exception = new EventStoreConflictException("Identity", "identity-1", 0L, 2L);

        assertEquals(0L, exception.getExpectedGeneration());
        assertEquals(2L, exception.getActualGeneration());
        assertEquals("Identity", exception.getAggregateName());
        assertTrue(exception.getMessage().contains("identity-1"));
    }

    @Test
    public void testStoreContentionExceptionKeepsCause() {
        IllegalStateException cause = new IllegalStateException("lock timeout");
        StoreContentionException exception = new StoreContentionException("busy", "Wallet", null, cause);

        assertSame(cause, exception.getCause());
        assertNull(exception.getAggregateId());
    }

    static class TestLedgerException extends LedgerException {
        public TestLedgerException(String aggregateName, String aggregateId) {
            super("test", aggregateName, aggregateId);
        }
    }
}
