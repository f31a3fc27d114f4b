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

package org.elasticsoftware.ledger.idempotency;

import org.elasticsoftware.ledger.store.IdempotencyKey;
import org.elasticsoftware.ledger.store.IdempotencyStore;
import org.elasticsoftware.ledger.store.StoreContentionException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IdempotencyResolverTest {

    @Test
    void testWithoutExternalIdEveryCallGetsANewId() {
        IdempotencyStore store = mock(IdempotencyStore.class);
        AtomicInteger counter = new AtomicInteger();
        IdempotencyResolver resolver = new IdempotencyResolver(store, () -> "id-" + counter.incrementAndGet());

        assertEquals("id-1", resolver.resolveId("Wallet", "party-1", null));
        assertEquals("id-2", resolver.resolveId("Wallet", "party-1", null));
        verifyNoInteractions(store);
    }

    @Test
    void testSameKeyResolvesToSameId() {
        IdempotencyResolver resolver = new IdempotencyResolver(new InMemoryIdempotencyStore());

        String first = resolver.resolveId("Wallet", "party-1", "ext-1");
        String second = resolver.resolveId("Wallet", "party-1", "ext-1");
        String otherOwner = resolver.resolveId("Wallet", "party-2", "ext-1");

        assertEquals(first, second);
        assertNotEquals(first, otherOwner);
        assertEquals(first, resolver.findId("Wallet", "party-1", "ext-1").orElseThrow());
        assertTrue(resolver.findId("Identity", "party-1", "ext-1").isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testContentionIsPropagated() {
        IdempotencyStore store = mock(IdempotencyStore.class);
        when(store.getOrCreate(eq(new IdempotencyKey("Wallet", "party-1", "ext-1")), any(Supplier.class)))
                .thenThrow(new StoreContentionException("locked", "Wallet", null));
        IdempotencyResolver resolver = new IdempotencyResolver(store);

        assertThrows(StoreContentionException.class, () -> resolver.resolveId("Wallet", "party-1", "ext-1"));
    }
}
