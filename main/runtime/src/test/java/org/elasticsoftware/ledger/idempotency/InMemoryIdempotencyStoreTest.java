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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryIdempotencyStoreTest {

    @Test
    void testGetWhenEmpty() {
        InMemoryIdempotencyStore store = new InMemoryIdempotencyStore();
        assertTrue(store.get(new IdempotencyKey("Wallet", "party-1", "ext-1")).isEmpty());
    }

    @Test
    void testFirstMappingWins() {
        InMemoryIdempotencyStore store = new InMemoryIdempotencyStore();
        IdempotencyKey key = new IdempotencyKey("Wallet", "party-1", "ext-1");

        assertEquals("id-1", store.getOrCreate(key, () -> "id-1"));
        assertEquals("id-1", store.getOrCreate(key, () -> "id-2"));
        assertEquals("id-1", store.get(key).orElseThrow());
    }

    @Test
    void testKeysAreScopedByKindAndOwner() {
        InMemoryIdempotencyStore store = new InMemoryIdempotencyStore();

        store.getOrCreate(new IdempotencyKey("Wallet", "party-1", "ext-1"), () -> "wallet");
        store.getOrCreate(new IdempotencyKey("Identity", "party-1", "ext-1"), () -> "identity");
        store.getOrCreate(new IdempotencyKey("Wallet", "party-2", "ext-1"), () -> "other-party");

        assertEquals("wallet", store.get(new IdempotencyKey("Wallet", "party-1", "ext-1")).orElseThrow());
        assertEquals("identity", store.get(new IdempotencyKey("Identity", "party-1", "ext-1")).orElseThrow());
        assertEquals("other-party", store.get(new IdempotencyKey("Wallet", "party-2", "ext-1")).orElseThrow());
    }

    @Test
    void testConcurrentCallersResolveTheSameId() {
        InMemoryIdempotencyStore store = new InMemoryIdempotencyStore();
        IdempotencyKey key = new IdempotencyKey("Wallet", "party-1", "ext-1");
        AtomicInteger generated = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<String>> futures = IntStream.range(0, 32)
                    .mapToObj(i -> CompletableFuture.supplyAsync(
                            () -> store.getOrCreate(key, () -> "id-" + generated.incrementAndGet()), executor))
                    .toList();
            List<String> ids = futures.stream().map(CompletableFuture::join).distinct().toList();
            assertEquals(1, ids.size());
            assertEquals(1, generated.get());
        } finally {
            executor.shutdownNow();
        }
    }
}
