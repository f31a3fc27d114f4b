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
import org.elasticsoftware.ledger.store.StoreContentionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

public class RocksDBIdempotencyStoreTest {
    @TempDir
    Path baseDir;

    @Test
    public void testCreate() {
        try (RocksDBIdempotencyStore store = new RocksDBIdempotencyStore(baseDir.toString(), 1000)) {
            Assertions.assertTrue(store.get(new IdempotencyKey("Wallet", "party-1", "ext-1")).isEmpty());
        }
        Assertions.assertTrue(Files.isDirectory(baseDir.resolve("idempotency")));
    }

    @Test
    public void testGetOrCreate() {
        try (RocksDBIdempotencyStore store = new RocksDBIdempotencyStore(baseDir.toString(), 1000)) {
            IdempotencyKey key = new IdempotencyKey("Wallet", "party-1", "ext-1");
            Assertions.assertEquals("id-1", store.getOrCreate(key, () -> "id-1"));
            Assertions.assertEquals("id-1", store.getOrCreate(key, () -> "id-2"));
            Assertions.assertEquals("id-1", store.get(key).orElseThrow());
        }
    }

    @Test
    public void testKeyPartsDoNotRunTogether() {
        try (RocksDBIdempotencyStore store = new RocksDBIdempotencyStore(baseDir.toString(), 1000)) {
            store.getOrCreate(new IdempotencyKey("Wallet", "party-1", "ext"), () -> "id-1");
            Assertions.assertTrue(store.get(new IdempotencyKey("Wallet", "party-1e", "xt")).isEmpty());
            Assertions.assertTrue(store.get(new IdempotencyKey("Wallet", "party-", "1ext")).isEmpty());
        }
    }

    @Test
    public void testMappingSurvivesRestart() {
        IdempotencyKey key = new IdempotencyKey("Identity", "party-1", "ext-1");
        try (RocksDBIdempotencyStore store = new RocksDBIdempotencyStore(baseDir.toString(), 1000)) {
            store.getOrCreate(key, () -> "id-1");
        }
        try (RocksDBIdempotencyStore store = new RocksDBIdempotencyStore(baseDir.toString(), 1000)) {
            Assertions.assertEquals("id-1", store.get(key).orElseThrow());
            Assertions.assertEquals("id-1", store.getOrCreate(key, () -> "id-2"));
        }
    }

    @Test
    public void testLockedKeyIsContention() throws Exception {
        ExecutorService competingWriter = Executors.newSingleThreadExecutor();
        AtomicReference<Throwable> competingFailure = new AtomicReference<>();
        try (RocksDBIdempotencyStore store = new RocksDBIdempotencyStore(baseDir.toString(), 100)) {
            IdempotencyKey key = new IdempotencyKey("Wallet", "party-1", "ext-1");
            String id = store.getOrCreate(key, () -> {
                // the row lock is held until this supplier returns
                Future<String> competing = competingWriter.submit(() -> store.getOrCreate(key, () -> "id-2"));
                try {
                    competing.get(10, TimeUnit.SECONDS);
                } catch (ExecutionException e) {
                    competingFailure.set(e.getCause());
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
                return "id-1";
            });

            Assertions.assertEquals("id-1", id);
            Assertions.assertInstanceOf(StoreContentionException.class, competingFailure.get());
            Assertions.assertEquals("id-1", store.getOrCreate(key, () -> "id-3"));
        } finally {
            competingWriter.shutdownNow();
        }
    }
}
