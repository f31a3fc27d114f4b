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

import com.google.common.base.Joiner;
import org.elasticsoftware.ledger.store.IdempotencyKey;
import org.elasticsoftware.ledger.store.IdempotencyStore;
import org.elasticsoftware.ledger.store.StoreContentionException;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Keeps the external id mappings in a RocksDB {@link TransactionDB}. The key is locked with
 * {@code getForUpdate} before a new mapping is written, so two writers for the same key never both
 * succeed.
 */
public class RocksDBIdempotencyStore implements IdempotencyStore, Closeable {
    private static final Logger log = LoggerFactory.getLogger(RocksDBIdempotencyStore.class);
    private static final Joiner KEY_JOINER = Joiner.on('\u0000');
    private final TransactionDB db;
    private final File baseDir;

    public RocksDBIdempotencyStore(String baseDir, long lockTimeoutMillis) {
        RocksDB.loadLibrary();
        final Options options = new Options();
        final TransactionDBOptions transactionDBOptions = new TransactionDBOptions();
        options.setCreateIfMissing(true);
        transactionDBOptions.setTransactionLockTimeout(lockTimeoutMillis);
        this.baseDir = new File(baseDir, "idempotency");
        try {
            Files.createDirectories(this.baseDir.getAbsoluteFile().toPath());
            db = TransactionDB.open(options, transactionDBOptions, this.baseDir.getAbsolutePath());
            log.info("RocksDB idempotency store initialized in folder {}", this.baseDir.getAbsolutePath());
        } catch (IOException | RocksDBException e) {
            throw new IdempotencyStoreException("Error initializing RocksDB", null, e);
        }
    }

    @Override
    public void close() {
        try {
            db.syncWal();
        } catch (RocksDBException e) {
            log.error("Error syncing WAL. Exception: '{}', message: '{}'", e.getCause(), e.getMessage(), e);
        }
        db.close();
    }

    @Override
    public String getOrCreate(IdempotencyKey key, Supplier<String> idSupplier) {
        byte[] keyBytes = keyBytes(key);
        try (WriteOptions writeOptions = new WriteOptions();
             ReadOptions readOptions = new ReadOptions();
             Transaction transaction = db.beginTransaction(writeOptions)) {
            byte[] existing = transaction.getForUpdate(readOptions, keyBytes, true);
            if (existing != null) {
                transaction.rollback();
                return new String(existing, StandardCharsets.UTF_8);
            }
            String aggregateId = idSupplier.get();
            transaction.put(keyBytes, aggregateId.getBytes(StandardCharsets.UTF_8));
            transaction.commit();
            log.trace("Stored mapping {} -> {}", key.asString(), aggregateId);
            return aggregateId;
        } catch (RocksDBException e) {
            if (isContention(e)) {
                throw new StoreContentionException("Idempotency key " + key.asString() + " is locked by another writer",
                        key.entityKind(), null, e);
            }
            throw new IdempotencyStoreException("Problem storing idempotency key " + key.asString(), key.entityKind(), e);
        }
    }

    @Override
    public Optional<String> get(IdempotencyKey key) {
        try {
            byte[] value = db.get(keyBytes(key));
            return Optional.ofNullable(value).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
        } catch (RocksDBException e) {
            throw new IdempotencyStoreException("Problem reading idempotency key " + key.asString(), key.entityKind(), e);
        }
    }

    private static boolean isContention(RocksDBException e) {
        if (e.getStatus() == null) {
            return false;
        }
        Status.Code code = e.getStatus().getCode();
        return code == Status.Code.Busy || code == Status.Code.TimedOut || code == Status.Code.TryAgain;
    }

    private static byte[] keyBytes(IdempotencyKey key) {
        return KEY_JOINER.join(key.entityKind(), key.owner(), key.externalId()).getBytes(StandardCharsets.UTF_8);
    }
}
