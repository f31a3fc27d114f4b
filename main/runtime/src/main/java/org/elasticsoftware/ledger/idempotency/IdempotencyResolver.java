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

import jakarta.annotation.Nullable;
import org.elasticsoftware.ledger.store.IdempotencyKey;
import org.elasticsoftware.ledger.store.IdempotencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns a client supplied external id into the internal id of an aggregate. The same
 * (entity kind, owner, external id) always resolves to the same internal id. Without an external id
 * every call mints a new id.
 */
public class IdempotencyResolver {
    private static final Logger logger = LoggerFactory.getLogger(IdempotencyResolver.class);
    private final IdempotencyStore idempotencyStore;
    private final Supplier<String> idGenerator;

    public IdempotencyResolver(IdempotencyStore idempotencyStore) {
        this(idempotencyStore, () -> UUID.randomUUID().toString());
    }

    public IdempotencyResolver(IdempotencyStore idempotencyStore, Supplier<String> idGenerator) {
        this.idempotencyStore = idempotencyStore;
        this.idGenerator = idGenerator;
    }

    public String resolveId(String entityKind, String owner, @Nullable String externalId) {
        if (externalId == null) {
            return idGenerator.get();
        }
        IdempotencyKey key = new IdempotencyKey(entityKind, owner, externalId);
        String aggregateId = idempotencyStore.getOrCreate(key, idGenerator);
        logger.debug("Resolved {} to {} with id {}", key.asString(), entityKind, aggregateId);
        return aggregateId;
    }

    public Optional<String> findId(String entityKind, String owner, String externalId) {
        return idempotencyStore.get(new IdempotencyKey(entityKind, owner, externalId));
    }
}
