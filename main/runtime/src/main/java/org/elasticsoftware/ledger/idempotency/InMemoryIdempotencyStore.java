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

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

public class InMemoryIdempotencyStore implements IdempotencyStore {
    private final ConcurrentMap<IdempotencyKey, String> mappings = new ConcurrentHashMap<>();

    @Override
    public String getOrCreate(IdempotencyKey key, Supplier<String> idSupplier) {
        return mappings.computeIfAbsent(key, k -> idSupplier.get());
    }

    @Override
    public Optional<String> get(IdempotencyKey key) {
        return Optional.ofNullable(mappings.get(key));
    }
}
