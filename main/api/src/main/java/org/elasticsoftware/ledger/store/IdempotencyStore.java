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

package org.elasticsoftware.ledger.store;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maps idempotency keys to internal aggregate ids. A mapping is written at most once and is never
 * changed or removed afterwards.
 */
public interface IdempotencyStore {
    /**
     * Atomically returns the id mapped to {@code key}, or stores and returns the id produced by
     * {@code idSupplier} when no mapping exists yet.
     *
     * @throws StoreContentionException when a concurrent writer holds the key
     */
    String getOrCreate(IdempotencyKey key, Supplier<String> idSupplier);

    Optional<String> get(IdempotencyKey key);
}
