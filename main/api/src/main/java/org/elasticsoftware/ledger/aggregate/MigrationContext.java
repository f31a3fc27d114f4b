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

package org.elasticsoftware.ledger.aggregate;

import jakarta.annotation.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Values needed to migrate a legacy event that the event itself does not carry.
 *
 * @param timestamp the moment the event was recorded by the event store
 * @param context   the entity context kept next to the aggregate, keyed by namespace
 */
public record MigrationContext(@Nullable Instant timestamp, Map<String, Object> context) {
    private static final MigrationContext EMPTY = new MigrationContext(null, Map.of());

    public MigrationContext {
        context = context != null ? Map.copyOf(context) : Map.of();
    }

    public static MigrationContext empty() {
        return EMPTY;
    }

    public MigrationContext withTimestamp(@Nullable Instant timestamp) {
        return new MigrationContext(timestamp, context);
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> getNamespace(String namespace) {
        Object value = context.get(namespace);
        if (value instanceof Map<?, ?> map) {
            return Optional.of((Map<String, Object>) map);
        }
        return Optional.empty();
    }
}
