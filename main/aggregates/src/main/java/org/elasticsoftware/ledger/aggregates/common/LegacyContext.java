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

package org.elasticsoftware.ledger.aggregates.common;

import jakarta.annotation.Nullable;
import org.elasticsoftware.ledger.aggregate.MigrationContext;

import java.time.Instant;
import java.util.Map;

/**
 * Reads the values that old event versions did not record from the migration context.
 */
public final class LegacyContext {
    public static final String NAMESPACE = "ledger.api";
    public static final String METADATA_KEY = "metadata";

    private LegacyContext() {
    }

    /**
     * The metadata the request layer stored next to the entity, or null when there is none.
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public static Map<String, Object> metadata(MigrationContext migrationContext) {
        return migrationContext.getNamespace(NAMESPACE)
                .map(namespace -> namespace.get(METADATA_KEY))
                .filter(Map.class::isInstance)
                .map(metadata -> Map.copyOf((Map<String, Object>) metadata))
                .orElse(null);
    }

    /**
     * The moment the legacy event was stored. Records written before the store tracked time fall back
     * to the epoch.
     */
    public static Instant createdAt(MigrationContext migrationContext) {
        return migrationContext.timestamp() != null ? migrationContext.timestamp() : Instant.EPOCH;
    }
}
