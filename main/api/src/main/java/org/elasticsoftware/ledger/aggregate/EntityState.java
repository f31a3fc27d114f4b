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

/**
 * The public face of a top-level entity. The request layer uses these fields to build its
 * authorization facts, the core never interprets the metadata.
 */
public interface EntityState extends AggregateState {
    @Nullable String owner();

    @Nullable String externalId();

    @Nullable Instant createdAt();

    @Nullable Map<String, Object> metadata();
}
