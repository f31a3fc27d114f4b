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

package org.elasticsoftware.ledger.protocol;

import jakarta.annotation.Nullable;

import java.time.Instant;

/**
 * The stored form of a domain event.
 *
 * @param name        the event type name from {@code @DomainEventInfo}
 * @param version     the schema version the payload was written with
 * @param payload     the serialized event
 * @param encoding    how the payload is encoded
 * @param aggregateId the aggregate this event belongs to
 * @param generation  the 1-based position of the event in the aggregate's log
 * @param timestamp   when the event store accepted the event, null for events not yet stored
 */
public record DomainEventRecord(
        String name,
        int version,
        byte[] payload,
        PayloadEncoding encoding,
        String aggregateId,
        long generation,
        @Nullable Instant timestamp
) {
    public DomainEventRecord withPosition(long generation, Instant timestamp) {
        return new DomainEventRecord(name, version, payload, encoding, aggregateId, generation, timestamp);
    }
}
