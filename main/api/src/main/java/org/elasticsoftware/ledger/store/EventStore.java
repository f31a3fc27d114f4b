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

import org.elasticsoftware.ledger.protocol.DomainEventRecord;

import java.util.List;

/**
 * The durable, per-aggregate ordered log of domain events.
 */
public interface EventStore {
    /**
     * Returns the events of an aggregate in the order they were appended, or an empty list when
     * nothing was ever appended for this id.
     *
     * @throws StoreContentionException when the store is temporarily unable to serve the request
     */
    List<DomainEventRecord> load(String aggregateName, String aggregateId);

    /**
     * Appends events to the log of an aggregate. The append only succeeds when the log currently
     * holds exactly {@code expectedGeneration} events.
     *
     * @return the appended records with their generation and timestamp filled in
     * @throws EventStoreConflictException when another writer appended to the same log first
     * @throws StoreContentionException    when the store is temporarily unable to serve the request
     */
    List<DomainEventRecord> append(String aggregateName,
                                   String aggregateId,
                                   long expectedGeneration,
                                   List<DomainEventRecord> events);
}
