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

package org.elasticsoftware.ledger.state;

import org.elasticsoftware.ledger.protocol.DomainEventRecord;
import org.elasticsoftware.ledger.store.EventStore;
import org.elasticsoftware.ledger.store.EventStoreConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Event store backed by a map of lists. Appends are checked against the expected generation so
 * concurrent writers of one aggregate behave like they would against a durable store.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);
    private final Map<String, List<DomainEventRecord>> logs = new HashMap<>();
    private final Clock clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized List<DomainEventRecord> load(String aggregateName, String aggregateId) {
        return List.copyOf(logs.getOrDefault(key(aggregateName, aggregateId), List.of()));
    }

    @Override
    public synchronized List<DomainEventRecord> append(String aggregateName,
                                                       String aggregateId,
                                                       long expectedGeneration,
                                                       List<DomainEventRecord> events) {
        List<DomainEventRecord> log = logs.computeIfAbsent(key(aggregateName, aggregateId), k -> new ArrayList<>());
        if (log.size() != expectedGeneration) {
            throw new EventStoreConflictException(aggregateName, aggregateId, expectedGeneration, log.size());
        }
        Instant now = clock.instant();
        List<DomainEventRecord> appended = new ArrayList<>(events.size());
        for (DomainEventRecord event : events) {
            DomainEventRecord stored = event.withPosition(log.size() + 1L, now);
            log.add(stored);
            appended.add(stored);
        }
        logger.trace("Appended {} events to {} with id {}, generation is now {}", events.size(), aggregateName, aggregateId, log.size());
        return List.copyOf(appended);
    }

    /**
     * Writes records as they are, for seeding a log with events of older schema versions.
     */
    public synchronized void importRecords(String aggregateName, String aggregateId, List<DomainEventRecord> records) {
        logs.computeIfAbsent(key(aggregateName, aggregateId), k -> new ArrayList<>()).addAll(records);
    }

    private static String key(String aggregateName, String aggregateId) {
        return aggregateName + "/" + aggregateId;
    }
}
