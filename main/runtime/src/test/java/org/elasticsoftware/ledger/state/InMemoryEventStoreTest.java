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
import org.elasticsoftware.ledger.protocol.PayloadEncoding;
import org.elasticsoftware.ledger.store.EventStoreConflictException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventStoreTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void testLoadWhenEmpty() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        assertTrue(eventStore.load("Wallet", "nonexistent").isEmpty());
    }

    @Test
    void testAppendAssignsGenerationAndTimestamp() {
        InMemoryEventStore eventStore = new InMemoryEventStore(Clock.fixed(NOW, ZoneOffset.UTC));

        List<DomainEventRecord> appended = eventStore.append("Wallet", "w1", 0L, List.of(createRecord("w1"), createRecord("w1")));

        assertEquals(2, appended.size());
        assertEquals(1L, appended.get(0).generation());
        assertEquals(2L, appended.get(1).generation());
        assertEquals(NOW, appended.get(1).timestamp());
        assertEquals(2, eventStore.load("Wallet", "w1").size());
    }

    @Test
    void testAppendWithWrongGeneration() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        eventStore.append("Wallet", "w1", 0L, List.of(createRecord("w1")));

        EventStoreConflictException e = assertThrows(EventStoreConflictException.class,
                () -> eventStore.append("Wallet", "w1", 0L, List.of(createRecord("w1"))));
        assertEquals(0L, e.getExpectedGeneration());
        assertEquals(1L, e.getActualGeneration());
        assertEquals(1, eventStore.load("Wallet", "w1").size());
    }

    @Test
    void testLogsAreKeptPerAggregateName() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        eventStore.append("Wallet", "id1", 0L, List.of(createRecord("id1")));

        assertTrue(eventStore.load("Identity", "id1").isEmpty());
        // the same id under another aggregate starts its own log
        assertDoesNotThrow(() -> eventStore.append("Identity", "id1", 0L, List.of(createRecord("id1"))));
    }

    @Test
    void testImportRecordsKeepsPosition() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        Instant recordedAt = Instant.parse("2018-01-01T00:00:00Z");
        eventStore.importRecords("Wallet", "w1", List.of(createRecord("w1").withPosition(1L, recordedAt)));

        List<DomainEventRecord> loaded = eventStore.load("Wallet", "w1");
        assertEquals(1, loaded.size());
        assertEquals(recordedAt, loaded.get(0).timestamp());
        assertEquals(1L, eventStore.append("Wallet", "w1", 1L, List.of(createRecord("w1"))).size());
    }

    private DomainEventRecord createRecord(String aggregateId) {
        return new DomainEventRecord(
                "WalletCreated",
                2,
                "{}".getBytes(StandardCharsets.UTF_8),
                PayloadEncoding.JSON,
                aggregateId,
                0L,
                null);
    }
}
