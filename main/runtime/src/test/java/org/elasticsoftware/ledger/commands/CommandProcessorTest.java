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

package org.elasticsoftware.ledger.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.ledger.aggregate.AggregateRuntimeRegistry;
import org.elasticsoftware.ledger.aggregate.MigrationContextProvider;
import org.elasticsoftware.ledger.aggregate.counter.Counter;
import org.elasticsoftware.ledger.aggregate.counter.CounterIncrementedEvent;
import org.elasticsoftware.ledger.aggregate.counter.CounterState;
import org.elasticsoftware.ledger.aggregate.counter.CreateCounterCommand;
import org.elasticsoftware.ledger.aggregate.counter.IncrementCounterCommand;
import org.elasticsoftware.ledger.aggregate.counter.NegativeIncrementErrorEvent;
import org.elasticsoftware.ledger.beans.AggregateRuntimeFactory;
import org.elasticsoftware.ledger.errors.AggregateNotFoundErrorEvent;
import org.elasticsoftware.ledger.idempotency.IdempotencyResolver;
import org.elasticsoftware.ledger.idempotency.InMemoryIdempotencyStore;
import org.elasticsoftware.ledger.protocol.DomainEventRecord;
import org.elasticsoftware.ledger.serialization.DomainEventSerde;
import org.elasticsoftware.ledger.state.InMemoryEventStore;
import org.elasticsoftware.ledger.store.EventStoreConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class CommandProcessorTest {
    private static final RequestContext PARTY_1 = new RequestContext("party-1");
    private final AtomicInteger conflictsToThrow = new AtomicInteger();
    private CreateCommandProcessor createCommandProcessor;
    private CommandProcessor commandProcessor;

    @BeforeEach
    void setUp() {
        InMemoryEventStore eventStore = new InMemoryEventStore() {
            @Override
            public synchronized List<DomainEventRecord> append(String aggregateName, String aggregateId,
                                                               long expectedGeneration, List<DomainEventRecord> events) {
                if (expectedGeneration > 0 && conflictsToThrow.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                    throw new EventStoreConflictException(aggregateName, aggregateId, expectedGeneration, expectedGeneration + 1);
                }
                return super.append(aggregateName, aggregateId, expectedGeneration, events);
            }
        };
        IdempotencyResolver resolver = new IdempotencyResolver(new InMemoryIdempotencyStore());
        AggregateRuntimeFactory factory = new AggregateRuntimeFactory(
                eventStore, new DomainEventSerde(new ObjectMapper()), MigrationContextProvider.EMPTY, resolver);
        AggregateRuntimeRegistry registry = new AggregateRuntimeRegistry(List.of(factory.create(new Counter())));
        createCommandProcessor = new CreateCommandProcessor(registry, resolver, 3, 1);
        commandProcessor = new CommandProcessor(registry, 3);
    }

    private String createCounter() {
        CreateResult<CounterState> result = createCommandProcessor.create(PARTY_1, new CreateCounterCommand("clicks", null));
        return result.view().aggregateId();
    }

    @Test
    void testIncrement() {
        String id = createCounter();

        CommandResult<CounterState> result = commandProcessor.handle(new IncrementCounterCommand(id, 3));

        assertTrue(result.isSuccess());
        assertEquals(List.of(new CounterIncrementedEvent(id, 3)), result.events());
        assertEquals(3L, result.view().state().value());
        assertEquals(2L, result.view().generation());
    }

    @Test
    void testUnknownAggregate() {
        CommandResult<CounterState> result = commandProcessor.handle(new IncrementCounterCommand("missing", 3));

        assertFalse(result.isSuccess());
        assertEquals(new AggregateNotFoundErrorEvent("missing", "Counter"), result.error());
    }

    @Test
    void testErrorEventIsNotAppended() {
        String id = createCounter();

        CommandResult<CounterState> result = commandProcessor.handle(new IncrementCounterCommand(id, -1));

        assertEquals(new NegativeIncrementErrorEvent(id, -1), result.error());
        assertNull(result.view());
        assertEquals(0L, commandProcessor.<CounterState>handle(new IncrementCounterCommand(id, 0)).view().state().value());
    }

    @Test
    void testNoEventsKeepsGeneration() {
        String id = createCounter();

        CommandResult<CounterState> result = commandProcessor.handle(new IncrementCounterCommand(id, 0));

        assertTrue(result.isSuccess());
        assertTrue(result.events().isEmpty());
        assertEquals(1L, result.view().generation());
    }

    @Test
    void testConflictIsRetried() {
        String id = createCounter();
        conflictsToThrow.set(2);

        CommandResult<CounterState> result = commandProcessor.handle(new IncrementCounterCommand(id, 1));

        assertTrue(result.isSuccess());
        assertEquals(1L, result.view().state().value());
        assertEquals(0, conflictsToThrow.get());
    }

    @Test
    void testConflictGivesUpAfterMaxAttempts() {
        String id = createCounter();
        conflictsToThrow.set(3);

        CommandResult<CounterState> result = commandProcessor.handle(new IncrementCounterCommand(id, 1));

        assertFalse(result.isSuccess());
    }

    @Test
    void testCreateCommandsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> commandProcessor.handle(new CreateCounterCommand("clicks", null)));
    }
}
