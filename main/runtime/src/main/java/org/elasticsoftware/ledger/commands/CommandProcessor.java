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

import org.elasticsoftware.ledger.aggregate.*;
import org.elasticsoftware.ledger.errors.AggregateNotFoundErrorEvent;
import org.elasticsoftware.ledger.errors.CommandExecutionErrorEvent;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;
import org.elasticsoftware.ledger.store.EventStoreConflictException;
import org.elasticsoftware.ledger.store.StoreContentionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Runs commands against existing aggregates. The produced events are appended after the
 * generation the command saw; when another writer got there first the command is run again
 * against the newer state.
 */
public class CommandProcessor {
    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);
    private final AggregateRuntimeRegistry registry;
    private final int maxAttempts;

    public CommandProcessor(AggregateRuntimeRegistry registry, int maxAttempts) {
        this.registry = registry;
        this.maxAttempts = maxAttempts;
    }

    public <S extends AggregateState> CommandResult<S> handle(Command command) {
        AggregateRuntime<S> runtime = registry.getRuntime(command.getClass());
        if (runtime.isCreateCommand(command.getClass())) {
            throw new IllegalArgumentException(command.getClass().getName() + " must be sent through the CreateCommandProcessor");
        }
        for (int attempt = 1; ; attempt++) {
            try {
                Optional<AggregateView<S>> current = runtime.load(command.getAggregateId());
                if (current.isEmpty()) {
                    return CommandResult.failed(new AggregateNotFoundErrorEvent(command.getAggregateId(), runtime.getName()));
                }
                List<DomainEvent> events = runtime.handleCommand(command, current.get().state());
                if (events.size() == 1 && events.get(0) instanceof ErrorEvent errorEvent) {
                    return CommandResult.failed(errorEvent);
                }
                if (events.isEmpty()) {
                    logger.debug("{} on {} with id {} produced no events", command.getClass().getSimpleName(),
                            runtime.getName(), command.getAggregateId());
                    return CommandResult.success(current.get(), events);
                }
                return CommandResult.success(runtime.append(command.getAggregateId(), current.get(), events), events);
            } catch (StoreContentionException | EventStoreConflictException e) {
                if (attempt >= maxAttempts) {
                    logger.error("Giving up on {} for {} with id {} after {} attempts", command.getClass().getSimpleName(),
                            runtime.getName(), command.getAggregateId(), attempt, e);
                    return CommandResult.failed(unexpected(runtime, command, e));
                }
                logger.warn("{} on attempt {} of {} for {} with id {}, retrying", e.getClass().getSimpleName(), attempt,
                        maxAttempts, runtime.getName(), command.getAggregateId());
            } catch (MigrationGapException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.error("Unexpected failure handling {} for {} with id {}", command.getClass().getSimpleName(),
                        runtime.getName(), command.getAggregateId(), e);
                return CommandResult.failed(unexpected(runtime, command, e));
            }
        }
    }

    private static CommandExecutionErrorEvent unexpected(AggregateRuntime<?> runtime, Command command, Exception e) {
        return new CommandExecutionErrorEvent(command.getAggregateId(), runtime.getName(), command.getClass().getSimpleName(), e.getMessage());
    }
}
