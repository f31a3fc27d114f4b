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
import org.elasticsoftware.ledger.errors.CommandExecutionErrorEvent;
import org.elasticsoftware.ledger.errors.ExternalIdConflictErrorEvent;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;
import org.elasticsoftware.ledger.idempotency.IdempotencyResolver;
import org.elasticsoftware.ledger.store.EventStoreConflictException;
import org.elasticsoftware.ledger.store.StoreContentionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Creates aggregates exactly once per external id. A create command is bound to the id the
 * {@link IdempotencyResolver} hands out for its external id. When an aggregate already lives under
 * that id the command is either a replay of the original request or a conflict.
 */
public class CreateCommandProcessor {
    private static final Logger logger = LoggerFactory.getLogger(CreateCommandProcessor.class);
    private final AggregateRuntimeRegistry registry;
    private final IdempotencyResolver idempotencyResolver;
    private final int maxAttempts;
    private final int appendRetries;

    public CreateCommandProcessor(AggregateRuntimeRegistry registry,
                                  IdempotencyResolver idempotencyResolver,
                                  int maxAttempts,
                                  int appendRetries) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (appendRetries < 0) {
            throw new IllegalArgumentException("appendRetries must not be negative");
        }
        this.registry = registry;
        this.idempotencyResolver = idempotencyResolver;
        this.maxAttempts = maxAttempts;
        this.appendRetries = appendRetries;
    }

    public <S extends AggregateState, C extends CreateAggregateCommand<S, C>> CreateResult<S> create(RequestContext requestContext,
                                                                                                      C command) {
        AggregateRuntime<S> runtime = registry.getRuntime(command.getClass());
        if (!runtime.isCreateCommand(command.getClass())) {
            throw new IllegalArgumentException(command.getClass().getName() + " is not a create command of " + runtime.getName());
        }
        String aggregateId = null;
        for (int attempt = 1; ; attempt++) {
            try {
                aggregateId = idempotencyResolver.resolveId(runtime.getName(), requestContext.partyId(), command.externalId());
                return createOrReplay(runtime, command.assign(aggregateId, requestContext.partyId()));
            } catch (StoreContentionException e) {
                if (attempt >= maxAttempts) {
                    logger.error("Giving up on {} for {} after {} attempts", command.getClass().getSimpleName(), runtime.getName(), attempt, e);
                    return CreateResult.failed(unexpected(runtime, aggregateId, command, e));
                }
                logger.warn("Store contention on attempt {} of {} for {}, retrying", attempt, maxAttempts, runtime.getName());
            } catch (MigrationGapException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.error("Unexpected failure creating {} with id {}", runtime.getName(), aggregateId, e);
                return CreateResult.failed(unexpected(runtime, aggregateId, command, e));
            }
        }
    }

    private <S extends AggregateState, C extends CreateAggregateCommand<S, C>> CreateResult<S> createOrReplay(AggregateRuntime<S> runtime,
                                                                                                               C command) {
        String aggregateId = command.getAggregateId();
        for (int append = 0; ; append++) {
            Optional<AggregateView<S>> existing = runtime.load(aggregateId);
            if (existing.isPresent()) {
                if (command.matches(existing.get().state())) {
                    logger.info("Replayed create of {} with id {}", runtime.getName(), aggregateId);
                    return CreateResult.replayed(existing.get());
                }
                logger.warn("External id {} of {} with id {} was used with different parameters",
                        command.externalId(), runtime.getName(), aggregateId);
                return CreateResult.failed(new ExternalIdConflictErrorEvent(aggregateId, runtime.getName(),
                        String.valueOf(command.externalId())));
            }
            List<DomainEvent> events = runtime.handleCommand(command, null);
            if (events.size() == 1 && events.get(0) instanceof ErrorEvent errorEvent) {
                return CreateResult.failed(errorEvent);
            }
            try {
                AggregateView<S> view = runtime.append(aggregateId, null, events);
                logger.info("Created {} with id {}", runtime.getName(), aggregateId);
                return CreateResult.created(view);
            } catch (EventStoreConflictException e) {
                if (append >= appendRetries) {
                    throw e;
                }
                logger.warn("Concurrent create of {} with id {}, checking the stored aggregate", runtime.getName(), aggregateId);
            }
        }
    }

    private static CommandExecutionErrorEvent unexpected(AggregateRuntime<?> runtime, String aggregateId, CreateAggregateCommand<?, ?> command, Exception e) {
        return new CommandExecutionErrorEvent(
                aggregateId != null ? aggregateId : "",
                runtime.getName(),
                command.getClass().getSimpleName(),
                e.getMessage());
    }
}
