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

package org.elasticsoftware.ledger.aggregates.identity;

import org.elasticsoftware.ledger.aggregate.Aggregate;
import org.elasticsoftware.ledger.aggregate.MigrationContext;
import org.elasticsoftware.ledger.aggregates.common.LegacyContext;
import org.elasticsoftware.ledger.aggregates.common.ReferenceValidator;
import org.elasticsoftware.ledger.aggregates.lookup.ProviderCatalog;
import org.elasticsoftware.ledger.annotations.AggregateInfo;
import org.elasticsoftware.ledger.annotations.CommandHandler;
import org.elasticsoftware.ledger.annotations.EventSourcingHandler;
import org.elasticsoftware.ledger.annotations.UpcastingHandler;
import org.elasticsoftware.ledger.errors.ReferencedEntityInaccessibleErrorEvent;
import org.elasticsoftware.ledger.errors.ReferencedEntityNotFoundErrorEvent;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;

import java.time.Clock;
import java.util.Optional;
import java.util.stream.Stream;

@AggregateInfo(value = "Identity", events = IdentityEvent.class)
public final class Identity implements Aggregate<IdentityState> {
    private final ReferenceValidator referenceValidator;
    private final ProviderCatalog providerCatalog;
    private final Clock clock;

    public Identity(ReferenceValidator referenceValidator, ProviderCatalog providerCatalog, Clock clock) {
        this.referenceValidator = referenceValidator;
        this.providerCatalog = providerCatalog;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "Identity";
    }

    @Override
    public Class<IdentityState> getStateClass() {
        return IdentityState.class;
    }

    @CommandHandler(create = true,
            produces = IdentityCreatedEvent.class,
            errors = {ReferencedEntityNotFoundErrorEvent.class, ReferencedEntityInaccessibleErrorEvent.class})
    public Stream<DomainEvent> create(CreateIdentityCommand cmd, IdentityState isNull) {
        Optional<ErrorEvent> partyError = referenceValidator.checkParty(cmd.id(), cmd.partyId());
        if (partyError.isPresent()) {
            return Stream.of(partyError.get());
        }
        if (!providerCatalog.exists(cmd.provider())) {
            return Stream.of(new ReferencedEntityNotFoundErrorEvent(cmd.id(), "provider", cmd.provider()));
        }
        return Stream.of(new IdentityCreatedEvent(
                cmd.id(),
                cmd.partyId(),
                cmd.name(),
                cmd.provider(),
                cmd.externalId(),
                clock.instant(),
                cmd.metadata()));
    }

    @EventSourcingHandler(create = true)
    public IdentityState create(IdentityCreatedEvent event, IdentityState isNull) {
        return new IdentityState(
                event.id(),
                event.partyId(),
                event.name(),
                event.provider(),
                event.externalId(),
                event.createdAt(),
                event.metadata());
    }

    @UpcastingHandler
    public IdentityCreatedEvent upcast(IdentityCreatedEventV1 event, MigrationContext migrationContext) {
        return new IdentityCreatedEvent(
                event.id(),
                event.partyId(),
                event.name(),
                event.provider(),
                event.externalId(),
                LegacyContext.createdAt(migrationContext),
                event.metadata());
    }
}
