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

package org.elasticsoftware.ledger.aggregates.wallet;

import jakarta.annotation.Nullable;
import org.elasticsoftware.ledger.aggregate.Aggregate;
import org.elasticsoftware.ledger.aggregate.AggregateRepository;
import org.elasticsoftware.ledger.aggregate.MigrationContext;
import org.elasticsoftware.ledger.aggregate.ParentAggregate;
import org.elasticsoftware.ledger.aggregates.account.Account;
import org.elasticsoftware.ledger.aggregates.account.AccountState;
import org.elasticsoftware.ledger.aggregates.common.LegacyContext;
import org.elasticsoftware.ledger.aggregates.common.ReferenceValidator;
import org.elasticsoftware.ledger.aggregates.identity.IdentityState;
import org.elasticsoftware.ledger.aggregates.lookup.CurrencyCatalog;
import org.elasticsoftware.ledger.annotations.AggregateInfo;
import org.elasticsoftware.ledger.annotations.CommandHandler;
import org.elasticsoftware.ledger.annotations.EventSourcingHandler;
import org.elasticsoftware.ledger.annotations.UpcastingHandler;
import org.elasticsoftware.ledger.errors.ReferencedEntityInaccessibleErrorEvent;
import org.elasticsoftware.ledger.errors.ReferencedEntityNotFoundErrorEvent;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

@AggregateInfo(value = "Wallet", events = WalletEvent.class)
public final class Wallet implements Aggregate<WalletState>, ParentAggregate<WalletState, AccountState> {
    private final Account account;
    private final AggregateRepository<IdentityState> identities;
    private final ReferenceValidator referenceValidator;
    private final CurrencyCatalog currencyCatalog;
    private final Clock clock;

    public Wallet(Account account,
                  AggregateRepository<IdentityState> identities,
                  ReferenceValidator referenceValidator,
                  CurrencyCatalog currencyCatalog,
                  Clock clock) {
        this.account = account;
        this.identities = identities;
        this.referenceValidator = referenceValidator;
        this.currencyCatalog = currencyCatalog;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "Wallet";
    }

    @Override
    public Class<WalletState> getStateClass() {
        return WalletState.class;
    }

    @CommandHandler(create = true,
            produces = {WalletCreatedEvent.class, WalletAccountEvent.class},
            errors = {ReferencedEntityNotFoundErrorEvent.class, ReferencedEntityInaccessibleErrorEvent.class})
    public Stream<DomainEvent> create(CreateWalletCommand cmd, WalletState isNull) {
        Optional<IdentityState> identity = identities.findById(cmd.identityId());
        if (identity.isEmpty()) {
            return Stream.of(new ReferencedEntityNotFoundErrorEvent(cmd.id(), "identity", cmd.identityId()));
        }
        Optional<ErrorEvent> referenceError = referenceValidator.checkOwner(cmd.id(), "identity", cmd.identityId(),
                        identity.get().partyId(), cmd.partyId())
                .or(() -> referenceValidator.checkParty(cmd.id(), cmd.partyId()));
        if (referenceError.isPresent()) {
            return Stream.of(referenceError.get());
        }
        String currency = cmd.currency().toUpperCase(Locale.ROOT);
        if (!currencyCatalog.isKnown(currency)) {
            return Stream.of(new ReferencedEntityNotFoundErrorEvent(cmd.id(), "currency", cmd.currency()));
        }
        return Stream.of(
                new WalletCreatedEvent(
                        cmd.id(),
                        cmd.partyId(),
                        cmd.identityId(),
                        cmd.name(),
                        currency,
                        cmd.externalId(),
                        clock.instant(),
                        cmd.metadata()),
                new WalletAccountEvent(cmd.id(), account.open(cmd.id(), cmd.identityId(), cmd.partyId(), currency)));
    }

    @EventSourcingHandler(create = true)
    public WalletState create(WalletCreatedEvent event, WalletState shell) {
        return new WalletState(
                event.id(),
                event.partyId(),
                event.identityId(),
                event.name(),
                event.currency(),
                event.externalId(),
                event.createdAt(),
                event.metadata(),
                shell != null ? shell.account() : null);
    }

    @UpcastingHandler
    public WalletCreatedEvent upcast(WalletCreatedEventV1 event, MigrationContext migrationContext) {
        return new WalletCreatedEvent(
                event.id(),
                event.partyId(),
                event.identityId(),
                event.name(),
                event.currency(),
                event.externalId(),
                LegacyContext.createdAt(migrationContext),
                LegacyContext.metadata(migrationContext));
    }

    @Override
    public Account getSubAggregate() {
        return account;
    }

    @Override
    public AccountState getSubAggregateState(@Nullable WalletState state) {
        return state != null ? state.account() : null;
    }

    @Override
    public WalletState withSubAggregateState(String aggregateId, @Nullable WalletState state, AccountState subAggregateState) {
        return (state != null ? state : WalletState.shell(aggregateId)).withAccount(subAggregateState);
    }
}
