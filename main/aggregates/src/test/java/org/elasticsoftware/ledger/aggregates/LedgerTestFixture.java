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

package org.elasticsoftware.ledger.aggregates;

import org.elasticsoftware.ledger.LedgerRuntimeConfiguration;
import org.elasticsoftware.ledger.aggregate.AggregateRuntime;
import org.elasticsoftware.ledger.aggregate.AggregateRuntimeRegistry;
import org.elasticsoftware.ledger.aggregate.MigrationContext;
import org.elasticsoftware.ledger.aggregates.account.Account;
import org.elasticsoftware.ledger.aggregates.common.LegacyContext;
import org.elasticsoftware.ledger.aggregates.common.ReferenceValidator;
import org.elasticsoftware.ledger.aggregates.identity.CreateIdentityCommand;
import org.elasticsoftware.ledger.aggregates.identity.Identity;
import org.elasticsoftware.ledger.aggregates.identity.IdentityState;
import org.elasticsoftware.ledger.aggregates.instrument.AuthorizeInstrumentCommand;
import org.elasticsoftware.ledger.aggregates.instrument.BankCardResource;
import org.elasticsoftware.ledger.aggregates.instrument.CreateInstrumentCommand;
import org.elasticsoftware.ledger.aggregates.instrument.Instrument;
import org.elasticsoftware.ledger.aggregates.instrument.InstrumentState;
import org.elasticsoftware.ledger.aggregates.lookup.Accounter;
import org.elasticsoftware.ledger.aggregates.lookup.CurrencyCatalog;
import org.elasticsoftware.ledger.aggregates.lookup.PartyManagement;
import org.elasticsoftware.ledger.aggregates.lookup.ProviderCatalog;
import org.elasticsoftware.ledger.aggregates.transfer.Transfer;
import org.elasticsoftware.ledger.aggregates.transfer.TransferState;
import org.elasticsoftware.ledger.aggregates.wallet.CreateWalletCommand;
import org.elasticsoftware.ledger.aggregates.wallet.Wallet;
import org.elasticsoftware.ledger.aggregates.wallet.WalletState;
import org.elasticsoftware.ledger.aggregates.withdrawal.Withdrawal;
import org.elasticsoftware.ledger.aggregates.withdrawal.WithdrawalState;
import org.elasticsoftware.ledger.beans.AggregateRuntimeFactory;
import org.elasticsoftware.ledger.commands.CommandProcessor;
import org.elasticsoftware.ledger.commands.CreateCommandProcessor;
import org.elasticsoftware.ledger.commands.CreateResult;
import org.elasticsoftware.ledger.commands.RequestContext;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.idempotency.IdempotencyResolver;
import org.elasticsoftware.ledger.idempotency.InMemoryIdempotencyStore;
import org.elasticsoftware.ledger.protocol.DomainEventRecord;
import org.elasticsoftware.ledger.serialization.DomainEventSerde;
import org.elasticsoftware.ledger.state.InMemoryEventStore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The five entity runtimes wired against in-memory stores and fake lookup services.
 */
public class LedgerTestFixture {
    public static final Instant NOW = Instant.parse("2024-06-01T09:30:00Z");
    public static final RequestContext PARTY_1 = new RequestContext("party-1");
    public static final RequestContext PARTY_2 = new RequestContext("party-2");

    public final InMemoryEventStore eventStore = new InMemoryEventStore(Clock.fixed(NOW, ZoneOffset.UTC));
    public final DomainEventSerde serde = new DomainEventSerde(new LedgerRuntimeConfiguration().ledgerObjectMapper());
    public final Set<String> parties = new HashSet<>(Set.of("party-1", "party-2"));
    public final Map<String, String> blockedParties = new HashMap<>();
    public final Set<String> providers = new HashSet<>(Set.of("test-provider"));
    public final Set<String> currencies = new HashSet<>(Set.of("USD", "EUR", "RUB"));
    public final Map<String, Map<String, Object>> legacyMetadata = new HashMap<>();
    public final AtomicInteger openedAccounts = new AtomicInteger();

    public final AggregateRuntime<IdentityState> identities;
    public final AggregateRuntime<WalletState> wallets;
    public final AggregateRuntime<InstrumentState> instruments;
    public final AggregateRuntime<WithdrawalState> withdrawals;
    public final AggregateRuntime<TransferState> transfers;
    public final CreateCommandProcessor createCommandProcessor;
    public final CommandProcessor commandProcessor;

    public LedgerTestFixture() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        PartyManagement partyManagement = new PartyManagement() {
            @Override
            public boolean exists(String partyId) {
                return parties.contains(partyId);
            }

            @Override
            public Optional<String> getInaccessibilityReason(String partyId) {
                return Optional.ofNullable(blockedParties.get(partyId));
            }
        };
        ProviderCatalog providerCatalog = providers::contains;
        CurrencyCatalog currencyCatalog = currencies::contains;
        Accounter accounter = currencyCode -> "acc-" + openedAccounts.incrementAndGet();
        IdempotencyResolver resolver = new IdempotencyResolver(new InMemoryIdempotencyStore());
        AggregateRuntimeFactory factory = new AggregateRuntimeFactory(eventStore, serde, this::migrationContext, resolver);
        ReferenceValidator referenceValidator = new ReferenceValidator(partyManagement);
        Account account = new Account(accounter);

        identities = factory.create(new Identity(referenceValidator, providerCatalog, clock));
        wallets = factory.create(new Wallet(account, identities, referenceValidator, currencyCatalog, clock));
        instruments = factory.create(new Instrument(account, identities, referenceValidator, currencyCatalog, clock));
        withdrawals = factory.create(new Withdrawal(wallets, instruments, referenceValidator, clock));
        transfers = factory.create(new Transfer(wallets, referenceValidator, clock));

        AggregateRuntimeRegistry registry = new AggregateRuntimeRegistry(List.of(identities, wallets, instruments, withdrawals, transfers));
        createCommandProcessor = new CreateCommandProcessor(registry, resolver, 3, 1);
        commandProcessor = new CommandProcessor(registry, 3);
    }

    private MigrationContext migrationContext(String aggregateName, String aggregateId) {
        Map<String, Object> metadata = legacyMetadata.get(aggregateId);
        if (metadata == null) {
            return MigrationContext.empty();
        }
        return new MigrationContext(null, Map.of(LegacyContext.NAMESPACE, Map.of(LegacyContext.METADATA_KEY, metadata)));
    }

    public String createIdentity(RequestContext requestContext) {
        CreateResult<IdentityState> result = createCommandProcessor.create(requestContext,
                new CreateIdentityCommand("John Doe", "test-provider", null, null));
        return result.view().aggregateId();
    }

    public String createWallet(RequestContext requestContext, String identityId, String currency) {
        CreateResult<WalletState> result = createCommandProcessor.create(requestContext,
                new CreateWalletCommand("Main", identityId, currency, null, null));
        return result.view().aggregateId();
    }

    public String createAuthorizedInstrument(RequestContext requestContext, String identityId, String currency) {
        CreateResult<InstrumentState> result = createCommandProcessor.create(requestContext,
                new CreateInstrumentCommand("Card", identityId, currency, new BankCardResource("token-1", "424242", "4242"), null, null));
        String instrumentId = result.view().aggregateId();
        commandProcessor.handle(new AuthorizeInstrumentCommand(instrumentId));
        return instrumentId;
    }

    /**
     * Stores events as they would have been written by an older release.
     */
    public void importLegacy(String aggregateName, String aggregateId, Instant recordedAt, DomainEvent... events) {
        long generation = eventStore.load(aggregateName, aggregateId).size();
        List<DomainEventRecord> records = new ArrayList<>();
        for (DomainEvent event : events) {
            records.add(serde.serialize(aggregateName, event).withPosition(++generation, recordedAt));
        }
        eventStore.importRecords(aggregateName, aggregateId, records);
    }

    public int logLength(String aggregateName, String aggregateId) {
        return eventStore.load(aggregateName, aggregateId).size();
    }
}
