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

import org.elasticsoftware.ledger.aggregate.AggregateRuntime;
import org.elasticsoftware.ledger.aggregate.AggregateRuntimeRegistry;
import org.elasticsoftware.ledger.aggregates.common.Money;
import org.elasticsoftware.ledger.aggregates.identity.CreateIdentityCommand;
import org.elasticsoftware.ledger.aggregates.identity.IdentityState;
import org.elasticsoftware.ledger.aggregates.instrument.AuthorizeInstrumentCommand;
import org.elasticsoftware.ledger.aggregates.instrument.CreateInstrumentCommand;
import org.elasticsoftware.ledger.aggregates.instrument.CryptoWalletResource;
import org.elasticsoftware.ledger.aggregates.instrument.InstrumentState;
import org.elasticsoftware.ledger.aggregates.lookup.Accounter;
import org.elasticsoftware.ledger.aggregates.lookup.CurrencyCatalog;
import org.elasticsoftware.ledger.aggregates.lookup.PartyManagement;
import org.elasticsoftware.ledger.aggregates.lookup.ProviderCatalog;
import org.elasticsoftware.ledger.aggregates.wallet.CreateWalletCommand;
import org.elasticsoftware.ledger.aggregates.wallet.WalletState;
import org.elasticsoftware.ledger.aggregates.withdrawal.CreateWithdrawalCommand;
import org.elasticsoftware.ledger.aggregates.withdrawal.WithdrawalState;
import org.elasticsoftware.ledger.aggregates.withdrawal.WithdrawalStatus;
import org.elasticsoftware.ledger.commands.CommandProcessor;
import org.elasticsoftware.ledger.commands.CreateCommandProcessor;
import org.elasticsoftware.ledger.commands.CreateResult;
import org.elasticsoftware.ledger.commands.RequestContext;
import org.elasticsoftware.ledger.idempotency.InMemoryIdempotencyStore;
import org.elasticsoftware.ledger.store.IdempotencyStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = {LedgerAggregatesConfiguration.class, LedgerAggregatesConfigurationTest.Collaborators.class})
public class LedgerAggregatesConfigurationTest {
    private static final RequestContext PARTY = new RequestContext("party-1");

    @Autowired
    @Qualifier("ledgerCreateCommandProcessor")
    CreateCommandProcessor createCommandProcessor;

    @Autowired
    @Qualifier("ledgerCommandProcessor")
    CommandProcessor commandProcessor;

    @Autowired
    @Qualifier("ledgerAggregateRuntimeRegistry")
    AggregateRuntimeRegistry registry;

    @Autowired
    @Qualifier("ledgerIdempotencyStore")
    IdempotencyStore idempotencyStore;

    @Autowired
    @Qualifier("walletRuntime")
    AggregateRuntime<WalletState> walletRuntime;

    @Configuration
    static class Collaborators {
        @Bean
        public PartyManagement partyManagement() {
            return new PartyManagement() {
                @Override
                public boolean exists(String partyId) {
                    return true;
                }

                @Override
                public Optional<String> getInaccessibilityReason(String partyId) {
                    return Optional.empty();
                }
            };
        }

        @Bean
        public ProviderCatalog providerCatalog() {
            return "test-provider"::equals;
        }

        @Bean
        public CurrencyCatalog currencyCatalog() {
            return Set.of("USD", "BTC")::contains;
        }

        @Bean
        public Accounter accounter() {
            return currencyCode -> UUID.randomUUID().toString();
        }
    }

    @Test
    void testRuntimesAreRegistered() {
        assertThat(registry.getRuntimes())
                .extracting(AggregateRuntime::getName)
                .containsExactlyInAnyOrder("Identity", "Wallet", "Instrument", "Withdrawal", "Transfer");
        assertThat(idempotencyStore).isInstanceOf(InMemoryIdempotencyStore.class);
    }

    @Test
    void testCreateEntitiesThroughTheContext() {
        CreateResult<IdentityState> identity = createCommandProcessor.create(PARTY,
                new CreateIdentityCommand("John Doe", "test-provider", "identity-1", null));
        String identityId = identity.view().aggregateId();

        CreateResult<WalletState> wallet = createCommandProcessor.create(PARTY,
                new CreateWalletCommand("Savings", identityId, "BTC", "wallet-1", Map.of("color", "orange")));
        CreateResult<InstrumentState> instrument = createCommandProcessor.create(PARTY,
                new CreateInstrumentCommand("Cold storage", identityId, "BTC",
                        new CryptoWalletResource("bc1qxy", "BTC", Map.of()), "instrument-1", null));
        String instrumentId = instrument.view().aggregateId();
        commandProcessor.handle(new AuthorizeInstrumentCommand(instrumentId));

        CreateResult<WithdrawalState> withdrawal = createCommandProcessor.create(PARTY,
                new CreateWithdrawalCommand(wallet.view().aggregateId(), instrumentId, new Money(10, "BTC"), "withdrawal-1", null));

        assertEquals(CreateResult.Outcome.CREATED, withdrawal.outcome());
        assertEquals(WithdrawalStatus.PENDING, withdrawal.state().orElseThrow().status());
        assertEquals(wallet.view(), walletRuntime.findByExternalId("party-1", "wallet-1").orElseThrow());
    }
}
