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
import org.elasticsoftware.ledger.aggregate.AggregateRepository;
import org.elasticsoftware.ledger.aggregate.AggregateRuntime;
import org.elasticsoftware.ledger.aggregates.account.Account;
import org.elasticsoftware.ledger.aggregates.common.ReferenceValidator;
import org.elasticsoftware.ledger.aggregates.identity.Identity;
import org.elasticsoftware.ledger.aggregates.identity.IdentityState;
import org.elasticsoftware.ledger.aggregates.instrument.Instrument;
import org.elasticsoftware.ledger.aggregates.instrument.InstrumentState;
import org.elasticsoftware.ledger.aggregates.lookup.Accounter;
import org.elasticsoftware.ledger.aggregates.lookup.CurrencyCatalog;
import org.elasticsoftware.ledger.aggregates.lookup.PartyManagement;
import org.elasticsoftware.ledger.aggregates.lookup.ProviderCatalog;
import org.elasticsoftware.ledger.aggregates.transfer.Transfer;
import org.elasticsoftware.ledger.aggregates.transfer.TransferState;
import org.elasticsoftware.ledger.aggregates.wallet.Wallet;
import org.elasticsoftware.ledger.aggregates.wallet.WalletState;
import org.elasticsoftware.ledger.aggregates.withdrawal.Withdrawal;
import org.elasticsoftware.ledger.aggregates.withdrawal.WithdrawalState;
import org.elasticsoftware.ledger.beans.AggregateRuntimeFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;

/**
 * Wires the ledger aggregates. The application provides the {@link PartyManagement},
 * {@link ProviderCatalog}, {@link CurrencyCatalog} and {@link Accounter} beans, and optionally a
 * {@link org.elasticsoftware.ledger.aggregate.MigrationContextProvider}.
 */
@Configuration
@Import(LedgerRuntimeConfiguration.class)
public class LedgerAggregatesConfiguration {

    @Bean(name = "ledgerClock")
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean(name = "ledgerReferenceValidator")
    public ReferenceValidator referenceValidator(PartyManagement partyManagement) {
        return new ReferenceValidator(partyManagement);
    }

    @Bean(name = "account")
    public Account account(Accounter accounter) {
        return new Account(accounter);
    }

    @Bean(name = "identity")
    public Identity identity(@Qualifier("ledgerReferenceValidator") ReferenceValidator referenceValidator,
                             ProviderCatalog providerCatalog,
                             @Qualifier("ledgerClock") Clock clock) {
        return new Identity(referenceValidator, providerCatalog, clock);
    }

    @Bean(name = "identityRuntime")
    public AggregateRuntime<IdentityState> identityRuntime(@Qualifier("ledgerAggregateRuntimeFactory") AggregateRuntimeFactory factory,
                                                           @Qualifier("identity") Identity identity) {
        return factory.create(identity);
    }

    @Bean(name = "wallet")
    public Wallet wallet(@Qualifier("account") Account account,
                         @Qualifier("identityRuntime") AggregateRepository<IdentityState> identities,
                         @Qualifier("ledgerReferenceValidator") ReferenceValidator referenceValidator,
                         CurrencyCatalog currencyCatalog,
                         @Qualifier("ledgerClock") Clock clock) {
        return new Wallet(account, identities, referenceValidator, currencyCatalog, clock);
    }

    @Bean(name = "walletRuntime")
    public AggregateRuntime<WalletState> walletRuntime(@Qualifier("ledgerAggregateRuntimeFactory") AggregateRuntimeFactory factory,
                                                       @Qualifier("wallet") Wallet wallet) {
        return factory.create(wallet);
    }

    @Bean(name = "instrument")
    public Instrument instrument(@Qualifier("account") Account account,
                                 @Qualifier("identityRuntime") AggregateRepository<IdentityState> identities,
                                 @Qualifier("ledgerReferenceValidator") ReferenceValidator referenceValidator,
                                 CurrencyCatalog currencyCatalog,
                                 @Qualifier("ledgerClock") Clock clock) {
        return new Instrument(account, identities, referenceValidator, currencyCatalog, clock);
    }

    @Bean(name = "instrumentRuntime")
    public AggregateRuntime<InstrumentState> instrumentRuntime(@Qualifier("ledgerAggregateRuntimeFactory") AggregateRuntimeFactory factory,
                                                               @Qualifier("instrument") Instrument instrument) {
        return factory.create(instrument);
    }

    @Bean(name = "withdrawal")
    public Withdrawal withdrawal(@Qualifier("walletRuntime") AggregateRepository<WalletState> wallets,
                                 @Qualifier("instrumentRuntime") AggregateRepository<InstrumentState> instruments,
                                 @Qualifier("ledgerReferenceValidator") ReferenceValidator referenceValidator,
                                 @Qualifier("ledgerClock") Clock clock) {
        return new Withdrawal(wallets, instruments, referenceValidator, clock);
    }

    @Bean(name = "withdrawalRuntime")
    public AggregateRuntime<WithdrawalState> withdrawalRuntime(@Qualifier("ledgerAggregateRuntimeFactory") AggregateRuntimeFactory factory,
                                                               @Qualifier("withdrawal") Withdrawal withdrawal) {
        return factory.create(withdrawal);
    }

    @Bean(name = "transfer")
    public Transfer transfer(@Qualifier("walletRuntime") AggregateRepository<WalletState> wallets,
                             @Qualifier("ledgerReferenceValidator") ReferenceValidator referenceValidator,
                             @Qualifier("ledgerClock") Clock clock) {
        return new Transfer(wallets, referenceValidator, clock);
    }

    @Bean(name = "transferRuntime")
    public AggregateRuntime<TransferState> transferRuntime(@Qualifier("ledgerAggregateRuntimeFactory") AggregateRuntimeFactory factory,
                                                           @Qualifier("transfer") Transfer transfer) {
        return factory.create(transfer);
    }
}
