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

package org.elasticsoftware.ledger.aggregates.account;

import org.elasticsoftware.ledger.aggregate.Aggregate;
import org.elasticsoftware.ledger.aggregates.lookup.Accounter;
import org.elasticsoftware.ledger.annotations.AggregateInfo;
import org.elasticsoftware.ledger.annotations.EventSourcingHandler;
import org.elasticsoftware.ledger.annotations.UpcastingHandler;

import java.util.Locale;

/**
 * The ledger account that wallets and instruments embed. It has no commands of its own: the parent
 * opens it while handling its create command.
 */
@AggregateInfo(value = "Account", events = AccountEvent.class)
public final class Account implements Aggregate<AccountState> {
    private final Accounter accounter;

    public Account(Accounter accounter) {
        this.accounter = accounter;
    }

    @Override
    public String getName() {
        return "Account";
    }

    @Override
    public Class<AccountState> getStateClass() {
        return AccountState.class;
    }

    /**
     * Opens an account with the external accounter and returns the event that records it.
     */
    public AccountCreatedEvent open(String id, String identityId, String partyId, String currency) {
        String normalizedCurrency = currency.toUpperCase(Locale.ROOT);
        String accounterAccountId = accounter.createAccount(normalizedCurrency);
        return new AccountCreatedEvent(id, identityId, partyId, normalizedCurrency, accounterAccountId);
    }

    @EventSourcingHandler(create = true)
    public AccountState create(AccountCreatedEvent event, AccountState isNull) {
        return new AccountState(event.id(), event.identityId(), event.partyId(), event.currency(), event.accounterAccountId());
    }

    @UpcastingHandler
    public AccountCreatedEvent upcast(AccountCreatedEventV1 event) {
        return new AccountCreatedEvent(
                event.id(),
                event.identityId(),
                event.partyId(),
                event.currency().toUpperCase(Locale.ROOT),
                event.accounterAccountId());
    }
}
