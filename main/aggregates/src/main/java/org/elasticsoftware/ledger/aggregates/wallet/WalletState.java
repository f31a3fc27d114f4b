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
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.ledger.aggregate.EntityState;
import org.elasticsoftware.ledger.aggregates.account.AccountState;

import java.time.Instant;
import java.util.Map;

/**
 * All fields but {@code id} are null for a wallet whose account events were seen before its
 * creation event.
 */
public record WalletState(
        @NotNull String id,
        @Nullable String partyId,
        @Nullable String identityId,
        @Nullable String name,
        @Nullable String currency,
        @Nullable String externalId,
        @Nullable Instant createdAt,
        @Nullable Map<String, Object> metadata,
        @Nullable AccountState account
) implements EntityState {
    public static WalletState shell(String id) {
        return new WalletState(id, null, null, null, null, null, null, null, null);
    }

    @Override
    public String getAggregateId() {
        return id();
    }

    @Override
    public String owner() {
        return partyId();
    }

    public WalletState withAccount(AccountState account) {
        return new WalletState(id, partyId, identityId, name, currency, externalId, createdAt, metadata, account);
    }
}
