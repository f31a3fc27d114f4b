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

package org.elasticsoftware.ledger.aggregates.transfer;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.ledger.aggregates.common.Money;
import org.elasticsoftware.ledger.annotations.CommandInfo;
import org.elasticsoftware.ledger.commands.CreateAggregateCommand;

import java.util.Map;
import java.util.Objects;

@CommandInfo(type = "CreateTransfer")
public record CreateTransferCommand(
        @Nullable String id,
        @Nullable String partyId,
        @NotNull String sourceWalletId,
        @NotNull String destinationWalletId,
        @NotNull Money body,
        @Nullable String externalId,
        @Nullable Map<String, Object> metadata
) implements CreateAggregateCommand<TransferState, CreateTransferCommand> {

    public CreateTransferCommand(String sourceWalletId, String destinationWalletId, Money body,
                                 @Nullable String externalId, @Nullable Map<String, Object> metadata) {
        this(null, null, sourceWalletId, destinationWalletId, body, externalId, metadata);
    }

    @Override
    public String getAggregateId() {
        return id();
    }

    @Override
    public CreateTransferCommand assign(String aggregateId, String partyId) {
        return new CreateTransferCommand(aggregateId, partyId, sourceWalletId, destinationWalletId, body, externalId, metadata);
    }

    @Override
    public boolean matches(TransferState existingState) {
        return Objects.equals(sourceWalletId, existingState.sourceWalletId()) &&
                Objects.equals(destinationWalletId, existingState.destinationWalletId()) &&
                Objects.equals(body, existingState.body());
    }
}
