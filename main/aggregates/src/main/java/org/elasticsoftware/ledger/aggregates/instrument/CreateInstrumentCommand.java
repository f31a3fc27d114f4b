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

package org.elasticsoftware.ledger.aggregates.instrument;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.ledger.annotations.CommandInfo;
import org.elasticsoftware.ledger.commands.CreateAggregateCommand;

import java.util.Map;
import java.util.Objects;

@CommandInfo(type = "CreateInstrument")
public record CreateInstrumentCommand(
        @Nullable String id,
        @Nullable String partyId,
        @NotNull String name,
        @NotNull String identityId,
        @NotNull String currency,
        @NotNull Resource resource,
        @Nullable String externalId,
        @Nullable Map<String, Object> metadata
) implements CreateAggregateCommand<InstrumentState, CreateInstrumentCommand> {

    public CreateInstrumentCommand(String name, String identityId, String currency, Resource resource,
                                   @Nullable String externalId, @Nullable Map<String, Object> metadata) {
        this(null, null, name, identityId, currency, resource, externalId, metadata);
    }

    @Override
    public String getAggregateId() {
        return id();
    }

    @Override
    public CreateInstrumentCommand assign(String aggregateId, String partyId) {
        return new CreateInstrumentCommand(aggregateId, partyId, name, identityId, currency, resource, externalId, metadata);
    }

    @Override
    public boolean matches(InstrumentState existingState) {
        return Objects.equals(name, existingState.name()) &&
                Objects.equals(identityId, existingState.identityId()) &&
                currency.equalsIgnoreCase(String.valueOf(existingState.currency())) &&
                Objects.equals(resource, existingState.resource());
    }
}
