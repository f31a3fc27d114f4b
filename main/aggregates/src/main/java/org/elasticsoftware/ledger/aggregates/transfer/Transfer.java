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

import org.elasticsoftware.ledger.aggregate.Aggregate;
import org.elasticsoftware.ledger.aggregate.AggregateRepository;
import org.elasticsoftware.ledger.aggregates.common.Money;
import org.elasticsoftware.ledger.aggregates.common.ReferenceValidator;
import org.elasticsoftware.ledger.aggregates.errors.InconsistentCurrencyErrorEvent;
import org.elasticsoftware.ledger.aggregates.errors.InvalidAmountErrorEvent;
import org.elasticsoftware.ledger.aggregates.errors.InvalidStatusTransitionErrorEvent;
import org.elasticsoftware.ledger.aggregates.wallet.WalletState;
import org.elasticsoftware.ledger.annotations.AggregateInfo;
import org.elasticsoftware.ledger.annotations.CommandHandler;
import org.elasticsoftware.ledger.annotations.EventSourcingHandler;
import org.elasticsoftware.ledger.errors.ReferencedEntityInaccessibleErrorEvent;
import org.elasticsoftware.ledger.errors.ReferencedEntityNotFoundErrorEvent;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;

import java.time.Clock;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Moves funds between two wallets of the same party.
 */
@AggregateInfo(value = "Transfer", events = TransferEvent.class)
public final class Transfer implements Aggregate<TransferState> {
    private final AggregateRepository<WalletState> wallets;
    private final ReferenceValidator referenceValidator;
    private final Clock clock;

    public Transfer(AggregateRepository<WalletState> wallets, ReferenceValidator referenceValidator, Clock clock) {
        this.wallets = wallets;
        this.referenceValidator = referenceValidator;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "Transfer";
    }

    @Override
    public Class<TransferState> getStateClass() {
        return TransferState.class;
    }

    @CommandHandler(create = true,
            produces = {TransferCreatedEvent.class, TransferStatusChangedEvent.class},
            errors = {ReferencedEntityNotFoundErrorEvent.class,
                    ReferencedEntityInaccessibleErrorEvent.class,
                    InvalidAmountErrorEvent.class,
                    InconsistentCurrencyErrorEvent.class})
    public Stream<DomainEvent> create(CreateTransferCommand cmd, TransferState isNull) {
        Optional<WalletState> source = wallets.findById(cmd.sourceWalletId()).filter(state -> state.partyId() != null);
        if (source.isEmpty()) {
            return Stream.of(new ReferencedEntityNotFoundErrorEvent(cmd.id(), "source", cmd.sourceWalletId()));
        }
        Optional<WalletState> destination = wallets.findById(cmd.destinationWalletId()).filter(state -> state.partyId() != null);
        if (destination.isEmpty()) {
            return Stream.of(new ReferencedEntityNotFoundErrorEvent(cmd.id(), "destination", cmd.destinationWalletId()));
        }
        Optional<ErrorEvent> referenceError = referenceValidator.checkOwner(cmd.id(), "source", cmd.sourceWalletId(),
                        source.get().partyId(), cmd.partyId())
                .or(() -> referenceValidator.checkOwner(cmd.id(), "destination", cmd.destinationWalletId(),
                        destination.get().partyId(), cmd.partyId()))
                .or(() -> referenceValidator.checkParty(cmd.id(), cmd.partyId()));
        if (referenceError.isPresent()) {
            return Stream.of(referenceError.get());
        }
        Money body = cmd.body();
        if (body.amount() <= 0) {
            return Stream.of(new InvalidAmountErrorEvent(cmd.id(), body));
        }
        if (!body.currency().equalsIgnoreCase(source.get().currency())) {
            return Stream.of(new InconsistentCurrencyErrorEvent(cmd.id(), cmd.sourceWalletId(), source.get().currency(), body.currency()));
        }
        if (!body.currency().equalsIgnoreCase(destination.get().currency())) {
            return Stream.of(new InconsistentCurrencyErrorEvent(cmd.id(), cmd.destinationWalletId(), destination.get().currency(), body.currency()));
        }
        return Stream.of(
                new TransferCreatedEvent(
                        cmd.id(),
                        cmd.partyId(),
                        cmd.sourceWalletId(),
                        cmd.destinationWalletId(),
                        body,
                        cmd.externalId(),
                        clock.instant(),
                        cmd.metadata()),
                new TransferStatusChangedEvent(cmd.id(), TransferStatus.PENDING, null));
    }

    @CommandHandler(produces = TransferStatusChangedEvent.class, errors = InvalidStatusTransitionErrorEvent.class)
    public Stream<DomainEvent> finish(FinishTransferCommand cmd, TransferState currentState) {
        if (currentState.status() == cmd.outcome()) {
            return Stream.empty();
        }
        if (!cmd.outcome().isFinal() || (currentState.status() != null && currentState.status().isFinal())) {
            return Stream.of(new InvalidStatusTransitionErrorEvent(cmd.id(), String.valueOf(currentState.status()), cmd.outcome().name()));
        }
        return Stream.of(new TransferStatusChangedEvent(cmd.id(), cmd.outcome(), cmd.failureReason()));
    }

    @EventSourcingHandler(create = true)
    public TransferState create(TransferCreatedEvent event, TransferState isNull) {
        return new TransferState(
                event.id(),
                event.partyId(),
                event.sourceWalletId(),
                event.destinationWalletId(),
                event.body(),
                event.externalId(),
                event.createdAt(),
                event.metadata(),
                null,
                null);
    }

    @EventSourcingHandler
    public TransferState statusChanged(TransferStatusChangedEvent event, TransferState state) {
        return state.withStatus(event.status(), event.failureReason());
    }
}
