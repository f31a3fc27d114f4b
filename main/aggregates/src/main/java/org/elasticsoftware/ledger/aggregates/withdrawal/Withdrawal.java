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

package org.elasticsoftware.ledger.aggregates.withdrawal;

import org.elasticsoftware.ledger.aggregate.Aggregate;
import org.elasticsoftware.ledger.aggregate.AggregateRepository;
import org.elasticsoftware.ledger.aggregates.common.Money;
import org.elasticsoftware.ledger.aggregates.common.ReferenceValidator;
import org.elasticsoftware.ledger.aggregates.errors.InconsistentCurrencyErrorEvent;
import org.elasticsoftware.ledger.aggregates.errors.InvalidAmountErrorEvent;
import org.elasticsoftware.ledger.aggregates.errors.InvalidStatusTransitionErrorEvent;
import org.elasticsoftware.ledger.aggregates.instrument.InstrumentState;
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

@AggregateInfo(value = "Withdrawal", events = WithdrawalEvent.class)
public final class Withdrawal implements Aggregate<WithdrawalState> {
    private final AggregateRepository<WalletState> wallets;
    private final AggregateRepository<InstrumentState> instruments;
    private final ReferenceValidator referenceValidator;
    private final Clock clock;

    public Withdrawal(AggregateRepository<WalletState> wallets,
                      AggregateRepository<InstrumentState> instruments,
                      ReferenceValidator referenceValidator,
                      Clock clock) {
        this.wallets = wallets;
        this.instruments = instruments;
        this.referenceValidator = referenceValidator;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "Withdrawal";
    }

    @Override
    public Class<WithdrawalState> getStateClass() {
        return WithdrawalState.class;
    }

    @CommandHandler(create = true,
            produces = {WithdrawalCreatedEvent.class, WithdrawalStatusChangedEvent.class},
            errors = {ReferencedEntityNotFoundErrorEvent.class,
                    ReferencedEntityInaccessibleErrorEvent.class,
                    InvalidAmountErrorEvent.class,
                    InconsistentCurrencyErrorEvent.class})
    public Stream<DomainEvent> create(CreateWithdrawalCommand cmd, WithdrawalState isNull) {
        Optional<WalletState> wallet = wallets.findById(cmd.walletId()).filter(state -> state.partyId() != null);
        if (wallet.isEmpty()) {
            return Stream.of(new ReferencedEntityNotFoundErrorEvent(cmd.id(), "wallet", cmd.walletId()));
        }
        Optional<InstrumentState> destination = instruments.findById(cmd.destinationId()).filter(state -> state.partyId() != null);
        if (destination.isEmpty()) {
            return Stream.of(new ReferencedEntityNotFoundErrorEvent(cmd.id(), "destination", cmd.destinationId()));
        }
        Optional<ErrorEvent> referenceError = referenceValidator.checkOwner(cmd.id(), "wallet", cmd.walletId(),
                        wallet.get().partyId(), cmd.partyId())
                .or(() -> referenceValidator.checkOwner(cmd.id(), "destination", cmd.destinationId(),
                        destination.get().partyId(), cmd.partyId()))
                .or(() -> referenceValidator.checkParty(cmd.id(), cmd.partyId()));
        if (referenceError.isPresent()) {
            return Stream.of(referenceError.get());
        }
        if (!destination.get().isAuthorized()) {
            return Stream.of(new ReferencedEntityInaccessibleErrorEvent(cmd.id(), "destination", cmd.destinationId(), "unauthorized"));
        }
        Money body = cmd.body();
        if (body.amount() <= 0) {
            return Stream.of(new InvalidAmountErrorEvent(cmd.id(), body));
        }
        if (!body.currency().equalsIgnoreCase(wallet.get().currency())) {
            return Stream.of(new InconsistentCurrencyErrorEvent(cmd.id(), cmd.walletId(), wallet.get().currency(), body.currency()));
        }
        if (!body.currency().equalsIgnoreCase(destination.get().currency())) {
            return Stream.of(new InconsistentCurrencyErrorEvent(cmd.id(), cmd.destinationId(), destination.get().currency(), body.currency()));
        }
        return Stream.of(
                new WithdrawalCreatedEvent(
                        cmd.id(),
                        cmd.partyId(),
                        cmd.walletId(),
                        cmd.destinationId(),
                        body,
                        cmd.externalId(),
                        clock.instant(),
                        cmd.metadata()),
                new WithdrawalStatusChangedEvent(cmd.id(), WithdrawalStatus.PENDING, null));
    }

    @CommandHandler(produces = WithdrawalStatusChangedEvent.class, errors = InvalidStatusTransitionErrorEvent.class)
    public Stream<DomainEvent> finish(FinishWithdrawalCommand cmd, WithdrawalState currentState) {
        if (currentState.status() == cmd.outcome()) {
            return Stream.empty();
        }
        if (!cmd.outcome().isFinal() || (currentState.status() != null && currentState.status().isFinal())) {
            return Stream.of(new InvalidStatusTransitionErrorEvent(cmd.id(), String.valueOf(currentState.status()), cmd.outcome().name()));
        }
        return Stream.of(new WithdrawalStatusChangedEvent(cmd.id(), cmd.outcome(), cmd.failureReason()));
    }

    @EventSourcingHandler(create = true)
    public WithdrawalState create(WithdrawalCreatedEvent event, WithdrawalState isNull) {
        return new WithdrawalState(
                event.id(),
                event.partyId(),
                event.walletId(),
                event.destinationId(),
                event.body(),
                event.externalId(),
                event.createdAt(),
                event.metadata(),
                null,
                null);
    }

    @EventSourcingHandler
    public WithdrawalState statusChanged(WithdrawalStatusChangedEvent event, WithdrawalState state) {
        return state.withStatus(event.status(), event.failureReason());
    }
}
