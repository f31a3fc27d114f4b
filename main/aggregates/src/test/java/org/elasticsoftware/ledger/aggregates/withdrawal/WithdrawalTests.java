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

import org.elasticsoftware.ledger.aggregates.LedgerTestFixture;
import org.elasticsoftware.ledger.aggregates.common.Money;
import org.elasticsoftware.ledger.aggregates.errors.InconsistentCurrencyErrorEvent;
import org.elasticsoftware.ledger.aggregates.errors.InvalidAmountErrorEvent;
import org.elasticsoftware.ledger.aggregates.errors.InvalidStatusTransitionErrorEvent;
import org.elasticsoftware.ledger.aggregates.instrument.BankCardResource;
import org.elasticsoftware.ledger.aggregates.instrument.CreateInstrumentCommand;
import org.elasticsoftware.ledger.commands.CommandResult;
import org.elasticsoftware.ledger.commands.CreateResult;
import org.elasticsoftware.ledger.errors.ReferencedEntityInaccessibleErrorEvent;
import org.elasticsoftware.ledger.errors.ReferencedEntityNotFoundErrorEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.elasticsoftware.ledger.aggregates.LedgerTestFixture.NOW;
import static org.elasticsoftware.ledger.aggregates.LedgerTestFixture.PARTY_1;
import static org.elasticsoftware.ledger.aggregates.LedgerTestFixture.PARTY_2;
import static org.junit.jupiter.api.Assertions.*;

public class WithdrawalTests {
    private LedgerTestFixture ledger;
    private String identityId;
    private String walletId;
    private String destinationId;

    @BeforeEach
    void setUp() {
        ledger = new LedgerTestFixture();
        identityId = ledger.createIdentity(PARTY_1);
        walletId = ledger.createWallet(PARTY_1, identityId, "USD");
        destinationId = ledger.createAuthorizedInstrument(PARTY_1, identityId, "USD");
    }

    private CreateResult<WithdrawalState> withdraw(String walletId, String destinationId, Money body) {
        return ledger.createCommandProcessor.create(PARTY_1, new CreateWithdrawalCommand(walletId, destinationId, body, "ext-1", null));
    }

    @Test
    void testCreateWithdrawal() {
        CreateResult<WithdrawalState> result = withdraw(walletId, destinationId, new Money(1500, "USD"));

        assertEquals(CreateResult.Outcome.CREATED, result.outcome());
        WithdrawalState state = result.state().orElseThrow();
        assertEquals(WithdrawalStatus.PENDING, state.status());
        assertEquals(new Money(1500, "USD"), state.body());
        assertEquals(NOW, state.createdAt());
        assertEquals(2L, result.view().generation());

        CreateResult<WithdrawalState> replay = withdraw(walletId, destinationId, new Money(1500, "USD"));
        assertEquals(CreateResult.Outcome.REPLAYED, replay.outcome());
    }

    @Test
    void testUnknownWallet() {
        ReferencedEntityNotFoundErrorEvent error =
                (ReferencedEntityNotFoundErrorEvent) withdraw("no-wallet", destinationId, new Money(100, "USD")).error();
        assertEquals("wallet", error.referenceType());
    }

    @Test
    void testUnknownDestination() {
        ReferencedEntityNotFoundErrorEvent error =
                (ReferencedEntityNotFoundErrorEvent) withdraw(walletId, "no-destination", new Money(100, "USD")).error();
        assertEquals("destination", error.referenceType());
    }

    @Test
    void testUnauthorizedDestination() {
        String unauthorized = ledger.createCommandProcessor.create(PARTY_1, new CreateInstrumentCommand(
                "Card", identityId, "USD", new BankCardResource("token-9", null, null), null, null)).view().aggregateId();

        ReferencedEntityInaccessibleErrorEvent error =
                (ReferencedEntityInaccessibleErrorEvent) withdraw(walletId, unauthorized, new Money(100, "USD")).error();
        assertEquals("destination", error.referenceType());
        assertEquals("unauthorized", error.reason());
    }

    @Test
    void testWalletOfAnotherParty() {
        String otherIdentity = ledger.createIdentity(PARTY_2);
        String otherWallet = ledger.createWallet(PARTY_2, otherIdentity, "USD");

        ReferencedEntityInaccessibleErrorEvent error =
                (ReferencedEntityInaccessibleErrorEvent) withdraw(otherWallet, destinationId, new Money(100, "USD")).error();
        assertEquals("wallet", error.referenceType());
        assertEquals(otherWallet, error.referenceId());
    }

    @Test
    void testAmountMustBePositive() {
        CreateResult<WithdrawalState> result = withdraw(walletId, destinationId, new Money(0, "USD"));

        assertEquals(new InvalidAmountErrorEvent(result.error().getAggregateId(), new Money(0, "USD")), result.error());
    }

    @Test
    void testCurrencyMustMatchWallet() {
        InconsistentCurrencyErrorEvent error =
                (InconsistentCurrencyErrorEvent) withdraw(walletId, destinationId, new Money(100, "EUR")).error();

        assertEquals(walletId, error.referenceId());
        assertEquals("USD", error.expectedCurrency());
        assertEquals("EUR", error.actualCurrency());
    }

    @Test
    void testCurrencyMustMatchDestination() {
        String eurDestination = ledger.createAuthorizedInstrument(PARTY_1, identityId, "EUR");

        InconsistentCurrencyErrorEvent error =
                (InconsistentCurrencyErrorEvent) withdraw(walletId, eurDestination, new Money(100, "USD")).error();

        assertEquals(eurDestination, error.referenceId());
    }

    @Test
    void testFinish() {
        String withdrawalId = withdraw(walletId, destinationId, new Money(100, "USD")).view().aggregateId();

        CommandResult<WithdrawalState> failed = ledger.commandProcessor.handle(
                new FinishWithdrawalCommand(withdrawalId, WithdrawalStatus.FAILED, "insufficient funds"));
        CommandResult<WithdrawalState> repeated = ledger.commandProcessor.handle(
                new FinishWithdrawalCommand(withdrawalId, WithdrawalStatus.FAILED, "insufficient funds"));
        CommandResult<WithdrawalState> reversed = ledger.commandProcessor.handle(
                new FinishWithdrawalCommand(withdrawalId, WithdrawalStatus.SUCCEEDED, null));

        assertEquals(WithdrawalStatus.FAILED, failed.view().state().status());
        assertEquals("insufficient funds", failed.view().state().failureReason());
        assertTrue(repeated.events().isEmpty());
        assertEquals(new InvalidStatusTransitionErrorEvent(withdrawalId, "FAILED", "SUCCEEDED"), reversed.error());
        assertEquals(WithdrawalStatus.FAILED, ledger.withdrawals.findById(withdrawalId).orElseThrow().status());
    }

    @Test
    void testFinishWithPendingIsNoop() {
        String withdrawalId = withdraw(walletId, destinationId, new Money(100, "USD")).view().aggregateId();

        CommandResult<WithdrawalState> result = ledger.commandProcessor.handle(
                new FinishWithdrawalCommand(withdrawalId, WithdrawalStatus.PENDING, null));

        assertTrue(result.isSuccess());
        assertTrue(result.events().isEmpty());
        assertEquals(2L, result.view().generation());
    }
}
