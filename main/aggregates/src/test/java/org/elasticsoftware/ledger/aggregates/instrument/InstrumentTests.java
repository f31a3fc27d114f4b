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

import org.elasticsoftware.ledger.aggregate.AggregateView;
import org.elasticsoftware.ledger.aggregates.LedgerTestFixture;
import org.elasticsoftware.ledger.commands.CommandResult;
import org.elasticsoftware.ledger.commands.CreateResult;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.elasticsoftware.ledger.aggregates.LedgerTestFixture.PARTY_1;
import static org.junit.jupiter.api.Assertions.*;

public class InstrumentTests {
    private static final Instant RECORDED_AT = Instant.parse("2019-07-04T16:20:00Z");
    private static final BankCardResource CARD = new BankCardResource("token-1", "424242", "4242");
    private LedgerTestFixture ledger;
    private String identityId;

    @BeforeEach
    void setUp() {
        ledger = new LedgerTestFixture();
        identityId = ledger.createIdentity(PARTY_1);
    }

    @Test
    void testCreatedInstrumentIsUnauthorized() {
        CreateResult<InstrumentState> result = ledger.createCommandProcessor.create(PARTY_1,
                new CreateInstrumentCommand("Card", identityId, "usd", CARD, "ext-1", null));

        InstrumentState state = result.state().orElseThrow();
        assertEquals(InstrumentStatus.UNAUTHORIZED, state.status());
        assertEquals("USD", state.currency());
        assertEquals(CARD, state.resource());
        assertNotNull(state.account());
        assertEquals(3L, result.view().generation());
    }

    @Test
    void testReplayComparesResource() {
        ledger.createCommandProcessor.create(PARTY_1, new CreateInstrumentCommand("Card", identityId, "USD", CARD, "ext-1", null));

        CreateResult<InstrumentState> otherCard = ledger.createCommandProcessor.create(PARTY_1,
                new CreateInstrumentCommand("Card", identityId, "USD", new BankCardResource("token-2", null, null), "ext-1", null));
        CreateResult<InstrumentState> sameCard = ledger.createCommandProcessor.create(PARTY_1,
                new CreateInstrumentCommand("Card", identityId, "USD", CARD, "ext-1", null));

        assertFalse(otherCard.isSuccess());
        assertEquals(CreateResult.Outcome.REPLAYED, sameCard.outcome());
    }

    @Test
    void testAuthorizeTwice() {
        String instrumentId = ledger.createCommandProcessor.create(PARTY_1,
                new CreateInstrumentCommand("Card", identityId, "USD", CARD, null, null)).view().aggregateId();
        int logLength = ledger.logLength("Instrument", instrumentId);

        CommandResult<InstrumentState> first = ledger.commandProcessor.handle(new AuthorizeInstrumentCommand(instrumentId));
        CommandResult<InstrumentState> second = ledger.commandProcessor.handle(new AuthorizeInstrumentCommand(instrumentId));

        assertEquals(List.of(new InstrumentStatusChangedEvent(instrumentId, InstrumentStatus.AUTHORIZED)), first.events());
        assertTrue(second.isSuccess());
        assertTrue(second.events().isEmpty());
        assertEquals(InstrumentStatus.AUTHORIZED, second.view().state().status());
        assertEquals(logLength + 1, ledger.logLength("Instrument", instrumentId));
    }

    @Test
    void testVersion1IsMigratedToCurrent() {
        ledger.legacyMetadata.put("legacy-1", Map.of("origin", "import"));
        ledger.importLegacy("Instrument", "legacy-1", RECORDED_AT, new InstrumentCreatedEventV1(
                "legacy-1", "party-1", identityId, "card 123456789012 ok", "USD", CARD, "ext-legacy"));

        InstrumentState state = ledger.instruments.findById("legacy-1").orElseThrow();

        assertEquals("card  ok", state.name());
        assertEquals(Map.of("origin", "import"), state.metadata());
        assertEquals(RECORDED_AT, state.createdAt());
        assertEquals(InstrumentStatus.UNAUTHORIZED, state.status());
    }

    @Test
    void testVersion0CryptoWalletKeepsTag() {
        ledger.importLegacy("Instrument", "legacy-0", RECORDED_AT, new InstrumentCreatedEventV0(
                "legacy-0", "party-1", identityId, "Cold storage", "BTC",
                new LegacyResource("crypto_wallet", Map.of("id", "bc1qxy", "currency", "bitcoin", "tag", "memo-7")),
                null));

        InstrumentState state = ledger.instruments.findById("legacy-0").orElseThrow();

        assertEquals(new CryptoWalletResource("bc1qxy", "bitcoin", Map.of("tag", "memo-7")), state.resource());
        assertNull(state.metadata());
    }

    @Test
    void testEveryLegacyVersionReachesCurrent() {
        Map<String, Object> metadata = Map.of("origin", "import");
        List<DomainEvent> legacyEvents = List.of(
                new InstrumentCreatedEventV0("v0", "party-1", identityId, "Card", "USD",
                        new LegacyResource("bank_card", Map.of("token", "t", "bin", "411111", "masked_pan", "1111")), null),
                new InstrumentCreatedEventV1("v1", "party-1", identityId, "Card", "USD", CARD, null),
                new InstrumentCreatedEventV2("v2", "party-1", identityId, "Card", "USD", CARD, null, RECORDED_AT),
                new InstrumentCreatedEventV3("v3", "party-1", identityId, "Card", "USD", CARD, null, RECORDED_AT, metadata));

        for (DomainEvent event : legacyEvents) {
            ledger.legacyMetadata.put(event.getAggregateId(), metadata);
            ledger.importLegacy("Instrument", event.getAggregateId(), RECORDED_AT, event);
            InstrumentState state = ledger.instruments.findById(event.getAggregateId()).orElseThrow();
            assertThat(state).hasNoNullFieldsOrPropertiesExcept("externalId", "account");
            assertEquals(RECORDED_AT, state.createdAt());
            assertEquals(metadata, state.metadata());
        }
    }

    @Test
    void testMigrationIsStableOnceCurrent() {
        ledger.legacyMetadata.put("legacy-1", Map.of("origin", "import"));
        ledger.importLegacy("Instrument", "legacy-1", RECORDED_AT, new InstrumentCreatedEventV1(
                "legacy-1", "party-1", identityId, "card 4111111111111111", "USD", CARD, null));
        AggregateView<InstrumentState> migrated = ledger.instruments.load("legacy-1").orElseThrow();
        InstrumentState state = migrated.state();

        // store the migrated shape again, now at the current version
        ledger.importLegacy("Instrument", "current-1", RECORDED_AT, new InstrumentCreatedEvent(
                "current-1", state.partyId(), state.identityId(), state.name(), state.currency(), state.resource(),
                state.externalId(), state.createdAt(), state.metadata()));
        InstrumentState remigrated = ledger.instruments.findById("current-1").orElseThrow();

        assertEquals(migrated, ledger.instruments.load("legacy-1").orElseThrow());
        assertEquals(state.name(), remigrated.name());
        assertEquals(state.metadata(), remigrated.metadata());
        assertEquals(state.createdAt(), remigrated.createdAt());
    }

    @Test
    void testScrubName() {
        assertEquals("card  ok", Instrument.scrubName("card 123456789012 ok"));
        assertEquals("visa ", Instrument.scrubName("visa 4111111111111111"));
        assertEquals("order 12345678901", Instrument.scrubName("order 12345678901"));
        assertEquals("0", Instrument.scrubName("12345678901234567890"));
    }

    @Test
    void testUnknownLegacyResource() {
        assertThrows(IllegalArgumentException.class,
                () -> Instrument.toResource(new LegacyResource("paper_cheque", Map.of())));
    }

    @Test
    void testVersion0NestedBankCardIsUnwrapped() {
        ledger.importLegacy("Instrument", "legacy-card", RECORDED_AT, new InstrumentCreatedEventV0(
                "legacy-card", "party-1", identityId, "Card", "USD",
                new LegacyResource("bank_card", Map.of("bank_card",
                        Map.of("token", "t", "bin", "411111", "masked_pan", "1111"))),
                null));

        InstrumentState state = ledger.instruments.load("legacy-card").orElseThrow().state();

        assertEquals(new BankCardResource("t", "411111", "1111"), state.resource());
    }

    @Test
    void testVersion0NestedCryptoWalletIsUnwrapped() {
        ledger.importLegacy("Instrument", "legacy-wallet", RECORDED_AT, new InstrumentCreatedEventV0(
                "legacy-wallet", "party-1", identityId, "Cold storage", "BTC",
                new LegacyResource("crypto_wallet", Map.of("crypto_wallet",
                        Map.of("id", "rXyz", "currency", "ripple", "tag", "42"))),
                null));

        InstrumentState state = ledger.instruments.load("legacy-wallet").orElseThrow().state();

        assertEquals(new CryptoWalletResource("rXyz", "ripple", Map.of("tag", "42")), state.resource());
    }

    @Test
    void testLegacyResourceWithoutRequiredFieldIsRejected() {
        IllegalArgumentException noToken = assertThrows(IllegalArgumentException.class,
                () -> Instrument.toResource(new LegacyResource("bank_card", Map.of("bin", "411111"))));
        assertThat(noToken.getMessage()).contains("token");

        IllegalArgumentException noCurrency = assertThrows(IllegalArgumentException.class,
                () -> Instrument.toResource(new LegacyResource("crypto_wallet",
                        Map.of("crypto_wallet", Map.of("id", "bc1qxy")))));
        assertThat(noCurrency.getMessage()).contains("currency");

        assertThrows(IllegalArgumentException.class,
                () -> Instrument.toResource(new LegacyResource("bank_card", Map.of("token", List.of("t")))));
    }

    @Test
    void testLegacyNumericBinIsKeptAsText() {
        assertEquals(new BankCardResource("t", "411111", null),
                Instrument.toResource(new LegacyResource("bank_card", Map.of("token", "t", "bin", 411111))));
    }
}
