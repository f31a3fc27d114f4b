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
import org.elasticsoftware.ledger.aggregate.Aggregate;
import org.elasticsoftware.ledger.aggregate.AggregateRepository;
import org.elasticsoftware.ledger.aggregate.MigrationContext;
import org.elasticsoftware.ledger.aggregate.ParentAggregate;
import org.elasticsoftware.ledger.aggregates.account.Account;
import org.elasticsoftware.ledger.aggregates.account.AccountState;
import org.elasticsoftware.ledger.aggregates.common.LegacyContext;
import org.elasticsoftware.ledger.aggregates.common.ReferenceValidator;
import org.elasticsoftware.ledger.aggregates.identity.IdentityState;
import org.elasticsoftware.ledger.aggregates.lookup.CurrencyCatalog;
import org.elasticsoftware.ledger.annotations.AggregateInfo;
import org.elasticsoftware.ledger.annotations.CommandHandler;
import org.elasticsoftware.ledger.annotations.EventSourcingHandler;
import org.elasticsoftware.ledger.annotations.UpcastingHandler;
import org.elasticsoftware.ledger.errors.ReferencedEntityInaccessibleErrorEvent;
import org.elasticsoftware.ledger.errors.ReferencedEntityNotFoundErrorEvent;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * A payment instrument (a card or a crypto wallet address) that withdrawals pay out to. New
 * instruments start {@link InstrumentStatus#UNAUTHORIZED} and can only move to
 * {@link InstrumentStatus#AUTHORIZED}.
 */
@AggregateInfo(value = "Instrument", events = InstrumentEvent.class)
public final class Instrument implements Aggregate<InstrumentState>, ParentAggregate<InstrumentState, AccountState> {
    // card numbers that ended up in instrument names
    private static final Pattern CARD_NUMBER = Pattern.compile("\\d{12,19}");
    private final Account account;
    private final AggregateRepository<IdentityState> identities;
    private final ReferenceValidator referenceValidator;
    private final CurrencyCatalog currencyCatalog;
    private final Clock clock;

    public Instrument(Account account,
                      AggregateRepository<IdentityState> identities,
                      ReferenceValidator referenceValidator,
                      CurrencyCatalog currencyCatalog,
                      Clock clock) {
        this.account = account;
        this.identities = identities;
        this.referenceValidator = referenceValidator;
        this.currencyCatalog = currencyCatalog;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "Instrument";
    }

    @Override
    public Class<InstrumentState> getStateClass() {
        return InstrumentState.class;
    }

    @CommandHandler(create = true,
            produces = {InstrumentCreatedEvent.class, InstrumentAccountEvent.class, InstrumentStatusChangedEvent.class},
            errors = {ReferencedEntityNotFoundErrorEvent.class, ReferencedEntityInaccessibleErrorEvent.class})
    public Stream<DomainEvent> create(CreateInstrumentCommand cmd, InstrumentState isNull) {
        Optional<IdentityState> identity = identities.findById(cmd.identityId());
        if (identity.isEmpty()) {
            return Stream.of(new ReferencedEntityNotFoundErrorEvent(cmd.id(), "identity", cmd.identityId()));
        }
        Optional<ErrorEvent> referenceError = referenceValidator.checkOwner(cmd.id(), "identity", cmd.identityId(),
                        identity.get().partyId(), cmd.partyId())
                .or(() -> referenceValidator.checkParty(cmd.id(), cmd.partyId()));
        if (referenceError.isPresent()) {
            return Stream.of(referenceError.get());
        }
        String currency = cmd.currency().toUpperCase(Locale.ROOT);
        if (!currencyCatalog.isKnown(currency)) {
            return Stream.of(new ReferencedEntityNotFoundErrorEvent(cmd.id(), "currency", cmd.currency()));
        }
        return Stream.of(
                new InstrumentCreatedEvent(
                        cmd.id(),
                        cmd.partyId(),
                        cmd.identityId(),
                        cmd.name(),
                        currency,
                        cmd.resource(),
                        cmd.externalId(),
                        clock.instant(),
                        cmd.metadata()),
                new InstrumentAccountEvent(cmd.id(), account.open(cmd.id(), cmd.identityId(), cmd.partyId(), currency)),
                new InstrumentStatusChangedEvent(cmd.id(), InstrumentStatus.UNAUTHORIZED));
    }

    @CommandHandler(produces = InstrumentStatusChangedEvent.class, errors = {})
    public Stream<DomainEvent> authorize(AuthorizeInstrumentCommand cmd, InstrumentState currentState) {
        if (currentState.isAuthorized()) {
            return Stream.empty();
        }
        return Stream.of(new InstrumentStatusChangedEvent(cmd.id(), InstrumentStatus.AUTHORIZED));
    }

    @EventSourcingHandler(create = true)
    public InstrumentState create(InstrumentCreatedEvent event, InstrumentState shell) {
        return new InstrumentState(
                event.id(),
                event.partyId(),
                event.identityId(),
                event.name(),
                event.currency(),
                event.resource(),
                event.externalId(),
                event.createdAt(),
                event.metadata(),
                shell != null && shell.status() != null ? shell.status() : InstrumentStatus.UNAUTHORIZED,
                shell != null ? shell.account() : null);
    }

    @EventSourcingHandler
    public InstrumentState statusChanged(InstrumentStatusChangedEvent event, InstrumentState state) {
        return state.withStatus(event.status());
    }

    @UpcastingHandler
    public InstrumentCreatedEventV1 upcast(InstrumentCreatedEventV0 event) {
        return new InstrumentCreatedEventV1(
                event.id(),
                event.partyId(),
                event.identityId(),
                event.name(),
                event.currency(),
                toResource(event.resource()),
                event.externalId());
    }

    @UpcastingHandler
    public InstrumentCreatedEventV2 upcast(InstrumentCreatedEventV1 event, MigrationContext migrationContext) {
        return new InstrumentCreatedEventV2(
                event.id(),
                event.partyId(),
                event.identityId(),
                event.name(),
                event.currency(),
                event.resource(),
                event.externalId(),
                LegacyContext.createdAt(migrationContext));
    }

    @UpcastingHandler
    public InstrumentCreatedEventV3 upcast(InstrumentCreatedEventV2 event, MigrationContext migrationContext) {
        return new InstrumentCreatedEventV3(
                event.id(),
                event.partyId(),
                event.identityId(),
                event.name(),
                event.currency(),
                event.resource(),
                event.externalId(),
                event.createdAt(),
                LegacyContext.metadata(migrationContext));
    }

    @UpcastingHandler
    public InstrumentCreatedEvent upcast(InstrumentCreatedEventV3 event) {
        return new InstrumentCreatedEvent(
                event.id(),
                event.partyId(),
                event.identityId(),
                scrubName(event.name()),
                event.currency(),
                event.resource(),
                event.externalId(),
                event.createdAt(),
                event.metadata());
    }

    @Override
    public Account getSubAggregate() {
        return account;
    }

    @Override
    public AccountState getSubAggregateState(@Nullable InstrumentState state) {
        return state != null ? state.account() : null;
    }

    @Override
    public InstrumentState withSubAggregateState(String aggregateId, @Nullable InstrumentState state, AccountState subAggregateState) {
        return (state != null ? state : InstrumentState.shell(aggregateId)).withAccount(subAggregateState);
    }

    static String scrubName(String name) {
        return CARD_NUMBER.matcher(name).replaceAll("");
    }

    /**
     * Maps a version 0 resource to its tagged form. The fields are either flat or nested one level
     * under the resource type, as in {@code {"bank_card": {"token": ...}}}.
     */
    static Resource toResource(LegacyResource legacyResource) {
        String type = legacyResource.type();
        Map<String, Object> fields = unwrapFields(legacyResource);
        switch (type) {
            case "bank_card":
                return new BankCardResource(
                        legacyText(type, fields, "token", true),
                        legacyText(type, fields, "bin", false),
                        legacyText(type, fields, "masked_pan", false));
            case "crypto_wallet":
                Object tag = fields.get("tag");
                return new CryptoWalletResource(
                        legacyText(type, fields, "id", true),
                        legacyText(type, fields, "currency", true),
                        tag != null ? Map.of("tag", tag) : Map.of());
            default:
                throw new IllegalArgumentException("Unknown legacy resource type " + type);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> unwrapFields(LegacyResource legacyResource) {
        Map<String, Object> fields = legacyResource.fields();
        if (fields == null) {
            throw new IllegalArgumentException("Legacy " + legacyResource.type() + " resource has no fields");
        }
        Object nested = fields.get(legacyResource.type());
        return nested instanceof Map<?, ?> nestedFields ? (Map<String, Object>) nestedFields : fields;
    }

    @Nullable
    private static String legacyText(String type, Map<String, Object> fields, String key, boolean required) {
        Object value = fields.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Legacy " + type + " resource is missing " + key);
            }
            return null;
        }
        if (value instanceof CharSequence || value instanceof Number) {
            return value.toString();
        }
        throw new IllegalArgumentException("Legacy " + type + " resource field " + key + " is not a scalar: " +
                value.getClass().getSimpleName());
    }
}
