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

package org.elasticsoftware.ledger.aggregates.common;

import org.elasticsoftware.ledger.aggregates.lookup.PartyManagement;
import org.elasticsoftware.ledger.errors.ReferencedEntityInaccessibleErrorEvent;
import org.elasticsoftware.ledger.errors.ReferencedEntityNotFoundErrorEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * Checks shared by the create handlers: the requesting party must exist and be accessible, and
 * referenced entities must belong to it.
 */
public class ReferenceValidator {
    private final PartyManagement partyManagement;

    public ReferenceValidator(PartyManagement partyManagement) {
        this.partyManagement = partyManagement;
    }

    public Optional<ErrorEvent> checkParty(String aggregateId, String partyId) {
        if (!partyManagement.exists(partyId)) {
            return Optional.of(new ReferencedEntityNotFoundErrorEvent(aggregateId, "party", partyId));
        }
        return partyManagement.getInaccessibilityReason(partyId)
                .map(reason -> new ReferencedEntityInaccessibleErrorEvent(aggregateId, "party", partyId, reason));
    }

    public Optional<ErrorEvent> checkOwner(String aggregateId,
                                           String referenceType,
                                           String referenceId,
                                           String ownerPartyId,
                                           String requestingPartyId) {
        if (!Objects.equals(ownerPartyId, requestingPartyId)) {
            return Optional.of(new ReferencedEntityInaccessibleErrorEvent(aggregateId, referenceType, referenceId,
                    "owned by another party"));
        }
        return Optional.empty();
    }
}
