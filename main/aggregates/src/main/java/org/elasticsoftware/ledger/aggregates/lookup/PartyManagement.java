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

package org.elasticsoftware.ledger.aggregates.lookup;

import java.util.Optional;

/**
 * The party registry kept outside the ledger.
 */
public interface PartyManagement {
    boolean exists(String partyId);

    /**
     * Returns why the party may not be used right now (blocked, suspended), or empty when it is
     * accessible.
     */
    Optional<String> getInaccessibilityReason(String partyId);
}
