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

package org.elasticsoftware.ledger.store;

import org.elasticsoftware.ledger.LedgerException;

public class EventStoreConflictException extends LedgerException {
    private final long expectedGeneration;
    private final long actualGeneration;

    public EventStoreConflictException(String aggregateName, String aggregateId, long expectedGeneration, long actualGeneration) {
        super("Expected generation " + expectedGeneration + " but found " + actualGeneration +
                " for " + aggregateName + " with id " + aggregateId, aggregateName, aggregateId);
        this.expectedGeneration = expectedGeneration;
        this.actualGeneration = actualGeneration;
    }

    public long getExpectedGeneration() {
        return expectedGeneration;
    }

    public long getActualGeneration() {
        return actualGeneration;
    }
}
