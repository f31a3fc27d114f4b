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

package org.elasticsoftware.ledger.aggregate;

import org.elasticsoftware.ledger.LedgerException;

/**
 * An event version without a way forward to the current version. This is a schema bug and must
 * never be converted into a recoverable error.
 */
public class MigrationGapException extends LedgerException {
    private final String eventType;
    private final int eventVersion;

    public MigrationGapException(String message, String aggregateName, String aggregateId, String eventType, int eventVersion) {
        super(message, aggregateName, aggregateId);
        this.eventType = eventType;
        this.eventVersion = eventVersion;
    }

    public String getEventType() {
        return eventType;
    }

    public int getEventVersion() {
        return eventVersion;
    }
}
