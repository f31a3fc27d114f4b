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

package org.elasticsoftware.ledger.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.ledger.annotations.DomainEventInfo;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.protocol.DomainEventRecord;
import org.elasticsoftware.ledger.protocol.PayloadEncoding;

import java.io.IOException;

/**
 * Converts domain events to and from the records kept by the event store. The record name and
 * version come from the event's {@link DomainEventInfo}.
 */
public class DomainEventSerde {
    private final ObjectMapper objectMapper;

    public DomainEventSerde(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DomainEventRecord serialize(String aggregateName, DomainEvent event) {
        DomainEventInfo eventInfo = event.getClass().getAnnotation(DomainEventInfo.class);
        if (eventInfo == null) {
            throw new IllegalArgumentException("Event class " + event.getClass().getName() +
                    " must be annotated with @DomainEventInfo");
        }
        try {
            return new DomainEventRecord(
                    eventInfo.type(),
                    eventInfo.version(),
                    objectMapper.writeValueAsBytes(event),
                    PayloadEncoding.JSON,
                    event.getAggregateId(),
                    0L,
                    null);
        } catch (IOException e) {
            throw new EventSerializationException("Unable to serialize " + eventInfo.type() + " version " + eventInfo.version(),
                    aggregateName, event.getAggregateId(), e);
        }
    }

    public <E extends DomainEvent> E deserialize(String aggregateName, DomainEventRecord record, Class<E> eventClass) {
        if (record.encoding() != PayloadEncoding.JSON) {
            throw new EventSerializationException("Unsupported payload encoding " + record.encoding() + " for " + record.name(),
                    aggregateName, record.aggregateId(), null);
        }
        try {
            return objectMapper.readValue(record.payload(), eventClass);
        } catch (IOException e) {
            throw new EventSerializationException("Unable to deserialize " + record.name() + " version " + record.version() +
                    " at generation " + record.generation(), aggregateName, record.aggregateId(), e);
        }
    }
}
