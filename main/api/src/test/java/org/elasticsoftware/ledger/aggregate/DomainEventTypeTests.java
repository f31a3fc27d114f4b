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

import org.elasticsoftware.ledger.events.DomainEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DomainEventTypeTests {

    @Test
    public void testDomainEventTypeCreation() {
        DomainEventType<TestEvent> eventType = new DomainEventType<>("TestEvent", 2, TestEvent.class, true, false);

        assertEquals("TestEvent", eventType.typeName());
        assertEquals(2, eventType.version());
        assertEquals(TestEvent.class, eventType.typeClass());
        assertTrue(eventType.create());
        assertFalse(eventType.error());
    }

    @Test
    public void testEquality() {
        assertEquals(
                new DomainEventType<>("TestEvent", 1, TestEvent.class, false, false),
                new DomainEventType<>("TestEvent", 1, TestEvent.class, false, false));
        assertNotEquals(
                new DomainEventType<>("TestEvent", 1, TestEvent.class, false, false),
                new DomainEventType<>("TestEvent", 2, TestEvent.class, false, false));
    }

    record TestEvent(String id) implements DomainEvent {
        @Override
        public String getAggregateId() {
            return id;
        }
    }
}
