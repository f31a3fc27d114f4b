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

package org.elasticsoftware.ledger.events;

import jakarta.validation.constraints.NotNull;

/**
 * Carries an event of an embedded aggregate inside the event log of its parent.
 *
 * @param <E> the base type of the embedded aggregate's events
 */
public interface SubAggregateEvent<E extends DomainEvent> extends DomainEvent {
    @NotNull E event();

    @NotNull SubAggregateEvent<E> withEvent(@NotNull E event);
}
