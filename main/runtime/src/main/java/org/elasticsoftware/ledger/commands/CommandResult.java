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

package org.elasticsoftware.ledger.commands;

import jakarta.annotation.Nullable;
import org.elasticsoftware.ledger.aggregate.AggregateState;
import org.elasticsoftware.ledger.aggregate.AggregateView;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;

import java.util.List;

/**
 * @param view   the state after the command, or the unchanged state when nothing was appended
 * @param events the events that were appended, empty for a no-op
 * @param error  set when the command was rejected
 */
public record CommandResult<S extends AggregateState>(
        @Nullable AggregateView<S> view,
        List<DomainEvent> events,
        @Nullable ErrorEvent error
) {
    public static <S extends AggregateState> CommandResult<S> success(AggregateView<S> view, List<DomainEvent> events) {
        return new CommandResult<>(view, List.copyOf(events), null);
    }

    public static <S extends AggregateState> CommandResult<S> failed(ErrorEvent error) {
        return new CommandResult<>(null, List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
