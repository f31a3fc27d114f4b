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
import org.elasticsoftware.ledger.events.ErrorEvent;

import java.util.Optional;

public record CreateResult<S extends AggregateState>(
        Outcome outcome,
        @Nullable AggregateView<S> view,
        @Nullable ErrorEvent error
) {
    public enum Outcome {
        CREATED,
        REPLAYED,
        FAILED
    }

    public static <S extends AggregateState> CreateResult<S> created(AggregateView<S> view) {
        return new CreateResult<>(Outcome.CREATED, view, null);
    }

    public static <S extends AggregateState> CreateResult<S> replayed(AggregateView<S> view) {
        return new CreateResult<>(Outcome.REPLAYED, view, null);
    }

    public static <S extends AggregateState> CreateResult<S> failed(ErrorEvent error) {
        return new CreateResult<>(Outcome.FAILED, null, error);
    }

    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }

    public Optional<S> state() {
        return Optional.ofNullable(view).map(AggregateView::state);
    }
}
