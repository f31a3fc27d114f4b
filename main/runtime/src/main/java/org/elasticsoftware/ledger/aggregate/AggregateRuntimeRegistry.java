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

import org.elasticsoftware.ledger.commands.Command;

import java.util.List;
import java.util.Optional;

/**
 * Looks up the runtime that owns a command or an aggregate name.
 */
public class AggregateRuntimeRegistry {
    private final List<AggregateRuntime<?>> runtimes;

    public AggregateRuntimeRegistry(List<AggregateRuntime<?>> runtimes) {
        this.runtimes = List.copyOf(runtimes);
    }

    @SuppressWarnings("unchecked")
    public <S extends AggregateState> AggregateRuntime<S> getRuntime(Class<? extends Command> commandClass) {
        return (AggregateRuntime<S>) runtimes.stream()
                .filter(runtime -> runtime.handles(commandClass))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No aggregate handles command " + commandClass.getName()));
    }

    public Optional<AggregateRuntime<?>> getRuntime(String aggregateName) {
        return runtimes.stream().filter(runtime -> runtime.getName().equals(aggregateName)).findFirst();
    }

    public List<AggregateRuntime<?>> getRuntimes() {
        return runtimes;
    }
}
