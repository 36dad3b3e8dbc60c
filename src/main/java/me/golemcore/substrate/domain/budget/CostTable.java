package me.golemcore.substrate.domain.budget;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.substrate.domain.exception.UnknownActionKindException;
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configured price list: action kind to cost. Read-only after construction.
 */
@Component
public class CostTable {

    private final Map<String, Long> costs;

    public CostTable(SubstrateProperties properties) {
        Map<String, Long> configured = new LinkedHashMap<>();
        properties.getBudget().getCostTable().forEach((kind, cost) -> {
            if (cost == null || cost < 0) {
                throw new IllegalArgumentException("cost of " + kind + " must be a non-negative number");
            }
            configured.put(kind, cost);
        });
        this.costs = Collections.unmodifiableMap(configured);
    }

    /**
     * @throws UnknownActionKindException
     *             if the kind has no configured cost
     */
    public long quote(String actionKind) {
        Long cost = actionKind == null ? null : costs.get(actionKind);
        if (cost == null) {
            throw new UnknownActionKindException(actionKind);
        }
        return cost;
    }

    public boolean isKnown(String actionKind) {
        return actionKind != null && costs.containsKey(actionKind);
    }

    public Map<String, Long> asMap() {
        return costs;
    }
}
