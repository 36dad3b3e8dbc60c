package me.golemcore.substrate.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of an agent's budget. Instances are immutable; the Budget Register
 * swaps in a new snapshot for every committed change.
 *
 * <p>
 * Consumption is also kept per cost type, which is the action kind of the paid
 * intent or {@link #UNATTRIBUTED} for debits bound to no intent. An account
 * with a window refuses debits once {@code windowEndsAt} has passed.
 */
@Value
@Builder(toBuilder = true)
public class BudgetAccount {

    public static final String UNATTRIBUTED = "unattributed";

    String agentId;
    long allocated;
    long consumed;
    @Builder.Default
    Map<String, Long> consumedByType = Map.of();
    Instant windowEndsAt;

    public static BudgetAccount open(String agentId, long allocated) {
        return BudgetAccount.builder().agentId(agentId).allocated(allocated).consumed(0).build();
    }

    public long getRemaining() {
        return allocated - consumed;
    }

    public boolean covers(long amount) {
        return getRemaining() >= amount;
    }

    public boolean isExpired(Instant now) {
        return windowEndsAt != null && now.isAfter(windowEndsAt);
    }

    public long getConsumed(String costType) {
        return consumedByType.getOrDefault(costType, 0L);
    }

    public BudgetAccount withDebit(long amount) {
        return withDebit(amount, UNATTRIBUTED);
    }

    public BudgetAccount withDebit(long amount, String costType) {
        if (!covers(amount)) {
            throw new IllegalStateException("debit of " + amount + " exceeds remaining " + getRemaining());
        }
        Map<String, Long> byType = new LinkedHashMap<>(consumedByType);
        byType.merge(costType == null ? UNATTRIBUTED : costType, amount, Long::sum);
        return toBuilder().consumed(consumed + amount).consumedByType(Map.copyOf(byType)).build();
    }

    public BudgetAccount withAllocation(long amount) {
        return toBuilder().allocated(allocated + amount).build();
    }

    public BudgetAccount withWindow(Instant endsAt) {
        return toBuilder().windowEndsAt(endsAt).build();
    }
}
