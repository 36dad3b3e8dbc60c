package me.golemcore.substrate.domain.ledger;

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
import lombok.Singular;
import lombok.Value;
import me.golemcore.substrate.domain.model.EntryOutcome;

import java.util.Map;

/**
 * What a component asks the ledger to record. Sequence, hashes and timestamp
 * are assigned by the ledger at append time.
 */
@Value
@Builder
public class LedgerWrite {

    String actor;
    String actionKind;
    @Singular("detail")
    Map<String, Object> payload;
    @Builder.Default
    EntryOutcome outcome = EntryOutcome.COMMITTED;

    public static LedgerWrite of(String actor, String actionKind, Map<String, Object> payload,
            EntryOutcome outcome) {
        return LedgerWrite.builder()
                .actor(actor)
                .actionKind(actionKind)
                .payload(payload)
                .outcome(outcome)
                .build();
    }
}
