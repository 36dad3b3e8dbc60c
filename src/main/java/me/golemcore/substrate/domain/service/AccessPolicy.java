package me.golemcore.substrate.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.domain.exception.PrivilegeRequiredException;
import me.golemcore.substrate.domain.ledger.Ledger;
import me.golemcore.substrate.domain.ledger.LedgerWrite;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.LedgerActions;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.model.PayloadKeys;
import me.golemcore.substrate.domain.model.Privilege;
import org.springframework.stereotype.Component;

/**
 * Capability check: does this caller hold the privilege an operation needs.
 * Refusals are recorded so that every misuse is traceable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessPolicy {

    private final Ledger ledger;

    public void require(Caller caller, Privilege required, String operation) {
        if (caller.holds(required)) {
            return;
        }
        LedgerEntry entry = ledger.append(LedgerWrite.builder()
                .actor(caller.getId())
                .actionKind(LedgerActions.ACCESS_DENIED)
                .detail(PayloadKeys.OPERATION, operation)
                .detail(PayloadKeys.REQUIRED_PRIVILEGE, required.name())
                .detail(PayloadKeys.PRIVILEGE, caller.getPrivilege().name())
                .outcome(EntryOutcome.FAILED)
                .build());
        log.warn("[Kernel] {} ({}) lacks {} for {}", caller.getId(), caller.getPrivilege(), required, operation);
        throw new PrivilegeRequiredException(
                operation + " requires " + required + " privilege; " + caller.getId() + " holds "
                        + caller.getPrivilege(),
                entry.sequence());
    }
}
