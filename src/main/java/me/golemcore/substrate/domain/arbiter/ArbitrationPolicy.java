package me.golemcore.substrate.domain.arbiter;

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

import me.golemcore.substrate.domain.model.DenialKind;
import me.golemcore.substrate.domain.model.Privilege;
import me.golemcore.substrate.domain.model.SystemMode;
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import org.springframework.stereotype.Component;

/**
 * Pure decision function of the Arbiter. Given the same inputs it always
 * returns the same decision.
 *
 * <p>
 * Checks run in order: transition table, anti-thrash window (DEFEND exempt),
 * requester privilege.
 */
@Component
public class ArbitrationPolicy {

    private final SubstrateProperties.ArbiterProperties settings;

    public ArbitrationPolicy(SubstrateProperties properties) {
        this.settings = properties.getArbiter();
    }

    public Decision evaluate(SystemMode from, SystemMode target, int transitionsInWindow, Privilege privilege) {
        if (!TransitionTable.isAllowed(from, target)) {
            return Decision.deny(DenialKind.INVALID_TRANSITION,
                    target + " is not reachable from " + from + "; allowed: " + TransitionTable.reachableFrom(from));
        }
        if (target != SystemMode.DEFEND && transitionsInWindow >= settings.getThrashLimit()) {
            return Decision.deny(DenialKind.THRASH_LIMIT,
                    transitionsInWindow + " transitions within " + settings.getThrashWindow()
                            + " reached the limit of " + settings.getThrashLimit() + "; only DEFEND is accepted");
        }
        Privilege required = requiredPrivilege(from, target);
        if (!privilege.satisfies(required)) {
            return Decision.deny(DenialKind.INSUFFICIENT_PRIVILEGE,
                    from + " -> " + target + " requires " + required + " privilege, requester holds " + privilege);
        }
        return Decision.approve();
    }

    public Privilege requiredPrivilege(SystemMode from, SystemMode target) {
        if (from == SystemMode.DEFEND) {
            return settings.getRecoveryPrivilege();
        }
        return settings.privilegeFor(target);
    }

    /**
     * Outcome of {@link #evaluate}.
     */
    public record Decision(boolean approved, DenialKind denialKind, String reason) {

        static Decision approve() {
            return new Decision(true, null, "approved");
        }

        static Decision deny(DenialKind kind, String reason) {
            return new Decision(false, kind, reason);
        }
    }
}
