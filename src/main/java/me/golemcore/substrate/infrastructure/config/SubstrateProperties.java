package me.golemcore.substrate.infrastructure.config;

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

import lombok.Data;
import me.golemcore.substrate.domain.model.Privilege;
import me.golemcore.substrate.domain.model.SystemMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Policy parameters of the constraint-enforcement kernel, bound from
 * application.yml.
 *
 * <p>
 * All configuration lives under the {@code substrate.*} prefix:
 * <ul>
 * <li>{@link LedgerProperties} - append retry and storage backend</li>
 * <li>{@link BudgetProperties} - cost table and debit velocity signal</li>
 * <li>{@link ArbiterProperties} - anti-thrash window and mode privileges</li>
 * <li>{@link GuardianProperties} - quarantine rules, review deadlines,
 * expiry</li>
 * <li>{@link SecurityProperties} - JWT bearer authentication of the REST
 * surface</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "substrate")
@Data
public class SubstrateProperties {

    private LedgerProperties ledger = new LedgerProperties();
    private BudgetProperties budget = new BudgetProperties();
    private ArbiterProperties arbiter = new ArbiterProperties();
    private GuardianProperties guardian = new GuardianProperties();
    private SecurityProperties security = new SecurityProperties();

    @Data
    public static class LedgerProperties {
        private int appendMaxAttempts = 5;
        private Duration appendBackoff = Duration.ofMillis(5);

        /** {@code memory} or {@code local}. */
        private String storage = "memory";
        private String localPath = "${user.home}/.substrate/ledger.jsonl";
    }

    @Data
    public static class BudgetProperties {
        private Map<String, Long> costTable = new LinkedHashMap<>();
        private Duration velocityWindow = Duration.ofSeconds(1);

        /** Debit attempts per window above which an anomaly signal is raised. */
        private int velocityThreshold = 5;
    }

    @Data
    public static class ArbiterProperties {
        private Duration thrashWindow = Duration.ofMinutes(1);
        private int thrashLimit = 3;
        private Map<SystemMode, Privilege> requiredPrivilege = defaultRequiredPrivileges();

        /** Privilege needed to leave DEFEND. */
        private Privilege recoveryPrivilege = Privilege.OPERATOR;

        public Privilege privilegeFor(SystemMode target) {
            return requiredPrivilege.getOrDefault(target, Privilege.OPERATOR);
        }

        private static Map<SystemMode, Privilege> defaultRequiredPrivileges() {
            Map<SystemMode, Privilege> defaults = new EnumMap<>(SystemMode.class);
            defaults.put(SystemMode.OBSERVE, Privilege.AGENT);
            defaults.put(SystemMode.ALERT, Privilege.AGENT);
            defaults.put(SystemMode.ACT, Privilege.OPERATOR);
            defaults.put(SystemMode.DEFEND, Privilege.OPERATOR);
            return defaults;
        }
    }

    @Data
    public static class GuardianProperties {
        private int velocityStrikes = 3;
        private Duration strikeWindow = Duration.ofSeconds(3);
        private int maxConsecutiveDenials = 3;
        private int maxConsecutiveFailures = 3;
        private Duration evaluationTimeout = Duration.ofMillis(250);

        /** Size of the fixed pool that runs rule evaluation. */
        private int evaluatorThreads = 4;
        private Duration reviewDeadline = Duration.ofMinutes(5);

        /** Zero keeps quarantines until manual release. */
        private Duration quarantineExpiry = Duration.ZERO;
        private Duration sweepInterval = Duration.ofSeconds(10);

        /** Zero disables escalation to termination. */
        private int terminationAfterQuarantines = 0;
    }

    @Data
    public static class SecurityProperties {
        private boolean enabled = true;
        private String jwtSecret;
        private int jwtExpirationMinutes = 60;
        private String corsAllowedOrigins;
    }
}
