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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.adapter.outbound.storage.InMemoryLedgerStorageAdapter;
import me.golemcore.substrate.adapter.outbound.storage.LocalLedgerStorageAdapter;
import me.golemcore.substrate.port.outbound.LedgerStoragePort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Spring configuration of the kernel's shared infrastructure: the clock, the
 * JSON mapper and the ledger storage backend.
 *
 * <p>
 * The backend is chosen by {@code substrate.ledger.storage}: {@code memory}
 * (default) or {@code local} for a JSONL file at
 * {@code substrate.ledger.local-path}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final SubstrateProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public LedgerStoragePort ledgerStoragePort(ObjectMapper objectMapper) {
        String storage = properties.getLedger().getStorage();
        if ("local".equalsIgnoreCase(storage)) {
            Path path = resolvePath(properties.getLedger().getLocalPath());
            log.info("[Ledger] Using local JSONL storage at {}", path);
            return new LocalLedgerStorageAdapter(path, objectMapper);
        }
        if (!"memory".equalsIgnoreCase(storage)) {
            throw new IllegalArgumentException("Unsupported substrate.ledger.storage: " + storage);
        }
        log.info("[Ledger] Using in-memory storage; the ledger will not survive a restart");
        return new InMemoryLedgerStorageAdapter();
    }

    @PostConstruct
    public void init() {
        SubstrateProperties.ArbiterProperties arbiter = properties.getArbiter();
        SubstrateProperties.GuardianProperties guardian = properties.getGuardian();
        log.info("Substrate kernel starting...");
        log.info("Cost table: {}", properties.getBudget().getCostTable());
        log.info("Anti-thrash: {} transitions per {}", arbiter.getThrashLimit(), arbiter.getThrashWindow());
        log.info("Guardian: {} velocity strikes per {}, evaluation timeout {}, review deadline {}",
                guardian.getVelocityStrikes(), guardian.getStrikeWindow(), guardian.getEvaluationTimeout(),
                guardian.getReviewDeadline());
    }

    static Path resolvePath(String configured) {
        return Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }
}
