package me.golemcore.substrate.domain.agent;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.domain.exception.AgentQuarantinedException;
import me.golemcore.substrate.domain.exception.AgentTerminatedException;
import me.golemcore.substrate.domain.exception.UnknownAgentException;
import me.golemcore.substrate.domain.ledger.Ledger;
import me.golemcore.substrate.domain.ledger.LedgerWrite;
import me.golemcore.substrate.domain.model.Agent;
import me.golemcore.substrate.domain.model.AgentStatus;
import me.golemcore.substrate.domain.model.AgentType;
import me.golemcore.substrate.domain.model.EntryOutcome;
import me.golemcore.substrate.domain.model.LedgerActions;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.model.PayloadKeys;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Registered agents and the admission gate every agent-initiated operation
 * passes before any cost or mode logic runs.
 *
 * <p>
 * Status changes are only accepted together with the ledger entry that
 * recorded them.
 */
@Service
@Slf4j
public class AgentRegistry {

    private final Ledger ledger;
    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Object registrationLock = new Object();

    public AgentRegistry(Ledger ledger) {
        this.ledger = ledger;
    }

    /**
     * Register a new agent with one {@code agent.registered} entry. The
     * {@code alongside} callback runs under the same entry so that dependent
     * state (the budget account) appears atomically with the agent.
     */
    public Agent register(String authorizedBy, String agentId, AgentType type, long initialAllocation,
            Consumer<LedgerEntry> alongside) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("agent type is required");
        }
        if (initialAllocation < 0) {
            throw new IllegalArgumentException("initial allocation must not be negative");
        }
        synchronized (registrationLock) {
            if (agents.containsKey(agentId)) {
                throw new IllegalArgumentException("agent already registered: " + agentId);
            }
            LedgerWrite write = LedgerWrite.builder()
                    .actor(authorizedBy)
                    .actionKind(LedgerActions.AGENT_REGISTERED)
                    .detail(PayloadKeys.AGENT_ID, agentId)
                    .detail(PayloadKeys.AGENT_TYPE, type.name())
                    .detail(PayloadKeys.ALLOCATION, initialAllocation)
                    .build();
            LedgerEntry entry = ledger.commit(write, recorded -> {
                agents.put(agentId, Agent.builder()
                        .id(agentId)
                        .type(type)
                        .status(AgentStatus.ACTIVE)
                        .registeredAt(recorded.timestamp())
                        .statusChangedAt(recorded.timestamp())
                        .statusLedgerSequence(recorded.sequence())
                        .build());
                alongside.accept(recorded);
            });
            log.info("[Kernel] Registered {} agent {} with allocation {} (ledger #{})", type, agentId,
                    initialAllocation, entry.sequence());
            return agents.get(agentId);
        }
    }

    /**
     * Gate for agent-initiated operations.
     *
     * @throws UnknownAgentException
     *             if the id was never registered
     * @throws AgentQuarantinedException
     *             while the agent is quarantined
     * @throws AgentTerminatedException
     *             once the agent is terminated
     */
    public Agent admit(String agentId, String operation) {
        return admit(agentId, operation, false);
    }

    /**
     * Gate for reports an agent files about work already paid for. Quarantined
     * agents pass, so the ledger stays the record of truth; terminated and
     * unknown agents do not.
     */
    public Agent admitReport(String agentId, String operation) {
        return admit(agentId, operation, true);
    }

    private Agent admit(String agentId, String operation, boolean quarantineAllowed) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            long sequence = recordRejection(agentId, operation, "UNKNOWN");
            throw new UnknownAgentException("unknown agent " + agentId + " attempted " + operation, sequence);
        }
        if (agent.getStatus() == AgentStatus.QUARANTINED && !quarantineAllowed) {
            long sequence = recordRejection(agentId, operation, agent.getStatus().name());
            log.warn("[Kernel] Quarantined agent {} attempted {}", agentId, operation);
            throw new AgentQuarantinedException(
                    "agent " + agentId + " is quarantined; " + operation + " refused", sequence);
        }
        if (agent.getStatus() == AgentStatus.TERMINATED) {
            long sequence = recordRejection(agentId, operation, agent.getStatus().name());
            log.warn("[Kernel] Terminated agent {} attempted {}", agentId, operation);
            throw new AgentTerminatedException(
                    "agent " + agentId + " is terminated; " + operation + " refused", sequence);
        }
        return agent;
    }

    /**
     * Apply a status change recorded by {@code recordedBy}. Termination is
     * final: a terminated agent never changes status again.
     */
    public Agent changeStatus(String agentId, AgentStatus status, LedgerEntry recordedBy) {
        if (recordedBy == null) {
            throw new IllegalArgumentException("status change requires its ledger entry");
        }
        Agent updated = agents.computeIfPresent(agentId, (id, agent) -> {
            if (agent.getStatus() == AgentStatus.TERMINATED) {
                throw new AgentTerminatedException("agent " + id + " is terminated", agent.getStatusLedgerSequence());
            }
            return agent.toBuilder()
                    .status(status)
                    .statusChangedAt(recordedBy.timestamp())
                    .statusLedgerSequence(recordedBy.sequence())
                    .build();
        });
        if (updated == null) {
            throw new UnknownAgentException("unknown agent " + agentId, null);
        }
        return updated;
    }

    /**
     * Replace the registry contents with replayed agents. Used once at start.
     */
    public void restore(Collection<Agent> replayed) {
        synchronized (registrationLock) {
            agents.clear();
            replayed.forEach(agent -> agents.put(agent.getId(), agent));
        }
    }

    public Optional<Agent> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Agent require(String agentId) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            throw new UnknownAgentException("unknown agent " + agentId, null);
        }
        return agent;
    }

    public List<Agent> list() {
        return agents.values().stream()
                .sorted(Comparator.comparing(Agent::getRegisteredAt).thenComparing(Agent::getId))
                .toList();
    }

    private long recordRejection(String agentId, String operation, String status) {
        LedgerEntry entry = ledger.append(LedgerWrite.builder()
                .actor(agentId == null ? "unknown" : agentId)
                .actionKind(LedgerActions.ADMISSION_REJECTED)
                .detail(PayloadKeys.OPERATION, operation)
                .detail(PayloadKeys.STATUS, status)
                .outcome(EntryOutcome.FAILED)
                .build());
        return entry.sequence();
    }
}
