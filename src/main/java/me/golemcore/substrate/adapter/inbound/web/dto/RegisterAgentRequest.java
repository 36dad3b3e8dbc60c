package me.golemcore.substrate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.substrate.domain.model.AgentType;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterAgentRequest {
    private String agentId;
    private AgentType type;
    private long initialAllocation;
}
