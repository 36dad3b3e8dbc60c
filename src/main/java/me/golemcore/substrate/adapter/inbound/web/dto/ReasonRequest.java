package me.golemcore.substrate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional free-text reason for manual Guardian overrides and checkpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReasonRequest {
    private String reason;
}
