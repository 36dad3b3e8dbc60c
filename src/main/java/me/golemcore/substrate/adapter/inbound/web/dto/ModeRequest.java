package me.golemcore.substrate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.substrate.domain.model.SystemMode;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModeRequest {
    private SystemMode targetMode;
    private String justification;
}
