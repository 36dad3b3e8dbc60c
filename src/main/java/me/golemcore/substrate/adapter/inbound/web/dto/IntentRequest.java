package me.golemcore.substrate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Action an agent is about to perform. {@code details} is recorded verbatim in
 * the intent entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntentRequest {
    private String actionKind;
    private Map<String, Object> details;
}
