package me.golemcore.substrate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.substrate.domain.model.LedgerEntry;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerPageResponse {
    private long from;
    private long to;
    private long tailSequence;
    private List<LedgerEntry> entries;
}
