package me.golemcore.substrate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AllocationRequest {
    private long amount;

    /** Length of a new budget window; null keeps the current one. */
    private Long windowHours;

    public AllocationRequest(long amount) {
        this.amount = amount;
    }
}
