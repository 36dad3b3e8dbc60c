package me.golemcore.substrate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.substrate.adapter.inbound.web.dto.AllocationRequest;
import me.golemcore.substrate.adapter.inbound.web.dto.CostTotalResponse;
import me.golemcore.substrate.domain.model.BudgetAccount;
import me.golemcore.substrate.domain.model.BudgetSummary;
import me.golemcore.substrate.domain.service.KernelService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.time.Duration;

/**
 * Budget accounts: summary, per-agent view and cost totals, privileged
 * allocation.
 */
@RestController
@RequestMapping("/api/budget")
@RequiredArgsConstructor
public class BudgetController {

    private final KernelService kernelService;
    private final CallerResolver callerResolver;

    @GetMapping
    public Mono<ResponseEntity<BudgetSummary>> getSummary(Principal principal) {
        return Mono.fromCallable(
                () -> ResponseEntity.ok(kernelService.getBudgetSummary(callerResolver.resolve(principal))));
    }

    @GetMapping("/{agentId}")
    public Mono<ResponseEntity<BudgetAccount>> getAccount(@PathVariable String agentId, Principal principal) {
        return Mono.fromCallable(
                () -> ResponseEntity.ok(kernelService.getBudgetAccount(callerResolver.resolve(principal), agentId)));
    }

    @GetMapping("/{agentId}/costs")
    public Mono<ResponseEntity<CostTotalResponse>> getTotalCost(@PathVariable String agentId,
            @RequestParam(required = false) String costType, Principal principal) {
        return Mono.fromCallable(() -> ResponseEntity.ok(CostTotalResponse.builder()
                .agentId(agentId)
                .costType(costType)
                .total(kernelService.getTotalCost(callerResolver.resolve(principal), agentId, costType))
                .build()));
    }

    @PostMapping("/{agentId}/allocations")
    public Mono<ResponseEntity<BudgetAccount>> allocate(@PathVariable String agentId,
            @RequestBody AllocationRequest request, Principal principal) {
        return Mono.fromCallable(() -> {
            Duration window = request.getWindowHours() == null ? null : Duration.ofHours(request.getWindowHours());
            return ResponseEntity.ok(kernelService.allocate(callerResolver.resolve(principal), agentId,
                    request.getAmount(), window));
        });
    }
}
