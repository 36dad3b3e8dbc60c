package me.golemcore.substrate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.substrate.adapter.inbound.web.dto.LedgerPageResponse;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.ChainVerification;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.service.KernelService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.util.List;

/**
 * Read-only ledger access for auditors. Omitted bounds default to the whole
 * ledger.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private static final int MAX_PAGE = 1000;

    private final KernelService kernelService;
    private final CallerResolver callerResolver;

    @GetMapping
    public Mono<ResponseEntity<LedgerPageResponse>> getRange(
            @RequestParam(defaultValue = "1") long from,
            @RequestParam(required = false) Long to,
            Principal principal) {
        return Mono.fromCallable(() -> {
            Caller caller = callerResolver.resolve(principal);
            long tail = kernelService.ledgerTailSequence();
            long end = Math.min(to != null ? to : tail, from + MAX_PAGE - 1);
            List<LedgerEntry> entries = end < from ? List.of() : kernelService.getLedgerRange(caller, from, end);
            return ResponseEntity.ok(LedgerPageResponse.builder()
                    .from(from)
                    .to(end)
                    .tailSequence(tail)
                    .entries(entries)
                    .build());
        });
    }

    @GetMapping("/verify")
    public Mono<ResponseEntity<ChainVerification>> verify(
            @RequestParam(defaultValue = "1") long from,
            @RequestParam(required = false) Long to,
            Principal principal) {
        return Mono.fromCallable(() -> {
            long end = to != null ? to : Math.max(from, kernelService.ledgerTailSequence());
            return ResponseEntity.ok(kernelService.verifyChain(callerResolver.resolve(principal), from, end));
        });
    }
}
