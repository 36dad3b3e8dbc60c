package me.golemcore.substrate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.substrate.adapter.inbound.web.dto.ReasonRequest;
import me.golemcore.substrate.domain.model.Agent;
import me.golemcore.substrate.domain.model.QuarantineRecord;
import me.golemcore.substrate.domain.service.KernelService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.util.List;

/**
 * Manual Guardian overrides and quarantine listing.
 */
@RestController
@RequestMapping("/api/guardian")
@RequiredArgsConstructor
public class GuardianController {

    private final KernelService kernelService;
    private final CallerResolver callerResolver;

    @GetMapping("/quarantines")
    public Mono<ResponseEntity<List<QuarantineRecord>>> listQuarantines(Principal principal) {
        return Mono.fromCallable(
                () -> ResponseEntity.ok(kernelService.listQuarantines(callerResolver.resolve(principal))));
    }

    @PostMapping("/agents/{agentId}/quarantine")
    public Mono<ResponseEntity<QuarantineRecord>> quarantine(@PathVariable String agentId,
            @RequestBody(required = false) ReasonRequest request, Principal principal) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                kernelService.quarantine(callerResolver.resolve(principal), agentId, reasonOf(request))));
    }

    @PostMapping("/agents/{agentId}/release")
    public Mono<ResponseEntity<QuarantineRecord>> release(@PathVariable String agentId,
            @RequestBody(required = false) ReasonRequest request, Principal principal) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                kernelService.release(callerResolver.resolve(principal), agentId, reasonOf(request))));
    }

    @PostMapping("/agents/{agentId}/terminate")
    public Mono<ResponseEntity<Agent>> terminate(@PathVariable String agentId,
            @RequestBody(required = false) ReasonRequest request, Principal principal) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                kernelService.terminate(callerResolver.resolve(principal), agentId, reasonOf(request))));
    }

    private static String reasonOf(ReasonRequest request) {
        return request == null ? null : request.getReason();
    }
}
