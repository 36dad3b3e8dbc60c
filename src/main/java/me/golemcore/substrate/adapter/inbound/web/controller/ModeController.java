package me.golemcore.substrate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.substrate.adapter.inbound.web.dto.ModeRequest;
import me.golemcore.substrate.domain.model.ModeChangeRequest;
import me.golemcore.substrate.domain.model.ModeState;
import me.golemcore.substrate.domain.service.KernelService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.util.List;

/**
 * Operational mode: current state, request history, and new requests.
 */
@RestController
@RequestMapping("/api/mode")
@RequiredArgsConstructor
public class ModeController {

    private final KernelService kernelService;
    private final CallerResolver callerResolver;

    @GetMapping
    public Mono<ResponseEntity<ModeState>> getMode() {
        return Mono.fromCallable(() -> ResponseEntity.ok(kernelService.currentMode()));
    }

    @GetMapping("/requests")
    public Mono<ResponseEntity<List<ModeChangeRequest>>> listRequests(Principal principal) {
        return Mono.fromCallable(
                () -> ResponseEntity.ok(kernelService.listModeRequests(callerResolver.resolve(principal))));
    }

    /**
     * Answers 200 with the approved request, or 409 with the denied one and its
     * reason.
     */
    @PostMapping("/requests")
    public Mono<ResponseEntity<ModeChangeRequest>> requestModeChange(@RequestBody ModeRequest request,
            Principal principal) {
        return Mono.fromCallable(() -> {
            ModeChangeRequest resolved = kernelService.requestModeChange(callerResolver.resolve(principal),
                    request.getTargetMode(), request.getJustification());
            HttpStatus status = resolved.isApproved() ? HttpStatus.OK : HttpStatus.CONFLICT;
            return ResponseEntity.status(status).body(resolved);
        });
    }
}
