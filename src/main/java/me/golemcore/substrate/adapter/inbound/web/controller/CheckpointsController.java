package me.golemcore.substrate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.substrate.adapter.inbound.web.dto.ReasonRequest;
import me.golemcore.substrate.domain.model.Checkpoint;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.service.KernelService;
import org.springframework.http.HttpStatus;
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
 * Checkpoints and rollback. The request body's {@code reason} is used as the
 * checkpoint description.
 */
@RestController
@RequestMapping("/api/checkpoints")
@RequiredArgsConstructor
public class CheckpointsController {

    private final KernelService kernelService;
    private final CallerResolver callerResolver;

    @GetMapping
    public Mono<ResponseEntity<List<Checkpoint>>> list(Principal principal) {
        return Mono.fromCallable(
                () -> ResponseEntity.ok(kernelService.listCheckpoints(callerResolver.resolve(principal))));
    }

    @PostMapping
    public Mono<ResponseEntity<Checkpoint>> create(@RequestBody(required = false) ReasonRequest request,
            Principal principal) {
        return Mono.fromCallable(() -> {
            String description = request == null ? null : request.getReason();
            Checkpoint checkpoint = kernelService.createCheckpoint(callerResolver.resolve(principal), description);
            return ResponseEntity.status(HttpStatus.CREATED).body(checkpoint);
        });
    }

    @PostMapping("/{checkpointId}/rollback")
    public Mono<ResponseEntity<LedgerEntry>> rollback(@PathVariable String checkpointId, Principal principal) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                kernelService.rollback(callerResolver.resolve(principal), checkpointId)));
    }
}
