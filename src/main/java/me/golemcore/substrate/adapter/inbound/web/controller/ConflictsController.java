package me.golemcore.substrate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.substrate.adapter.inbound.web.dto.ConflictRequest;
import me.golemcore.substrate.domain.model.ConflictResolution;
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
 * Operator decisions on conflicts between agents.
 */
@RestController
@RequestMapping("/api/conflicts")
@RequiredArgsConstructor
public class ConflictsController {

    private final KernelService kernelService;
    private final CallerResolver callerResolver;

    @GetMapping
    public Mono<ResponseEntity<List<ConflictResolution>>> list(Principal principal) {
        return Mono.fromCallable(
                () -> ResponseEntity.ok(kernelService.listConflictResolutions(callerResolver.resolve(principal))));
    }

    @PostMapping
    public Mono<ResponseEntity<ConflictResolution>> resolve(@RequestBody ConflictRequest request,
            Principal principal) {
        return Mono.fromCallable(() -> {
            ConflictResolution resolution = kernelService.resolveConflict(callerResolver.resolve(principal),
                    request.getConflictType(), request.getAgentIds(), request.getResolution());
            return ResponseEntity.status(HttpStatus.CREATED).body(resolution);
        });
    }
}
