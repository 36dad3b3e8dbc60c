package me.golemcore.substrate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.substrate.adapter.inbound.web.dto.RegisterAgentRequest;
import me.golemcore.substrate.domain.model.Agent;
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

@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
public class AgentsController {

    private final KernelService kernelService;
    private final CallerResolver callerResolver;

    @PostMapping
    public Mono<ResponseEntity<Agent>> register(@RequestBody RegisterAgentRequest request, Principal principal) {
        return Mono.fromCallable(() -> {
            Agent agent = kernelService.registerAgent(callerResolver.resolve(principal), request.getAgentId(),
                    request.getType(), request.getInitialAllocation());
            return ResponseEntity.status(HttpStatus.CREATED).body(agent);
        });
    }

    @GetMapping
    public Mono<ResponseEntity<List<Agent>>> list(Principal principal) {
        return Mono.fromCallable(() -> ResponseEntity.ok(kernelService.listAgents(callerResolver.resolve(principal))));
    }
}
