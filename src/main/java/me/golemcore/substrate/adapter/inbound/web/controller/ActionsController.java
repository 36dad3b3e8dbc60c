package me.golemcore.substrate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.adapter.inbound.web.dto.DebitRequest;
import me.golemcore.substrate.adapter.inbound.web.dto.IntentRequest;
import me.golemcore.substrate.adapter.inbound.web.dto.OutcomeRequest;
import me.golemcore.substrate.domain.model.ActionIntent;
import me.golemcore.substrate.domain.model.DebitResult;
import me.golemcore.substrate.domain.model.LedgerEntry;
import me.golemcore.substrate.domain.service.KernelService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;

/**
 * Agent runtime endpoints: intent, debit, outcome.
 */
@RestController
@RequestMapping("/api/actions")
@RequiredArgsConstructor
@Slf4j
public class ActionsController {

    private final KernelService kernelService;
    private final CallerResolver callerResolver;

    @PostMapping("/intents")
    public Mono<ResponseEntity<ActionIntent>> submitIntent(@RequestBody IntentRequest request, Principal principal) {
        return Mono.fromCallable(() -> {
            ActionIntent intent = kernelService.submitIntent(callerResolver.resolve(principal),
                    request.getActionKind(), request.getDetails());
            return ResponseEntity.status(HttpStatus.CREATED).body(intent);
        });
    }

    /**
     * A rejected debit answers 409 with the unchanged remaining budget; the
     * agent must not perform the action.
     */
    @PostMapping("/debits")
    public Mono<ResponseEntity<DebitResult>> debit(@RequestBody DebitRequest request, Principal principal) {
        return Mono.fromCallable(() -> {
            DebitResult result = kernelService.debit(callerResolver.resolve(principal), request.getAmount(),
                    request.getIntentSequence());
            HttpStatus status = result.isAccepted() ? HttpStatus.OK : HttpStatus.CONFLICT;
            return ResponseEntity.status(status).body(result);
        });
    }

    @PostMapping("/outcomes")
    public Mono<ResponseEntity<LedgerEntry>> submitOutcome(@RequestBody OutcomeRequest request,
            Principal principal) {
        return Mono.fromCallable(() -> ResponseEntity.ok(kernelService.submitOutcome(callerResolver.resolve(principal),
                request.getIntentSequence(), request.isSuccess(), request.getResult())));
    }
}
