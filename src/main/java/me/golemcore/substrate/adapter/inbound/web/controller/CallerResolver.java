package me.golemcore.substrate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.Privilege;
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.security.Principal;

/**
 * Turns the request principal into a kernel {@link Caller}. With security
 * disabled, anonymous requests act as the local architect.
 */
@Component
@RequiredArgsConstructor
public class CallerResolver {

    static final Caller LOCAL_ARCHITECT = new Caller("local", Privilege.ARCHITECT);

    private final SubstrateProperties properties;

    public Caller resolve(Principal principal) {
        if (principal instanceof Authentication authentication
                && authentication.getPrincipal() instanceof Caller caller) {
            return caller;
        }
        if (!properties.getSecurity().isEnabled()) {
            return LOCAL_ARCHITECT;
        }
        throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Unauthorized");
    }
}
