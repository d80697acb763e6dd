package com.finsolve.assistant.security;

import com.finsolve.assistant.access.Role;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import reactor.core.publisher.Mono;

public class StaticTokenAuthenticationManager implements ReactiveAuthenticationManager {

    private final String expectedToken;
    private final String userId;
    private final Role role;

    public StaticTokenAuthenticationManager(String expectedToken, String userId, Role role) {
        this.expectedToken = expectedToken;
        this.userId = userId;
        this.role = role;
    }

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        if (!(authentication instanceof BearerTokenAuthenticationToken bearer)) {
            return Mono.error(new BadCredentialsException("Unsupported authentication token"));
        }

        String token = bearer.getToken();
        if (token == null || !token.equals(expectedToken)) {
            return Mono.error(new BadCredentialsException("Invalid bearer token"));
        }

        Authentication result = new UsernamePasswordAuthenticationToken(
                userId,
                null,
                role == null ? AuthorityUtils.NO_AUTHORITIES : AuthorityUtils.createAuthorityList(role.authority())
        );
        return Mono.just(result);
    }
}
