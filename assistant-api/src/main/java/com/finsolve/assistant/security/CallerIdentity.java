package com.finsolve.assistant.security;

import com.finsolve.assistant.access.Role;
import com.finsolve.assistant.exception.UnknownRoleException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;

import java.util.Comparator;
import java.util.Optional;

/**
 * The authenticated user and the department role the request runs under. When
 * several department roles are granted, the first in {@link Role} declaration
 * order applies.
 */
public record CallerIdentity(String userId, Role role) {

    public static CallerIdentity from(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new UnknownRoleException("anonymous");
        }
        Role role = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .map(Role::fromTag)
                .flatMap(Optional::stream)
                .min(Comparator.naturalOrder())
                .orElseThrow(() -> new UnknownRoleException(authentication.getName()));
        return new CallerIdentity(authentication.getName(), role);
    }
}
