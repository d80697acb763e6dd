package com.finsolve.assistant.security;

import com.finsolve.assistant.access.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps the {@code role} and {@code roles} claims to {@code ROLE_<ROLE>} authorities.
 * Values that name no known department role are dropped.
 */
@Component
public class JwtRoleConverter implements Converter<Jwt, Collection<GrantedAuthority>> {

    private static final Logger log = LoggerFactory.getLogger(JwtRoleConverter.class);

    @Override
    public Collection<GrantedAuthority> convert(Jwt jwt) {
        List<String> claimed = new ArrayList<>();
        Optional.ofNullable(jwt.getClaimAsString("role")).ifPresent(claimed::add);
        Optional.ofNullable(jwt.getClaimAsStringList("roles")).ifPresent(claimed::addAll);
        return claimed.stream()
                .map(value -> {
                    Optional<Role> role = Role.fromTag(value);
                    if (role.isEmpty()) {
                        log.debug("Ignoring unknown role claim {} for subject {}", value, jwt.getSubject());
                    }
                    return role;
                })
                .flatMap(Optional::stream)
                .map(Role::authority)
                .map(SimpleGrantedAuthority::new)
                .collect(Collectors.toSet());
    }
}
