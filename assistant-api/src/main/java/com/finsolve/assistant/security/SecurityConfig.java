package com.finsolve.assistant.security;

import com.finsolve.assistant.access.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.oauth2.server.resource.authentication.ReactiveJwtAuthenticationConverterAdapter;
import org.springframework.security.oauth2.server.resource.web.server.authentication.ServerBearerTokenAuthenticationConverter;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.authentication.AuthenticationWebFilter;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatchers;

/**
 * Stateless bearer authentication for the API. A configured static token takes
 * precedence over JWT validation. The department role is resolved per request
 * from the granted authorities, not by the filter chain.
 */
@Configuration
@EnableWebFluxSecurity
@EnableConfigurationProperties(SecurityProperties.class)
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    private static final String[] PUBLIC_PATHS = {"/actuator/health", "/actuator/health/**", "/actuator/info"};

    private final JwtRoleConverter roleConverter;
    private final SecurityProperties securityProperties;

    public SecurityConfig(JwtRoleConverter roleConverter, SecurityProperties securityProperties) {
        this.roleConverter = roleConverter;
        this.securityProperties = securityProperties;
    }

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        http.csrf(ServerHttpSecurity.CsrfSpec::disable)
                .cors(Customizer.withDefaults())
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
                .authorizeExchange(registry -> registry
                        .pathMatchers(PUBLIC_PATHS).permitAll()
                        .anyExchange().authenticated());

        if (securityProperties.hasStaticToken()) {
            Role role = staticRole(securityProperties);
            log.info("Authenticating requests with the static token as user {} ({})",
                    securityProperties.getStaticUser(), role.tag());
            http.addFilterAt(staticTokenFilter(role), SecurityWebFiltersOrder.AUTHENTICATION);
        } else {
            log.info("Authenticating requests with JWTs, principal claim {}", securityProperties.getUserClaim());
            http.oauth2ResourceServer(resourceServer -> resourceServer
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter())));
        }
        return http.build();
    }

    ReactiveJwtAuthenticationConverterAdapter jwtAuthenticationConverter() {
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setJwtGrantedAuthoritiesConverter(roleConverter);
        converter.setPrincipalClaimName(securityProperties.getUserClaim());
        return new ReactiveJwtAuthenticationConverterAdapter(converter);
    }

    static Role staticRole(SecurityProperties properties) {
        return Role.fromTag(properties.getStaticRole())
                .orElseThrow(() -> new IllegalStateException(
                        "chat.security.static-role '" + properties.getStaticRole() + "' is not a known department role"));
    }

    private AuthenticationWebFilter staticTokenFilter(Role role) {
        AuthenticationWebFilter filter = new AuthenticationWebFilter(new StaticTokenAuthenticationManager(
                securityProperties.getStaticToken(), securityProperties.getStaticUser(), role));
        filter.setServerAuthenticationConverter(new ServerBearerTokenAuthenticationConverter());
        filter.setRequiresAuthenticationMatcher(ServerWebExchangeMatchers.anyExchange());
        filter.setSecurityContextRepository(NoOpServerSecurityContextRepository.getInstance());
        return filter;
    }
}
