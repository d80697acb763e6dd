package com.finsolve.assistant.access;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

@Component
public class AccessScopeResolver {

    private static final Map<Role, AccessScope> SCOPES;

    static {
        Map<Role, AccessScope> scopes = new EnumMap<>(Role.class);
        register(scopes, Role.FINANCE, EnumSet.of(DocumentCollection.FINANCE, DocumentCollection.GENERAL));
        register(scopes, Role.MARKETING, EnumSet.of(DocumentCollection.MARKETING, DocumentCollection.GENERAL));
        register(scopes, Role.HR, EnumSet.of(DocumentCollection.HR, DocumentCollection.GENERAL));
        register(scopes, Role.ENGINEERING, EnumSet.of(DocumentCollection.ENGINEERING, DocumentCollection.GENERAL));
        register(scopes, Role.EMPLOYEE, EnumSet.of(DocumentCollection.GENERAL));
        register(scopes, Role.C_LEVEL, EnumSet.allOf(DocumentCollection.class));
        SCOPES = Collections.unmodifiableMap(scopes);
    }

    private static void register(Map<Role, AccessScope> scopes, Role role, EnumSet<DocumentCollection> collections) {
        scopes.put(role, new AccessScope(role, collections));
    }

    public AccessScope accessScope(Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role is required to resolve an access scope");
        }
        AccessScope scope = SCOPES.get(role);
        if (scope == null) {
            throw new IllegalStateException("No access scope registered for role " + role);
        }
        return scope;
    }
}
