package com.finsolve.assistant.access;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The fixed set of collections a role may read during one request. Instances are
 * only handed out by {@link AccessScopeResolver}, so a scope can never be built
 * from a caller-supplied collection list.
 */
public final class AccessScope {

    private final Role role;
    private final Set<DocumentCollection> collections;

    AccessScope(Role role, Set<DocumentCollection> collections) {
        this.role = Objects.requireNonNull(role, "role");
        this.collections = Collections.unmodifiableSet(EnumSet.copyOf(collections));
    }

    public Role role() {
        return role;
    }

    public Set<DocumentCollection> collections() {
        return collections;
    }

    /**
     * Collections in declaration order, used to keep fan-out output reproducible.
     */
    public List<DocumentCollection> orderedCollections() {
        return List.copyOf(collections);
    }

    public boolean permits(DocumentCollection collection) {
        return collection != null && collections.contains(collection);
    }

    public List<String> departments() {
        return collections.stream().map(DocumentCollection::department).toList();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AccessScope scope)) {
            return false;
        }
        return role == scope.role && collections.equals(scope.collections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, collections);
    }

    @Override
    public String toString() {
        return "AccessScope[" + role.tag() + " -> " + departments() + "]";
    }
}
