package io.github.eutro.exir.passes.hygiene;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * The names visible at a point of the tree, from outside the clause being repaired.
 * <p>
 * Immutable, so a scope extended for one clause never leaks into its siblings.
 */
public final class Scope {
    public static final Scope EMPTY = new Scope(Collections.emptySet());

    private final Set<String> names;

    private Scope(Set<String> names) {
        this.names = names;
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    /**
     * Get a scope with some more names visible.
     *
     * @param added The names.
     * @return The extended scope, or this if no name is new.
     */
    public Scope with(Collection<String> added) {
        if (names.containsAll(added)) return this;
        Set<String> extended = new HashSet<>(names);
        extended.addAll(added);
        return new Scope(Collections.unmodifiableSet(extended));
    }

    @Override
    public String toString() {
        return "Scope" + names;
    }
}
