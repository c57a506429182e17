package io.github.eutro.exir.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A clause: {@code patterns when guard -> body}.
 * <p>
 * The unit of scope for {@code case}, {@code fn} and {@code try} dispatch. {@code case},
 * {@code rescue}, {@code catch} and {@code else} clauses have exactly one pattern,
 * {@code fn} clauses have one per parameter. Every binder in the patterns is visible
 * throughout the guard and the body.
 */
public final class Clause {
    public final List<Pattern> patterns;
    public final @Nullable Expr guard;
    public final Expr body;

    public Clause(List<? extends Pattern> patterns, @Nullable Expr guard, @NotNull Expr body) {
        this.patterns = Nodes.copy(patterns);
        this.guard = guard;
        this.body = body;
    }

    /**
     * Get the only pattern of this clause.
     *
     * @return The pattern.
     * @throws IllegalStateException If the clause does not have exactly one pattern.
     */
    public Pattern pattern() {
        if (patterns.size() != 1) {
            throw new IllegalStateException("clause has " + patterns.size() + " patterns");
        }
        return patterns.get(0);
    }

    public Clause withPatterns(List<Pattern> patterns) {
        if (Nodes.sameRefs(this.patterns, patterns)) return this;
        return new Clause(patterns, guard, body);
    }

    public Clause withGuardAndBody(@Nullable Expr guard, @NotNull Expr body) {
        if (guard == this.guard && body == this.body) return this;
        return new Clause(patterns, guard, body);
    }

    public Clause withBody(@NotNull Expr body) {
        return withGuardAndBody(guard, body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clause)) return false;
        Clause clause = (Clause) o;
        return patterns.equals(clause.patterns)
                && Objects.equals(guard, clause.guard)
                && body.equals(clause.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patterns, guard, body);
    }

    @Override
    public String toString() {
        return IRDisplay.display(this);
    }
}
