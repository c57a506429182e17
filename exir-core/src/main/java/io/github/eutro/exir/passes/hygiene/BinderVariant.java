package io.github.eutro.exir.passes.hygiene;

import io.github.eutro.exir.ir.Clause;
import org.jetbrains.annotations.Nullable;

/**
 * A clause shape that {@link BinderHygiene} knows how to repair.
 * <p>
 * Variants only decide whether they apply, and which binder is the target;
 * {@link BinderRepair} makes the decision.
 */
@FunctionalInterface
public interface BinderVariant {
    /**
     * Get the binder of a clause to repair, if this variant applies to it.
     *
     * @param clause The clause.
     * @return The binder name, or null if the clause is not of this shape.
     */
    @Nullable String target(Clause clause);
}
