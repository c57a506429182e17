package io.github.eutro.exir.passes.meta;

import io.github.eutro.exir.ir.Expr;

/**
 * Answers whether a name is referenced within a function's scope.
 */
@FunctionalInterface
public interface UsageQuery {
    /**
     * A query backed by {@link FreeVars}: a name is used if it is free in the scope,
     * so references to a later rebinding of the name do not count. A word of raw code
     * counts as a reference.
     */
    UsageQuery FREE_VARS = (scope, name) -> FreeVars.of(scope).contains(name);

    /**
     * Check whether {@code name} is referenced in {@code functionScope}.
     *
     * @param functionScope The guard or body of a function, in which the name is bound from outside.
     * @param name          The name.
     * @return Whether it is used.
     */
    boolean isUsed(Expr functionScope, String name);
}
