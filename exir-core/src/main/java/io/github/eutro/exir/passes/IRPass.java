package io.github.eutro.exir.passes;

import io.github.eutro.exir.passes.misc.ChainedPass;

/**
 * A pass to run on some part of the IR, such as a whole tree or a single function definition.
 * <p>
 * Passes are pure: the IR is immutable, and a pass returns its input reference when it
 * has nothing to change.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 * @see io.github.eutro.exir.ir
 */
@FunctionalInterface
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
