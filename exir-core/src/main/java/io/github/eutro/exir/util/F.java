package io.github.eutro.exir.util;

/**
 * A simple unary function.
 * <p>
 * Equivalent to {@link java.util.function.Function}, used for node rewrites so that a
 * rewrite can be passed around without pulling in the functional-interface zoo.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    /**
     * Apply the function.
     *
     * @param a The argument.
     * @return The result.
     */
    B apply(A a);
}
