package io.github.eutro.exir.util;

import java.util.Objects;

/**
 * An immutable pair, compared by value.
 * <p>
 * Holds the entries of map and struct nodes, and the arms of {@code cond}.
 *
 * @param <L> The type of the key or condition.
 * @param <R> The type of the value or body.
 */
public final class Pair<L, R> {
    public final L left;
    public final R right;

    private Pair(L left, R right) {
        this.left = left;
        this.right = right;
    }

    public static <L, R> Pair<L, R> of(L left, R right) {
        return new Pair<>(left, right);
    }

    /**
     * Replace the right element, keeping this pair if it is unchanged.
     *
     * @param right The new right element.
     * @param <S>   Its type.
     * @return The pair.
     */
    @SuppressWarnings("unchecked")
    public <S> Pair<L, S> withRight(S right) {
        return right == this.right ? (Pair<L, S>) this : of(left, right);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Pair)) return false;
        Pair<?, ?> that = (Pair<?, ?>) o;
        return Objects.equals(left, that.left) && Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(left) + Objects.hashCode(right);
    }

    @Override
    public String toString() {
        return left + " => " + right;
    }
}
