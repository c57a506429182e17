package io.github.eutro.exir.ext;

import org.jetbrains.annotations.Nullable;

/**
 * Something that carries {@link Ext} values: node metadata, or the nodes themselves.
 */
public interface ExtContainer {
    /**
     * Look up {@code ext}.
     *
     * @param ext The key.
     * @param <T> The value type.
     * @return The value, or null if there is none.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default boolean hasExt(Ext<?> ext) {
        return getNullable(ext) != null;
    }

    /**
     * Check whether a boolean flag is set to true. An absent flag is not set.
     *
     * @param ext The flag.
     * @return Whether it is set.
     */
    default boolean isFlagged(Ext<Boolean> ext) {
        return Boolean.TRUE.equals(getNullable(ext));
    }
}
