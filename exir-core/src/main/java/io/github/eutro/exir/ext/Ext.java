package io.github.eutro.exir.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A key into node {@link Meta metadata}.
 * <p>
 * Keys are singletons, declared as constants such as those of {@link ProvenanceExts}. Two keys
 * are never equal, even with the same name; they sort in declaration order, which is all
 * {@link Meta} needs to keep its entries stable.
 *
 * @param <T> The type of value the key maps to.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ORDINAL = new AtomicInteger();

    private final int ordinal = NEXT_ORDINAL.getAndIncrement();
    private final Class<T> valueType;
    private final String name;

    private Ext(Class<T> valueType, String name) {
        this.valueType = valueType;
        this.name = name;
    }

    /**
     * Declare a key.
     *
     * @param valueType The class of the values; stored values are checked against it.
     * @param name      A name for display.
     * @param <T>       The value type.
     * @return The key.
     */
    public static <T> Ext<T> create(Class<T> valueType, String name) {
        return new Ext<>(valueType, name);
    }

    /**
     * Check that a value may be stored under this key.
     *
     * @param value The value.
     * @return The value.
     * @throws ClassCastException If it is of the wrong type.
     */
    T check(@NotNull Object value) {
        return valueType.cast(value);
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(ordinal, o.ordinal);
    }

    @Override
    public int hashCode() {
        return ordinal;
    }

    @Override
    public String toString() {
        return name + "<" + valueType.getSimpleName() + ">";
    }
}
