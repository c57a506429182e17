package io.github.eutro.exir.ext;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * An immutable {@link ExtContainer}, holding the provenance metadata of an IR node.
 * <p>
 * Updates return new instances; nodes can therefore share their metadata freely.
 */
public final class Meta implements ExtContainer {
    /**
     * The metadata with no exts.
     */
    public static final Meta EMPTY = new Meta(Collections.emptyMap());

    private final Map<Ext<?>, Object> map;

    private Meta(Map<Ext<?>, Object> map) {
        this.map = map;
    }

    /**
     * Get metadata with {@code ext} associated with {@code value}, and all other exts as in this.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     * @return The new metadata.
     * @throws ClassCastException If the value is not of the type the ext was declared with.
     */
    @Contract(pure = true)
    public <T> @NotNull Meta with(Ext<T> ext, @NotNull T value) {
        if (value.equals(map.get(ext))) return this;
        Map<Ext<?>, Object> copy = new TreeMap<>(map);
        copy.put(ext, ext.check(value));
        return new Meta(Collections.unmodifiableMap(copy));
    }

    /**
     * Get metadata without {@code ext}, and all other exts as in this.
     *
     * @param ext The ext.
     * @return The new metadata.
     */
    @Contract(pure = true)
    public @NotNull Meta without(Ext<?> ext) {
        if (!map.containsKey(ext)) return this;
        if (map.size() == 1) return EMPTY;
        Map<Ext<?>, Object> copy = new TreeMap<>(map);
        copy.remove(ext);
        return new Meta(Collections.unmodifiableMap(copy));
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return (T) map.get(ext);
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        map.forEach((ext, o) -> sj.add(ext.getName() + "=" + o));
        return sj.toString();
    }
}
