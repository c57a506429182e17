package io.github.eutro.exir.api;

import io.github.eutro.exir.ext.ProvenanceExts;
import io.github.eutro.exir.ext.SourcePos;
import io.github.eutro.exir.ir.Expr;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A problem found in a tree, reported by a pass that could not handle it.
 */
public final class Diagnostic {
    public final String message;
    public final @Nullable SourcePos position;

    public Diagnostic(@NotNull String message, @Nullable SourcePos position) {
        this.message = message;
        this.position = position;
    }

    /**
     * Create a diagnostic at the source position of a node, if it has one.
     *
     * @param node    The node.
     * @param message The message.
     * @return The diagnostic.
     */
    public static Diagnostic at(Expr node, String message) {
        return new Diagnostic(message, node.getNullable(ProvenanceExts.POSITION));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return message.equals(that.message) && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, position);
    }

    @Override
    public String toString() {
        return position == null ? message : position + ": " + message;
    }
}
