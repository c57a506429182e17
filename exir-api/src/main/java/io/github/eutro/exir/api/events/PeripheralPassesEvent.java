package io.github.eutro.exir.api.events;

import io.github.eutro.exir.api.DiagnosticSink;
import io.github.eutro.exir.api.Normalization;
import io.github.eutro.exir.ir.Expr;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired after the core passes have run, for running further passes over the tree.
 * <p>
 * Listeners replace {@link #tree} with the result of their passes. Passes that find a
 * problem they cannot repair report it to {@link #diagnostics}.
 *
 * @see Normalization
 */
public class PeripheralPassesEvent implements NormalizationEvent {
    /**
     * The tree.
     */
    @NotNull
    public Expr tree;

    /**
     * Where to report problems.
     */
    @NotNull
    public final DiagnosticSink diagnostics;

    /**
     * Construct a new peripheral passes event over the given tree.
     *
     * @param tree        The tree.
     * @param diagnostics The diagnostic sink.
     */
    public PeripheralPassesEvent(@NotNull Expr tree, @NotNull DiagnosticSink diagnostics) {
        this.tree = tree;
        this.diagnostics = diagnostics;
    }
}
