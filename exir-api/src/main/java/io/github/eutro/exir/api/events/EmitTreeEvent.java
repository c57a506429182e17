package io.github.eutro.exir.api.events;

import io.github.eutro.exir.api.Normalization;
import io.github.eutro.exir.ir.Expr;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a normalized tree should be emitted.
 *
 * @see Normalization
 */
public class EmitTreeEvent implements NormalizationEvent, CancellableEvent {
    /**
     * The tree to be emitted.
     */
    @NotNull
    public Expr tree;
    private boolean cancelled = false;

    /**
     * Construct a new tree emit event.
     *
     * @param tree The tree to emit.
     */
    public EmitTreeEvent(@NotNull Expr tree) {
        this.tree = tree;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
