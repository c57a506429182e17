package io.github.eutro.exir.api.events;

import io.github.eutro.exir.api.ExirCompiler;
import io.github.eutro.exir.api.Normalization;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a normalization is started.
 *
 * @see ExirCompiler
 * @see Normalization
 */
public class RunNormalizationEvent implements CompilerEvent {
    /**
     * The normalization.
     */
    @NotNull
    public Normalization normalization;

    /**
     * Construct a new run-normalization event.
     *
     * @param normalization The normalization.
     */
    public RunNormalizationEvent(@NotNull Normalization normalization) {
        this.normalization = normalization;
    }
}
