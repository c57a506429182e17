package io.github.eutro.exir.api.events;

import io.github.eutro.exir.api.Normalization;
import io.github.eutro.exir.api.NormalizerOptions;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired when constructing the {@link NormalizerOptions options} of a normalization.
 *
 * @see Normalization
 * @see NormalizerOptions.Builder
 */
public class ModifyOptionsEvent implements NormalizationEvent {
    /**
     * The options builder.
     */
    @NotNull
    public NormalizerOptions.Builder optionsBuilder;

    /**
     * Construct a new modify-options event with the given options builder.
     *
     * @param optionsBuilder The builder.
     */
    public ModifyOptionsEvent(@NotNull NormalizerOptions.Builder optionsBuilder) {
        this.optionsBuilder = optionsBuilder;
    }
}
