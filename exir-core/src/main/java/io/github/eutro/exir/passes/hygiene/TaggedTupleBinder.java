package io.github.eutro.exir.passes.hygiene;

import io.github.eutro.exir.ir.Clause;
import org.jetbrains.annotations.Nullable;

/**
 * Clauses matching a tagged pair {@code {:tag, x}}; the target is {@code x}.
 */
public class TaggedTupleBinder implements BinderVariant {
    public static final TaggedTupleBinder INSTANCE = new TaggedTupleBinder();

    @Override
    public @Nullable String target(Clause clause) {
        return BinderRepair.taggedBinder(BinderRepair.soloPattern(clause));
    }
}
