package io.github.eutro.exir.passes.hygiene;

import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.ir.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Tuple patterns nesting exactly one tagged payload, as in {@code {:event, {:data, x}}};
 * the target is the payload binder {@code x}.
 */
public class NestedTaggedPayload implements BinderVariant {
    public static final NestedTaggedPayload INSTANCE = new NestedTaggedPayload();

    @Override
    public @Nullable String target(Clause clause) {
        Pattern pattern = BinderRepair.soloPattern(clause);
        if (!(pattern instanceof Pattern.Tuple)) return null;
        String found = null;
        for (Pattern element : ((Pattern.Tuple) pattern).elements) {
            String binder = BinderRepair.taggedBinder(element);
            if (binder == null) continue;
            if (found != null) return null;
            found = binder;
        }
        return found;
    }
}
