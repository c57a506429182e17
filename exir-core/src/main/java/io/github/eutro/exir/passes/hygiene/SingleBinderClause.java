package io.github.eutro.exir.passes.hygiene;

import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.passes.meta.Bindings;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * Clauses whose patterns bind exactly one name in total; the target is that name.
 */
public class SingleBinderClause implements BinderVariant {
    public static final SingleBinderClause INSTANCE = new SingleBinderClause();

    @Override
    public @Nullable String target(Clause clause) {
        Set<String> binders = Bindings.binders(clause.patterns);
        return binders.size() == 1 ? binders.iterator().next() : null;
    }
}
