package io.github.eutro.exir.passes.misc;

import io.github.eutro.exir.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The composition of two passes, built by {@link IRPass#then(IRPass)}.
 * <p>
 * Nested chains are flattened when the chain is built, so a pipeline of any length
 * runs in a single loop, and a failure can say which of its passes threw.
 *
 * @param <A> The input type.
 * @param <B> The type passed from the first pass to the second.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final List<IRPass<?, ?>> passes;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> second) {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        addFlattened(passes, first);
        addFlattened(passes, second);
        this.passes = Collections.unmodifiableList(passes);
    }

    private static void addFlattened(List<IRPass<?, ?>> out, IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            out.addAll(((ChainedPass<?, ?, ?>) pass).passes);
        } else {
            out.add(pass);
        }
    }

    /**
     * Get the passes this chain runs, in order.
     *
     * @return The passes, none of which is itself a chain.
     */
    public List<IRPass<?, ?>> passes() {
        return passes;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object value = a;
        for (int i = 0; i < passes.size(); i++) {
            try {
                value = ((IRPass<Object, Object>) passes.get(i)).run(value);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("running pass " + i + " of " + passes.size() + " in chain"));
                throw t;
            }
        }
        return (C) value;
    }
}
