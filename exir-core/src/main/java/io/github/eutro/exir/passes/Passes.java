package io.github.eutro.exir.passes;

import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.IRDisplay;
import io.github.eutro.exir.passes.flow.AccumulatorThreading;
import io.github.eutro.exir.passes.flow.ControlFlowNormalizer;
import io.github.eutro.exir.passes.hygiene.BinderHygiene;
import io.github.eutro.exir.passes.misc.ForPass;
import io.github.eutro.exir.passes.misc.PrefixUnusedParameters;

/**
 * The fixed pipelines.
 * <p>
 * Hygiene runs after the control-flow passes, since it repairs binders those passes
 * (and the lowering) leave behind.
 */
public class Passes {
    /**
     * Whether to dump the tree to standard error after every pass of the pipelines.
     */
    public static boolean DEBUG_PASSES = System.getenv("EXIR_DEBUG_PASSES") != null;

    public static final IRPass<Expr, Expr> PERIPHERAL =
            ForPass.liftNodes(PrefixUnusedParameters.INSTANCE);

    public static final IRPass<Expr, Expr> CORE =
            step("control flow", ControlFlowNormalizer.INSTANCE)
                    .then(step("accumulator threading", AccumulatorThreading.INSTANCE))
                    .then(step("binder hygiene", BinderHygiene.INSTANCE));

    public static final IRPass<Expr, Expr> DEFAULT =
            CORE.then(step("peripheral", PERIPHERAL));

    /**
     * Wrap a pass of a pipeline with debug output, if enabled.
     *
     * @param label The name of the pass.
     * @param pass  The pass.
     * @return The pass to put in the pipeline.
     */
    public static IRPass<Expr, Expr> step(String label, IRPass<Expr, Expr> pass) {
        if (!DEBUG_PASSES) return pass;
        return IRDisplay.debugDisplayOnError(label, pass).then(IRDisplay.debugDisplay("after " + label));
    }
}
