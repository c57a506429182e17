package io.github.eutro.exir.api;

import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.passes.IRPass;
import io.github.eutro.exir.passes.Passes;
import io.github.eutro.exir.passes.flow.AccumulatorThreading;
import io.github.eutro.exir.passes.flow.ControlFlowNormalizer;
import io.github.eutro.exir.passes.hygiene.BinderHygiene;

/**
 * Which passes a {@link Normalization} runs.
 * <p>
 * The core passes always run in the same order: control flow, accumulator threading, then
 * binder hygiene; disabling one skips it without reordering the others.
 */
public final class NormalizerOptions {
    public final boolean controlFlow;
    public final boolean accumulatorThreading;
    public final boolean binderHygiene;
    public final boolean peripheralDefaults;

    private NormalizerOptions(Builder builder) {
        controlFlow = builder.controlFlow;
        accumulatorThreading = builder.accumulatorThreading;
        binderHygiene = builder.binderHygiene;
        peripheralDefaults = builder.peripheralDefaults;
    }

    /**
     * Get the core pipeline these options enable.
     *
     * @return The pass.
     */
    public IRPass<Expr, Expr> corePasses() {
        IRPass<Expr, Expr> pass = expr -> expr;
        if (controlFlow) pass = pass.then(Passes.step("control flow", ControlFlowNormalizer.INSTANCE));
        if (accumulatorThreading) pass = pass.then(Passes.step("accumulator threading", AccumulatorThreading.INSTANCE));
        if (binderHygiene) pass = pass.then(Passes.step("binder hygiene", BinderHygiene.INSTANCE));
        return pass;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean controlFlow = true;
        private boolean accumulatorThreading = true;
        private boolean binderHygiene = true;
        private boolean peripheralDefaults = true;

        public Builder setControlFlow(boolean controlFlow) {
            this.controlFlow = controlFlow;
            return this;
        }

        public Builder setAccumulatorThreading(boolean accumulatorThreading) {
            this.accumulatorThreading = accumulatorThreading;
            return this;
        }

        public Builder setBinderHygiene(boolean binderHygiene) {
            this.binderHygiene = binderHygiene;
            return this;
        }

        /**
         * Set whether the default {@link Passes#PERIPHERAL peripheral passes} run before
         * listeners of the peripheral passes event.
         *
         * @param peripheralDefaults Whether to run them.
         * @return This, for chaining.
         */
        public Builder setPeripheralDefaults(boolean peripheralDefaults) {
            this.peripheralDefaults = peripheralDefaults;
            return this;
        }

        public NormalizerOptions build() {
            return new NormalizerOptions(this);
        }
    }
}
