package io.github.eutro.exir.api;

import io.github.eutro.exir.api.events.*;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.passes.Passes;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents the normalization of a single lowered tree.
 * <p>
 * Normalization, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunNormalizationEvent} is fired on the {@link ExirCompiler compiler}.</li>
 *     <li>{@link ModifyOptionsEvent} is fired.</li>
 *     <li>The core passes enabled by the options are run, in their fixed order.</li>
 *     <li>The {@link Passes#PERIPHERAL default peripheral passes} are run, if enabled.</li>
 *     <li>{@link PeripheralPassesEvent} is fired.</li>
 *     <li>{@link EmitTreeEvent} is fired with the final tree.</li>
 * </ol>
 */
public class Normalization extends EventSupplier<NormalizationEvent> {
    private final ExirCompiler cc;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * The tree being normalized.
     */
    @NotNull
    public Expr tree;

    Normalization(ExirCompiler cc, @NotNull Expr tree) {
        this.cc = cc;
        this.tree = tree;
    }

    /**
     * Run the normalization.
     * <p>
     * See the documentation of this class for details.
     */
    public void run() {
        cc.dispatch(RunNormalizationEvent.class, new RunNormalizationEvent(this));
        NormalizerOptions options = dispatch(ModifyOptionsEvent.class,
                new ModifyOptionsEvent(NormalizerOptions.builder()))
                .optionsBuilder
                .build();

        Expr result = options.corePasses().run(tree);
        if (options.peripheralDefaults) {
            result = Passes.step("peripheral", Passes.PERIPHERAL).run(result);
        }
        result = dispatch(PeripheralPassesEvent.class, new PeripheralPassesEvent(result, this::report)).tree;

        tree = result;
        dispatch(EmitTreeEvent.class, new EmitTreeEvent(result));
    }

    private void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        cc.getDiagnosticSink().report(diagnostic);
    }

    /**
     * Get the diagnostics reported so far.
     *
     * @return The diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Disable or enable one of the core passes for this normalization, by
     * {@link ModifyOptionsEvent modifying the options}.
     *
     * @param binderHygiene Whether to run binder hygiene.
     * @return This, for convenience.
     */
    public Normalization setBinderHygiene(boolean binderHygiene) {
        listen(ModifyOptionsEvent.class, evt -> evt.optionsBuilder.setBinderHygiene(binderHygiene));
        return this;
    }
}
