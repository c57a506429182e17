package io.github.eutro.exir.api;

import io.github.eutro.exir.api.events.*;
import io.github.eutro.exir.ir.Expr;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * The entry point for normalizing lowered trees.
 * <p>
 * Trees are {@link #submit(Expr) submitted} to get a {@link Normalization}, which does the
 * work when run. Listeners on the compiler apply to every normalization it starts; see
 * {@link #lift()}.
 */
public class ExirCompiler extends EventSupplier<CompilerEvent> {
    private DiagnosticSink diagnosticSink = DiagnosticSink.STDERR;

    @Contract(pure = true)
    public Normalization submit(@NotNull Expr tree) {
        return newNormalization(tree);
    }

    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    private Normalization newNormalization(Expr tree) {
        return new Normalization(this, tree);
    }

    /**
     * Get a dispatcher through which listeners can be added to every normalization this compiler runs.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<NormalizationEvent> lift() {
        return new EventDispatcher<NormalizationEvent>() {
            @Override
            public <T extends NormalizationEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                ExirCompiler.this.listen(RunNormalizationEvent.class, evt ->
                        evt.normalization.listen(eventClass, listener));
            }

            @Override
            public <T extends NormalizationEvent> boolean unlisten(Class<T> eventClass, @NotNull Consumer<T> listener) {
                throw new UnsupportedOperationException("lifted listeners cannot be removed");
            }
        };
    }

    /**
     * Collect every tree this compiler emits into a queue.
     *
     * @return The queue.
     */
    public BlockingQueue<Expr> outputsAsQueue() {
        BlockingQueue<Expr> queue = new LinkedBlockingQueue<>();
        lift().listen(EmitTreeEvent.class, evt -> queue.add(evt.tree));
        return queue;
    }

    public DiagnosticSink getDiagnosticSink() {
        return diagnosticSink;
    }

    public ExirCompiler setDiagnosticSink(@NotNull DiagnosticSink diagnosticSink) {
        this.diagnosticSink = diagnosticSink;
        return this;
    }
}
