package io.github.eutro.exir.api;

/**
 * Receives the {@link Diagnostic}s of a normalization.
 * <p>
 * The core passes never report anything; only passes plugged in through
 * {@link io.github.eutro.exir.api.events.PeripheralPassesEvent} do.
 */
@FunctionalInterface
public interface DiagnosticSink {
    /**
     * Prints diagnostics to standard error.
     */
    DiagnosticSink STDERR = diagnostic -> System.err.println("error: " + diagnostic);

    void report(Diagnostic diagnostic);
}
