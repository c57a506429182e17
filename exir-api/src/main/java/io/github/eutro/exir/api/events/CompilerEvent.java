package io.github.eutro.exir.api.events;

import io.github.eutro.exir.api.ExirCompiler;

/**
 * An event fired on the compiler itself.
 *
 * @see ExirCompiler
 */
public interface CompilerEvent {
}
