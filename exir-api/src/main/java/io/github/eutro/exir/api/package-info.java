/**
 * A configurable API over the core exir passes.
 * <p>
 * The main entrypoint to this API is the {@link io.github.eutro.exir.api.ExirCompiler},
 * to which lowered trees can be submitted for normalization.
 * <p>
 * The compiler can be configured using the {@link io.github.eutro.exir.api.events events API}.
 */
package io.github.eutro.exir.api;
