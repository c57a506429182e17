/**
 * Events that occur during a normalization.
 * <p>
 * These can be used to configure the normalizer, to run extra passes, and the like.
 * <p>
 * The API revolves around {@link io.github.eutro.exir.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.exir.api.events;
