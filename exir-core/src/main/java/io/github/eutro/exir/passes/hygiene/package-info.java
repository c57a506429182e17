/**
 * Passes that repair scoping of clause binders.
 */
package io.github.eutro.exir.passes.hygiene;
