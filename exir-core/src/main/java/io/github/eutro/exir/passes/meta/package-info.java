/**
 * Analyses which other passes use to decide what to do.
 */
package io.github.eutro.exir.passes.meta;
