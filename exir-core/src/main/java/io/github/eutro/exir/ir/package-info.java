/**
 * The IR: an immutable, Elixir-shaped expression tree, and the traversals over it.
 * <p>
 * {@link io.github.eutro.exir.ir.Expr} and {@link io.github.eutro.exir.ir.Pattern} are closed
 * hierarchies. Unchanged subtrees are shared between a tree and its rewrites, so passes can
 * check whether anything changed by reference.
 */
package io.github.eutro.exir.ir;
