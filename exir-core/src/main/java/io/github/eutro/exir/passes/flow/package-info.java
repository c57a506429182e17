/**
 * Passes that repair control flow lowered into iteration and fold calls.
 * <p>
 * Each of these leaves a construct unchanged unless every precondition of its rewrite holds.
 */
package io.github.eutro.exir.passes.flow;
