package io.github.eutro.exir.api.events;

import io.github.eutro.exir.api.Normalization;

/**
 * An event fired during the normalization of a single tree.
 *
 * @see Normalization
 */
public interface NormalizationEvent {
}
