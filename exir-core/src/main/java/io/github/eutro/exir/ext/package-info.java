/**
 * Exts: typed metadata keys.
 * <p>
 * Every IR expression carries an immutable {@link io.github.eutro.exir.ext.Meta},
 * a map from {@link io.github.eutro.exir.ext.Ext} keys to values. The lowering stage
 * uses it to pass provenance (see {@link io.github.eutro.exir.ext.ProvenanceExts})
 * down to the repair passes, which only read it, except on nodes they build themselves.
 * <p>
 * Metadata never takes part in structural equality of nodes.
 */
package io.github.eutro.exir.ext;
