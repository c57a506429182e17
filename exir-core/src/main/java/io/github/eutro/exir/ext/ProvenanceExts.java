package io.github.eutro.exir.ext;

/**
 * The exts attached to expressions by the lowering stage, and the few that passes set
 * on nodes they construct.
 */
public class ProvenanceExts {
    /**
     * Where the expression came from in the source program.
     */
    public static final Ext<SourcePos> POSITION = Ext.create(SourcePos.class, "POSITION");

    /**
     * Set on a value expression that was the operand of an early {@code return} in the source.
     * <p>
     * Authoritative when present, including when {@code false}.
     */
    public static final Ext<Boolean> EARLY_RETURN = Ext.create(Boolean.class, "EARLY_RETURN");

    /**
     * Set on a lowered loop which is known to contain a {@code return} anywhere in its body.
     */
    public static final Ext<Boolean> LOOP_HAS_RETURN = Ext.create(Boolean.class, "LOOP_HAS_RETURN");

    /**
     * Set by the control-flow normalizer on the {@code Enum.reduce_while} fold it builds.
     */
    public static final Ext<Boolean> NORMALIZED_FOLD = Ext.create(Boolean.class, "NORMALIZED_FOLD");
}
