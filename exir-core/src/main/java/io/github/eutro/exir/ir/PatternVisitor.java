package io.github.eutro.exir.ir;

/**
 * A visitor over every kind of {@link Pattern}.
 *
 * @param <R> The result type.
 */
public interface PatternVisitor<R> {
    R visitBind(Pattern.Bind pattern);

    R visitWildcard(Pattern.Wildcard pattern);

    R visitLit(Pattern.Lit pattern);

    R visitTuple(Pattern.Tuple pattern);

    R visitList(Pattern.ListP pattern);

    R visitCons(Pattern.Cons pattern);

    R visitMap(Pattern.MapP pattern);

    R visitStruct(Pattern.StructP pattern);

    R visitAlias(Pattern.Alias pattern);

    R visitPin(Pattern.Pin pattern);

    R visitBits(Pattern.Bits pattern);
}
