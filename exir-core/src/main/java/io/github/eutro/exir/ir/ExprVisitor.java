package io.github.eutro.exir.ir;

/**
 * A visitor over every kind of {@link Expr}.
 *
 * @param <R> The result type.
 */
public interface ExprVisitor<R> {
    R visitVar(Expr.Var expr);

    R visitLiteral(Expr.Literal expr);

    R visitTuple(Expr.Tuple expr);

    R visitList(Expr.ListExpr expr);

    R visitMap(Expr.MapExpr expr);

    R visitStruct(Expr.Struct expr);

    R visitCall(Expr.Call expr);

    R visitBinary(Expr.Binary expr);

    R visitUnary(Expr.Unary expr);

    R visitMatch(Expr.Match expr);

    R visitIf(Expr.If expr);

    R visitCase(Expr.Case expr);

    R visitCond(Expr.Cond expr);

    R visitBlock(Expr.Block expr);

    R visitFn(Expr.Fn expr);

    R visitComprehension(Expr.Comprehension expr);

    R visitTry(Expr.Try expr);

    R visitField(Expr.Field expr);

    R visitPin(Expr.Pin expr);

    R visitRaw(Expr.Raw expr);

    R visitDef(Expr.Def expr);

    R visitModule(Expr.Module expr);
}
