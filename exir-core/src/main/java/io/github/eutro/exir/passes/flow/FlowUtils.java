package io.github.eutro.exir.passes.flow;

import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.IR;
import io.github.eutro.exir.ir.Trees;

import java.util.List;

final class FlowUtils {
    private FlowUtils() {
    }

    /**
     * Rebuild an expression in statement position from its new statements, sharing where possible.
     */
    static Expr rebuildStmts(Expr original, List<Expr> stmts) {
        if (original instanceof Expr.Block) return ((Expr.Block) original).withStmts(stmts);
        if (stmts.size() == 1) return stmts.get(0);
        return IR.block(stmts);
    }

    /**
     * Whether an expression is free of side effects, and cheap to evaluate more than once.
     */
    static boolean isPure(Expr expr) {
        return !Trees.anyMatch(expr, node -> {
            switch (node.kind()) {
                case VAR:
                case LITERAL:
                case BINARY:
                case UNARY:
                case FIELD:
                case TUPLE:
                case LIST:
                    return false;
                default:
                    return true;
            }
        });
    }
}
