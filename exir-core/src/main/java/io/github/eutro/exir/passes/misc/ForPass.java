package io.github.eutro.exir.passes.misc;

import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.Trees;
import io.github.eutro.exir.passes.IRPass;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on whole trees.
 */
public class ForPass {
    /**
     * Lift a function definition pass to operate on every {@link Expr.Def} in a tree.
     *
     * @param pass The definition pass.
     * @return The tree pass.
     */
    public static IRPass<Expr, Expr> liftDefs(IRPass<Expr.Def, Expr> pass) {
        return new Defs(pass);
    }

    /**
     * Lift a node pass to run bottom-up on every node of a tree.
     *
     * @param pass The node pass.
     * @return The tree pass.
     */
    public static IRPass<Expr, Expr> liftNodes(IRPass<Expr, Expr> pass) {
        return new Nodes(pass);
    }

    private static class Defs implements IRPass<Expr, Expr> {
        private final IRPass<Expr.Def, Expr> pass;

        private Defs(IRPass<Expr.Def, Expr> pass) {
            this.pass = pass;
        }

        @Override
        public Expr run(Expr expr) {
            int[] i = {0};
            return Trees.transform(expr, node -> {
                if (!(node instanceof Expr.Def)) return node;
                Expr.Def def = (Expr.Def) node;
                try {
                    return pass.run(def);
                } catch (Throwable t) {
                    t.addSuppressed(new RuntimeException("in definition " + i[0] + " (" + def.name + ")"));
                    throw t;
                } finally {
                    i[0]++;
                }
            });
        }
    }

    private static class Nodes implements IRPass<Expr, Expr> {
        private final IRPass<Expr, Expr> pass;

        private Nodes(IRPass<Expr, Expr> pass) {
            this.pass = pass;
        }

        @Override
        public Expr run(Expr expr) {
            return Trees.transform(expr, node -> {
                try {
                    return pass.run(node);
                } catch (Throwable t) {
                    t.addSuppressed(new RuntimeException("in " + node.kind() + " node"));
                    throw t;
                }
            });
        }
    }
}
