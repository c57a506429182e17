package io.github.eutro.exir.passes.flow;

import io.github.eutro.exir.ext.ProvenanceExts;
import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.ExprRewriter;
import io.github.eutro.exir.ir.IR;
import io.github.eutro.exir.ir.Pattern;
import io.github.eutro.exir.ir.Trees;
import io.github.eutro.exir.passes.IRPass;
import io.github.eutro.exir.passes.meta.Bindings;
import io.github.eutro.exir.util.Names;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Rewrites early returns out of {@code Enum.each} into a halting fold.
 * <p>
 * A {@code return} inside a loop of the source is lowered to
 * {@code Enum.each(coll, fn x -> if cond do value end end)}, which only ends the current
 * element: the statements after the loop still run. Within a function body, such a loop and
 * the statements after it become:
 *
 * <pre>{@code
 * case Enum.reduce_while(coll, :__no_return__, fn x, acc ->
 *        if cond do {:halt, {:__return__, value}} else {:cont, acc} end
 *      end) do
 *   {:__return__, result} -> result
 *   _ -> <the statements after the loop>
 * end
 * }</pre>
 */
public class ControlFlowNormalizer implements IRPass<Expr, Expr> {
    public static final ControlFlowNormalizer INSTANCE = new ControlFlowNormalizer();

    /**
     * The accumulator of a fold that has not returned.
     */
    public static final String NO_RETURN = "__no_return__";
    /**
     * The tag of the value a fold returns with.
     */
    public static final String RETURN = "__return__";

    @Override
    public Expr run(Expr expr) {
        return new Rewriter().rewrite(expr, false);
    }

    /**
     * The context is whether the node is the function of an iteration, which is not a
     * function body of the source.
     */
    private static class Rewriter extends ExprRewriter<Boolean> {
        @Override
        protected Expr enter(Expr expr, Boolean iterationFn, List<Boolean> childContexts) {
            int arity = expr.children().size();
            boolean iteration = expr instanceof Expr.Call && isIteration((Expr.Call) expr);
            for (int i = 0; i < arity; i++) childContexts.add(iteration && i == arity - 1);
            return expr;
        }

        @Override
        protected Expr exit(Expr expr, Boolean iterationFn) {
            switch (expr.kind()) {
                case DEF: {
                    Expr.Def def = (Expr.Def) expr;
                    return def.withBody(normalizeBody(def.body, Bindings.allNames(def)));
                }
                case FN: {
                    if (iterationFn) return expr;
                    Expr.Fn fn = (Expr.Fn) expr;
                    List<Clause> clauses = new ArrayList<>(fn.clauses.size());
                    for (Clause clause : fn.clauses) {
                        Set<String> taken = Bindings.allNames(clause.body);
                        taken.addAll(Bindings.binders(clause.patterns));
                        clauses.add(clause.withBody(normalizeBody(clause.body, taken)));
                    }
                    return fn.withClauses(clauses);
                }
                default:
                    return expr;
            }
        }
    }

    private static boolean isIteration(Expr.Call call) {
        return "Enum".equals(call.module)
                && !call.args.isEmpty()
                && call.args.get(call.args.size() - 1) instanceof Expr.Fn;
    }

    static Expr normalizeBody(Expr body, Set<String> taken) {
        List<Expr> stmts = normalizeSequence(IR.stmts(body), taken);
        return stmts == null ? body : FlowUtils.rebuildStmts(body, stmts);
    }

    /**
     * Normalize the first early-returning loop of a statement sequence, and recursively the
     * statements after it.
     *
     * @return The new statements, or null if there was no such loop.
     */
    static @Nullable List<Expr> normalizeSequence(List<Expr> stmts, Set<String> taken) {
        for (int i = 0; i < stmts.size(); i++) {
            EarlyReturnLoop loop = EarlyReturnLoop.detect(stmts.get(i));
            if (loop == null) continue;

            List<Expr> remainder = stmts.subList(i + 1, stmts.size());
            List<Expr> normalizedRemainder = normalizeSequence(remainder, taken);
            if (normalizedRemainder != null) remainder = normalizedRemainder;

            List<Expr> out = new ArrayList<>(stmts.subList(0, i));
            out.addAll(loop.leading);
            out.add(loop.toFold(taken, remainder));
            return out;
        }
        return null;
    }

    private static class EarlyReturnLoop {
        final List<Expr> leading;
        final Expr.Call call;
        final Pattern param;
        final Expr.If ifExpr;

        private EarlyReturnLoop(List<Expr> leading, Expr.Call call, Pattern param, Expr.If ifExpr) {
            this.leading = leading;
            this.call = call;
            this.param = param;
            this.ifExpr = ifExpr;
        }

        static @Nullable EarlyReturnLoop detect(Expr stmt) {
            if (stmt instanceof Expr.Block) {
                List<Expr> wrapped = ((Expr.Block) stmt).stmts;
                if (wrapped.isEmpty()) return null;
                Expr last = wrapped.get(wrapped.size() - 1);
                return last instanceof Expr.Call
                        ? detect(wrapped.subList(0, wrapped.size() - 1), (Expr.Call) last)
                        : null;
            }
            return stmt instanceof Expr.Call ? detect(Collections.emptyList(), (Expr.Call) stmt) : null;
        }

        private static @Nullable EarlyReturnLoop detect(List<Expr> leading, Expr.Call call) {
            if (!call.isRemote("Enum", "each", 2)) return null;
            if (!(call.args.get(1) instanceof Expr.Fn)) return null;
            Expr.Fn fn = (Expr.Fn) call.args.get(1);
            if (fn.clauses.size() != 1) return null;
            Clause clause = fn.clauses.get(0);
            if (clause.patterns.size() != 1 || clause.guard != null) return null;

            Expr body = clause.body;
            if (body instanceof Expr.Block && ((Expr.Block) body).stmts.size() == 1) {
                body = ((Expr.Block) body).stmts.get(0);
            }
            if (!(body instanceof Expr.If)) return null;
            Expr.If ifExpr = (Expr.If) body;
            if (!IR.isNoOp(ifExpr.orElse)) return null;
            if (!isEarlyReturn(ifExpr.then, call)) return null;
            return new EarlyReturnLoop(leading, call, clause.pattern(), ifExpr);
        }

        private static boolean isEarlyReturn(Expr consequent, Expr.Call call) {
            if (consequent.hasExt(ProvenanceExts.EARLY_RETURN)) {
                return consequent.isFlagged(ProvenanceExts.EARLY_RETURN);
            }
            if (Trees.anyMatch(consequent, node -> node.isFlagged(ProvenanceExts.EARLY_RETURN))) return true;
            return call.isFlagged(ProvenanceExts.LOOP_HAS_RETURN);
        }

        Expr toFold(Set<String> taken, List<Expr> remainder) {
            String acc = Names.fresh("acc", taken);
            String result = Names.fresh("result", taken);

            List<Expr> halt = new ArrayList<>(IR.stmts(ifExpr.then));
            Expr value = halt.isEmpty() ? IR.nil() : halt.remove(halt.size() - 1);
            halt.add(IR.haltTuple(IR.tuple(IR.atom(RETURN), value)));
            Expr haltBody = halt.size() == 1 ? halt.get(0) : IR.block(halt);

            Expr.If step = new Expr.If(ifExpr.meta(), ifExpr.cond, haltBody, IR.contTuple(IR.var(acc)), ifExpr.unless);
            Expr.Fn stepFn = ((Expr.Fn) call.args.get(1))
                    .withClauses(Collections.singletonList(new Clause(Arrays.asList(param, IR.pvar(acc)), null, step)));
            Expr fold = new Expr.Call(call.meta(), "Enum", "reduce_while",
                    Arrays.asList(call.args.get(0), IR.atom(NO_RETURN), stepFn))
                    .withExt(ProvenanceExts.NORMALIZED_FOLD, true);

            Expr fallthrough;
            if (remainder.isEmpty()) {
                fallthrough = IR.atom("ok");
            } else if (remainder.size() == 1) {
                fallthrough = remainder.get(0);
            } else {
                fallthrough = IR.block(remainder);
            }
            return IR.caseOf(fold,
                    IR.clause(IR.ptuple(IR.patom(RETURN), IR.pvar(result)), IR.var(result)),
                    IR.clause(IR.wildcard(), fallthrough));
        }
    }
}
