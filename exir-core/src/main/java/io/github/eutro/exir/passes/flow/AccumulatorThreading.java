package io.github.eutro.exir.passes.flow;

import io.github.eutro.exir.ext.Meta;
import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.IR;
import io.github.eutro.exir.ir.Pattern;
import io.github.eutro.exir.ir.Trees;
import io.github.eutro.exir.passes.IRPass;
import io.github.eutro.exir.passes.meta.Bindings;
import io.github.eutro.exir.passes.meta.FreeVars;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Threads reassignments of fold accumulators through the fold's return value.
 * <p>
 * In {@code Enum.reduce_while(coll, init, fn elem, acc -> body end)}, the lowering may leave
 * an assignment {@code acc = rhs} inside an {@code if} branch, which has no effect on the
 * {@code {:cont, acc}} returned after it. Such an assignment is erased, and {@code rhs} is
 * spliced into the returned tuple instead, selected by the branch condition.
 * <p>
 * An assignment in a statement sequence that itself contains a {@code {:cont, _}} or
 * {@code {:halt, _}} tuple is on the result path already, and is kept. If any part of
 * the fold cannot be threaded safely, the whole fold is left unchanged. That includes an
 * update with side effects, and an accumulator assigned within a {@code case} or
 * {@code cond} in statement position.
 */
public class AccumulatorThreading implements IRPass<Expr, Expr> {
    public static final AccumulatorThreading INSTANCE = new AccumulatorThreading();

    @Override
    public Expr run(Expr expr) {
        return Trees.transform(expr, node -> node instanceof Expr.Call ? threadFold((Expr.Call) node) : node);
    }

    static Expr threadFold(Expr.Call call) {
        if (!call.isRemote("Enum", "reduce_while", 3)) return call;
        if (!(call.args.get(2) instanceof Expr.Fn)) return call;
        Expr.Fn fn = (Expr.Fn) call.args.get(2);
        if (fn.clauses.size() != 1) return call;
        Clause clause = fn.clauses.get(0);
        if (clause.patterns.size() != 2 || clause.guard != null) return call;
        Set<String> accNames = accumulatorNames(clause.patterns.get(1));
        if (accNames.isEmpty()) return call;

        Threader threader = new Threader(accNames);
        if (!threader.assignsAccumulator(clause.body)) return call;
        List<Expr> stmts = threader.sequence(IR.stmts(clause.body), new LinkedHashMap<>(), true);
        if (threader.failed) return call;
        Expr body = FlowUtils.rebuildStmts(clause.body, stmts);
        if (body == clause.body) return call;

        List<Expr> args = new ArrayList<>(call.args);
        args.set(2, fn.withClauses(Collections.singletonList(clause.withBody(body))));
        return call.withChildren(args);
    }

    /**
     * Get the accumulator names declared by the accumulator pattern of a fold function:
     * the binder itself, or the binders in the slots of a tuple.
     */
    static Set<String> accumulatorNames(Pattern accPattern) {
        Set<String> names = new LinkedHashSet<>();
        if (accPattern instanceof Pattern.Bind) {
            names.add(((Pattern.Bind) accPattern).name);
        } else if (accPattern instanceof Pattern.Tuple) {
            for (Pattern element : ((Pattern.Tuple) accPattern).elements) {
                if (element instanceof Pattern.Bind) names.add(((Pattern.Bind) element).name);
            }
        }
        names.remove("_");
        return names;
    }

    private static boolean intersects(Set<String> a, Set<String> b) {
        for (String s : a) {
            if (b.contains(s)) return true;
        }
        return false;
    }

    private static final class Threader {
        final Set<String> accNames;
        boolean failed = false;

        Threader(Set<String> accNames) {
            this.accNames = accNames;
        }

        @Nullable String assignedAccumulator(Expr stmt) {
            if (!(stmt instanceof Expr.Match)) return null;
            String name = ((Expr.Match) stmt).assignedName();
            return name != null && accNames.contains(name) ? name : null;
        }

        boolean assignsAccumulator(Expr expr) {
            return Trees.anyMatch(expr, node -> assignedAccumulator(node) != null);
        }

        Set<String> dependencies(Map<String, Expr> pending) {
            Set<String> deps = new HashSet<>();
            for (Expr update : pending.values()) deps.addAll(FreeVars.of(update));
            return deps;
        }

        void checkRead(@Nullable Expr expr, Map<String, Expr> pending) {
            if (expr != null && intersects(FreeVars.of(expr), pending.keySet())) failed = true;
        }

        Expr substitute(Expr expr, Map<String, Expr> pending) {
            if (pending.isEmpty()) return expr;
            for (Expr node : Trees.preorder(expr)) {
                for (Pattern pattern : Bindings.ownPatterns(node)) {
                    if (intersects(Bindings.binders(pattern), pending.keySet())) {
                        failed = true;
                        return expr;
                    }
                }
            }
            return Trees.transform(expr, node -> {
                if (!(node instanceof Expr.Var)) return node;
                Expr update = pending.get(((Expr.Var) node).name);
                return update == null ? node : update;
            });
        }

        /**
         * Thread a statement sequence.
         * <p>
         * {@code pending} holds the updates not yet spliced in; it is updated with the ones
         * this sequence leaves behind. If {@code tail}, the last statement is the value of the fold
         * function, and must consume the updates.
         */
        List<Expr> sequence(List<Expr> stmts, Map<String, Expr> pending, boolean tail) {
            boolean hasControlTuple = false;
            for (Expr stmt : stmts) {
                if (Trees.anyMatch(stmt, IR::isFoldControlTuple)) {
                    hasControlTuple = true;
                    break;
                }
            }

            List<Expr> out = new ArrayList<>(stmts.size());
            Set<String> localBound = new HashSet<>();
            for (int i = 0; i < stmts.size() && !failed; i++) {
                Expr stmt = stmts.get(i);
                if (tail && i == stmts.size() - 1) {
                    out.add(tail(stmt, pending));
                    break;
                }

                String assigned = assignedAccumulator(stmt);
                if (assigned != null && !hasControlTuple) {
                    Expr update = substitute(((Expr.Match) stmt).value, pending);
                    // a spliced update may be copied or moved past other statements
                    if (!FlowUtils.isPure(update)) failed = true;
                    if (intersects(FreeVars.of(update), localBound)) failed = true;
                    pending.put(assigned, update);
                    continue;
                }

                if (stmt instanceof Expr.If) {
                    Expr result = branchStatement((Expr.If) stmt, pending);
                    if (result != null) out.add(result);
                } else {
                    checkRead(stmt, pending);
                    if (assigned == null && assignsAccumulator(stmt)) failed = true;
                    out.add(stmt);
                }

                Set<String> bound = FreeVars.statementBinders(stmt);
                if (intersects(bound, pending.keySet()) || intersects(bound, dependencies(pending))) {
                    failed = true;
                }
                localBound.addAll(bound);
            }
            if (!tail && intersects(dependencies(pending), localBound)) failed = true;
            return out;
        }

        /**
         * Thread an {@code if} in statement position, combining the updates of its branches.
         *
         * @return The new statement, or null if it should be dropped.
         */
        @Nullable Expr branchStatement(Expr.If ifExpr, Map<String, Expr> pending) {
            checkRead(ifExpr.cond, pending);
            List<Expr> oldThen = IR.stmts(ifExpr.then);
            Map<String, Expr> thenOut = new LinkedHashMap<>(pending);
            List<Expr> thenStmts = sequence(oldThen, thenOut, false);
            List<Expr> oldElse = ifExpr.orElse == null ? Collections.emptyList() : IR.stmts(ifExpr.orElse);
            Map<String, Expr> elseOut = new LinkedHashMap<>(pending);
            List<Expr> elseStmts = sequence(oldElse, elseOut, false);
            if (failed) return ifExpr;

            Set<String> updated = new LinkedHashSet<>(thenOut.keySet());
            updated.addAll(elseOut.keySet());
            for (String name : updated) {
                Expr current = pending.containsKey(name) ? pending.get(name) : IR.var(name);
                Expr thenValue = thenOut.getOrDefault(name, current);
                Expr elseValue = elseOut.getOrDefault(name, current);
                if (thenValue == current && elseValue == current) continue;
                if (!FlowUtils.isPure(ifExpr.cond)) {
                    failed = true;
                    return ifExpr;
                }
                pending.put(name, new Expr.If(Meta.EMPTY, ifExpr.cond, thenValue, elseValue, ifExpr.unless));
            }

            boolean erased = thenStmts.size() != oldThen.size() || elseStmts.size() != oldElse.size();
            if (erased && thenStmts.isEmpty() && elseStmts.isEmpty() && FlowUtils.isPure(ifExpr.cond)) {
                return null;
            }
            Expr newThen = thenStmts.isEmpty() ? IR.nil() : FlowUtils.rebuildStmts(ifExpr.then, thenStmts);
            Expr newElse;
            if (ifExpr.orElse == null) {
                newElse = null;
            } else {
                newElse = elseStmts.isEmpty() ? IR.nil() : FlowUtils.rebuildStmts(ifExpr.orElse, elseStmts);
            }
            List<Expr> children = new ArrayList<>();
            children.add(ifExpr.cond);
            children.add(newThen);
            if (newElse != null) children.add(newElse);
            return ifExpr.withChildren(children);
        }

        /**
         * Thread the value of a sequence, splicing the pending updates into the control tuples it returns.
         */
        Expr tail(Expr stmt, Map<String, Expr> pending) {
            if (pending.isEmpty() && !assignsAccumulator(stmt)) return stmt;
            switch (stmt.kind()) {
                case TUPLE: {
                    if (!IR.isFoldControlTuple(stmt)) break;
                    Expr.Tuple tuple = (Expr.Tuple) stmt;
                    List<Expr> elements = new ArrayList<>(tuple.elements);
                    elements.set(1, substitute(elements.get(1), pending));
                    return tuple.withChildren(elements);
                }
                case IF: {
                    Expr.If ifExpr = (Expr.If) stmt;
                    checkRead(ifExpr.cond, pending);
                    List<Expr> children = new ArrayList<>();
                    children.add(ifExpr.cond);
                    children.add(tailBranch(ifExpr.then, pending));
                    if (ifExpr.orElse != null) children.add(tailBranch(ifExpr.orElse, pending));
                    return failed ? stmt : ifExpr.withChildren(children);
                }
                case CASE: {
                    Expr.Case caseExpr = (Expr.Case) stmt;
                    checkRead(caseExpr.subject, pending);
                    Set<String> captured = new HashSet<>(pending.keySet());
                    captured.addAll(dependencies(pending));
                    List<Clause> clauses = new ArrayList<>(caseExpr.clauses.size());
                    for (Clause clause : caseExpr.clauses) {
                        if (intersects(Bindings.binders(clause.patterns), captured)) failed = true;
                        checkRead(clause.guard, pending);
                        clauses.add(clause.withBody(tailBranch(clause.body, pending)));
                    }
                    return failed ? stmt : caseExpr.withClauses(clauses);
                }
                case COND: {
                    Expr.Cond cond = (Expr.Cond) stmt;
                    List<Expr> children = new ArrayList<>();
                    for (int i = 0; i < cond.arms.size(); i++) {
                        checkRead(cond.arms.get(i).left, pending);
                        children.add(cond.arms.get(i).left);
                        children.add(tailBranch(cond.arms.get(i).right, pending));
                    }
                    return failed ? stmt : cond.withChildren(children);
                }
                case BLOCK:
                    return FlowUtils.rebuildStmts(stmt, sequence(((Expr.Block) stmt).stmts, pending, true));
                default:
                    break;
            }
            // the value does not return the accumulator, so pending updates would be lost
            if (!pending.isEmpty()) failed = true;
            return stmt;
        }

        private Expr tailBranch(Expr branch, Map<String, Expr> pending) {
            List<Expr> stmts = sequence(IR.stmts(branch), new LinkedHashMap<>(pending), true);
            if (failed) return branch;
            return stmts.isEmpty() ? branch : FlowUtils.rebuildStmts(branch, stmts);
        }
    }
}
