package io.github.eutro.exir.passes.meta;

import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.Pattern;
import io.github.eutro.exir.ir.Trees;
import io.github.eutro.exir.util.Names;
import io.github.eutro.exir.util.Pair;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the free simple identifiers of an expression.
 * <p>
 * A name is free if it is referenced where no enclosing binder within the expression is in
 * scope. Scoping follows the target language: a match binds for the rest of its block, and
 * clause, parameter and generator binders are visible only inside their clause.
 */
public final class FreeVars {
    private FreeVars() {
    }

    /**
     * Get the free simple identifiers of an expression, in order of first reference.
     *
     * @param expr The expression.
     * @return The free names.
     */
    public static Set<String> of(Expr expr) {
        return of(expr, Collections.emptySet());
    }

    /**
     * Get the simple identifiers referenced by an expression that are bound neither by
     * {@code bound} nor within the expression itself.
     * <p>
     * Raw code is opaque, so every simple identifier that occurs in its text as a whole word
     * counts as referenced.
     *
     * @param expr  The expression.
     * @param bound The names already in scope.
     * @return The free names.
     */
    public static Set<String> of(Expr expr, Set<String> bound) {
        Set<String> out = new LinkedHashSet<>();
        Deque<Pair<Expr, Set<String>>> stack = new ArrayDeque<>();
        stack.push(Pair.of(expr, bound));
        List<Pair<Expr, Set<String>>> work = new ArrayList<>();
        while (!stack.isEmpty()) {
            Pair<Expr, Set<String>> top = stack.pop();
            work.clear();
            visit(top.left, top.right, out, work);
            for (int i = work.size() - 1; i >= 0; i--) stack.push(work.get(i));
        }
        return out;
    }

    /**
     * Get the names a statement binds for the statements after it in the same block.
     * <p>
     * These are the binders of match operators reachable without entering a nested scope.
     *
     * @param stmt The statement.
     * @return The names.
     */
    public static Set<String> statementBinders(Expr stmt) {
        Set<String> names = new LinkedHashSet<>();
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(stmt);
        while (!stack.isEmpty()) {
            Expr expr = stack.pop();
            switch (expr.kind()) {
                case MATCH:
                    names.addAll(Bindings.binders(((Expr.Match) expr).pattern));
                    stack.push(((Expr.Match) expr).value);
                    break;
                case IF:
                case CASE:
                case COND:
                case BLOCK:
                case FN:
                case COMPREHENSION:
                case TRY:
                case DEF:
                case MODULE:
                    break;
                default: {
                    List<Expr> children = expr.children();
                    for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
                }
            }
        }
        return names;
    }

    private static Set<String> extend(Set<String> bound, Set<String> names) {
        if (names.isEmpty() || bound.containsAll(names)) return bound;
        Set<String> extended = new HashSet<>(bound);
        extended.addAll(names);
        return extended;
    }

    private static void visitPatterns(List<Pattern> patterns, Set<String> bound, List<Pair<Expr, Set<String>>> work) {
        for (Pattern pattern : patterns) {
            for (Pattern p : Trees.preorder(pattern)) {
                for (Expr embedded : Bindings.embeddedExprs(p)) {
                    work.add(Pair.of(embedded, bound));
                }
            }
        }
    }

    private static void visitClauses(List<Clause> clauses, Set<String> bound, List<Pair<Expr, Set<String>>> work) {
        for (Clause clause : clauses) {
            visitPatterns(clause.patterns, bound, work);
            Set<String> inner = extend(bound, Bindings.binders(clause.patterns));
            if (clause.guard != null) work.add(Pair.of(clause.guard, inner));
            work.add(Pair.of(clause.body, inner));
        }
    }

    /**
     * Record the names a node references itself, and add its subexpressions to {@code work}
     * in order, each with the names in scope there.
     */
    private static void visit(Expr expr, Set<String> bound, Set<String> out, List<Pair<Expr, Set<String>>> work) {
        switch (expr.kind()) {
            case VAR: {
                String name = ((Expr.Var) expr).name;
                if (Names.isSimpleIdentifier(name) && !bound.contains(name)) out.add(name);
                break;
            }
            case RAW:
                for (String name : Names.wordsOf(((Expr.Raw) expr).code)) {
                    if (!bound.contains(name)) out.add(name);
                }
                break;
            case MATCH: {
                Expr.Match match = (Expr.Match) expr;
                visitPatterns(Collections.singletonList(match.pattern), bound, work);
                work.add(Pair.of(match.value, bound));
                break;
            }
            case BLOCK: {
                Set<String> scope = bound;
                for (Expr stmt : ((Expr.Block) expr).stmts) {
                    work.add(Pair.of(stmt, scope));
                    scope = extend(scope, statementBinders(stmt));
                }
                break;
            }
            case CASE: {
                Expr.Case caseExpr = (Expr.Case) expr;
                work.add(Pair.of(caseExpr.subject, bound));
                visitClauses(caseExpr.clauses, bound, work);
                break;
            }
            case FN:
                visitClauses(((Expr.Fn) expr).clauses, bound, work);
                break;
            case TRY: {
                Expr.Try tryExpr = (Expr.Try) expr;
                work.add(Pair.of(tryExpr.body, bound));
                visitClauses(tryExpr.rescues, bound, work);
                visitClauses(tryExpr.catches, bound, work);
                visitClauses(tryExpr.elses, bound, work);
                if (tryExpr.after != null) work.add(Pair.of(tryExpr.after, bound));
                break;
            }
            case COMPREHENSION: {
                Expr.Comprehension comp = (Expr.Comprehension) expr;
                if (comp.into != null) work.add(Pair.of(comp.into, bound));
                Set<String> scope = bound;
                for (Expr.Comprehension.Generator generator : comp.generators) {
                    work.add(Pair.of(generator.collection, scope));
                    visitPatterns(Collections.singletonList(generator.pattern), scope, work);
                    scope = extend(scope, Bindings.binders(generator.pattern));
                }
                for (Expr filter : comp.filters) work.add(Pair.of(filter, scope));
                work.add(Pair.of(comp.body, scope));
                break;
            }
            case DEF: {
                Expr.Def def = (Expr.Def) expr;
                visitPatterns(def.params, bound, work);
                Set<String> inner = extend(bound, Bindings.binders(def.params));
                if (def.guard != null) work.add(Pair.of(def.guard, inner));
                work.add(Pair.of(def.body, inner));
                break;
            }
            default:
                for (Expr child : expr.children()) work.add(Pair.of(child, bound));
        }
    }
}
