package io.github.eutro.exir.passes.hygiene;

import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.ExprRewriter;
import io.github.eutro.exir.passes.IRPass;
import io.github.eutro.exir.passes.meta.Bindings;
import io.github.eutro.exir.passes.meta.FreeVars;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Repairs clause binders throughout a tree.
 * <p>
 * Every {@code case}, {@code fn} and {@code try} clause is offered to the variants in order,
 * and the first whose trigger matches decides which binder {@link BinderRepair} works on.
 * Clauses are repaired outermost first, each against the names visible around it.
 */
public class BinderHygiene implements IRPass<Expr, Expr> {
    public static final BinderHygiene INSTANCE = new BinderHygiene(Arrays.asList(
            TaggedTupleBinder.INSTANCE,
            SingleBinderClause.INSTANCE,
            NestedTaggedPayload.INSTANCE
    ));

    private final List<BinderVariant> variants;

    public BinderHygiene(List<BinderVariant> variants) {
        this.variants = new ArrayList<>(variants);
    }

    @Override
    public Expr run(Expr expr) {
        return new Walker().rewrite(expr, Scope.EMPTY);
    }

    Clause repairClause(Clause clause, Scope scope) {
        for (BinderVariant variant : variants) {
            String target = variant.target(clause);
            if (target != null) return BinderRepair.repair(clause, target, scope);
        }
        return clause;
    }

    private List<Clause> repairClauses(List<Clause> clauses, Scope scope, List<Scope> childScopes) {
        List<Clause> out = new ArrayList<>(clauses.size());
        for (Clause clause : clauses) {
            Clause repaired = repairClause(clause, scope);
            Scope inner = scope.with(Bindings.binders(repaired.patterns));
            if (repaired.guard != null) childScopes.add(inner);
            childScopes.add(inner);
            out.add(repaired);
        }
        return out;
    }

    private class Walker extends ExprRewriter<Scope> {
        @Override
        protected Expr enter(Expr expr, Scope scope, List<Scope> childScopes) {
            switch (expr.kind()) {
                case DEF: {
                    Scope inner = scope.with(Bindings.binders(((Expr.Def) expr).params));
                    return super.enter(expr, inner, childScopes);
                }
                case BLOCK: {
                    Scope current = scope;
                    for (Expr stmt : ((Expr.Block) expr).stmts) {
                        childScopes.add(current);
                        current = current.with(FreeVars.statementBinders(stmt));
                    }
                    return expr;
                }
                case CASE: {
                    Expr.Case caseExpr = (Expr.Case) expr;
                    childScopes.add(scope);
                    return caseExpr.withClauses(repairClauses(caseExpr.clauses, scope, childScopes));
                }
                case FN: {
                    Expr.Fn fn = (Expr.Fn) expr;
                    return fn.withClauses(repairClauses(fn.clauses, scope, childScopes));
                }
                case TRY: {
                    Expr.Try tryExpr = (Expr.Try) expr;
                    childScopes.add(scope);
                    Expr.Try rebuilt = tryExpr.withClauses(
                            repairClauses(tryExpr.rescues, scope, childScopes),
                            repairClauses(tryExpr.catches, scope, childScopes),
                            repairClauses(tryExpr.elses, scope, childScopes));
                    if (tryExpr.after != null) childScopes.add(scope);
                    return rebuilt;
                }
                case COMPREHENSION: {
                    Expr.Comprehension comp = (Expr.Comprehension) expr;
                    Scope current = scope;
                    for (Expr.Comprehension.Generator generator : comp.generators) {
                        childScopes.add(current);
                        current = current.with(Bindings.binders(generator.pattern));
                    }
                    for (int i = 0; i < comp.filters.size(); i++) childScopes.add(current);
                    if (comp.into != null) childScopes.add(scope);
                    childScopes.add(current);
                    return expr;
                }
                default:
                    return super.enter(expr, scope, childScopes);
            }
        }
    }
}
