package io.github.eutro.exir.passes.misc;

import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.IR;
import io.github.eutro.exir.ir.Pattern;
import io.github.eutro.exir.ir.Trees;
import io.github.eutro.exir.passes.IRPass;
import io.github.eutro.exir.passes.meta.Bindings;
import io.github.eutro.exir.passes.meta.UsageQuery;
import io.github.eutro.exir.util.Names;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renames parameters that are never used to {@code _name}.
 * <p>
 * Runs on a single {@code def} or {@code fn} node; lift it with {@link ForPass#liftNodes(IRPass)}.
 */
public class PrefixUnusedParameters implements IRPass<Expr, Expr> {
    public static final PrefixUnusedParameters INSTANCE = new PrefixUnusedParameters(UsageQuery.FREE_VARS);

    private final UsageQuery usage;

    public PrefixUnusedParameters(UsageQuery usage) {
        this.usage = usage;
    }

    @Override
    public Expr run(Expr expr) {
        if (expr instanceof Expr.Def) {
            Expr.Def def = (Expr.Def) expr;
            return def.withParams(prefixUnused(def.params, def.guard, def.body));
        }
        if (expr instanceof Expr.Fn) {
            Expr.Fn fn = (Expr.Fn) expr;
            List<Clause> clauses = new ArrayList<>(fn.clauses.size());
            for (Clause clause : fn.clauses) {
                clauses.add(clause.withPatterns(prefixUnused(clause.patterns, clause.guard, clause.body)));
            }
            return fn.withClauses(clauses);
        }
        return expr;
    }

    private List<Pattern> prefixUnused(List<Pattern> params, @Nullable Expr guard, Expr body) {
        Expr scope = guard == null ? body : IR.block(guard, body);
        Set<String> binders = Bindings.binders(params);
        Set<String> pinned = pinnedNames(params);
        List<Pattern> out = params;
        for (String name : binders) {
            if (Names.isIgnored(name) || !Names.isSimpleIdentifier(name)) continue;
            String prefixed = "_" + name;
            if (binders.contains(prefixed)) continue;
            if (Bindings.occurrences(params, name) != 1 || pinned.contains(name)) continue;
            if (usage.isUsed(scope, name)) continue;
            List<Pattern> renamed = new ArrayList<>(out.size());
            for (Pattern param : out) {
                renamed.add(Trees.transformPatterns(param, p -> p instanceof Pattern.Bind && ((Pattern.Bind) p).name.equals(name)
                        ? ((Pattern.Bind) p).withName(prefixed)
                        : p));
            }
            out = renamed;
        }
        return out;
    }

    private static Set<String> pinnedNames(List<Pattern> params) {
        Set<String> names = new HashSet<>();
        for (Pattern param : params) {
            for (Pattern p : Trees.preorder(param)) {
                for (Expr embedded : Bindings.embeddedExprs(p)) {
                    names.addAll(Bindings.allNames(embedded));
                }
            }
        }
        return names;
    }
}
