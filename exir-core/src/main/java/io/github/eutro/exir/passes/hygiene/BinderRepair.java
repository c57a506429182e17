package io.github.eutro.exir.passes.hygiene;

import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.IR;
import io.github.eutro.exir.ir.Pattern;
import io.github.eutro.exir.ir.Trees;
import io.github.eutro.exir.passes.meta.AccessorBases;
import io.github.eutro.exir.passes.meta.Bindings;
import io.github.eutro.exir.passes.meta.FreeVars;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Repairs a clause whose pattern binds one name while its body uses another.
 * <p>
 * The candidates for the name the body wants are the free identifiers of the guard and body,
 * less the pattern's own binders, the names used only as accessor bases, and the names the
 * body binds itself. A fix is applied only when there is exactly one candidate, and it is
 * not already visible from the enclosing scope. Otherwise the clause is returned as is.
 * <p>
 * Raw code cannot be renamed within, so a clause whose guard or body holds any is never repaired.
 */
public final class BinderRepair {
    private BinderRepair() {
    }

    /**
     * Compute the candidate names for a clause.
     *
     * @param clause The clause.
     * @return The candidates, in order of first reference.
     */
    public static Set<String> candidates(Clause clause) {
        Expr scope = guardAndBody(clause);
        Set<String> candidates = new LinkedHashSet<>(FreeVars.of(scope));
        candidates.removeAll(Bindings.binders(clause.patterns));
        candidates.removeAll(AccessorBases.of(scope));
        candidates.removeAll(Bindings.matchBound(clause.body));
        return candidates;
    }

    private static Expr guardAndBody(Clause clause) {
        return clause.guard == null ? clause.body : IR.block(clause.guard, clause.body);
    }

    /**
     * Repair a clause by renaming or aliasing {@code target}, one of its binders.
     *
     * @param clause The clause.
     * @param target The binder to repair.
     * @param scope  The names visible around the clause.
     * @return The repaired clause, or {@code clause} if no fix is justified.
     */
    public static Clause repair(Clause clause, String target, Scope scope) {
        if (!Bindings.binders(clause.patterns).contains(target)) return clause;
        if (Trees.anyMatch(guardAndBody(clause), node -> node instanceof Expr.Raw)) return clause;
        Set<String> candidates = candidates(clause);
        if (candidates.size() != 1) return clause;
        String candidate = candidates.iterator().next();
        if (candidate.equals(target) || scope.contains(candidate)) return clause;

        boolean referenced = FreeVars.of(guardAndBody(clause)).contains(target);
        if (Bindings.occurrences(clause.patterns, target) == 1 && !referenced) {
            return rename(clause, target, candidate);
        }
        if (clause.guard != null && FreeVars.of(clause.guard).contains(candidate)) return clause;
        return alias(clause, target, candidate);
    }

    private static Clause rename(Clause clause, String from, String to) {
        List<Pattern> patterns = new ArrayList<>(clause.patterns.size());
        for (Pattern pattern : clause.patterns) {
            patterns.add(Trees.transformPatterns(pattern, p -> renameBinder(p, from, to)));
        }
        return clause.withPatterns(patterns);
    }

    private static Pattern renameBinder(Pattern p, String from, String to) {
        if (p instanceof Pattern.Bind && ((Pattern.Bind) p).name.equals(from)) {
            return ((Pattern.Bind) p).withName(to);
        }
        if (p instanceof Pattern.Alias && ((Pattern.Alias) p).name.equals(from)) {
            return ((Pattern.Alias) p).withName(to);
        }
        return p;
    }

    private static Clause alias(Clause clause, String binder, String candidate) {
        Expr binding = IR.assign(candidate, IR.var(binder));
        Expr body = clause.body;
        List<Expr> stmts = new ArrayList<>();
        stmts.add(binding);
        stmts.addAll(IR.stmts(body));
        Expr newBody = body instanceof Expr.Block
                ? ((Expr.Block) body).withStmts(stmts)
                : IR.block(stmts);
        return clause.withBody(newBody);
    }

    /**
     * Get the only pattern of a clause if it has exactly one.
     *
     * @param clause The clause.
     * @return The pattern, or null.
     */
    static @Nullable Pattern soloPattern(Clause clause) {
        return clause.patterns.size() == 1 ? clause.patterns.get(0) : null;
    }

    /**
     * Get the binder in the second slot of a {@code {:tag, binder}} pattern.
     *
     * @param pattern The pattern.
     * @return The binder name, or null if the pattern does not have that shape.
     */
    static @Nullable String taggedBinder(@Nullable Pattern pattern) {
        if (!(pattern instanceof Pattern.Tuple)) return null;
        List<Pattern> elements = ((Pattern.Tuple) pattern).elements;
        if (elements.size() != 2) return null;
        Pattern tag = elements.get(0);
        Pattern slot = elements.get(1);
        if (!(tag instanceof Pattern.Lit)) return null;
        if (((Pattern.Lit) tag).value.litKind != Expr.Literal.LitKind.ATOM) return null;
        if (!(slot instanceof Pattern.Bind) || ((Pattern.Bind) slot).name.equals("_")) return null;
        return ((Pattern.Bind) slot).name;
    }
}
