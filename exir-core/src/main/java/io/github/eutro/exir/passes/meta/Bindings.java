package io.github.eutro.exir.passes.meta;

import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.Pattern;
import io.github.eutro.exir.ir.Trees;
import io.github.eutro.exir.util.Names;
import io.github.eutro.exir.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Queries about the names that patterns bind.
 */
public final class Bindings {
    private Bindings() {
    }

    /**
     * Get the names bound by a pattern, in order of first occurrence.
     *
     * @param pattern The pattern.
     * @return The names.
     */
    public static Set<String> binders(Pattern pattern) {
        return binders(Collections.singletonList(pattern));
    }

    /**
     * Get the names bound by a list of patterns, in order of first occurrence.
     *
     * @param patterns The patterns.
     * @return The names.
     */
    public static Set<String> binders(List<Pattern> patterns) {
        Set<String> names = new LinkedHashSet<>();
        for (Pattern pattern : patterns) {
            for (Pattern p : Trees.preorder(pattern)) {
                String name = binderName(p);
                if (name != null) names.add(name);
            }
        }
        return names;
    }

    /**
     * Count the occurrences of a binder in a list of patterns.
     *
     * @param patterns The patterns.
     * @param name     The name.
     * @return The number of {@link Pattern.Bind} and {@link Pattern.Alias} nodes binding it.
     */
    public static int occurrences(List<Pattern> patterns, String name) {
        int count = 0;
        for (Pattern pattern : patterns) {
            for (Pattern p : Trees.preorder(pattern)) {
                if (name.equals(binderName(p))) count++;
            }
        }
        return count;
    }

    static @Nullable String binderName(Pattern p) {
        if (p instanceof Pattern.Bind) {
            String name = ((Pattern.Bind) p).name;
            return "_".equals(name) ? null : name;
        }
        if (p instanceof Pattern.Alias) return ((Pattern.Alias) p).name;
        return null;
    }

    /**
     * Get the names bound by a match operator anywhere in a subtree.
     *
     * @param expr The subtree.
     * @return The names.
     */
    public static Set<String> matchBound(Expr expr) {
        Set<String> names = new LinkedHashSet<>();
        for (Expr node : Trees.preorder(expr)) {
            if (node instanceof Expr.Match) {
                names.addAll(binders(((Expr.Match) node).pattern));
            }
        }
        return names;
    }

    /**
     * Get the patterns which belong directly to a node: match patterns, clause heads,
     * generator patterns and parameters.
     *
     * @param node The node.
     * @return The patterns.
     */
    public static List<Pattern> ownPatterns(Expr node) {
        List<Pattern> patterns = new ArrayList<>();
        switch (node.kind()) {
            case MATCH:
                patterns.add(((Expr.Match) node).pattern);
                break;
            case CASE:
                addClausePatterns(patterns, ((Expr.Case) node).clauses);
                break;
            case FN:
                addClausePatterns(patterns, ((Expr.Fn) node).clauses);
                break;
            case TRY: {
                Expr.Try tryExpr = (Expr.Try) node;
                addClausePatterns(patterns, tryExpr.rescues);
                addClausePatterns(patterns, tryExpr.catches);
                addClausePatterns(patterns, tryExpr.elses);
                break;
            }
            case COMPREHENSION:
                for (Expr.Comprehension.Generator generator : ((Expr.Comprehension) node).generators) {
                    patterns.add(generator.pattern);
                }
                break;
            case DEF:
                patterns.addAll(((Expr.Def) node).params);
                break;
            default:
                break;
        }
        return patterns;
    }

    private static void addClausePatterns(List<Pattern> out, List<Clause> clauses) {
        for (Clause clause : clauses) out.addAll(clause.patterns);
    }

    /**
     * Get every simple identifier that appears in a subtree, as a variable reference, as a binder,
     * or as a word of raw code.
     * <p>
     * A name outside this set cannot capture or be captured by anything in the subtree.
     *
     * @param expr The subtree.
     * @return The names.
     */
    public static Set<String> allNames(Expr expr) {
        Set<String> names = new LinkedHashSet<>();
        for (Expr node : Trees.preorder(expr)) {
            if (node instanceof Expr.Var) {
                names.add(((Expr.Var) node).name);
            } else if (node instanceof Expr.Raw) {
                names.addAll(Names.wordsOf(((Expr.Raw) node).code));
            }
            for (Pattern pattern : ownPatterns(node)) {
                names.addAll(binders(pattern));
                for (Pattern p : Trees.preorder(pattern)) {
                    for (Expr embedded : embeddedExprs(p)) {
                        names.addAll(allNames(embedded));
                    }
                }
            }
        }
        names.removeIf(name -> !Names.isSimpleIdentifier(name));
        return names;
    }

    /**
     * Get the expressions embedded directly in a pattern node: pinned values and map keys.
     *
     * @param pattern The pattern node.
     * @return The expressions.
     */
    public static List<Expr> embeddedExprs(Pattern pattern) {
        if (pattern instanceof Pattern.Pin) {
            return Collections.singletonList(((Pattern.Pin) pattern).expr);
        }
        if (pattern instanceof Pattern.MapP) {
            List<Expr> keys = new ArrayList<>();
            for (Pair<Expr, Pattern> entry : ((Pattern.MapP) pattern).entries) keys.add(entry.left);
            return keys;
        }
        return Collections.emptyList();
    }
}
