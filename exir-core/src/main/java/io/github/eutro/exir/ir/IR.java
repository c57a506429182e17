package io.github.eutro.exir.ir;

import io.github.eutro.exir.ext.Meta;
import io.github.eutro.exir.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static factories for IR nodes with empty metadata.
 */
public final class IR {
    public static final String CONT = "cont";
    public static final String HALT = "halt";

    private IR() {
    }

    public static Expr.Var var(String name) {
        return new Expr.Var(Meta.EMPTY, name);
    }

    public static Expr.Literal atom(String name) {
        return new Expr.Literal(Meta.EMPTY, Expr.Literal.LitKind.ATOM, name);
    }

    public static Expr.Literal str(String value) {
        return new Expr.Literal(Meta.EMPTY, Expr.Literal.LitKind.STRING, value);
    }

    public static Expr.Literal integer(long value) {
        return new Expr.Literal(Meta.EMPTY, Expr.Literal.LitKind.INTEGER, value);
    }

    public static Expr.Literal flt(double value) {
        return new Expr.Literal(Meta.EMPTY, Expr.Literal.LitKind.FLOAT, value);
    }

    public static Expr.Literal bool(boolean value) {
        return new Expr.Literal(Meta.EMPTY, Expr.Literal.LitKind.BOOLEAN, value);
    }

    public static Expr.Literal nil() {
        return new Expr.Literal(Meta.EMPTY, Expr.Literal.LitKind.NIL, null);
    }

    public static Expr.Tuple tuple(Expr... elements) {
        return new Expr.Tuple(Meta.EMPTY, Arrays.asList(elements));
    }

    public static Expr.Tuple tuple(List<? extends Expr> elements) {
        return new Expr.Tuple(Meta.EMPTY, elements);
    }

    public static Expr.ListExpr list(Expr... elements) {
        return new Expr.ListExpr(Meta.EMPTY, Arrays.asList(elements));
    }

    public static Expr.MapExpr map(List<Pair<Expr, Expr>> entries) {
        return new Expr.MapExpr(Meta.EMPTY, entries);
    }

    public static Expr.Struct struct(String module, List<Pair<String, Expr>> fields) {
        return new Expr.Struct(Meta.EMPTY, module, fields);
    }

    public static Expr.Call call(String function, Expr... args) {
        return new Expr.Call(Meta.EMPTY, null, function, Arrays.asList(args));
    }

    public static Expr.Call remote(String module, String function, Expr... args) {
        return new Expr.Call(Meta.EMPTY, module, function, Arrays.asList(args));
    }

    public static Expr.Binary binary(String op, Expr lhs, Expr rhs) {
        return new Expr.Binary(Meta.EMPTY, op, lhs, rhs);
    }

    public static Expr.Unary unary(String op, Expr operand) {
        return new Expr.Unary(Meta.EMPTY, op, operand);
    }

    public static Expr.Match match(Pattern pattern, Expr value) {
        return new Expr.Match(Meta.EMPTY, pattern, value);
    }

    /**
     * {@code name = value}.
     *
     * @param name  The name to bind.
     * @param value The value.
     * @return The match.
     */
    public static Expr.Match assign(String name, Expr value) {
        return match(pvar(name), value);
    }

    public static Expr.If ifThen(Expr cond, Expr then) {
        return new Expr.If(Meta.EMPTY, cond, then, null, false);
    }

    public static Expr.If ifElse(Expr cond, Expr then, @Nullable Expr orElse) {
        return new Expr.If(Meta.EMPTY, cond, then, orElse, false);
    }

    public static Expr.If unless(Expr cond, Expr then, @Nullable Expr orElse) {
        return new Expr.If(Meta.EMPTY, cond, then, orElse, true);
    }

    public static Expr.Case caseOf(Expr subject, Clause... clauses) {
        return new Expr.Case(Meta.EMPTY, subject, Arrays.asList(clauses));
    }

    public static Expr.Case caseOf(Expr subject, List<Clause> clauses) {
        return new Expr.Case(Meta.EMPTY, subject, clauses);
    }

    public static Expr.Cond cond(List<Pair<Expr, Expr>> arms) {
        return new Expr.Cond(Meta.EMPTY, arms);
    }

    public static Expr.Block block(Expr... stmts) {
        return new Expr.Block(Meta.EMPTY, Arrays.asList(stmts));
    }

    public static Expr.Block block(List<? extends Expr> stmts) {
        return new Expr.Block(Meta.EMPTY, stmts);
    }

    public static Expr.Fn fn(Clause... clauses) {
        return new Expr.Fn(Meta.EMPTY, Arrays.asList(clauses));
    }

    /**
     * A single clause anonymous function, {@code fn params -> body end}.
     *
     * @param params The parameter patterns.
     * @param body   The body.
     * @return The function.
     */
    public static Expr.Fn lambda(List<? extends Pattern> params, Expr body) {
        return fn(new Clause(params, null, body));
    }

    public static Expr.Comprehension comprehension(List<Expr.Comprehension.Generator> generators,
                                                   List<? extends Expr> filters,
                                                   @Nullable Expr into,
                                                   Expr body) {
        return new Expr.Comprehension(Meta.EMPTY, generators, filters, into, body);
    }

    public static Expr.Comprehension.Generator generator(Pattern pattern, Expr collection) {
        return new Expr.Comprehension.Generator(pattern, collection);
    }

    public static Expr.Try tryOf(Expr body,
                                 List<Clause> rescues,
                                 List<Clause> catches,
                                 List<Clause> elses,
                                 @Nullable Expr after) {
        return new Expr.Try(Meta.EMPTY, body, rescues, catches, elses, after);
    }

    public static Expr.Field field(Expr target, String field) {
        return new Expr.Field(Meta.EMPTY, target, field);
    }

    public static Expr.Pin pin(Expr expr) {
        return new Expr.Pin(Meta.EMPTY, expr);
    }

    public static Expr.Raw raw(String code) {
        return new Expr.Raw(Meta.EMPTY, code);
    }

    public static Expr.Def def(String name, List<? extends Pattern> params, Expr body) {
        return new Expr.Def(Meta.EMPTY, false, name, params, null, body);
    }

    public static Expr.Def defp(String name, List<? extends Pattern> params, Expr body) {
        return new Expr.Def(Meta.EMPTY, true, name, params, null, body);
    }

    public static Expr.Module module(String name, Expr... body) {
        return new Expr.Module(Meta.EMPTY, name, Arrays.asList(body));
    }

    public static Clause clause(Pattern pattern, Expr body) {
        return new Clause(Collections.singletonList(pattern), null, body);
    }

    public static Clause clause(Pattern pattern, @Nullable Expr guard, Expr body) {
        return new Clause(Collections.singletonList(pattern), guard, body);
    }

    public static Clause clause(List<? extends Pattern> patterns, @Nullable Expr guard, Expr body) {
        return new Clause(patterns, guard, body);
    }

    public static Pattern.Bind pvar(String name) {
        return new Pattern.Bind(name);
    }

    public static Pattern.Wildcard wildcard() {
        return Pattern.Wildcard.INSTANCE;
    }

    public static Pattern.Lit plit(Expr.Literal literal) {
        return new Pattern.Lit(literal);
    }

    public static Pattern.Lit patom(String name) {
        return plit(atom(name));
    }

    public static Pattern.Tuple ptuple(Pattern... elements) {
        return new Pattern.Tuple(Arrays.asList(elements));
    }

    public static Pattern.ListP plist(Pattern... elements) {
        return new Pattern.ListP(Arrays.asList(elements));
    }

    public static Pattern.Cons pcons(Pattern head, Pattern tail) {
        return new Pattern.Cons(Collections.singletonList(head), tail);
    }

    public static Pattern.Alias alias(String name, Pattern pattern) {
        return new Pattern.Alias(name, pattern);
    }

    public static Pattern.Pin ppin(Expr expr) {
        return new Pattern.Pin(expr);
    }

    public static List<Pattern> params(String... names) {
        List<Pattern> list = new ArrayList<>(names.length);
        for (String name : names) list.add(pvar(name));
        return list;
    }

    /**
     * {@code {:cont, value}}.
     *
     * @param value The accumulator value.
     * @return The tuple.
     */
    public static Expr.Tuple contTuple(Expr value) {
        return tuple(atom(CONT), value);
    }

    /**
     * {@code {:halt, value}}.
     *
     * @param value The accumulator value.
     * @return The tuple.
     */
    public static Expr.Tuple haltTuple(Expr value) {
        return tuple(atom(HALT), value);
    }

    /**
     * Check whether an expression is a {@code {:cont, _}} or {@code {:halt, _}} tuple.
     *
     * @param expr The expression.
     * @return Whether it is.
     */
    public static boolean isFoldControlTuple(Expr expr) {
        if (!(expr instanceof Expr.Tuple)) return false;
        List<Expr> elements = ((Expr.Tuple) expr).elements;
        if (elements.size() != 2 || !(elements.get(0) instanceof Expr.Literal)) return false;
        Expr.Literal tag = (Expr.Literal) elements.get(0);
        return tag.isAtom(CONT) || tag.isAtom(HALT);
    }

    /**
     * Check whether an expression is statically a no-op: nil, an empty block, or {@code :ok}.
     *
     * @param expr The expression.
     * @return Whether it is.
     */
    public static boolean isNoOp(@Nullable Expr expr) {
        if (expr == null) return true;
        if (expr instanceof Expr.Block) return ((Expr.Block) expr).stmts.isEmpty();
        if (expr instanceof Expr.Literal) {
            Expr.Literal lit = (Expr.Literal) expr;
            return lit.litKind == Expr.Literal.LitKind.NIL || lit.isAtom("ok");
        }
        return false;
    }

    /**
     * Get the statements of an expression in statement position: those of a block, or the
     * expression itself.
     *
     * @param expr The expression.
     * @return The statements.
     */
    public static List<Expr> stmts(Expr expr) {
        return expr instanceof Expr.Block ? ((Expr.Block) expr).stmts : Collections.singletonList(expr);
    }
}
