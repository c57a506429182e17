package io.github.eutro.exir.test;

import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.Pattern;
import io.github.eutro.exir.util.Pair;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates the subset of the IR the tests build, recording what {@code IO.puts} prints.
 * <p>
 * Values are {@link Long}, {@link Double}, {@link Boolean}, {@link String}, {@link Atom},
 * {@link Tuple}, {@link List}, {@link Closure}, or null for nil.
 */
public class Evaluator {
    public final List<String> output = new ArrayList<>();
    private final Map<String, Expr.Def> defs = new HashMap<>();

    public Evaluator(Expr... definitions) {
        for (Expr definition : definitions) {
            if (definition instanceof Expr.Module) {
                for (Expr stmt : ((Expr.Module) definition).body) define(stmt);
            } else {
                define(definition);
            }
        }
    }

    private void define(Expr expr) {
        Expr.Def def = (Expr.Def) expr;
        defs.put(def.name + "/" + def.params.size(), def);
    }

    public Object call(String name, Object... args) {
        Expr.Def def = defs.get(name + "/" + args.length);
        if (def == null) throw new IllegalArgumentException("no such function " + name + "/" + args.length);
        Map<String, Object> env = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            if (!match(def.params.get(i), args[i], env)) {
                throw new IllegalStateException("no clause of " + name + " matches");
            }
        }
        return eval(def.body, env);
    }

    public Object eval(Expr expr) {
        return eval(expr, new HashMap<>());
    }

    public static final class Atom {
        public final String name;

        public Atom(String name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Atom && name.equals(((Atom) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return ":" + name;
        }
    }

    public static final class Tuple {
        public final List<Object> elements;

        public Tuple(List<Object> elements) {
            this.elements = elements;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Tuple && elements.equals(((Tuple) o).elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return "{" + elements + "}";
        }
    }

    public final class Closure {
        final Expr.Fn fn;
        final Map<String, Object> env;

        Closure(Expr.Fn fn, Map<String, Object> env) {
            this.fn = fn;
            this.env = env;
        }

        public Object apply(Object... args) {
            for (Clause clause : fn.clauses) {
                if (clause.patterns.size() != args.length) continue;
                Map<String, Object> inner = new HashMap<>(env);
                boolean matched = true;
                for (int i = 0; i < args.length && matched; i++) {
                    matched = match(clause.patterns.get(i), args[i], inner);
                }
                if (matched && (clause.guard == null || truthy(eval(clause.guard, inner)))) {
                    return eval(clause.body, inner);
                }
            }
            throw new IllegalStateException("no clause matches " + fn);
        }
    }

    static boolean truthy(Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    Object eval(Expr expr, Map<String, Object> env) {
        switch (expr.kind()) {
            case VAR: {
                String name = ((Expr.Var) expr).name;
                if (!env.containsKey(name)) throw new IllegalStateException("undefined variable " + name);
                return env.get(name);
            }
            case LITERAL: {
                Expr.Literal lit = (Expr.Literal) expr;
                return lit.litKind == Expr.Literal.LitKind.ATOM ? new Atom((String) lit.value) : lit.value;
            }
            case TUPLE:
                return new Tuple(evalAll(((Expr.Tuple) expr).elements, env));
            case LIST:
                return evalAll(((Expr.ListExpr) expr).elements, env);
            case MAP: {
                Map<Object, Object> map = new HashMap<>();
                for (Pair<Expr, Expr> entry : ((Expr.MapExpr) expr).entries) {
                    map.put(eval(entry.left, env), eval(entry.right, env));
                }
                return map;
            }
            case CALL:
                return evalCall((Expr.Call) expr, env);
            case BINARY:
                return binary((Expr.Binary) expr, env);
            case UNARY: {
                Expr.Unary unary = (Expr.Unary) expr;
                Object operand = eval(unary.operand, env);
                switch (unary.op) {
                    case "not":
                    case "!":
                        return !truthy(operand);
                    case "-":
                        return -(Long) operand;
                    default:
                        throw new UnsupportedOperationException(unary.op);
                }
            }
            case MATCH: {
                Expr.Match match = (Expr.Match) expr;
                Object value = eval(match.value, env);
                if (!match(match.pattern, value, env)) throw new IllegalStateException("match failed: " + expr);
                return value;
            }
            case IF: {
                Expr.If ifExpr = (Expr.If) expr;
                boolean cond = truthy(eval(ifExpr.cond, env)) != ifExpr.unless;
                Expr branch = cond ? ifExpr.then : ifExpr.orElse;
                return branch == null ? null : eval(branch, new HashMap<>(env));
            }
            case CASE: {
                Expr.Case caseExpr = (Expr.Case) expr;
                Object subject = eval(caseExpr.subject, env);
                for (Clause clause : caseExpr.clauses) {
                    Map<String, Object> inner = new HashMap<>(env);
                    if (match(clause.pattern(), subject, inner)
                            && (clause.guard == null || truthy(eval(clause.guard, inner)))) {
                        return eval(clause.body, inner);
                    }
                }
                throw new IllegalStateException("no case clause matches " + subject);
            }
            case COND:
                for (Pair<Expr, Expr> arm : ((Expr.Cond) expr).arms) {
                    if (truthy(eval(arm.left, env))) return eval(arm.right, new HashMap<>(env));
                }
                throw new IllegalStateException("no cond clause is true");
            case BLOCK: {
                Object last = null;
                for (Expr stmt : ((Expr.Block) expr).stmts) last = eval(stmt, env);
                return last;
            }
            case FN:
                return new Closure((Expr.Fn) expr, new HashMap<>(env));
            case FIELD: {
                Expr.Field field = (Expr.Field) expr;
                return ((Map<?, ?>) eval(field.target, env)).get(new Atom(field.field));
            }
            default:
                throw new UnsupportedOperationException("cannot evaluate " + expr.kind());
        }
    }

    private List<Object> evalAll(List<Expr> exprs, Map<String, Object> env) {
        List<Object> values = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) values.add(eval(expr, env));
        return values;
    }

    private Object binary(Expr.Binary binary, Map<String, Object> env) {
        if (binary.op.equals("and") || binary.op.equals("&&")) {
            return truthy(eval(binary.lhs, env)) && truthy(eval(binary.rhs, env));
        }
        if (binary.op.equals("or") || binary.op.equals("||")) {
            return truthy(eval(binary.lhs, env)) || truthy(eval(binary.rhs, env));
        }
        Object lhs = eval(binary.lhs, env);
        Object rhs = eval(binary.rhs, env);
        switch (binary.op) {
            case "==":
                return Objects.equals(lhs, rhs);
            case "!=":
                return !Objects.equals(lhs, rhs);
            case "+":
                return (Long) lhs + (Long) rhs;
            case "-":
                return (Long) lhs - (Long) rhs;
            case "*":
                return (Long) lhs * (Long) rhs;
            case "<":
                return (Long) lhs < (Long) rhs;
            case ">":
                return (Long) lhs > (Long) rhs;
            case "<=":
                return (Long) lhs <= (Long) rhs;
            case ">=":
                return (Long) lhs >= (Long) rhs;
            case "<>":
                return String.valueOf(lhs) + rhs;
            default:
                throw new UnsupportedOperationException(binary.op);
        }
    }

    private Object evalCall(Expr.Call call, Map<String, Object> env) {
        List<Object> args = evalAll(call.args, env);
        if (call.module == null) {
            if (env.get(call.function) instanceof Closure) {
                return ((Closure) env.get(call.function)).apply(args.toArray());
            }
            return call(call.function, args.toArray());
        }
        switch (call.module + "." + call.function + "/" + args.size()) {
            case "IO.puts/1":
                output.add(String.valueOf(args.get(0)));
                return new Atom("ok");
            case "Enum.each/2":
                for (Object element : (List<?>) args.get(0)) ((Closure) args.get(1)).apply(element);
                return new Atom("ok");
            case "Enum.reduce/3": {
                Object acc = args.get(1);
                for (Object element : (List<?>) args.get(0)) acc = ((Closure) args.get(2)).apply(element, acc);
                return acc;
            }
            case "Enum.reduce_while/3": {
                Object acc = args.get(1);
                for (Object element : (List<?>) args.get(0)) {
                    Tuple step = (Tuple) ((Closure) args.get(2)).apply(element, acc);
                    acc = step.elements.get(1);
                    if (step.elements.get(0).equals(new Atom("halt"))) break;
                    if (!step.elements.get(0).equals(new Atom("cont"))) {
                        throw new IllegalStateException("bad reduce_while step " + step);
                    }
                }
                return acc;
            }
            case "Map.get/2":
                return ((Map<?, ?>) args.get(0)).get(args.get(1));
            default:
                throw new UnsupportedOperationException("cannot call " + call);
        }
    }

    boolean match(Pattern pattern, Object value, Map<String, Object> env) {
        switch (pattern.kind()) {
            case BIND: {
                String name = ((Pattern.Bind) pattern).name;
                if (!name.equals("_")) env.put(name, value);
                return true;
            }
            case WILDCARD:
                return true;
            case LIT:
                return Objects.equals(eval(((Pattern.Lit) pattern).value, env), value);
            case PIN:
                return Objects.equals(eval(((Pattern.Pin) pattern).expr, env), value);
            case TUPLE: {
                if (!(value instanceof Tuple)) return false;
                return matchAll(((Pattern.Tuple) pattern).elements, ((Tuple) value).elements, env);
            }
            case LIST: {
                if (!(value instanceof List)) return false;
                return matchAll(((Pattern.ListP) pattern).elements, (List<?>) value, env);
            }
            case CONS: {
                if (!(value instanceof List)) return false;
                Pattern.Cons cons = (Pattern.Cons) pattern;
                List<?> list = (List<?>) value;
                if (list.size() < cons.heads.size()) return false;
                return matchAll(cons.heads, list.subList(0, cons.heads.size()), env)
                        && match(cons.tail, new ArrayList<>(list.subList(cons.heads.size(), list.size())), env);
            }
            case ALIAS: {
                Pattern.Alias alias = (Pattern.Alias) pattern;
                env.put(alias.name, value);
                return match(alias.pattern, value, env);
            }
            default:
                throw new UnsupportedOperationException("cannot match " + pattern.kind());
        }
    }

    private boolean matchAll(List<Pattern> patterns, List<?> values, Map<String, Object> env) {
        if (patterns.size() != values.size()) return false;
        for (int i = 0; i < patterns.size(); i++) {
            if (!match(patterns.get(i), values.get(i), env)) return false;
        }
        return true;
    }
}
