package io.github.eutro.exir.passes.meta;

import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.util.Names;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the identifiers which occur only as the base of a field-style accessor.
 * <p>
 * An accessor base is the subject of {@code Map.get/fetch/fetch!}, {@code Keyword.get/fetch}
 * or {@code Access.get}, or the target of a field access {@code base.field}.
 */
public final class AccessorBases {
    private AccessorBases() {
    }

    /**
     * Check whether a call is a field-style accessor, whose first argument is its base.
     *
     * @param call The call.
     * @return Whether it is an accessor.
     */
    public static boolean isAccessor(Expr.Call call) {
        if (call.module == null || call.args.isEmpty()) return false;
        switch (call.module) {
            case "Map":
                return call.function.equals("get")
                        || call.function.equals("fetch")
                        || call.function.equals("fetch!");
            case "Keyword":
                return call.function.equals("get")
                        || call.function.equals("fetch");
            case "Access":
                return call.function.equals("get");
            default:
                return false;
        }
    }

    /**
     * Get the identifiers of an expression that are referenced at least once as an accessor
     * base, and never otherwise.
     *
     * @param expr The expression.
     * @return The names.
     */
    public static Set<String> of(Expr expr) {
        Set<String> asBase = new LinkedHashSet<>();
        Set<String> otherwise = new LinkedHashSet<>();
        Deque<Expr> stack = new ArrayDeque<>();
        Deque<Boolean> isBase = new ArrayDeque<>();
        stack.push(expr);
        isBase.push(false);
        while (!stack.isEmpty()) {
            Expr node = stack.pop();
            boolean base = isBase.pop();
            if (node instanceof Expr.Var) {
                String name = ((Expr.Var) node).name;
                if (Names.isSimpleIdentifier(name)) (base ? asBase : otherwise).add(name);
                continue;
            }
            List<Expr> children = node.children();
            for (int i = 0; i < children.size(); i++) {
                stack.push(children.get(i));
                isBase.push(i == 0 && isBaseHolder(node));
            }
        }
        asBase.removeAll(otherwise);
        return asBase;
    }

    private static boolean isBaseHolder(Expr node) {
        return node instanceof Expr.Field
                || node instanceof Expr.Call && isAccessor((Expr.Call) node);
    }
}
