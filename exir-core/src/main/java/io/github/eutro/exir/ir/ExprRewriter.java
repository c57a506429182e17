package io.github.eutro.exir.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A top-down rewrite which carries a context into each subtree.
 * <p>
 * Subclasses override {@link #enter} to replace a node and choose the context of each of its
 * children before they are visited, and {@link #exit} to rewrite the node once its children
 * have been. Like {@link Trees#transform}, this keeps its work on an explicit stack, so it
 * works on trees of any depth.
 *
 * @param <C> The type of context.
 */
public abstract class ExprRewriter<C> {
    private static final class Frame<C> {
        final Expr node;
        final C context;
        final List<Expr> children;
        final List<C> childContexts;
        final List<Expr> results;
        int index = 0;

        Frame(Expr node, C context, List<C> childContexts) {
            this.node = node;
            this.context = context;
            this.children = node.children();
            this.childContexts = childContexts;
            this.results = new ArrayList<>(children.size());
        }
    }

    /**
     * Prepare a node before its children are visited.
     * <p>
     * Defaults to visiting every child in the same context.
     *
     * @param expr          The node.
     * @param context       The context of the node.
     * @param childContexts The list to add the context of each child of the returned node to, in order.
     * @return The node whose children to visit, or {@code expr}.
     */
    protected Expr enter(Expr expr, C context, List<C> childContexts) {
        int arity = expr.children().size();
        for (int i = 0; i < arity; i++) childContexts.add(context);
        return expr;
    }

    /**
     * Rewrite a node after its children are rewritten. Defaults to the identity.
     *
     * @param expr    The node, rebuilt from its rewritten children.
     * @param context The context of the node.
     * @return The rewritten node.
     */
    protected Expr exit(Expr expr, C context) {
        return expr;
    }

    /**
     * Rewrite a tree.
     *
     * @param root    The tree.
     * @param context The context of the root.
     * @return The rewritten tree, or {@code root} if nothing changed.
     */
    public final Expr rewrite(Expr root, C context) {
        Deque<Frame<C>> stack = new ArrayDeque<>();
        stack.push(frame(root, context));
        while (true) {
            Frame<C> top = stack.peek();
            if (top.index < top.children.size()) {
                int i = top.index++;
                stack.push(frame(top.children.get(i), top.childContexts.get(i)));
                continue;
            }
            stack.pop();
            Expr result = exit(top.node.withChildren(top.results), top.context);
            if (stack.isEmpty()) return result;
            stack.peek().results.add(result);
        }
    }

    private Frame<C> frame(Expr expr, C context) {
        List<C> childContexts = new ArrayList<>();
        Expr entered = enter(expr, context, childContexts);
        Nodes.checkArity(childContexts, entered.children().size(), entered);
        return new Frame<>(entered, context, childContexts);
    }
}
