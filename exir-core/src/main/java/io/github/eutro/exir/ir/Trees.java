package io.github.eutro.exir.ir;

import io.github.eutro.exir.util.F;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Stack-safe traversals over expression and pattern trees.
 * <p>
 * None of these recurse on the native stack, so they work on trees of any depth.
 */
public final class Trees {
    private Trees() {
    }

    private static final class Frame<T> {
        final T node;
        final List<T> children;
        final List<T> results;
        int index = 0;

        Frame(T node, List<T> children) {
            this.node = node;
            this.children = children;
            this.results = new ArrayList<>(children.size());
        }
    }

    /**
     * Apply {@code f} bottom-up to every node of {@code root}.
     * <p>
     * Each node is rebuilt from its transformed children before {@code f} sees it. Parents are
     * rebuilt only if a child changed, so an {@code f} which returns its argument everywhere
     * returns {@code root} itself.
     *
     * @param root The tree.
     * @param f    The function to apply to each node.
     * @return The transformed tree.
     */
    public static Expr transform(@NotNull Expr root, @NotNull F<Expr, Expr> f) {
        Deque<Frame<Expr>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(root, root.children()));
        while (true) {
            Frame<Expr> top = stack.peek();
            if (top.index < top.children.size()) {
                Expr child = top.children.get(top.index++);
                stack.push(new Frame<>(child, child.children()));
                continue;
            }
            stack.pop();
            Expr result = f.apply(top.node.withChildren(top.results));
            if (stack.isEmpty()) return result;
            stack.peek().results.add(result);
        }
    }

    /**
     * Apply {@code f} bottom-up to every sub-pattern of {@code root}, as {@link #transform(Expr, F)}.
     *
     * @param root The pattern.
     * @param f    The function to apply to each sub-pattern.
     * @return The transformed pattern.
     */
    public static Pattern transformPatterns(@NotNull Pattern root, @NotNull F<Pattern, Pattern> f) {
        Deque<Frame<Pattern>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(root, root.children()));
        while (true) {
            Frame<Pattern> top = stack.peek();
            if (top.index < top.children.size()) {
                Pattern child = top.children.get(top.index++);
                stack.push(new Frame<>(child, child.children()));
                continue;
            }
            stack.pop();
            Pattern result = f.apply(top.node.withChildren(top.results));
            if (stack.isEmpty()) return result;
            stack.peek().results.add(result);
        }
    }

    /**
     * List every node of {@code root} in pre-order, {@code root} first.
     *
     * @param root The tree.
     * @return The nodes.
     */
    public static List<Expr> preorder(@NotNull Expr root) {
        List<Expr> out = new ArrayList<>();
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Expr node = stack.pop();
            out.add(node);
            List<Expr> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /**
     * List every sub-pattern of {@code root} in pre-order, {@code root} first.
     *
     * @param root The pattern.
     * @return The sub-patterns.
     */
    public static List<Pattern> preorder(@NotNull Pattern root) {
        List<Pattern> out = new ArrayList<>();
        Deque<Pattern> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Pattern node = stack.pop();
            out.add(node);
            List<Pattern> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /**
     * Check whether any node of {@code root}, including itself, satisfies {@code predicate}.
     *
     * @param root      The tree.
     * @param predicate The predicate.
     * @return Whether a node was found.
     */
    public static boolean anyMatch(@NotNull Expr root, @NotNull Predicate<Expr> predicate) {
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Expr node = stack.pop();
            if (predicate.test(node)) return true;
            for (Expr child : node.children()) {
                stack.push(child);
            }
        }
        return false;
    }
}
