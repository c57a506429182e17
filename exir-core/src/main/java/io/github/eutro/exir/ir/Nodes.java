package io.github.eutro.exir.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class Nodes {
    private Nodes() {
    }

    static <T> List<T> copy(List<? extends T> list) {
        if (list.isEmpty()) return Collections.emptyList();
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    static boolean sameRefs(List<?> lhs, List<?> rhs) {
        if (lhs == rhs) return true;
        if (lhs.size() != rhs.size()) return false;
        for (int i = 0; i < lhs.size(); i++) {
            if (lhs.get(i) != rhs.get(i)) return false;
        }
        return true;
    }

    static void checkArity(List<?> children, int expected, Object node) {
        if (children.size() != expected) {
            throw new IllegalArgumentException("expected " + expected + " children for "
                    + node.getClass().getSimpleName() + ", got " + children.size());
        }
    }
}
