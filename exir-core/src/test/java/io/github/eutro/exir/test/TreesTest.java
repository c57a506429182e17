package io.github.eutro.exir.test;

import io.github.eutro.exir.ext.ProvenanceExts;
import io.github.eutro.exir.ext.SourcePos;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.IR;
import io.github.eutro.exir.ir.Trees;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.exir.ir.IR.*;
import static org.junit.jupiter.api.Assertions.*;

public class TreesTest {
    @Test
    void testIdentityTransformSharesTree() {
        Expr tree = def("f", params("x"), block(
                assign("y", binary("+", var("x"), integer(1))),
                caseOf(var("y"), clause(ptuple(patom("ok"), pvar("z")), var("z")))));
        assertSame(tree, Trees.transform(tree, e -> e));
    }

    @Test
    void testTransformRebuildsOnlyChangedPath() {
        Expr.Tuple untouched = tuple(atom("a"), atom("b"));
        Expr tree = block(untouched, binary("+", var("x"), integer(1)));
        Expr result = Trees.transform(tree, e -> e instanceof Expr.Var ? var("renamed") : e);

        assertNotSame(tree, result);
        assertSame(untouched, ((Expr.Block) result).stmts.get(0));
        assertEquals(block(untouched, binary("+", var("renamed"), integer(1))), result);
    }

    @Test
    void testMetadataSurvivesRebuild() {
        SourcePos pos = new SourcePos("lib/a.ex", 3, 5);
        Expr call = remote("IO", "puts", var("x")).withExt(ProvenanceExts.POSITION, pos);
        Expr result = Trees.transform(block(call), e -> e instanceof Expr.Var ? var("y") : e);
        Expr rebuilt = ((Expr.Block) result).stmts.get(0);
        assertEquals(pos, rebuilt.getNullable(ProvenanceExts.POSITION));
        // metadata takes no part in equality
        assertEquals(remote("IO", "puts", var("y")), rebuilt);
    }

    @Test
    void testClauseBodiesAreChildren() {
        Expr tree = tryOf(var("body"),
                Collections.singletonList(clause(pvar("e"), var("rescued"))),
                Collections.singletonList(clause(Arrays.asList(patom("throw"), pvar("v")), var("guard"), var("caught"))),
                Collections.emptyList(),
                var("after"));
        List<Expr> children = tree.children();
        assertEquals(Arrays.asList(var("body"), var("rescued"), var("guard"), var("caught"), var("after")), children);
    }

    @Test
    void testWithChildrenChecksArity() {
        Expr tree = binary("+", var("x"), var("y"));
        assertThrows(IllegalArgumentException.class, () -> tree.withChildren(Collections.singletonList(var("x"))));
    }

    @Test
    void testDeepTreesDoNotOverflow() {
        Expr tree = integer(0);
        for (int i = 0; i < 200_000; i++) {
            tree = IR.unary("-", tree);
        }
        Expr result = Trees.transform(tree, e -> e instanceof Expr.Literal ? integer(1) : e);
        assertEquals(200_001, Trees.preorder(result).size());
        assertTrue(Trees.anyMatch(result, e -> e.equals(integer(1))));
        assertFalse(Trees.anyMatch(result, e -> e.equals(integer(0))));
    }
}
