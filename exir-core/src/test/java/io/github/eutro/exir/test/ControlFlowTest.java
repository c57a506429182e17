package io.github.eutro.exir.test;

import io.github.eutro.exir.ext.ProvenanceExts;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.Trees;
import io.github.eutro.exir.passes.flow.ControlFlowNormalizer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.exir.ir.IR.*;
import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowTest {
    private static Expr earlyReturn(Expr value) {
        return value.withExt(ProvenanceExts.EARLY_RETURN, true);
    }

    // Enum.each(list, fn x -> if x == target do <value> end end)
    private static Expr findLoop(Expr value) {
        return remote("Enum", "each", var("list"), lambda(params("x"),
                ifThen(binary("==", var("x"), var("target")), value)));
    }

    private static Expr.Module finder(Expr loop) {
        return module("Finder", def("find", params("list", "target"), block(
                loop,
                remote("IO", "puts", str("final result")),
                nil())));
    }

    private static List<Object> longs(long... values) {
        Object[] boxed = new Object[values.length];
        for (int i = 0; i < values.length; i++) boxed[i] = values[i];
        return Arrays.asList(boxed);
    }

    @Test
    void testEarlyReturnStopsFunction() {
        Expr.Module input = finder(findLoop(earlyReturn(var("x"))));

        Evaluator before = new Evaluator(input);
        assertNull(before.call("find", longs(1, 2, 3, 4), 3L));
        assertEquals(Collections.singletonList("final result"), before.output);

        Expr output = ControlFlowNormalizer.INSTANCE.run(input);
        Evaluator after = new Evaluator(output);
        assertEquals(3L, after.call("find", longs(1, 2, 3, 4), 3L));
        assertEquals(Collections.emptyList(), after.output);
        assertTrue(Trees.anyMatch(output, e -> e.isFlagged(ProvenanceExts.NORMALIZED_FOLD)));
        assertFalse(Trees.anyMatch(output, e -> e instanceof Expr.Call && ((Expr.Call) e).isRemote("Enum", "each", 2)));
    }

    @Test
    void testNoMatchFallsThroughOnce() {
        Expr output = ControlFlowNormalizer.INSTANCE.run(finder(findLoop(earlyReturn(var("x")))));
        Evaluator ev = new Evaluator(output);
        assertNull(ev.call("find", longs(1, 2, 4), 3L));
        assertEquals(Collections.singletonList("final result"), ev.output);
    }

    @Test
    void testReturnBlockKeepsLeadingStatements() {
        Expr value = earlyReturn(block(
                remote("IO", "puts", str("found")),
                binary("*", var("x"), integer(10))));
        Expr output = ControlFlowNormalizer.INSTANCE.run(finder(findLoop(value)));
        Evaluator ev = new Evaluator(output);
        assertEquals(30L, ev.call("find", longs(1, 3, 3), 3L));
        assertEquals(Collections.singletonList("found"), ev.output);
    }

    @Test
    void testWrapperBlockSpliced() {
        Expr wrapped = block(
                remote("IO", "puts", str("searching")),
                findLoop(earlyReturn(var("x"))));
        Expr output = ControlFlowNormalizer.INSTANCE.run(finder(wrapped));

        Expr.Def def = (Expr.Def) ((Expr.Module) output).body.get(0);
        List<Expr> stmts = ((Expr.Block) def.body).stmts;
        assertEquals(2, stmts.size());
        assertEquals(remote("IO", "puts", str("searching")), stmts.get(0));
        assertTrue(stmts.get(1) instanceof Expr.Case);

        Evaluator ev = new Evaluator(output);
        assertEquals(2L, ev.call("find", longs(2), 2L));
        assertEquals(Collections.singletonList("searching"), ev.output);
    }

    @Test
    void testSecondLoopInRemainderNormalized() {
        Expr second = remote("Enum", "each", var("list"), lambda(params("y"),
                ifThen(binary(">", var("y"), var("target")), earlyReturn(atom("bigger")))));
        Expr input = def("find", params("list", "target"), block(
                findLoop(earlyReturn(var("x"))),
                second,
                remote("IO", "puts", str("final result")),
                atom("none")));
        Expr output = ControlFlowNormalizer.INSTANCE.run(input);

        Evaluator ev = new Evaluator(output);
        assertEquals(new Evaluator.Atom("bigger"), ev.call("find", longs(1, 5), 3L));
        assertEquals(new Evaluator.Atom("none"), ev.call("find", longs(1, 2), 3L));
        assertEquals(Collections.singletonList("final result"), ev.output);
    }

    @Test
    void testCallFlagDetectsReturn() {
        Expr loop = findLoop(var("x")).withExt(ProvenanceExts.LOOP_HAS_RETURN, true);
        Expr output = ControlFlowNormalizer.INSTANCE.run(finder(loop));
        assertEquals(3L, new Evaluator(output).call("find", longs(3), 3L));
    }

    @Test
    void testConsequentFlagIsAuthoritative() {
        Expr loop = findLoop(var("x").withExt(ProvenanceExts.EARLY_RETURN, false))
                .withExt(ProvenanceExts.LOOP_HAS_RETURN, true);
        Expr.Module input = finder(loop);
        assertSame(input, ControlFlowNormalizer.INSTANCE.run(input));
    }

    @Test
    void testUnflaggedLoopUnchanged() {
        Expr.Module input = finder(findLoop(remote("IO", "puts", var("x"))));
        assertSame(input, ControlFlowNormalizer.INSTANCE.run(input));
    }

    @Test
    void testNonEmptyElseUnchanged() {
        Expr loop = remote("Enum", "each", var("list"), lambda(params("x"),
                ifElse(binary("==", var("x"), var("target")), earlyReturn(var("x")), remote("IO", "puts", var("x")))));
        Expr.Module input = finder(loop);
        assertSame(input, ControlFlowNormalizer.INSTANCE.run(input));
    }

    @Test
    void testFreshNamesAvoidCollisions() {
        Expr input = def("find", params("list", "target", "acc"), block(
                findLoop(earlyReturn(var("acc"))),
                var("result")));
        Expr output = ControlFlowNormalizer.INSTANCE.run(input);
        Expr.Case dispatch = (Expr.Case) ((Expr.Block) ((Expr.Def) output).body).stmts.get(0);
        Expr.Fn step = (Expr.Fn) ((Expr.Call) dispatch.subject).args.get(2);
        assertNotEquals(pvar("acc"), step.clauses.get(0).patterns.get(1));
        assertNotEquals(ptuple(patom(ControlFlowNormalizer.RETURN), pvar("result")), dispatch.clauses.get(0).pattern());
    }

    @Test
    void testNormalizingTwiceIsNoOp() {
        Expr once = ControlFlowNormalizer.INSTANCE.run(finder(findLoop(earlyReturn(var("x")))));
        assertSame(once, ControlFlowNormalizer.INSTANCE.run(once));
    }
}
