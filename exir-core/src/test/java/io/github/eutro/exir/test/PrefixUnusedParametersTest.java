package io.github.eutro.exir.test;

import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.passes.Passes;
import io.github.eutro.exir.passes.misc.ForPass;
import io.github.eutro.exir.passes.misc.PrefixUnusedParameters;
import io.github.eutro.exir.passes.meta.UsageQuery;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.github.eutro.exir.ir.IR.*;
import static org.junit.jupiter.api.Assertions.*;

public class PrefixUnusedParametersTest {
    @Test
    void testUnusedParameterPrefixed() {
        Expr input = def("handle", params("conn", "opts"), var("conn"));
        assertEquals(def("handle", params("conn", "_opts"), var("conn")), Passes.PERIPHERAL.run(input));
    }

    @Test
    void testUsedAndIgnoredParametersKept() {
        Expr input = def("handle", params("_conn", "opts", "_"), remote("Keyword", "get", var("opts"), atom("k")));
        assertSame(input, Passes.PERIPHERAL.run(input));
    }

    @Test
    void testGuardCountsAsUse() {
        Expr.Def plain = def("positive?", params("n"), bool(true));
        Expr input = new Expr.Def(plain.meta(), false, plain.name, plain.params,
                binary(">", var("n"), integer(0)), plain.body);
        assertSame(input, Passes.PERIPHERAL.run(input));
    }

    @Test
    void testRepeatedOrCollidingBindersKept() {
        Expr repeated = def("same", Arrays.asList(pvar("x"), pvar("x")), atom("ok"));
        assertSame(repeated, Passes.PERIPHERAL.run(repeated));

        Expr colliding = def("f", params("x", "_x"), atom("ok"));
        assertSame(colliding, Passes.PERIPHERAL.run(colliding));
    }

    @Test
    void testNestedPatternBinderPrefixed() {
        Expr input = lambda(Arrays.asList(ptuple(patom("ok"), pvar("value")), pvar("state")), var("state"));
        Expr expected = lambda(Arrays.asList(ptuple(patom("ok"), pvar("_value")), pvar("state")), var("state"));
        assertEquals(expected, Passes.PERIPHERAL.run(input));
    }

    @Test
    void testInnerFunctionUseCounts() {
        Expr input = def("f", params("list", "step"),
                remote("Enum", "map", var("list"), lambda(params("x"), call("step", var("x")))));
        Expr output = ForPass.liftNodes(PrefixUnusedParameters.INSTANCE).run(input);
        assertEquals(def("f", params("list", "_step"),
                remote("Enum", "map", var("list"), lambda(params("x"), call("step", var("x"))))), output);

        Expr captured = def("f", params("list", "k"),
                remote("Enum", "map", var("list"), lambda(params("x"), tuple(var("k"), var("x")))));
        assertSame(captured, Passes.PERIPHERAL.run(captured));
    }

    @Test
    void testCustomUsageQuery() {
        Expr input = def("f", params("a", "b"), atom("ok"));
        PrefixUnusedParameters onlyB = new PrefixUnusedParameters((scope, name) -> !name.equals("b"));
        assertEquals(def("f", params("a", "_b"), atom("ok")), onlyB.run(input));
    }

    @Test
    void testRawCodeCountsAsUse() {
        Expr input = def("f", params("x"), raw("IO.inspect(x)"));
        assertSame(input, Passes.PERIPHERAL.run(input));

        Expr partial = def("f", params("x", "opts"), raw("IO.inspect(x, label: \"x\")"));
        assertEquals(def("f", params("x", "_opts"), raw("IO.inspect(x, label: \"x\")")),
                Passes.PERIPHERAL.run(partial));

        assertTrue(UsageQuery.FREE_VARS.isUsed(raw("Enum.sum(xs)"), "xs"));
        assertFalse(UsageQuery.FREE_VARS.isUsed(raw("Enum.sum(xs_total)"), "xs"));
    }
}
