package io.github.eutro.exir.test;

import io.github.eutro.exir.ext.ProvenanceExts;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.ir.IRDisplay;
import io.github.eutro.exir.passes.IRPass;
import io.github.eutro.exir.passes.Passes;
import io.github.eutro.exir.passes.misc.ChainedPass;
import io.github.eutro.exir.passes.misc.ForPass;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.eutro.exir.ir.IR.*;
import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    private static Expr returningFinder() {
        // lowered from: for x <- list, do: if x == target, do: return {:ok, x}; IO.puts("missing"); :error
        return module("Finder", def("find", params("list", "target", "opts"), block(
                remote("Enum", "each", var("list"), lambda(params("x"),
                        ifThen(binary("==", var("x"), var("target")),
                                tuple(atom("ok"), var("x")).withExt(ProvenanceExts.EARLY_RETURN, true)))),
                caseOf(call("lookup", var("target")),
                        clause(ptuple(patom("found"), pvar("v")), var("hit")),
                        clause(wildcard(), atom("error"))))));
    }

    @Test
    void testDefaultPipeline() {
        Expr output = Passes.DEFAULT.run(returningFinder());
        Expr.Def find = (Expr.Def) ((Expr.Module) output).body.get(0);
        assertEquals(params("list", "target", "_opts"), find.params);

        Expr.Case dispatch = (Expr.Case) ((Expr.Block) find.body).stmts.get(0);
        Expr.Case lookup = (Expr.Case) dispatch.clauses.get(1).body;
        assertEquals(ptuple(patom("found"), pvar("hit")), lookup.clauses.get(0).pattern());

        Evaluator ev = new Evaluator(output);
        Evaluator.Tuple found = (Evaluator.Tuple) ev.call("find", Arrays.<Object>asList(1L, 2L), 2L, null);
        assertEquals(Arrays.<Object>asList(new Evaluator.Atom("ok"), 2L), found.elements);
    }

    @Test
    void testDefaultPipelineIsIdempotent() {
        Expr once = Passes.DEFAULT.run(returningFinder());
        assertSame(once, Passes.DEFAULT.run(once));
    }

    @Test
    void testChainFlattensInOrder() {
        List<String> log = new ArrayList<>();
        IRPass<Expr, Expr> a = e -> {
            log.add("a");
            return e;
        };
        IRPass<Expr, Expr> b = e -> {
            log.add("b");
            return e;
        };
        IRPass<Expr, Expr> c = e -> {
            log.add("c");
            return e;
        };
        IRPass<Expr, Expr> chain = a.then(b).then(c);
        assertEquals(Arrays.asList(a, b, c), ((ChainedPass<?, ?, ?>) chain).passes());
        chain.run(atom("ok"));
        assertEquals(Arrays.asList("a", "b", "c"), log);
    }

    @Test
    void testChainAddsContextToErrors() {
        IRPass<Expr, Expr> failing = e -> {
            throw new IllegalStateException("boom");
        };
        IRPass<Expr, Expr> chain = ((IRPass<Expr, Expr>) e -> e).then(failing);
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> chain.run(atom("ok")));
        assertEquals("running pass 1 of 2 in chain", ex.getSuppressed()[0].getMessage());
    }

    @Test
    void testLiftDefsVisitsEveryDefinition() {
        List<String> seen = new ArrayList<>();
        IRPass<Expr, Expr> lifted = ForPass.liftDefs(def -> {
            seen.add(def.name);
            return def.isPrivate ? def : def.withBody(atom("replaced"));
        });
        Expr input = module("M",
                def("a", params(), atom("ok")),
                defp("b", params(), atom("ok")));
        Expr.Module output = (Expr.Module) lifted.run(input);
        assertEquals(Arrays.asList("a", "b"), seen);
        assertEquals(atom("replaced"), ((Expr.Def) output.body.get(0)).body);
        assertSame(((Expr.Module) input).body.get(1), output.body.get(1));
    }

    @Test
    void testLiftedErrorsNameTheirDefinition() {
        IRPass<Expr, Expr> lifted = ForPass.liftDefs(def -> {
            if (def.name.equals("bad")) throw new IllegalArgumentException("cannot handle");
            return def;
        });
        Expr input = module("M", def("good", params(), atom("ok")), def("bad", params(), atom("ok")));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> lifted.run(input));
        assertEquals("in definition 1 (bad)", ex.getSuppressed()[0].getMessage());

        IRPass<Expr, Expr> nodes = ForPass.liftNodes(e -> {
            if (e instanceof Expr.Raw) throw new IllegalArgumentException("raw");
            return e;
        });
        IllegalArgumentException nodeEx = assertThrows(IllegalArgumentException.class,
                () -> nodes.run(block(raw("x"))));
        assertEquals("in RAW node", nodeEx.getSuppressed()[0].getMessage());
    }

    @Test
    void testDebugDisplayOnError() {
        IRPass<Expr, Expr> pass = IRDisplay.debugDisplayOnError("explode", e -> {
            throw new IllegalStateException("boom");
        });
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> pass.run(var("tree")));
        assertTrue(ex.getSuppressed()[0].getMessage().startsWith("in explode, running on:"));
        assertTrue(ex.getSuppressed()[0].getMessage().endsWith("tree"));
    }

    @Test
    void testDisplay() {
        Expr expr = def("f", params("x"), caseOf(var("x"),
                clause(ptuple(patom("ok"), pvar("v")), binary(">", var("v"), integer(0)), str("pos")),
                clause(wildcard(), nil())));
        assertEquals("def f(x) do\n" +
                "  case x do\n" +
                "    {:ok, v} when v > 0 ->\n" +
                "      \"pos\"\n" +
                "    _ ->\n" +
                "      nil\n" +
                "  end\n" +
                "end", IRDisplay.display(expr));
    }

    @Test
    void testDeepTreesDoNotOverflow() {
        Expr body = var("n");
        for (int i = 0; i < 100_000; i++) {
            body = unary("-", body);
        }
        Expr input = def("negate", params("n"), body);
        assertSame(input, Passes.DEFAULT.run(input));
    }
}
