package io.github.eutro.exir.test;

import io.github.eutro.exir.ir.Clause;
import io.github.eutro.exir.ir.Expr;
import io.github.eutro.exir.passes.hygiene.BinderHygiene;
import io.github.eutro.exir.passes.hygiene.BinderRepair;
import io.github.eutro.exir.passes.hygiene.Scope;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import static io.github.eutro.exir.ir.IR.*;
import static org.junit.jupiter.api.Assertions.*;

public class HygieneTest {
    private static Expr.Def caseIn(Clause clause, String... params) {
        return def("f", params(params), caseOf(var("v"), clause));
    }

    private static Clause onlyClause(Expr def) {
        return ((Expr.Case) ((Expr.Def) def).body).clauses.get(0);
    }

    @Test
    void testTaggedBinderRenamed() {
        Expr.Def input = caseIn(clause(ptuple(patom("tag"), pvar("x")), var("y")), "v");
        Expr output = BinderHygiene.INSTANCE.run(input);
        Clause clause = onlyClause(output);
        assertEquals(ptuple(patom("tag"), pvar("y")), clause.pattern());
        assertSame(onlyClause(input).body, clause.body);
    }

    @Test
    void testAmbiguousCandidatesUnchanged() {
        Expr.Def input = caseIn(clause(ptuple(patom("tag"), pvar("x")), tuple(var("y"), var("z"))), "v");
        assertSame(input, BinderHygiene.INSTANCE.run(input));
    }

    @Test
    void testRepairIsIdempotent() {
        Expr.Def input = def("f", params("v"), block(
                caseOf(var("v"), clause(ptuple(patom("ok"), pvar("x")), remote("IO", "puts", var("msg")))),
                remote("Enum", "each", var("v"), lambda(params("item"), remote("IO", "puts", var("elem"))))));
        Expr once = BinderHygiene.INSTANCE.run(input);
        assertNotSame(input, once);
        assertSame(once, BinderHygiene.INSTANCE.run(once));
    }

    @Test
    void testSingleBinderFnClauseRenamed() {
        Expr input = def("f", params("list"),
                remote("Enum", "each", var("list"), lambda(params("item"), remote("IO", "puts", var("elem")))));
        Expr output = BinderHygiene.INSTANCE.run(input);
        Expr expected = def("f", params("list"),
                remote("Enum", "each", var("list"), lambda(params("elem"), remote("IO", "puts", var("elem")))));
        assertEquals(expected, output);

        Evaluator ev = new Evaluator(output);
        ev.call("f", Arrays.<Object>asList("a", "b"));
        assertEquals(Arrays.asList("a", "b"), ev.output);
    }

    @Test
    void testNestedPayloadRenamed() {
        Expr.Def input = caseIn(clause(ptuple(patom("event"), pvar("meta"), ptuple(patom("data"), pvar("x"))),
                tuple(var("meta"), var("payload"))), "v");
        Clause clause = onlyClause(BinderHygiene.INSTANCE.run(input));
        assertEquals(ptuple(patom("event"), pvar("meta"), ptuple(patom("data"), pvar("payload"))), clause.pattern());
    }

    @Test
    void testCandidateVisibleInScopeRejected() {
        Expr.Def input = caseIn(clause(ptuple(patom("tag"), pvar("x")), var("y")), "v", "y");
        assertSame(input, BinderHygiene.INSTANCE.run(input));
    }

    @Test
    void testCandidateBoundEarlierInBlockRejected() {
        Expr input = def("f", params("v"), block(
                assign("y", integer(1)),
                caseOf(var("v"), clause(ptuple(patom("tag"), pvar("x")), var("y")))));
        assertSame(input, BinderHygiene.INSTANCE.run(input));
    }

    @Test
    void testReferencedBinderAliased() {
        Expr.Def input = caseIn(clause(ptuple(patom("tag"), pvar("x")), tuple(var("x"), var("y"))), "v");
        Expr output = BinderHygiene.INSTANCE.run(input);
        Clause clause = onlyClause(output);
        assertEquals(ptuple(patom("tag"), pvar("x")), clause.pattern());
        assertEquals(block(assign("y", var("x")), tuple(var("x"), var("y"))), clause.body);

        Evaluator.Tuple value = (Evaluator.Tuple) new Evaluator(output)
                .call("f", new Evaluator.Tuple(Arrays.<Object>asList(new Evaluator.Atom("tag"), 5L)));
        assertEquals(Arrays.<Object>asList(5L, 5L), value.elements);
    }

    @Test
    void testRepeatedBinderAliased() {
        Clause clause = clause(ptuple(pvar("x"), pvar("x")), var("y"));
        Clause repaired = BinderRepair.repair(clause, "x", Scope.EMPTY);
        assertEquals(ptuple(pvar("x"), pvar("x")), repaired.pattern());
        assertEquals(block(assign("y", var("x")), var("y")), repaired.body);
    }

    @Test
    void testGuardUsingCandidateRefusesAlias() {
        Clause clause = clause(ptuple(patom("tag"), pvar("x")),
                binary(">", var("y"), integer(0)),
                tuple(var("x"), var("y")));
        assertSame(clause, BinderRepair.repair(clause, "x", Scope.EMPTY));
    }

    @Test
    void testAccessorBasesAndLocalsAreNotCandidates() {
        Clause clause = clause(ptuple(patom("ok"), pvar("x")), block(
                assign("tmp", remote("Map", "get", var("opts"), atom("key"))),
                tuple(var("tmp"), var("wanted"))));
        assertEquals(new LinkedHashSet<>(Collections.singletonList("wanted")), BinderRepair.candidates(clause));
        assertEquals(ptuple(patom("ok"), pvar("wanted")),
                BinderRepair.repair(clause, "x", Scope.EMPTY).pattern());
    }

    @Test
    void testOuterClauseRepairedFirst() {
        // once the outer binder becomes y, the inner clause sees y in scope and is left alone
        Expr.Def input = caseIn(clause(ptuple(patom("ok"), pvar("x")),
                caseOf(var("y"), clause(ptuple(patom("err"), pvar("e")), var("y")))), "v");
        Expr output = BinderHygiene.INSTANCE.run(input);
        Clause outer = onlyClause(output);
        assertEquals(ptuple(patom("ok"), pvar("y")), outer.pattern());
        assertEquals(ptuple(patom("err"), pvar("e")), ((Expr.Case) outer.body).clauses.get(0).pattern());
    }

    @Test
    void testTryClausesRepaired() {
        Expr input = def("f", params(), tryOf(remote("Worker", "run"),
                Collections.emptyList(),
                Collections.singletonList(clause(ptuple(patom("exit"), pvar("r")), var("reason"))),
                Collections.emptyList(),
                null));
        Expr.Try output = (Expr.Try) ((Expr.Def) BinderHygiene.INSTANCE.run(input)).body;
        assertEquals(ptuple(patom("exit"), pvar("reason")), output.catches.get(0).pattern());
    }

    @Test
    void testClauseWithRawCodeUnchanged() {
        Expr.Def input = caseIn(clause(ptuple(patom("ok"), pvar("x")),
                block(raw("IO.inspect(x)"), var("y"))), "v");
        assertSame(input, BinderHygiene.INSTANCE.run(input));
    }
}
