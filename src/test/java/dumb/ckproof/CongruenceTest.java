package dumb.ckproof;

import dumb.ckproof.Congruence.MiddleSearch;
import dumb.ckproof.Deduction.ByAxiom;
import dumb.ckproof.Deduction.Step;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dumb.ckproof.Formula.*;
import static org.junit.jupiter.api.Assertions.*;

class CongruenceTest {
    private static final Formula zero = sym(1), one = sym(2), two = sym(3);
    private static final ByAxiom REFL = new ByAxiom(new Ref.Axiom(0)), SYM = new ByAxiom(new Ref.Axiom(1)),
            TRANS = new ByAxiom(new Ref.Axiom(2)), S_CONG = new ByAxiom(new Ref.Axiom(3)),
            PLUS_CONG = new ByAxiom(new Ref.Axiom(4));

    private static PropertyList.Registry registry;

    @BeforeAll
    static void verify() {
        var diagnostics = new Diagnostics();
        registry = new Verifier(AbstractTest.document(AbstractTest.EQUALITY), diagnostics).verify();
        assertFalse(diagnostics.errorFound());
    }

    private static Formula eq(Formula l, Formula r) {
        return app(sym(0), l, r);
    }

    private static Formula s(Formula x) {
        return app(sym(4), x);
    }

    private static Formula plus(Formula x, Formula y) {
        return app(sym(5), x, y);
    }

    @Test
    void reflexivityIsOneStep() {
        for (var t : List.of(zero, var(0), s(s(one)), plus(s(var(1)), def(7, zero)))) {
            var r = Congruence.byFunctionApplication(eq(t, t), List.of(), registry);
            assertTrue(r.ok(), () -> String.valueOf(r.problem()));
            assertEquals(List.of(new Step(REFL, eq(t, t))), r.steps());
        }
    }

    @Test
    void symmetryOfKnownFact() {
        var x = var(0);
        var y = var(1);
        var r = Congruence.byFunctionApplication(eq(y, x), List.of(eq(x, y)), registry);
        assertEquals(List.of(new Step(SYM, eq(y, x))), r.steps());
    }

    @Test
    void knownFactNeedsNoStep() {
        var r = Congruence.byFunctionApplication(eq(one, zero), List.of(eq(one, zero)), registry);
        assertTrue(r.ok());
        assertTrue(r.steps().isEmpty());
    }

    @Test
    void inputsSettledBeforeTheirApplication() {
        var goal = eq(s(plus(zero, zero)), s(plus(one, zero)));
        var r = Congruence.byFunctionApplication(goal, List.of(eq(one, zero)), registry);
        assertEquals(List.of(
                new Step(SYM, eq(zero, one)),
                new Step(REFL, eq(zero, zero)),
                new Step(PLUS_CONG, eq(plus(zero, zero), plus(one, zero))),
                new Step(S_CONG, goal)), r.steps());
    }

    @Test
    void failuresCarryTheirKind() {
        assertEquals(Diagnostic.Kind.CONGRUENCE_ARITY_MISMATCH,
                Congruence.byFunctionApplication(eq(plus(zero, one), app(sym(5), zero)), List.of(), registry).problem().kind());
        var unregistered = Congruence.byFunctionApplication(eq(app(sym(6), zero, zero), app(sym(6), one, zero)), List.of(), registry);
        assertEquals(Diagnostic.Kind.CONGRUENCE_UNREGISTERED, unregistered.problem().kind());
        assertEquals(new Ref.Symbol(6), unregistered.problem().culprit());
        assertTrue(unregistered.steps().isEmpty());
    }

    @Test
    void substitutionJoinsWithTransitivity() {
        var earlier = List.of(eq(one, zero), eq(one, two));

        var first = Congruence.bySubstitution(eq(one, one), earlier, registry, MiddleSearch.EARLIEST_FIRST);
        assertEquals(List.of(
                new Step(REFL, eq(one, one)),
                new Step(SYM, eq(zero, one)),
                new Step(TRANS, eq(one, zero)),
                new Step(TRANS, eq(one, one))), first.steps());

        var last = Congruence.bySubstitution(eq(one, one), earlier, registry, MiddleSearch.LATEST_FIRST);
        assertEquals(new Step(SYM, eq(two, one)), last.steps().get(1));
        assertEquals(new Step(TRANS, eq(one, one)), last.steps().get(3));
    }

    @Test
    void substitutionOfKnownFactNeedsNoStep() {
        var r = Congruence.bySubstitution(eq(one, zero), List.of(eq(one, zero)), registry, MiddleSearch.EARLIEST_FIRST);
        assertTrue(r.ok());
        assertTrue(r.steps().isEmpty());
    }
}
