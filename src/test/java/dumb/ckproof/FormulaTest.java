package dumb.ckproof;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static dumb.ckproof.Formula.*;
import static org.junit.jupiter.api.Assertions.*;

class FormulaTest {

    /** twice(x) = f x x, twiceG(y) = twice(g y), cst = c */
    private static final Directory dir = AbstractTest.document("""
            (system t)
            (type t N)
            (symbol t f (-> N N N))
            (symbol t g (-> N N))
            (symbol t h (-> N N N))
            (symbol t c N)
            (define t twice ((?x N)) (f ?x ?x))
            (define t twiceG ((?y N)) (twice (g ?y)))
            (define t cst () c)
            """);

    @Test
    void identicalIsStructural() {
        assertTrue(identical(app(sym(0), var(0), sym(3)), app(sym(0), var(0), sym(3))));
        assertFalse(identical(app(sym(0), var(0), sym(3)), app(sym(0), sym(3), var(0))));
        assertFalse(identical(def(2), sym(3)));
        assertFalse(identical(var(0), var(1)));
    }

    @Test
    void expandUnfoldsNestedDefinitions() {
        var expanded = def(1, sym(3)).expand(dir);
        var gc = app(sym(1), sym(3));
        assertTrue(identical(app(sym(0), gc, gc), expanded), expanded::toString);
        assertTrue(identical(sym(3), def(2).expand(dir)));
    }

    @Test
    void compatibleModuloDefinitions() {
        var a = def(1, var(0));
        var b = def(0, app(sym(1), var(0)));
        var c = app(sym(0), app(sym(1), var(0)), app(sym(1), var(0)));
        for (var x : List.of(a, b, c)) {
            assertTrue(compatible(x, x, dir));
            for (var y : List.of(a, b, c)) {
                assertTrue(compatible(x, y, dir));
                assertEquals(compatible(x, y, dir), compatible(y, x, dir));
            }
        }
        assertFalse(compatible(a, app(sym(0), var(0), var(0)), dir));
        assertFalse(compatible(def(2), app(sym(1), sym(3)), dir));
    }

    @Test
    void substituteReplacesOnlyMappedVariables() {
        var f = app(sym(0), var(0), def(0, var(1)));
        var g = f.substitute(Map.of(new Ref.Variable(1), sym(3)));
        assertTrue(identical(app(sym(0), var(0), def(0, sym(3))), g));
        assertSame(f, f.substitute(Map.of()));
    }

    /** {@code g(g(...g(leaf)))}, {@code depth} applications deep. */
    static Formula nested(Formula leaf, int depth) {
        var f = leaf;
        for (var i = 0; i < depth; i++) f = app(sym(1), f);
        return f;
    }

    @Test
    void deepFormulasStayOffTheCallStack() {
        var depth = 200_000;
        var c = nested(sym(3), depth);
        var v = nested(var(0), depth);

        assertFalse(identical(c, v));
        assertFalse(compatible(c, v, dir));
        assertTrue(compatible(nested(def(2), depth), c, dir));
        assertTrue(identical(c, nested(def(2), depth).expand(dir)));

        var substituted = v.substitute(Map.of(new Ref.Variable(0), sym(3)));
        assertTrue(identical(c, substituted));
        assertTrue(c.equals(substituted));
        assertEquals(c.hashCode(), substituted.hashCode());
        assertFalse(c.equals(v));
    }

    @Test
    void applicationView() {
        var a = app(sym(0), var(0), sym(3)).application().orElseThrow();
        assertEquals(new Ref.Symbol(0), a.functor());
        assertEquals(List.of(var(0), sym(3)), a.inputs());

        assertTrue(def(0, var(0)).application().isPresent());
        assertTrue(sym(3).application().isEmpty());
        assertTrue(app(var(0), sym(3)).application().isEmpty());
    }

    @Test
    void binaryView() {
        var b = app(sym(0), var(0), sym(3)).binary().orElseThrow();
        assertEquals(new Ref.Symbol(0), b.relation());
        assertTrue(identical(app(sym(0), sym(3), var(0)), b.reversed()));
        assertTrue(identical(app(sym(0), var(0), sym(3)), b.formula()));
        assertTrue(app(sym(1), var(0)).binary().isEmpty());

        var d = Binary.of(new Ref.Definition(4), var(0), var(1));
        assertEquals(new Def(new Ref.Definition(4), List.of(var(0), var(1))), d);
    }
}
