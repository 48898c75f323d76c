package dumb.ckproof;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A term over the resolved index space. Symbol and definition refs point into the {@link Directory};
 * variable refs point into the local scope of whatever declaration owns the formula.
 */
public sealed interface Formula permits Formula.Sym, Formula.Var, Formula.App, Formula.Def {

    static Sym sym(int symbol) {
        return new Sym(new Ref.Symbol(symbol));
    }

    static Var var(int variable) {
        return new Var(new Ref.Variable(variable));
    }

    /** Curried application: {@code app(f, a, b)} is {@code App(App(f, a), b)}. */
    static Formula app(Formula function, Formula... arguments) {
        var f = function;
        for (var a : arguments) f = new App(f, a);
        return f;
    }

    static Def def(int definition, Formula... inputs) {
        return new Def(new Ref.Definition(definition), List.of(inputs));
    }

    /** Structural tree equality, walked with an explicit stack. */
    static boolean identical(Formula a, Formula b) {
        var stack = new ArrayDeque<Formula[]>();
        stack.push(new Formula[]{a, b});
        while (!stack.isEmpty()) {
            var pair = stack.pop();
            var x = pair[0];
            var y = pair[1];
            if (x == y) continue;
            if (x instanceof Sym sx) {
                if (!(y instanceof Sym sy) || !sx.symbol().equals(sy.symbol())) return false;
            } else if (x instanceof Var vx) {
                if (!(y instanceof Var vy) || !vx.variable().equals(vy.variable())) return false;
            } else if (x instanceof App ax) {
                if (!(y instanceof App ay)) return false;
                stack.push(new Formula[]{ax.function(), ay.function()});
                stack.push(new Formula[]{ax.argument(), ay.argument()});
            } else if (x instanceof Def dx) {
                if (!(y instanceof Def dy) || !dx.definition().equals(dy.definition()) || dx.inputs().size() != dy.inputs().size())
                    return false;
                for (var i = 0; i < dx.inputs().size(); i++)
                    stack.push(new Formula[]{dx.inputs().get(i), dy.inputs().get(i)});
            }
        }
        return true;
    }

    /** Equivalence modulo definition unfolding. */
    static boolean compatible(Formula a, Formula b, Directory dir) {
        return identical(a, b) || identical(a.expand(dir), b.expand(dir));
    }

    /**
     * Replaces every definition node by its expansion, all the way down. Terminates because definitions
     * only reference earlier definitions once the directory has been verified.
     */
    default Formula expand(Directory dir) {
        return this instanceof Sym || this instanceof Var ? this : Rewrite.expand(this, dir);
    }

    /** Replaces variable leaves found in {@code mapping}; everything else keeps its shape. */
    default Formula substitute(Map<Ref.Variable, Formula> mapping) {
        return Rewrite.substitute(this, mapping);
    }

    /**
     * Views this formula as a functor applied to its inputs: the spine of curried applications down
     * to a symbol, or a definition node. Empty for bare variables and applications of variables.
     */
    default Optional<Applied> application() {
        if (this instanceof Def d) return Optional.of(new Applied(d.definition(), d.inputs()));
        var inputs = new ArrayList<Formula>();
        var f = this;
        while (f instanceof App a) {
            inputs.add(a.argument());
            f = a.function();
        }
        if (!(f instanceof Sym s) || inputs.isEmpty()) return Optional.empty();
        Collections.reverse(inputs);
        return Optional.of(new Applied(s.symbol(), inputs));
    }

    /** A functor applied to exactly two inputs, read as a relation between them. */
    default Optional<Binary> binary() {
        return application().filter(a -> a.inputs().size() == 2)
                .map(a -> new Binary(a.functor(), a.inputs().get(0), a.inputs().get(1)));
    }

    record Sym(Ref.Symbol symbol) implements Formula {
        public Sym {
            requireNonNull(symbol);
        }

        @Override
        public String toString() {
            return "s" + symbol.index();
        }
    }

    record Var(Ref.Variable variable) implements Formula {
        public Var {
            requireNonNull(variable);
        }

        @Override
        public String toString() {
            return "?v" + variable.index();
        }
    }

    record App(Formula function, Formula argument) implements Formula {
        public App {
            requireNonNull(function);
            requireNonNull(argument);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Formula f && identical(this, f);
        }

        @Override
        public int hashCode() {
            return Rewrite.hash(this);
        }

        @Override
        public String toString() {
            return application()
                    .map(a -> a.inputs().stream().map(Formula::toString).collect(Collectors.joining(" ", "(s" + a.functor().index() + " ", ")")))
                    .orElseGet(() -> "(" + function + " " + argument + ")");
        }
    }

    record Def(Ref.Definition definition, List<Formula> inputs) implements Formula {
        public Def {
            requireNonNull(definition);
            inputs = List.copyOf(requireNonNull(inputs));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Formula f && identical(this, f);
        }

        @Override
        public int hashCode() {
            return Rewrite.hash(this);
        }

        @Override
        public String toString() {
            return inputs.stream().map(i -> " " + i).collect(Collectors.joining("", "(d" + definition.index(), ")"));
        }
    }

    record Applied(Ref.Functor functor, List<Formula> inputs) {
        public Applied {
            requireNonNull(functor);
            inputs = List.copyOf(inputs);
        }
    }

    record Binary(Ref.Functor relation, Formula left, Formula right) {
        public Binary {
            requireNonNull(relation);
            requireNonNull(left);
            requireNonNull(right);
        }

        /** Rebuilds {@code relation(left, right)} in the same shape the relation is written in. */
        public static Formula of(Ref.Functor relation, Formula left, Formula right) {
            if (relation instanceof Ref.Definition d) return new Def(d, List.of(left, right));
            return app(new Sym((Ref.Symbol) relation), left, right);
        }

        public Formula formula() {
            return of(relation, left, right);
        }

        public Formula reversed() {
            return of(relation, right, left);
        }
    }
}
