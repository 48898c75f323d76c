package dumb.ckproof;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/**
 * Curried arrow type: either a ground sort, or a function from one input signature to an output
 * signature.
 */
public sealed interface TypeSignature permits TypeSignature.Ground, TypeSignature.Compound {

    static Ground ground(Ref.Type type) {
        return new Ground(type);
    }

    static TypeSignature function(TypeSignature output, TypeSignature... inputs) {
        return output.extend(List.of(inputs));
    }

    /** Number of {@code Compound} layers above the first {@code Ground}. */
    default int arity() {
        var n = 0;
        var s = this;
        while (s instanceof Compound c) {
            n++;
            s = c.output();
        }
        return n;
    }

    /**
     * Input signatures, outermost first. The iterator is lazy and can be walked only once.
     */
    default Iterator<TypeSignature> inputs() {
        return new Iterator<>() {
            private TypeSignature next = TypeSignature.this;

            @Override
            public boolean hasNext() {
                return next instanceof Compound;
            }

            @Override
            public TypeSignature next() {
                if (!(next instanceof Compound c)) throw new NoSuchElementException();
                next = c.output();
                return c.input();
            }
        };
    }

    /** Signature after supplying one input. Callers must already know this signature is compound. */
    default TypeSignature applied() {
        if (this instanceof Compound c) return c.output();
        throw new IllegalStateException("Cannot apply ground signature " + this);
    }

    /** Prepends {@code inputs} so that {@code inputs.get(0)} becomes the outermost input. */
    default TypeSignature extend(List<TypeSignature> inputs) {
        var s = this;
        for (var i = inputs.size() - 1; i >= 0; i--)
            s = new Compound(inputs.get(i), s);
        return s;
    }

    record Ground(Ref.Type type) implements TypeSignature {
        public Ground {
            requireNonNull(type);
        }

        @Override
        public String toString() {
            return "T" + type.index();
        }
    }

    record Compound(TypeSignature input, TypeSignature output) implements TypeSignature {
        public Compound {
            requireNonNull(input);
            requireNonNull(output);
        }

        @Override
        public String toString() {
            return (input instanceof Compound ? "(" + input + ")" : input.toString()) + " -> " + output;
        }
    }
}
