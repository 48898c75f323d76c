package dumb.ckproof;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/** Declarations of the language layer: systems, sorts, symbols, variables and definitions. */
public final class Lang {

    private Lang() {
    }

    public record Sys(String id) {
        public Sys {
            requireNonNull(id);
        }
    }

    public record Type(String id, Ref.Sys system) {
        public Type {
            requireNonNull(id);
            requireNonNull(system);
        }
    }

    public record Symbol(String id, Ref.Sys system, TypeSignature signature) {
        public Symbol {
            requireNonNull(id);
            requireNonNull(system);
            requireNonNull(signature);
        }
    }

    public record Variable(String id, TypeSignature signature) {
        public Variable {
            requireNonNull(id);
            requireNonNull(signature);
        }
    }

    /** Variables local to one definition, axiom or theorem; {@link Ref.Variable} indexes into it. */
    public record Scope(List<Variable> variables) {
        public static final Scope EMPTY = new Scope(List.of());

        public Scope {
            variables = List.copyOf(requireNonNull(variables));
        }

        public static Scope of(Variable... variables) {
            return new Scope(List.of(variables));
        }

        public Optional<Variable> variable(Ref.Variable ref) {
            var i = ref.index();
            return i >= 0 && i < variables.size() ? Optional.of(variables.get(i)) : Optional.empty();
        }

        public int size() {
            return variables.size();
        }
    }

    /**
     * A named abbreviation. Its formal inputs are the variables of its scope, in order, and its
     * expansion may mention no other variables.
     */
    public record Definition(String id, Ref.Sys system, Scope inputs, Formula expansion,
                             @Nullable TypeSignature declared) {
        public Definition {
            requireNonNull(id);
            requireNonNull(system);
            requireNonNull(inputs);
            requireNonNull(expansion);
        }

        public int arity() {
            return inputs.size();
        }

        /** The expansion with the supplied formulas put in place of the formal inputs. */
        public Formula instantiate(List<Formula> replacements) {
            if (replacements.size() != arity())
                throw new IllegalArgumentException("Definition " + id + " takes " + arity() + " inputs, got " + replacements.size());
            var mapping = new HashMap<Ref.Variable, Formula>();
            for (var i = 0; i < replacements.size(); i++)
                mapping.put(new Ref.Variable(i), replacements.get(i));
            return expansion.substitute(mapping);
        }
    }
}
