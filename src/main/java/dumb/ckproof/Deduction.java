package dumb.ckproof;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Axioms, theorems and the proofs that justify theorems. */
public final class Deduction {

    private Deduction() {
    }

    /** Algebraic role an author claims for the relation asserted by an axiom or theorem. */
    public enum Flag {REFLEXIVE, SYMMETRIC, TRANSITIVE, FUNCTION}

    /** A universally quantified implication from premises to one assertion. */
    public sealed interface Deductable permits Axiom, Theorem {
        String id();

        Ref.Sys system();

        Lang.Scope scope();

        List<Formula> premises();

        Formula assertion();

        List<Flag> flags();
    }

    public record Axiom(String id, Ref.Sys system, Lang.Scope scope, List<Formula> premises, Formula assertion,
                        List<Flag> flags) implements Deductable {
        public Axiom {
            requireNonNull(id);
            requireNonNull(system);
            requireNonNull(scope);
            premises = List.copyOf(requireNonNull(premises));
            requireNonNull(assertion);
            flags = List.copyOf(requireNonNull(flags));
        }
    }

    public record Theorem(String id, Ref.Sys system, Lang.Scope scope, List<Formula> premises, Formula assertion,
                          List<Flag> flags) implements Deductable {
        public Theorem {
            requireNonNull(id);
            requireNonNull(system);
            requireNonNull(scope);
            premises = List.copyOf(requireNonNull(premises));
            requireNonNull(assertion);
            flags = List.copyOf(requireNonNull(flags));
        }
    }

    /** Why a proof step holds. The last two are shorthands expanded into elementary steps. */
    public sealed interface Justification permits ByAxiom, ByTheorem, ByHypothesis, ByDefinition,
            ByFunctionApplication, BySubstitution {

        static Justification by(Ref.Deductable deductable) {
            return deductable instanceof Ref.Axiom a ? new ByAxiom(a) : new ByTheorem((Ref.Theorem) deductable);
        }

        default boolean isMacro() {
            return this instanceof ByFunctionApplication || this instanceof BySubstitution;
        }
    }

    public record ByAxiom(Ref.Axiom axiom) implements Justification {
        public ByAxiom {
            requireNonNull(axiom);
        }
    }

    public record ByTheorem(Ref.Theorem theorem) implements Justification {
        public ByTheorem {
            requireNonNull(theorem);
        }
    }

    /** Premise of the theorem being proven, 1-indexed. */
    public record ByHypothesis(int index) implements Justification {
    }

    public record ByDefinition() implements Justification {
    }

    public record ByFunctionApplication() implements Justification {
    }

    public record BySubstitution() implements Justification {
    }

    public record Step(Justification justification, Formula formula) {
        public Step {
            requireNonNull(justification);
            requireNonNull(formula);
        }
    }

    public record Proof(Ref.Theorem theorem, List<Step> steps) {
        public Proof {
            requireNonNull(theorem);
            steps = List.copyOf(requireNonNull(steps));
        }
    }
}
