package dumb.ckproof;

import dumb.ckproof.Deduction.Deductable;
import dumb.ckproof.Deduction.Flag;
import dumb.ckproof.Diagnostic.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static dumb.ckproof.Diagnostic.Kind.*;

/**
 * Checks that an axiom or theorem has the shape its flags claim and, if so, records it in the
 * property list of the relation (or function) involved.
 */
public enum Flags {
    ;

    private static final Logger logger = LoggerFactory.getLogger(Flags.class);

    /** Position of every flag that repeats an earlier one in the same list. */
    public static List<Integer> duplicates(Deductable d) {
        var seen = EnumSet.noneOf(Flag.class);
        var dups = new ArrayList<Integer>();
        var flags = d.flags();
        for (var i = 0; i < flags.size(); i++)
            if (!seen.add(flags.get(i))) dups.add(i);
        return dups;
    }

    public static Optional<Problem> verify(Flag flag, Ref.Deductable ref, Deductable d, PropertyList.Registry registry) {
        return switch (flag) {
            case REFLEXIVE -> reflexivity(ref, d, registry);
            case SYMMETRIC -> symmetry(ref, d, registry);
            case TRANSITIVE -> transitivity(ref, d, registry);
            case FUNCTION -> function(ref, d, registry);
        };
    }

    /** {@code R(x, y)} where both sides are bare variables. */
    private static Optional<Formula.Binary> simpleBinary(Formula f) {
        return f.binary().filter(b -> b.left() instanceof Formula.Var && b.right() instanceof Formula.Var);
    }

    private static Optional<Problem> fail(Diagnostic.Kind kind) {
        return Optional.of(Problem.of(kind));
    }

    private static Optional<Problem> reflexivity(Ref.Deductable ref, Deductable d, PropertyList.Registry registry) {
        if (!d.premises().isEmpty()) return fail(REFLEXIVITY_PREMISE_NOT_EMPTY);
        var assertion = simpleBinary(d.assertion());
        if (assertion.isEmpty()) return fail(REFLEXIVITY_ASSERTION_NOT_BINARY);
        var a = assertion.get();
        if (!a.left().equals(a.right())) return fail(REFLEXIVITY_ARGUMENT_MISMATCH);

        var list = registry.edit(a.relation());
        if (!list.setReflexive(ref))
            return Optional.of(new Problem(REFLEXIVITY_ALREADY_REGISTERED, list.reflexive().orElse(null)));
        logger.debug("{} registered as reflexivity of {}", ref, a.relation());
        return Optional.empty();
    }

    private static Optional<Problem> symmetry(Ref.Deductable ref, Deductable d, PropertyList.Registry registry) {
        var premises = d.premises();
        if (premises.size() != 1) return fail(SYMMETRY_PREMISE_WRONG_LENGTH);
        var premise = simpleBinary(premises.get(0));
        if (premise.isEmpty()) return fail(SYMMETRY_PREMISE_NOT_BINARY);
        var assertion = simpleBinary(d.assertion());
        if (assertion.isEmpty()) return fail(SYMMETRY_ASSERTION_NOT_BINARY);
        var p = premise.get();
        var a = assertion.get();
        if (!p.relation().equals(a.relation())) return fail(SYMMETRY_RELATION_MISMATCH);
        if (!p.left().equals(a.right()) || !p.right().equals(a.left())) return fail(SYMMETRY_ARGUMENT_MISMATCH);

        var list = registry.edit(a.relation());
        if (!list.setSymmetric(ref))
            return Optional.of(new Problem(SYMMETRY_ALREADY_REGISTERED, list.symmetric().orElse(null)));
        logger.debug("{} registered as symmetry of {}", ref, a.relation());
        return Optional.empty();
    }

    private static Optional<Problem> transitivity(Ref.Deductable ref, Deductable d, PropertyList.Registry registry) {
        var premises = d.premises();
        if (premises.size() != 2) return fail(TRANSITIVITY_PREMISE_WRONG_LENGTH);
        var first = simpleBinary(premises.get(0));
        if (first.isEmpty()) return fail(TRANSITIVITY_FIRST_PREMISE_NOT_BINARY);
        var second = simpleBinary(premises.get(1));
        if (second.isEmpty()) return fail(TRANSITIVITY_SECOND_PREMISE_NOT_BINARY);
        var p = first.get();
        var q = second.get();
        if (!p.relation().equals(q.relation())) return fail(TRANSITIVITY_PREMISE_RELATION_MISMATCH);
        if (!p.right().equals(q.left())) return fail(TRANSITIVITY_PREMISE_ARGUMENT_MISMATCH);
        var assertion = simpleBinary(d.assertion());
        if (assertion.isEmpty()) return fail(TRANSITIVITY_ASSERTION_NOT_BINARY);
        var a = assertion.get();
        if (!a.relation().equals(p.relation())) return fail(TRANSITIVITY_ASSERTION_RELATION_MISMATCH);
        if (!a.left().equals(p.left())) return fail(TRANSITIVITY_ASSERTION_LEFT_MISMATCH);
        if (!a.right().equals(q.right())) return fail(TRANSITIVITY_ASSERTION_RIGHT_MISMATCH);

        var list = registry.edit(a.relation());
        if (!list.setTransitive(ref))
            return Optional.of(new Problem(TRANSITIVITY_ALREADY_REGISTERED, list.transitive().orElse(null)));
        logger.debug("{} registered as transitivity of {}", ref, a.relation());
        return Optional.empty();
    }

    /**
     * {@code R(a1, b1), ..., R(an, bn)} implies {@code R(f(a1..an), f(b1..bn))}, for a relation R
     * already known to be a preorder.
     */
    private static Optional<Problem> function(Ref.Deductable ref, Deductable d, PropertyList.Registry registry) {
        var premises = d.premises();
        if (premises.isEmpty()) return fail(FUNCTION_PREMISE_EMPTY);
        var assertion = d.assertion().binary();
        if (assertion.isEmpty()) return fail(FUNCTION_ASSERTION_NOT_BINARY);
        var relation = assertion.get().relation();
        if (!registry.isPreorder(relation)) return Optional.of(new Problem(FUNCTION_RELATION_NOT_PREORDER, relation));

        var left = assertion.get().left().application();
        if (left.isEmpty()) return fail(FUNCTION_ASSERTION_LEFT_NOT_APPLICATION);
        var right = assertion.get().right().application();
        if (right.isEmpty()) return fail(FUNCTION_ASSERTION_RIGHT_NOT_APPLICATION);
        var l = left.get();
        var r = right.get();
        if (!l.functor().equals(r.functor())) return fail(FUNCTION_ASSERTION_FUNCTOR_MISMATCH);
        if (l.inputs().size() != r.inputs().size()) return fail(FUNCTION_ASSERTION_ARITY_MISMATCH);
        if (premises.size() != l.inputs().size()) return fail(FUNCTION_PREMISE_ARITY_MISMATCH);

        for (var i = 0; i < premises.size(); i++) {
            var leftInput = l.inputs().get(i);
            var rightInput = r.inputs().get(i);
            if (!(leftInput instanceof Formula.Var) || !(rightInput instanceof Formula.Var))
                return fail(FUNCTION_ASSERTION_INPUT_NOT_VARIABLE);
            var premise = simpleBinary(premises.get(i));
            if (premise.isEmpty()) return fail(FUNCTION_PREMISE_NOT_BINARY);
            var p = premise.get();
            if (!p.relation().equals(relation)) return fail(FUNCTION_PREMISE_RELATION_MISMATCH);
            if (!p.left().equals(leftInput)) return fail(FUNCTION_PREMISE_LEFT_MISMATCH);
            if (!p.right().equals(rightInput)) return fail(FUNCTION_PREMISE_RIGHT_MISMATCH);
        }

        var list = registry.edit(l.functor());
        if (!list.setFunction(relation, ref))
            return Optional.of(new Problem(FUNCTION_ALREADY_REGISTERED, list.function(relation).orElse(null)));
        logger.debug("{} registered as congruence of {} over {}", ref, l.functor(), relation);
        return Optional.empty();
    }
}
