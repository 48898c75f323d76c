package dumb.ckproof;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import static dumb.ckproof.Diagnostic.Phase.CHECK;
import static dumb.ckproof.Diagnostic.Phase.VERIFY;
import static java.util.Objects.requireNonNull;

/**
 * One problem found in a document.
 *
 * @param subject the declaration or proof it concerns
 * @param site    which part of the subject
 * @param index   position within the site (premise, step, variable or flag), or -1
 * @param kind    what went wrong
 * @param culprit the reference that caused it, when there is one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(Ref subject, Site site, int index, Kind kind, @Nullable Ref culprit) {
    public Diagnostic {
        requireNonNull(subject);
        requireNonNull(site);
        requireNonNull(kind);
    }

    public Phase phase() {
        return kind.phase;
    }

    @Override
    public String toString() {
        return kind + " at " + subject + " " + site + (index >= 0 ? "#" + index : "") + (culprit != null ? " (" + culprit + ")" : "");
    }

    public enum Phase {VERIFY, CHECK}

    public enum Site {DECLARATION, SIGNATURE, VARIABLE, EXPANSION, PREMISE, ASSERTION, FLAG, STEP, PROOF}

    public enum Kind {
        INVALID_SYSTEM_REF(VERIFY),
        INVALID_TYPE_REF(VERIFY),
        INVALID_SYMBOL_REF(VERIFY),
        INVALID_VARIABLE_REF(VERIFY),
        INVALID_DEFINITION_REF(VERIFY),
        INVALID_AXIOM_REF(VERIFY),
        INVALID_THEOREM_REF(VERIFY),

        DEFINITION_WRONG_ARITY(VERIFY),
        DEFINITION_INPUT_MISMATCH(VERIFY),
        DEFINITION_FORWARD_REFERENCE(VERIFY),
        DEFINITION_SIGNATURE_MISMATCH(VERIFY),
        APPLICATION_NOT_FUNCTION(VERIFY),
        APPLICATION_INPUT_MISMATCH(VERIFY),

        DUPLICATE_FLAG(VERIFY),
        REFLEXIVITY_PREMISE_NOT_EMPTY(VERIFY),
        REFLEXIVITY_ASSERTION_NOT_BINARY(VERIFY),
        REFLEXIVITY_ARGUMENT_MISMATCH(VERIFY),
        SYMMETRY_PREMISE_WRONG_LENGTH(VERIFY),
        SYMMETRY_PREMISE_NOT_BINARY(VERIFY),
        SYMMETRY_ASSERTION_NOT_BINARY(VERIFY),
        SYMMETRY_RELATION_MISMATCH(VERIFY),
        SYMMETRY_ARGUMENT_MISMATCH(VERIFY),
        TRANSITIVITY_PREMISE_WRONG_LENGTH(VERIFY),
        TRANSITIVITY_FIRST_PREMISE_NOT_BINARY(VERIFY),
        TRANSITIVITY_SECOND_PREMISE_NOT_BINARY(VERIFY),
        TRANSITIVITY_PREMISE_RELATION_MISMATCH(VERIFY),
        TRANSITIVITY_PREMISE_ARGUMENT_MISMATCH(VERIFY),
        TRANSITIVITY_ASSERTION_NOT_BINARY(VERIFY),
        TRANSITIVITY_ASSERTION_RELATION_MISMATCH(VERIFY),
        TRANSITIVITY_ASSERTION_LEFT_MISMATCH(VERIFY),
        TRANSITIVITY_ASSERTION_RIGHT_MISMATCH(VERIFY),
        FUNCTION_PREMISE_EMPTY(VERIFY),
        FUNCTION_ASSERTION_NOT_BINARY(VERIFY),
        FUNCTION_RELATION_NOT_PREORDER(VERIFY),
        FUNCTION_ASSERTION_LEFT_NOT_APPLICATION(VERIFY),
        FUNCTION_ASSERTION_RIGHT_NOT_APPLICATION(VERIFY),
        FUNCTION_ASSERTION_FUNCTOR_MISMATCH(VERIFY),
        FUNCTION_ASSERTION_ARITY_MISMATCH(VERIFY),
        FUNCTION_PREMISE_ARITY_MISMATCH(VERIFY),
        FUNCTION_ASSERTION_INPUT_NOT_VARIABLE(VERIFY),
        FUNCTION_PREMISE_NOT_BINARY(VERIFY),
        FUNCTION_PREMISE_RELATION_MISMATCH(VERIFY),
        FUNCTION_PREMISE_LEFT_MISMATCH(VERIFY),
        FUNCTION_PREMISE_RIGHT_MISMATCH(VERIFY),
        REFLEXIVITY_ALREADY_REGISTERED(VERIFY),
        SYMMETRY_ALREADY_REGISTERED(VERIFY),
        TRANSITIVITY_ALREADY_REGISTERED(VERIFY),
        FUNCTION_ALREADY_REGISTERED(VERIFY),

        HYPOTHESIS_ZERO_INDEX(VERIFY),
        HYPOTHESIS_INDEX_OUT_OF_RANGE(VERIFY),
        THEOREM_UNPROVEN(VERIFY),
        THEOREM_USED_BEFORE_PROOF(VERIFY),
        THEOREM_CIRCULAR_PROOF(VERIFY),

        AXIOM_ASSERTION_NOT_SUBSTITUTABLE(CHECK),
        AXIOM_NOT_SUBSTITUTABLE(CHECK),
        THEOREM_ASSERTION_NOT_SUBSTITUTABLE(CHECK),
        THEOREM_NOT_SUBSTITUTABLE(CHECK),
        SUBSTITUTION_LIMIT_EXCEEDED(CHECK),
        HYPOTHESIS_MISMATCH(CHECK),
        DEFINITION_MISMATCH(CHECK),
        MACRO_NOT_BINARY(CHECK),
        RELATION_NOT_PREORDER(CHECK),
        CONGRUENCE_NOT_DERIVABLE(CHECK),
        CONGRUENCE_FUNCTOR_MISMATCH(CHECK),
        CONGRUENCE_ARITY_MISMATCH(CHECK),
        CONGRUENCE_UNREGISTERED(CHECK),
        SUBSTITUTION_NO_MIDDLE(CHECK),
        SYNTHESIZED_THEOREM_NOT_CITABLE(CHECK),
        EMPTY(CHECK),
        ASSERTION_MISMATCH(CHECK);

        public final Phase phase;

        Kind(Phase phase) {
            this.phase = phase;
        }
    }

    /** A problem as reported by the routine that found it, before the caller says where it is. */
    public record Problem(Kind kind, @Nullable Ref culprit) {
        public Problem {
            requireNonNull(kind);
        }

        public static Problem of(Kind kind) {
            return new Problem(kind, null);
        }

        public Diagnostic at(Ref subject, Site site, int index) {
            return new Diagnostic(subject, site, index, kind, culprit);
        }
    }
}
