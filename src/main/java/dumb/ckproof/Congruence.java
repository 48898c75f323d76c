package dumb.ckproof;

import dumb.ckproof.Deduction.Justification;
import dumb.ckproof.Deduction.Step;
import dumb.ckproof.Diagnostic.Problem;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static dumb.ckproof.Diagnostic.Kind.*;
import static java.util.Objects.requireNonNull;

/**
 * Expands "by function application" and "by substitution" into elementary steps justified by the
 * reflexivity, symmetry, transitivity and congruence proofs registered for the relation involved.
 * The steps produced still have to pass the ordinary step check.
 */
public enum Congruence {
    ;

    private static final Logger logger = LoggerFactory.getLogger(Congruence.class);

    /** Which earlier steps "by substitution" tries first as the middle of the chain. */
    public enum MiddleSearch {EARLIEST_FIRST, LATEST_FIRST}

    /**
     * Proves {@code left ~ right} by decomposing both sides into the same functor applied to inputs
     * that are pairwise related, down to facts that are already known, reflexive or symmetric.
     */
    public static Synthesis byFunctionApplication(Formula goal, List<Formula> earlier, PropertyList.Registry registry) {
        var binary = goal.binary();
        if (binary.isEmpty()) return Synthesis.failed(Problem.of(MACRO_NOT_BINARY));
        var b = binary.get();
        if (!registry.isPreorder(b.relation())) return Synthesis.failed(new Problem(RELATION_NOT_PREORDER, b.relation()));

        var result = chain(b.relation(), b.left(), b.right(), earlier, registry);
        trace("function application", goal, result);
        return result;
    }

    /**
     * Proves {@code left ~ right} from some earlier {@code midLeft ~ midRight} by showing
     * {@code left ~ midLeft} and {@code midRight ~ right} by function application, then joining the
     * three with transitivity twice.
     */
    public static Synthesis bySubstitution(Formula goal, List<Formula> earlier, PropertyList.Registry registry,
                                           MiddleSearch order) {
        var binary = goal.binary();
        if (binary.isEmpty()) return Synthesis.failed(Problem.of(MACRO_NOT_BINARY));
        var b = binary.get();
        var relation = b.relation();
        var properties = registry.of(relation);
        if (!properties.isPreorder()) return Synthesis.failed(new Problem(RELATION_NOT_PREORDER, relation));
        if (known(goal, earlier, List.of())) return Synthesis.of(List.of());

        var transitive = Justification.by(properties.transitive().orElseThrow());
        var candidates = new ArrayList<>(earlier);
        if (order == MiddleSearch.LATEST_FIRST) Collections.reverse(candidates);

        for (var candidate : candidates) {
            var mid = candidate.binary().filter(m -> m.relation().equals(relation));
            if (mid.isEmpty()) continue;
            var m = mid.get();

            var before = chain(relation, b.left(), m.left(), earlier, registry);
            if (!before.ok()) continue;
            var known = new ArrayList<>(earlier);
            before.steps().forEach(s -> known.add(s.formula()));
            var after = chain(relation, m.right(), b.right(), known, registry);
            if (!after.ok()) continue;

            var steps = new ArrayList<Step>(before.steps());
            steps.addAll(after.steps());
            steps.add(new Step(transitive, Formula.Binary.of(relation, b.left(), m.right())));
            steps.add(new Step(transitive, goal));
            var result = Synthesis.of(steps);
            trace("substitution", goal, result);
            return result;
        }
        return Synthesis.failed(Problem.of(SUBSTITUTION_NO_MIDDLE));
    }

    /**
     * Stack machine behind function application. An application's own step is pushed before the
     * goals for its inputs, so it is emitted only after every input has been settled.
     */
    private static Synthesis chain(Ref.Functor relation, Formula left, Formula right, List<Formula> earlier,
                                   PropertyList.Registry registry) {
        var properties = registry.of(relation);
        var emitted = new ArrayList<Step>();
        var stack = new ArrayDeque<Frame>();
        stack.push(new Goal(left, right));

        while (!stack.isEmpty()) {
            var frame = stack.pop();
            if (frame instanceof Emit e) {
                emitted.add(e.step());
                continue;
            }
            var goal = (Goal) frame;
            var g = new Formula.Binary(relation, goal.left(), goal.right());
            var formula = g.formula();
            if (known(formula, earlier, emitted)) continue;

            if (Formula.identical(g.left(), g.right())) {
                emitted.add(new Step(Justification.by(properties.reflexive().orElseThrow()), formula));
                continue;
            }

            var symmetric = properties.symmetric();
            if (symmetric.isPresent() && known(g.reversed(), earlier, emitted)) {
                emitted.add(new Step(Justification.by(symmetric.get()), formula));
                continue;
            }

            var l = g.left().application();
            var r = g.right().application();
            if (l.isEmpty() || r.isEmpty()) return Synthesis.failed(Problem.of(CONGRUENCE_NOT_DERIVABLE));
            var functor = l.get().functor();
            if (!functor.equals(r.get().functor())) return Synthesis.failed(Problem.of(CONGRUENCE_FUNCTOR_MISMATCH));
            var leftInputs = l.get().inputs();
            var rightInputs = r.get().inputs();
            if (leftInputs.size() != rightInputs.size()) return Synthesis.failed(Problem.of(CONGRUENCE_ARITY_MISMATCH));
            var congruence = registry.of(functor).function(relation);
            if (congruence.isEmpty()) return Synthesis.failed(new Problem(CONGRUENCE_UNREGISTERED, functor));

            stack.push(new Emit(new Step(Justification.by(congruence.get()), formula)));
            for (var i = leftInputs.size() - 1; i >= 0; i--)
                stack.push(new Goal(leftInputs.get(i), rightInputs.get(i)));
        }
        return Synthesis.of(emitted);
    }

    private static boolean known(Formula f, List<Formula> earlier, List<Step> emitted) {
        return earlier.stream().anyMatch(e -> Formula.identical(e, f))
                || emitted.stream().anyMatch(s -> Formula.identical(s.formula(), f));
    }

    private static void trace(String how, Formula goal, Synthesis result) {
        if (logger.isTraceEnabled())
            logger.trace("{} by {}: {}", goal, how, result.ok() ? result.steps() : result.problem());
    }

    private sealed interface Frame permits Goal, Emit {
    }

    private record Goal(Formula left, Formula right) implements Frame {
    }

    private record Emit(Step step) implements Frame {
    }

    /** Either the elementary steps, in order, or the reason none could be produced. */
    public record Synthesis(List<Step> steps, @Nullable Problem problem) {
        public Synthesis {
            steps = List.copyOf(requireNonNull(steps));
        }

        static Synthesis of(List<Step> steps) {
            return new Synthesis(steps, null);
        }

        static Synthesis failed(Problem problem) {
            return new Synthesis(List.of(), requireNonNull(problem));
        }

        public boolean ok() {
            return problem == null;
        }
    }
}
