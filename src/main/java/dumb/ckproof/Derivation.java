package dumb.ckproof;

import dumb.ckproof.Deduction.ByAxiom;
import dumb.ckproof.Deduction.ByDefinition;
import dumb.ckproof.Deduction.ByFunctionApplication;
import dumb.ckproof.Deduction.ByHypothesis;
import dumb.ckproof.Deduction.BySubstitution;
import dumb.ckproof.Deduction.ByTheorem;
import dumb.ckproof.Deduction.Justification;
import dumb.ckproof.Deduction.Step;
import dumb.ckproof.Deduction.Theorem;
import dumb.ckproof.Diagnostic.Problem;
import dumb.ckproof.Diagnostic.Site;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static dumb.ckproof.Diagnostic.Kind.*;

/**
 * Derivation check of verified proofs. Each step is judged only against the formulas of the steps
 * before it in the same proof; shorthand steps are first expanded into elementary ones.
 */
public final class Derivation {
    private static final Logger logger = LoggerFactory.getLogger(Derivation.class);

    private final Directory dir;
    private final PropertyList.Registry registry;
    private final Checker.Configuration config;
    private final Diagnostics diagnostics;

    public Derivation(Directory dir, PropertyList.Registry registry, Checker.Configuration config, Diagnostics diagnostics) {
        this.dir = dir;
        this.registry = registry;
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public void proofs() {
        for (var ref : dir.proofRefs()) proof(ref);
    }

    /** @return whether the proof passed */
    public boolean proof(Ref.Proof ref) {
        var before = diagnostics.size();
        var proof = dir.proof(ref);
        var theorem = dir.theorem(proof.theorem());
        var steps = proof.steps();
        if (steps.isEmpty()) {
            diagnostics.err(ref, Site.PROOF, -1, Problem.of(EMPTY));
            logger.debug("{} of {} is empty", ref, theorem.id());
            return false;
        }

        var earlier = new ArrayList<Formula>(steps.size());
        for (var i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            var j = step.justification();
            if (j.isMacro()) {
                var at = i;
                macro(ref, j, step.formula(), theorem, earlier).forEach(p -> diagnostics.err(ref, Site.STEP, at, p));
            } else {
                var at = i;
                step(j, step.formula(), theorem, earlier).ifPresent(p -> diagnostics.err(ref, Site.STEP, at, p));
            }
            earlier.add(step.formula());
        }

        var last = steps.get(steps.size() - 1).formula();
        if (!Formula.compatible(last, theorem.assertion(), dir))
            diagnostics.err(ref, Site.ASSERTION, -1, Problem.of(ASSERTION_MISMATCH));

        var ok = diagnostics.size() == before;
        logger.debug("{} of {}: {}", ref, theorem.id(), ok ? "valid" : (diagnostics.size() - before) + " errors");
        return ok;
    }

    /**
     * Checks one elementary step claiming {@code f} in a proof of {@code theorem}.
     *
     * @param earlier formulas of the steps before it
     */
    public Optional<Problem> step(Justification j, Formula f, Theorem theorem, List<Formula> earlier) {
        if (j instanceof ByAxiom a)
            return deduction(a.axiom(), f, earlier, AXIOM_ASSERTION_NOT_SUBSTITUTABLE, AXIOM_NOT_SUBSTITUTABLE);
        if (j instanceof ByTheorem t)
            return deduction(t.theorem(), f, earlier, THEOREM_ASSERTION_NOT_SUBSTITUTABLE, THEOREM_NOT_SUBSTITUTABLE);
        if (j instanceof ByHypothesis h)
            return Formula.identical(f, theorem.premises().get(h.index() - 1))
                    ? Optional.empty() : Optional.of(Problem.of(HYPOTHESIS_MISMATCH));
        if (j instanceof ByDefinition)
            return earlier.stream().anyMatch(e -> Formula.compatible(e, f, dir))
                    ? Optional.empty() : Optional.of(Problem.of(DEFINITION_MISMATCH));
        throw new IllegalArgumentException("Not an elementary justification: " + j);
    }

    /**
     * Expands a shorthand step and checks each step it expands to, in order. Expanded steps become
     * visible to the ones after them, and are appended to {@code earlier}.
     */
    private List<Problem> macro(Ref.Proof ref, Justification j, Formula f, Theorem theorem, List<Formula> earlier) {
        Congruence.Synthesis synthesis;
        if (j instanceof ByFunctionApplication)
            synthesis = Congruence.byFunctionApplication(f, earlier, registry);
        else if (j instanceof BySubstitution)
            synthesis = Congruence.bySubstitution(f, earlier, registry, config.middleSearch());
        else
            throw new IllegalArgumentException("Not a shorthand justification: " + j);

        if (!synthesis.ok()) return List.of(synthesis.problem());

        var problems = new ArrayList<Problem>();
        for (Step s : synthesis.steps()) {
            if (s.justification() instanceof ByTheorem t && Verifier.citation(t.theorem(), ref, dir).isPresent())
                problems.add(new Problem(SYNTHESIZED_THEOREM_NOT_CITABLE, t.theorem()));
            else
                step(s.justification(), s.formula(), theorem, earlier).ifPresent(problems::add);
            earlier.add(s.formula());
        }
        return problems;
    }

    /**
     * Instantiates the cited axiom or theorem so its assertion reads {@code f}, then searches for one
     * assignment under which every premise is some earlier formula. Premises are merged fewest
     * candidates first; once the merged list outgrows {@code maxSubstitutions} the rest is left to
     * {@link #search}.
     */
    private Optional<Problem> deduction(Ref.Deductable ref, Formula f, List<Formula> earlier,
                                        Diagnostic.Kind assertionKind, Diagnostic.Kind premisesKind) {
        var d = dir.deductable(ref);
        var required = Substitution.of(d.assertion(), f, dir);
        if (required.isEmpty()) return Optional.of(new Problem(assertionKind, ref));

        var options = new ArrayList<SubstitutionList>(d.premises().size());
        for (var premise : d.premises()) {
            var found = SubstitutionList.find(premise, earlier, dir);
            if (found.impossible()) return Optional.of(new Problem(premisesKind, ref));
            options.add(found);
        }
        options.sort(Comparator.comparingInt(SubstitutionList::size));

        var candidates = SubstitutionList.of(required.get());
        for (var i = 0; i < options.size(); i++) {
            candidates = candidates.merge(options.get(i), dir);
            if (candidates.impossible()) return Optional.of(new Problem(premisesKind, ref));
            if (candidates.size() > config.maxSubstitutions()) {
                logger.debug("{}: {} candidate substitutions after {} premises, searching", ref, candidates.size(), i + 1);
                return search(required.get(), options, ref, premisesKind);
            }
        }
        return Optional.empty();
    }

    private record Partial(Substitution substitution, int premise) {
    }

    /**
     * Depth-first over {@code options}, extending one partial assignment at a time. Exact, but gives
     * up with {@code SUBSTITUTION_LIMIT_EXCEEDED} after {@code maxSearchSteps} merges.
     */
    private Optional<Problem> search(Substitution start, List<SubstitutionList> options, Ref.Deductable ref,
                                     Diagnostic.Kind premisesKind) {
        var work = new ArrayDeque<Partial>();
        work.push(new Partial(start, 0));
        var steps = 0L;
        while (!work.isEmpty()) {
            var p = work.pop();
            if (p.premise() == options.size()) return Optional.empty();
            var choices = options.get(p.premise()).substitutions();
            for (var i = choices.size() - 1; i >= 0; i--) {
                if (++steps > config.maxSearchSteps()) return Optional.of(new Problem(SUBSTITUTION_LIMIT_EXCEEDED, ref));
                p.substitution().merge(choices.get(i), dir).ifPresent(s -> work.push(new Partial(s, p.premise() + 1)));
            }
        }
        return Optional.of(new Problem(premisesKind, ref));
    }
}
