package dumb.ckproof;

import dumb.ckproof.Deduction.ByAxiom;
import dumb.ckproof.Deduction.ByHypothesis;
import dumb.ckproof.Deduction.ByTheorem;
import dumb.ckproof.Deduction.Deductable;
import dumb.ckproof.Deduction.Flag;
import dumb.ckproof.Diagnostic.Problem;
import dumb.ckproof.Diagnostic.Site;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static dumb.ckproof.Diagnostic.Kind.*;

/**
 * Structural pass over a whole directory: every reference resolves, every formula is well typed,
 * definitions only build on earlier definitions, flags have the shape they claim and hypothesis and
 * theorem citations are in range. Errors accumulate; nothing here stops at the first one.
 * <p>
 * Produces the property registry the derivation check reads.
 */
public final class Verifier {
    private static final Logger logger = LoggerFactory.getLogger(Verifier.class);

    private final Directory dir;
    private final Diagnostics diagnostics;
    private final PropertyList.Registry registry = new PropertyList.Registry();
    /** Derived signature of every definition that verified cleanly, set once. */
    private final Map<Ref.Definition, TypeSignature> signatures = new HashMap<>();

    public Verifier(Directory dir, Diagnostics diagnostics) {
        this.dir = dir;
        this.diagnostics = diagnostics;
    }

    public PropertyList.Registry verify() {
        var before = diagnostics.size();
        types();
        symbols();
        definitions();
        var clean = deductables();
        flags(clean);
        proofs();
        logger.debug("verified {} definitions, {} deductables, {} proofs: {} errors, {} property lists",
                dir.definitionRefs().size(), dir.deductableRefs().size(), dir.proofRefs().size(),
                diagnostics.size() - before, registry.size());
        return registry;
    }

    public Optional<TypeSignature> signature(Ref.Definition definition) {
        return Optional.ofNullable(signatures.get(definition));
    }

    /** Typing problems of a formula whose variables belong to {@code scope}. */
    public List<Problem> formula(Formula f, Lang.Scope scope) {
        var problems = new ArrayList<Problem>();
        signature(f, scope, Integer.MAX_VALUE, problems);
        return problems;
    }

    private void types() {
        for (var ref : dir.typeRefs())
            system(ref, dir.type(ref).system());
    }

    private void symbols() {
        for (var ref : dir.symbolRefs()) {
            var symbol = dir.symbol(ref);
            system(ref, symbol.system());
            diagnostics.err(ref, Site.SIGNATURE, -1, typeRefs(symbol.signature()));
        }
    }

    private void definitions() {
        for (var ref : dir.definitionRefs()) {
            var definition = dir.definition(ref);
            system(ref, definition.system());
            var inputsOk = scope(ref, definition.inputs());

            var problems = new ArrayList<Problem>();
            var expansion = signature(definition.expansion(), definition.inputs(), ref.index(), problems);
            diagnostics.err(ref, Site.EXPANSION, -1, problems);

            var declared = definition.declared();
            List<Problem> declaredProblems = declared != null ? typeRefs(declared) : List.of();
            diagnostics.err(ref, Site.SIGNATURE, -1, declaredProblems);

            if (!inputsOk || !problems.isEmpty() || expansion == null) continue;
            var derived = expansion.extend(definition.inputs().variables().stream().map(Lang.Variable::signature).toList());
            if (declared != null && declaredProblems.isEmpty() && !declared.equals(derived)) {
                diagnostics.err(ref, Site.SIGNATURE, -1, Problem.of(DEFINITION_SIGNATURE_MISMATCH));
                continue;
            }
            signatures.put(ref, derived);
        }
    }

    /** @return the deductables whose premises and assertion are well formed */
    private Set<Ref.Deductable> deductables() {
        var clean = new HashSet<Ref.Deductable>();
        for (var ref : dir.deductableRefs()) {
            var d = dir.deductable(ref);
            var before = diagnostics.size();
            system(ref, d.system());
            scope(ref, d.scope());
            var premises = d.premises();
            for (var i = 0; i < premises.size(); i++)
                diagnostics.err(ref, Site.PREMISE, i, formula(premises.get(i), d.scope()));
            diagnostics.err(ref, Site.ASSERTION, -1, formula(d.assertion(), d.scope()));
            if (diagnostics.size() == before) clean.add(ref);
        }
        return clean;
    }

    /**
     * Relation roles are registered for every deductable before any congruence is, so whether a
     * relation is a preorder does not depend on where its reflexivity and transitivity are declared.
     */
    private void flags(Set<Ref.Deductable> clean) {
        var refs = dir.deductableRefs();
        for (var ref : refs)
            for (var i : Flags.duplicates(dir.deductable(ref)))
                diagnostics.err(ref, Site.FLAG, i, Problem.of(DUPLICATE_FLAG));

        for (var ref : refs)
            if (clean.contains(ref)) flags(ref, dir.deductable(ref), false);
        for (var ref : refs)
            if (clean.contains(ref)) flags(ref, dir.deductable(ref), true);
    }

    private void flags(Ref.Deductable ref, Deductable d, boolean functions) {
        var duplicates = Flags.duplicates(d);
        var flags = d.flags();
        for (var i = 0; i < flags.size(); i++) {
            var flag = flags.get(i);
            if ((flag == Flag.FUNCTION) != functions || duplicates.contains(i)) continue;
            var at = i;
            Flags.verify(flag, ref, d, registry).ifPresent(p -> diagnostics.err(ref, Site.FLAG, at, p));
        }
    }

    private void proofs() {
        for (var ref : dir.proofRefs()) {
            var proof = dir.proof(ref);
            var theorem = proof.theorem();
            if (!dir.contains(theorem)) {
                diagnostics.err(ref, Site.PROOF, -1, new Problem(INVALID_THEOREM_REF, theorem));
                continue;
            }
            var t = dir.theorem(theorem);
            var steps = proof.steps();
            for (var i = 0; i < steps.size(); i++) {
                var step = steps.get(i);
                diagnostics.err(ref, Site.STEP, i, formula(step.formula(), t.scope()));
                var j = step.justification();
                if (j instanceof ByAxiom a) {
                    if (!dir.contains(a.axiom()))
                        diagnostics.err(ref, Site.STEP, i, new Problem(INVALID_AXIOM_REF, a.axiom()));
                } else if (j instanceof ByTheorem bt) {
                    if (!dir.contains(bt.theorem()))
                        diagnostics.err(ref, Site.STEP, i, new Problem(INVALID_THEOREM_REF, bt.theorem()));
                    else {
                        var at = i;
                        citation(bt.theorem(), ref, dir).ifPresent(p -> diagnostics.err(ref, Site.STEP, at, p));
                    }
                } else if (j instanceof ByHypothesis h) {
                    if (h.index() == 0)
                        diagnostics.err(ref, Site.STEP, i, Problem.of(HYPOTHESIS_ZERO_INDEX));
                    else if (h.index() < 0 || h.index() > t.premises().size())
                        diagnostics.err(ref, Site.STEP, i, Problem.of(HYPOTHESIS_INDEX_OUT_OF_RANGE));
                }
            }
        }
    }

    /**
     * Whether proof {@code citing} may use {@code theorem}: the theorem must have been proven by a
     * proof declared before {@code citing}. Later proofs of a theorem may cite it; its first may not.
     */
    static Optional<Problem> citation(Ref.Theorem theorem, Ref.Proof citing, Directory dir) {
        var first = dir.firstProof(theorem);
        if (first.isEmpty()) return Optional.of(new Problem(THEOREM_UNPROVEN, theorem));
        var order = Integer.compare(citing.index(), first.get().index());
        if (order < 0) return Optional.of(new Problem(THEOREM_USED_BEFORE_PROOF, theorem));
        if (order == 0) return Optional.of(new Problem(THEOREM_CIRCULAR_PROOF, theorem));
        return Optional.empty();
    }

    private void system(Ref subject, Ref.Sys system) {
        if (!dir.contains(system))
            diagnostics.err(subject, Site.DECLARATION, -1, new Problem(INVALID_SYSTEM_REF, system));
    }

    /** @return whether every variable signature in the scope names valid types */
    private boolean scope(Ref subject, Lang.Scope scope) {
        var ok = true;
        var variables = scope.variables();
        for (var i = 0; i < variables.size(); i++) {
            var problems = typeRefs(variables.get(i).signature());
            diagnostics.err(subject, Site.VARIABLE, i, problems);
            ok &= problems.isEmpty();
        }
        return ok;
    }

    private List<Problem> typeRefs(TypeSignature s) {
        if (s instanceof TypeSignature.Ground g)
            return dir.contains(g.type()) ? List.of() : List.of(new Problem(INVALID_TYPE_REF, g.type()));
        var c = (TypeSignature.Compound) s;
        var problems = new ArrayList<>(typeRefs(c.input()));
        problems.addAll(typeRefs(c.output()));
        return problems;
    }

    /** Marks a node whose children's signatures are on top of the result stack. */
    private record Finish(Formula node) {
    }

    /**
     * Types {@code f}, adding one problem per fault found and carrying on into every child. Children are
     * typed before their parent, left to right, over an explicit work stack.
     *
     * @param definitions definitions at or above this index may not be referenced
     * @return the signature, or null when it cannot be known because of a problem below
     */
    private @Nullable TypeSignature signature(Formula f, Lang.Scope scope, int definitions, List<Problem> problems) {
        var work = new ArrayDeque<Object>();
        var done = new ArrayList<TypeSignature>();
        work.push(f);
        while (!work.isEmpty()) {
            var next = work.pop();
            if (next instanceof Finish x) {
                if (x.node() instanceof Formula.App) {
                    var argument = done.remove(done.size() - 1);
                    var function = done.remove(done.size() - 1);
                    done.add(application(function, argument, problems));
                } else {
                    var d = (Formula.Def) x.node();
                    var inputs = done.subList(done.size() - d.inputs().size(), done.size());
                    var s = definition(d.definition(), new ArrayList<>(inputs), definitions, problems);
                    inputs.clear();
                    done.add(s);
                }
            } else if (next instanceof Formula.Sym s) {
                if (dir.contains(s.symbol())) {
                    done.add(dir.symbol(s.symbol()).signature());
                } else {
                    problems.add(new Problem(INVALID_SYMBOL_REF, s.symbol()));
                    done.add(null);
                }
            } else if (next instanceof Formula.Var v) {
                var variable = scope.variable(v.variable());
                if (variable.isEmpty()) problems.add(new Problem(INVALID_VARIABLE_REF, v.variable()));
                done.add(variable.map(Lang.Variable::signature).orElse(null));
            } else if (next instanceof Formula.App a) {
                work.push(new Finish(a));
                work.push(a.argument());
                work.push(a.function());
            } else {
                var d = (Formula.Def) next;
                work.push(new Finish(d));
                for (var i = d.inputs().size() - 1; i >= 0; i--) work.push(d.inputs().get(i));
            }
        }
        return done.get(0);
    }

    private static @Nullable TypeSignature application(@Nullable TypeSignature function, @Nullable TypeSignature argument,
                                                       List<Problem> problems) {
        if (function == null || argument == null) return null;
        if (!(function instanceof TypeSignature.Compound c)) {
            problems.add(Problem.of(APPLICATION_NOT_FUNCTION));
            return null;
        }
        if (!c.input().equals(argument)) {
            problems.add(Problem.of(APPLICATION_INPUT_MISMATCH));
            return null;
        }
        return c.output();
    }

    /** Signature of a definition node whose inputs typed to {@code inputs}. */
    private @Nullable TypeSignature definition(Ref.Definition ref, List<TypeSignature> inputs, int definitions,
                                               List<Problem> problems) {
        if (!dir.contains(ref)) {
            problems.add(new Problem(INVALID_DEFINITION_REF, ref));
            return null;
        }
        if (ref.index() >= definitions) {
            problems.add(new Problem(DEFINITION_FORWARD_REFERENCE, ref));
            return null;
        }
        if (inputs.size() != dir.definition(ref).arity()) {
            problems.add(new Problem(DEFINITION_WRONG_ARITY, ref));
            return null;
        }
        var derived = signatures.get(ref);
        if (derived == null) return null;

        var expected = derived.inputs();
        var known = true;
        for (var actual : inputs) {
            var formal = expected.next();
            if (actual == null) known = false;
            else if (!formal.equals(actual)) {
                problems.add(new Problem(DEFINITION_INPUT_MISMATCH, ref));
                known = false;
            }
        }
        if (!known) return null;
        var s = derived;
        for (var i = 0; i < inputs.size(); i++) s = s.applied();
        return s;
    }
}
