package dumb.ckproof;

import dumb.ckproof.Deduction.Axiom;
import dumb.ckproof.Deduction.Flag;
import dumb.ckproof.Deduction.Justification;
import dumb.ckproof.Deduction.Proof;
import dumb.ckproof.Deduction.Step;
import dumb.ckproof.Deduction.Theorem;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Directory} from S-expression declarations, resolving names as they are read:
 * <pre>
 * (system eq)
 * (type eq Nat)
 * (symbol eq s (-> Nat Nat))
 * (define eq double ((?n Nat)) (+ ?n ?n) (signature (-> Nat Nat)))
 * (axiom refl eq ((?x Nat)) (premises) (assert (= ?x ?x)) (flags REFLEXIVE))
 * (theorem t eq () (premises (= zero one)) (assert (= one zero)))
 * (proof t (step (hypothesis 1) (= zero one)) (step function (= one zero)))
 * </pre>
 * A name must be declared before it is used.
 */
final class KifDocument {
    private final Directory.Builder builder = Directory.builder();
    private final Map<String, Ref.Sys> systems = new HashMap<>();
    private final Map<String, Ref.Type> types = new HashMap<>();
    private final Map<String, Ref.Symbol> symbols = new HashMap<>();
    private final Map<String, Ref.Definition> definitions = new HashMap<>();
    private final Map<String, Ref.Axiom> axioms = new HashMap<>();
    private final Map<String, Ref.Theorem> theorems = new HashMap<>();
    private final Map<String, Map<String, Integer>> variables = new HashMap<>();

    static Directory of(List<Term> forms) {
        var doc = new KifDocument();
        forms.forEach(doc::declare);
        return doc.builder.build();
    }

    private void declare(Term form) {
        var l = list(form);
        var op = l.op().orElseThrow(() -> new IllegalArgumentException("Declaration without operator: " + form.toKif()));
        switch (op) {
            case "system" -> systems.put(atom(l.get(1)), builder.system(atom(l.get(1))));
            case "type" -> types.put(atom(l.get(2)), builder.type(system(l.get(1)), atom(l.get(2))));
            case "symbol" -> symbols.put(atom(l.get(2)), builder.symbol(system(l.get(1)), atom(l.get(2)), signature(l.get(3))));
            case "define" -> define(l);
            case "axiom", "theorem" -> deductable(op, l);
            case "proof" -> proof(l);
            default -> throw new IllegalArgumentException("Unknown declaration: " + form.toKif());
        }
    }

    private void define(Term.Lst l) {
        var name = atom(l.get(2));
        var names = new HashMap<String, Integer>();
        var scope = scope(l.get(3), names);
        var expansion = formula(l.get(4), names);
        @Nullable TypeSignature declared = null;
        if (l.size() > 5) declared = signature(section(l.get(5), "signature").get(1));
        definitions.put(name, builder.definition(system(l.get(1)), name, scope, expansion, declared));
    }

    private void deductable(String kind, Term.Lst l) {
        var name = atom(l.get(1));
        var sys = system(l.get(2));
        var names = new HashMap<String, Integer>();
        var scope = scope(l.get(3), names);
        var premises = section(l.get(4), "premises").rest().stream().map(p -> formula(p, names)).toList();
        var assertion = formula(section(l.get(5), "assert").get(1), names);
        var flags = new ArrayList<Flag>();
        if (l.size() > 6)
            section(l.get(6), "flags").rest().forEach(f -> flags.add(Flag.valueOf(atom(f))));

        if (kind.equals("axiom"))
            axioms.put(name, builder.axiom(new Axiom(name, sys, scope, premises, assertion, flags)));
        else {
            theorems.put(name, builder.theorem(new Theorem(name, sys, scope, premises, assertion, flags)));
            variables.put(name, names);
        }
    }

    private void proof(Term.Lst l) {
        var theorem = atom(l.get(1));
        var names = variables.get(theorem);
        if (names == null) throw new IllegalArgumentException("Proof of unknown theorem " + theorem);
        var steps = new ArrayList<Step>();
        for (var s : l.terms.subList(2, l.size())) {
            var step = section(s, "step");
            steps.add(new Step(justification(step.get(1)), formula(step.get(2), names)));
        }
        builder.proof(new Proof(theorems.get(theorem), steps));
    }

    private Justification justification(Term t) {
        if (t instanceof Term.Atom a) {
            return switch (a.value()) {
                case "definition" -> new Deduction.ByDefinition();
                case "function" -> new Deduction.ByFunctionApplication();
                case "substitution" -> new Deduction.BySubstitution();
                default -> throw new IllegalArgumentException("Unknown justification " + a.value());
            };
        }
        var l = list(t);
        var arg = atom(l.get(1));
        return switch (l.op().orElse("")) {
            case "axiom" -> new Deduction.ByAxiom(resolve(axioms, arg));
            case "theorem" -> new Deduction.ByTheorem(resolve(theorems, arg));
            case "hypothesis" -> new Deduction.ByHypothesis(Integer.parseInt(arg));
            default -> throw new IllegalArgumentException("Unknown justification " + t.toKif());
        };
    }

    private Lang.Scope scope(Term t, Map<String, Integer> names) {
        var vars = new ArrayList<Lang.Variable>();
        for (var v : list(t).terms) {
            var decl = list(v);
            var name = ((Term.Var) decl.get(0)).name();
            names.put(name, vars.size());
            vars.add(new Lang.Variable(name, signature(decl.get(1))));
        }
        return new Lang.Scope(vars);
    }

    /** {@code Nat}, or {@code (-> in1 in2 out)}. */
    private TypeSignature signature(Term t) {
        if (t instanceof Term.Atom a) return TypeSignature.ground(resolve(types, a.value()));
        var l = list(t);
        if (l.op().filter("->"::equals).isEmpty() || l.size() < 3)
            throw new IllegalArgumentException("Bad signature " + t.toKif());
        var parts = l.rest().stream().map(this::signature).toList();
        return parts.get(parts.size() - 1).extend(parts.subList(0, parts.size() - 1));
    }

    private Formula formula(Term t, Map<String, Integer> names) {
        if (t instanceof Term.Var v) return Formula.var(resolve(names, v.name()));
        if (t instanceof Term.Atom a) {
            var name = a.value();
            if (symbols.containsKey(name)) return new Formula.Sym(symbols.get(name));
            return new Formula.Def(resolve(definitions, name), List.of());
        }
        var l = list(t);
        var inputs = l.rest().stream().map(x -> formula(x, names)).toList();
        var head = l.get(0);
        if (head instanceof Term.Atom a && definitions.containsKey(a.value()))
            return new Formula.Def(definitions.get(a.value()), inputs);
        return Formula.app(formula(head, names), inputs.toArray(Formula[]::new));
    }

    private Ref.Sys system(Term t) {
        return resolve(systems, atom(t));
    }

    private static <X> X resolve(Map<String, X> names, String name) {
        var x = names.get(name);
        if (x == null) throw new IllegalArgumentException("Undeclared name " + name);
        return x;
    }

    private static Term.Lst section(Term t, String op) {
        var l = list(t);
        if (l.op().filter(op::equals).isEmpty())
            throw new IllegalArgumentException("Expected (" + op + " ...), found " + t.toKif());
        return l;
    }

    private static Term.Lst list(Term t) {
        if (t instanceof Term.Lst l) return l;
        throw new IllegalArgumentException("Expected a list, found " + t.toKif());
    }

    private static String atom(Term t) {
        if (t instanceof Term.Atom a) return a.value();
        throw new IllegalArgumentException("Expected an atom, found " + t.toKif());
    }
}
