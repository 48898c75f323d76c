package dumb.ckproof;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Binding of template variables to target formulas, produced by one-way matching. Never binds one
 * variable to two formulas that are not {@link Formula#compatible compatible}.
 */
public final class Substitution {
    public static final Substitution EMPTY = new Substitution(Map.of());

    private final Map<Ref.Variable, Formula> map;

    private Substitution(Map<Ref.Variable, Formula> map) {
        this.map = Collections.unmodifiableMap(map);
    }

    /**
     * Matches {@code template} against {@code target}. Walks both trees in lockstep with an explicit
     * stack; any shape mismatch rejects the whole match.
     */
    public static Optional<Substitution> of(Formula template, Formula target, Directory dir) {
        var stack = new ArrayDeque<Formula[]>();
        stack.push(new Formula[]{template, target});
        var map = new LinkedHashMap<Ref.Variable, Formula>();

        while (!stack.isEmpty()) {
            var pair = stack.pop();
            var t = pair[0];
            var x = pair[1];
            if (t instanceof Formula.Sym s) {
                if (!(x instanceof Formula.Sym xs) || !s.symbol().equals(xs.symbol())) return Optional.empty();
            } else if (t instanceof Formula.Var v) {
                var old = map.putIfAbsent(v.variable(), x);
                if (old != null && !Formula.compatible(old, x, dir)) return Optional.empty();
            } else if (t instanceof Formula.App a) {
                if (!(x instanceof Formula.App xa)) return Optional.empty();
                stack.push(new Formula[]{a.function(), xa.function()});
                stack.push(new Formula[]{a.argument(), xa.argument()});
            } else if (t instanceof Formula.Def d) {
                if (!(x instanceof Formula.Def xd) || !d.definition().equals(xd.definition())
                        || d.inputs().size() != xd.inputs().size())
                    return Optional.empty();
                for (var i = 0; i < d.inputs().size(); i++)
                    stack.push(new Formula[]{d.inputs().get(i), xd.inputs().get(i)});
            }
        }
        return Optional.of(new Substitution(map));
    }

    /**
     * Union of both binding sets, or empty when some variable is bound on both sides to formulas
     * that are not compatible. Where both sides bind a variable, this side's formula is kept.
     */
    public Optional<Substitution> merge(Substitution other, Directory dir) {
        requireNonNull(other);
        for (var e : other.map.entrySet()) {
            var mine = map.get(e.getKey());
            if (mine != null && !Formula.compatible(mine, e.getValue(), dir)) return Optional.empty();
        }
        var merged = new LinkedHashMap<>(map);
        other.map.forEach(merged::putIfAbsent);
        return Optional.of(new Substitution(merged));
    }

    public Map<Ref.Variable, Formula> map() {
        return map;
    }

    public Optional<Formula> get(Ref.Variable variable) {
        return Optional.ofNullable(map.get(variable));
    }

    public Formula apply(Formula template) {
        return template.substitute(map);
    }

    public int size() {
        return map.size();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Substitution s && map.equals(s.map));
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    @Override
    public String toString() {
        return "Substitution" + new HashMap<>(map);
    }
}
