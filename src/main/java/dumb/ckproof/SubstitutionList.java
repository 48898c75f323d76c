package dumb.ckproof;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Disjunction of substitutions: "any one of these bindings works". Kept as a list so that the choice
 * of fact for one premise is never committed before the other premises have been considered. Holds
 * no two equal substitutions.
 */
public final class SubstitutionList {
    private final List<Substitution> subs;

    private SubstitutionList(Collection<Substitution> subs) {
        this.subs = List.copyOf(subs);
    }

    public static SubstitutionList of(Substitution substitution) {
        return new SubstitutionList(List.of(requireNonNull(substitution)));
    }

    /** Every way {@code template} can be matched by one of the {@code candidates}. */
    public static SubstitutionList find(Formula template, Iterable<Formula> candidates, Directory dir) {
        var found = new LinkedHashSet<Substitution>();
        for (var target : candidates)
            Substitution.of(template, target, dir).ifPresent(found::add);
        return new SubstitutionList(found);
    }

    /** Every consistent pairing of one substitution from each list. */
    public SubstitutionList merge(SubstitutionList other, Directory dir) {
        var merged = new LinkedHashSet<Substitution>();
        for (var mine : subs)
            for (var theirs : other.subs)
                mine.merge(theirs, dir).ifPresent(merged::add);
        return new SubstitutionList(merged);
    }

    public boolean impossible() {
        return subs.isEmpty();
    }

    public int size() {
        return subs.size();
    }

    public List<Substitution> substitutions() {
        return subs;
    }

    @Override
    public String toString() {
        return "SubstitutionList" + subs;
    }
}
