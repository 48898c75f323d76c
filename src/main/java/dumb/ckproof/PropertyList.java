package dumb.ckproof;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Algebraic facts about one functor: which axiom or theorem proves it reflexive, symmetric or
 * transitive (when it is a relation), and which proves it a congruence for each relation (when it is
 * a function). Every slot is written at most once; a second write is refused.
 */
public final class PropertyList {
    private final Map<Ref.Functor, Ref.Deductable> functions = new LinkedHashMap<>();
    private @Nullable Ref.Deductable reflexive;
    private @Nullable Ref.Deductable symmetric;
    private @Nullable Ref.Deductable transitive;

    boolean setReflexive(Ref.Deductable proof) {
        if (reflexive != null) return false;
        reflexive = requireNonNull(proof);
        return true;
    }

    boolean setSymmetric(Ref.Deductable proof) {
        if (symmetric != null) return false;
        symmetric = requireNonNull(proof);
        return true;
    }

    boolean setTransitive(Ref.Deductable proof) {
        if (transitive != null) return false;
        transitive = requireNonNull(proof);
        return true;
    }

    boolean setFunction(Ref.Functor relation, Ref.Deductable proof) {
        return functions.putIfAbsent(requireNonNull(relation), requireNonNull(proof)) == null;
    }

    public Optional<Ref.Deductable> reflexive() {
        return Optional.ofNullable(reflexive);
    }

    public Optional<Ref.Deductable> symmetric() {
        return Optional.ofNullable(symmetric);
    }

    public Optional<Ref.Deductable> transitive() {
        return Optional.ofNullable(transitive);
    }

    /** The congruence proof of this function with respect to {@code relation}. */
    public Optional<Ref.Deductable> function(Ref.Functor relation) {
        return Optional.ofNullable(functions.get(relation));
    }

    public Map<Ref.Functor, Ref.Deductable> functions() {
        return Collections.unmodifiableMap(functions);
    }

    public boolean isPreorder() {
        return reflexive != null && transitive != null;
    }

    @Override
    public String toString() {
        return "PropertyList[reflexive=" + reflexive + ", symmetric=" + symmetric + ", transitive=" + transitive + ", functions=" + functions + ']';
    }

    /** Property lists of every functor that has any. */
    public static final class Registry {
        private final Map<Ref.Functor, PropertyList> lists = new HashMap<>();

        PropertyList edit(Ref.Functor functor) {
            return lists.computeIfAbsent(functor, f -> new PropertyList());
        }

        /** The functor's list, or a fresh empty one not held by this registry. */
        public PropertyList of(Ref.Functor functor) {
            var list = lists.get(functor);
            return list != null ? list : new PropertyList();
        }

        public boolean isPreorder(Ref.Functor relation) {
            return of(relation).isPreorder();
        }

        public int size() {
            return lists.size();
        }
    }
}
