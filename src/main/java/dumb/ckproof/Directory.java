package dumb.ckproof;

import dumb.ckproof.Deduction.Axiom;
import dumb.ckproof.Deduction.Deductable;
import dumb.ckproof.Deduction.Proof;
import dumb.ckproof.Deduction.Theorem;
import dumb.ckproof.Lang.Definition;
import dumb.ckproof.Lang.Symbol;
import dumb.ckproof.Lang.Sys;
import dumb.ckproof.Lang.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static java.util.Objects.requireNonNull;

/**
 * Append-only arena of every declaration in a document, addressed by {@link Ref} indices. Immutable
 * once built; references inside it are not guaranteed to resolve until {@link Verifier} says so.
 */
public final class Directory {
    private final List<Sys> systems;
    private final List<Type> types;
    private final List<Symbol> symbols;
    private final List<Definition> definitions;
    private final List<Axiom> axioms;
    private final List<Theorem> theorems;
    private final List<Proof> proofs;

    private Directory(Builder b) {
        this.systems = List.copyOf(b.systems);
        this.types = List.copyOf(b.types);
        this.symbols = List.copyOf(b.symbols);
        this.definitions = List.copyOf(b.definitions);
        this.axioms = List.copyOf(b.axioms);
        this.theorems = List.copyOf(b.theorems);
        this.proofs = List.copyOf(b.proofs);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static <X> Optional<X> lookup(List<X> list, int i) {
        return i >= 0 && i < list.size() ? Optional.of(list.get(i)) : Optional.empty();
    }

    private static <X> X require(List<X> list, Ref ref) {
        return lookup(list, ref.index()).orElseThrow(() -> new IllegalStateException("Unresolved reference " + ref));
    }

    public boolean contains(Ref ref) {
        requireNonNull(ref);
        if (ref instanceof Ref.Sys) return lookup(systems, ref.index()).isPresent();
        if (ref instanceof Ref.Type) return lookup(types, ref.index()).isPresent();
        if (ref instanceof Ref.Symbol) return lookup(symbols, ref.index()).isPresent();
        if (ref instanceof Ref.Definition) return lookup(definitions, ref.index()).isPresent();
        if (ref instanceof Ref.Axiom) return lookup(axioms, ref.index()).isPresent();
        if (ref instanceof Ref.Theorem) return lookup(theorems, ref.index()).isPresent();
        if (ref instanceof Ref.Proof) return lookup(proofs, ref.index()).isPresent();
        throw new IllegalArgumentException("Variables resolve against a local scope, not the directory: " + ref);
    }

    public Type type(Ref.Type ref) {
        return require(types, ref);
    }

    public Symbol symbol(Ref.Symbol ref) {
        return require(symbols, ref);
    }

    public Definition definition(Ref.Definition ref) {
        return require(definitions, ref);
    }

    public Axiom axiom(Ref.Axiom ref) {
        return require(axioms, ref);
    }

    public Theorem theorem(Ref.Theorem ref) {
        return require(theorems, ref);
    }

    public Proof proof(Ref.Proof ref) {
        return require(proofs, ref);
    }

    public Deductable deductable(Ref.Deductable ref) {
        return ref instanceof Ref.Axiom a ? axiom(a) : theorem((Ref.Theorem) ref);
    }

    /** The proof that fixes the theorem's position for citation order, if it has one. */
    public Optional<Ref.Proof> firstProof(Ref.Theorem theorem) {
        return IntStream.range(0, proofs.size())
                .filter(i -> proofs.get(i).theorem().equals(theorem))
                .mapToObj(Ref.Proof::new)
                .findFirst();
    }

    public List<Ref.Type> typeRefs() {
        return IntStream.range(0, types.size()).mapToObj(Ref.Type::new).toList();
    }

    public List<Ref.Symbol> symbolRefs() {
        return IntStream.range(0, symbols.size()).mapToObj(Ref.Symbol::new).toList();
    }

    public List<Ref.Definition> definitionRefs() {
        return IntStream.range(0, definitions.size()).mapToObj(Ref.Definition::new).toList();
    }

    /** Axioms first, then theorems, each in declaration order. */
    public List<Ref.Deductable> deductableRefs() {
        var refs = new ArrayList<Ref.Deductable>();
        IntStream.range(0, axioms.size()).mapToObj(Ref.Axiom::new).forEach(refs::add);
        IntStream.range(0, theorems.size()).mapToObj(Ref.Theorem::new).forEach(refs::add);
        return refs;
    }

    public List<Ref.Proof> proofRefs() {
        return IntStream.range(0, proofs.size()).mapToObj(Ref.Proof::new).toList();
    }

    public static final class Builder {
        private final List<Sys> systems = new ArrayList<>();
        private final List<Type> types = new ArrayList<>();
        private final List<Symbol> symbols = new ArrayList<>();
        private final List<Definition> definitions = new ArrayList<>();
        private final List<Axiom> axioms = new ArrayList<>();
        private final List<Theorem> theorems = new ArrayList<>();
        private final List<Proof> proofs = new ArrayList<>();

        private Builder() {
        }

        public Ref.Sys system(String id) {
            systems.add(new Sys(id));
            return new Ref.Sys(systems.size() - 1);
        }

        public Ref.Type type(Ref.Sys system, String id) {
            types.add(new Type(id, system));
            return new Ref.Type(types.size() - 1);
        }

        public Ref.Symbol symbol(Ref.Sys system, String id, TypeSignature signature) {
            symbols.add(new Symbol(id, system, signature));
            return new Ref.Symbol(symbols.size() - 1);
        }

        public Ref.Definition definition(Ref.Sys system, String id, Lang.Scope inputs, Formula expansion,
                                         @Nullable TypeSignature declared) {
            definitions.add(new Definition(id, system, inputs, expansion, declared));
            return new Ref.Definition(definitions.size() - 1);
        }

        public Ref.Axiom axiom(Axiom axiom) {
            axioms.add(requireNonNull(axiom));
            return new Ref.Axiom(axioms.size() - 1);
        }

        public Ref.Theorem theorem(Theorem theorem) {
            theorems.add(requireNonNull(theorem));
            return new Ref.Theorem(theorems.size() - 1);
        }

        public Ref.Proof proof(Proof proof) {
            proofs.add(requireNonNull(proof));
            return new Ref.Proof(proofs.size() - 1);
        }

        public Directory build() {
            return new Directory(this);
        }
    }
}
