package dumb.ckproof;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Index of an entity in the {@link Directory} arena. Variables index into the local scope of the
 * enclosing definition, axiom or theorem rather than into the directory.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Ref.Sys.class, name = "system"),
        @JsonSubTypes.Type(value = Ref.Type.class, name = "type"),
        @JsonSubTypes.Type(value = Ref.Symbol.class, name = "symbol"),
        @JsonSubTypes.Type(value = Ref.Definition.class, name = "definition"),
        @JsonSubTypes.Type(value = Ref.Variable.class, name = "variable"),
        @JsonSubTypes.Type(value = Ref.Axiom.class, name = "axiom"),
        @JsonSubTypes.Type(value = Ref.Theorem.class, name = "theorem"),
        @JsonSubTypes.Type(value = Ref.Proof.class, name = "proof")
})
public sealed interface Ref permits Ref.Sys, Ref.Type, Ref.Functor, Ref.Variable, Ref.Deductable, Ref.Proof {

    int index();

    /** Something that can head an application: a symbol or a definition. Relations are functors too. */
    sealed interface Functor extends Ref permits Symbol, Definition {
    }

    /** Something a proof step may cite. */
    sealed interface Deductable extends Ref permits Axiom, Theorem {
    }

    record Sys(int index) implements Ref {
    }

    record Type(int index) implements Ref {
    }

    record Symbol(int index) implements Functor {
    }

    record Definition(int index) implements Functor {
    }

    record Variable(int index) implements Ref {
    }

    record Axiom(int index) implements Deductable {
    }

    record Theorem(int index) implements Deductable {
    }

    record Proof(int index) implements Ref {
    }
}
