package dumb.ckproof;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** S-expression read by {@link KifParser}; test documents are written in it. */
sealed interface Term permits Term.Atom, Term.Var, Term.Lst {

    String toKif();

    record Var(String name) implements Term {
        public Var {
            requireNonNull(name);
            if (!name.startsWith("?") || name.length() < 2)
                throw new IllegalArgumentException("Variable name must start with '?' and have length > 1: " + name);
        }

        @Override
        public String toKif() {
            return name;
        }
    }

    record Atom(String value) implements Term {
        public Atom {
            requireNonNull(value);
        }

        @Override
        public String toKif() {
            return value.isEmpty() || value.chars().anyMatch(c -> Character.isWhitespace(c) || "()\";?".indexOf(c) != -1)
                    ? '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"'
                    : value;
        }
    }

    final class Lst implements Term {
        public final List<Term> terms;

        Lst(List<Term> terms) {
            this.terms = List.copyOf(terms);
        }

        public Term get(int index) {
            return terms.get(index);
        }

        public int size() {
            return terms.size();
        }

        public List<Term> rest() {
            return terms.subList(Math.min(1, terms.size()), terms.size());
        }

        public Optional<String> op() {
            return !terms.isEmpty() && terms.get(0) instanceof Atom a ? Optional.of(a.value()) : Optional.empty();
        }

        @Override
        public String toKif() {
            return terms.stream().map(Term::toKif).collect(Collectors.joining(" ", "(", ")"));
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lst that && terms.equals(that.terms));
        }

        @Override
        public int hashCode() {
            return terms.hashCode();
        }

        @Override
        public String toString() {
            return "KifList" + terms;
        }
    }
}
