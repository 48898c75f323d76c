package dumb.ckproof;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Collector threaded through every verify and check routine. One instance per run; never shared.
 */
public class Diagnostics {
    private final List<Diagnostic> errors = new ArrayList<>();

    public void err(Diagnostic error) {
        errors.add(error);
    }

    public void err(Ref subject, Diagnostic.Site site, int index, Diagnostic.Problem problem) {
        errors.add(problem.at(subject, site, index));
    }

    public void err(Ref subject, Diagnostic.Site site, int index, Collection<Diagnostic.Problem> problems) {
        problems.forEach(p -> err(subject, site, index, p));
    }

    public boolean errorFound() {
        return !errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public List<Diagnostic> errors() {
        return List.copyOf(errors);
    }
}
