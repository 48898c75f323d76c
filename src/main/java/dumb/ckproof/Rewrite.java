package dumb.ckproof;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;

/**
 * Whole-tree rewrites of formulas, each a post-order rebuild over an explicit work stack so that
 * nesting depth is bounded by heap, not by the call stack.
 */
enum Rewrite {
    ;

    /** Marks a node whose rewritten children are on top of the result stack. */
    private record Assemble(Formula node) {
    }

    static Formula expand(Formula root, Directory dir) {
        var work = new ArrayDeque<Object>();
        var done = new ArrayDeque<Formula>();
        work.push(root);
        while (!work.isEmpty()) {
            var next = work.pop();
            if (next instanceof Assemble a) {
                done.push(assemble(a.node(), done));
            } else if (next instanceof Formula.Def d) {
                // unfolded in place; the instance is walked again
                work.push(dir.definition(d.definition()).instantiate(d.inputs()));
            } else if (next instanceof Formula.App a) {
                descend(a, work);
            } else {
                done.push((Formula) next);
            }
        }
        return done.pop();
    }

    static Formula substitute(Formula root, Map<Ref.Variable, Formula> mapping) {
        if (mapping.isEmpty()) return root;
        var work = new ArrayDeque<Object>();
        var done = new ArrayDeque<Formula>();
        work.push(root);
        while (!work.isEmpty()) {
            var next = work.pop();
            if (next instanceof Assemble a) {
                done.push(assemble(a.node(), done));
            } else if (next instanceof Formula.Var v) {
                done.push(mapping.getOrDefault(v.variable(), v));
            } else if (next instanceof Formula.Sym s) {
                done.push(s);
            } else {
                descend((Formula) next, work);
            }
        }
        return done.pop();
    }

    /** Structural hash, consistent with {@link Formula#identical}. */
    static int hash(Formula root) {
        var h = 1;
        var work = new ArrayDeque<Formula>();
        work.push(root);
        while (!work.isEmpty()) {
            var f = work.pop();
            if (f instanceof Formula.Sym s) {
                h = 31 * h + s.symbol().hashCode();
            } else if (f instanceof Formula.Var v) {
                h = 31 * h + 7 + v.variable().hashCode();
            } else if (f instanceof Formula.App a) {
                h = 31 * h + 11;
                work.push(a.argument());
                work.push(a.function());
            } else {
                var d = (Formula.Def) f;
                h = 31 * (31 * h + d.definition().hashCode()) + d.inputs().size();
                for (var i = d.inputs().size() - 1; i >= 0; i--) work.push(d.inputs().get(i));
            }
        }
        return h;
    }

    /** Schedules {@code node} for reassembly after its children, visited left to right. */
    private static void descend(Formula node, ArrayDeque<Object> work) {
        work.push(new Assemble(node));
        if (node instanceof Formula.App a) {
            work.push(a.argument());
            work.push(a.function());
        } else {
            var inputs = ((Formula.Def) node).inputs();
            for (var i = inputs.size() - 1; i >= 0; i--) work.push(inputs.get(i));
        }
    }

    /** Rebuilds {@code node} from its rewritten children, reusing it when none changed. */
    private static Formula assemble(Formula node, ArrayDeque<Formula> done) {
        if (node instanceof Formula.App a) {
            var argument = done.pop();
            var function = done.pop();
            return function == a.function() && argument == a.argument() ? a : new Formula.App(function, argument);
        }
        var d = (Formula.Def) node;
        var n = d.inputs().size();
        var inputs = new ArrayList<Formula>(n);
        var same = true;
        for (var i = n - 1; i >= 0; i--) {
            var x = done.pop();
            same &= x == d.inputs().get(i);
            inputs.add(x);
        }
        if (same) return d;
        Collections.reverse(inputs);
        return new Formula.Def(d.definition(), inputs);
    }
}
