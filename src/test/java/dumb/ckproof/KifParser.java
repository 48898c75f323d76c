package dumb.ckproof;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the S-expression documents the scenario tests are written in: lists, {@code ?variables},
 * bare atoms and {@code "quoted names"}, with {@code ;} line comments. Open lists are kept on an
 * explicit stack.
 */
final class KifParser {
    private final String text;
    private int pos;
    private int line = 1;

    private KifParser(String text) {
        this.text = text;
    }

    static List<Term> parseKif(String kif) throws ParseException {
        return new KifParser(kif).document();
    }

    private List<Term> document() throws ParseException {
        var top = new ArrayList<Term>();
        var open = new ArrayDeque<List<Term>>();
        while (true) {
            skipBlank();
            var into = open.isEmpty() ? top : open.peek();
            if (pos == text.length()) {
                if (!open.isEmpty()) throw error(open.size() + " unclosed list(s)");
                return top;
            }
            var c = text.charAt(pos);
            if (c == '(') {
                pos++;
                open.push(new ArrayList<>());
            } else if (c == ')') {
                if (open.isEmpty()) throw error("unbalanced ')'");
                pos++;
                var done = new Term.Lst(open.pop());
                (open.isEmpty() ? top : open.peek()).add(done);
            } else if (c == '"') {
                var end = text.indexOf('"', pos + 1);
                if (end < 0) throw error("unterminated string");
                into.add(new Term.Atom(text.substring(pos + 1, end)));
                pos = end + 1;
            } else {
                var word = word();
                into.add(word.startsWith("?") ? variable(word) : new Term.Atom(word));
            }
        }
    }

    private Term.Var variable(String word) throws ParseException {
        if (word.length() < 2) throw error("'?' without a name");
        return new Term.Var(word);
    }

    private String word() {
        var start = pos;
        while (pos < text.length() && !Character.isWhitespace(text.charAt(pos)) && "()\";".indexOf(text.charAt(pos)) < 0)
            pos++;
        return text.substring(start, pos);
    }

    private void skipBlank() {
        while (pos < text.length()) {
            var c = text.charAt(pos);
            if (c == ';') {
                while (pos < text.length() && text.charAt(pos) != '\n') pos++;
            } else if (Character.isWhitespace(c)) {
                if (c == '\n') line++;
                pos++;
            } else {
                return;
            }
        }
    }

    private ParseException error(String message) {
        return new ParseException(message + " at line " + line);
    }

    static class ParseException extends Exception {
        ParseException(String message) {
            super(message);
        }
    }
}
